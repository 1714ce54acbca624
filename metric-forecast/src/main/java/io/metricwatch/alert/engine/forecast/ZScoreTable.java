package io.metricwatch.alert.engine.forecast;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Fixed z-scores for the supported confidence levels. Any other level uses the 95% score. This is
 * a lookup, not an inverse normal.
 */
class ZScoreTable {
  static final double DEFAULT_Z_SCORE = 1.96;
  private static final double TOLERANCE = 1e-9;

  private static final Map<Double, Double> Z_SCORES =
      ImmutableMap.of(0.80, 1.28, 0.85, 1.44, 0.90, 1.645, 0.95, 1.96, 0.99, 2.576);

  private ZScoreTable() {}

  static double zScore(double confidenceLevel) {
    for (Map.Entry<Double, Double> entry : Z_SCORES.entrySet()) {
      if (Math.abs(entry.getKey() - confidenceLevel) < TOLERANCE) {
        return entry.getValue();
      }
    }
    return DEFAULT_Z_SCORE;
  }
}
