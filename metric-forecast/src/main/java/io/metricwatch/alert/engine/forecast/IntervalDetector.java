package io.metricwatch.alert.engine.forecast;

import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Estimates the cadence of a sorted series from its leading deltas. */
class IntervalDetector {
  static final Duration DEFAULT_INTERVAL = Duration.ofDays(1);
  private static final int MAX_SAMPLED_POINTS = 10;

  private IntervalDetector() {}

  /**
   * Median (upper median for an even count) of the positive deltas between the first ten points.
   * Falls back to one day when no delta is positive.
   */
  static Duration detectInterval(List<TimeSeriesPoint> sortedPoints) {
    List<Duration> deltas = new ArrayList<>();
    int limit = Math.min(sortedPoints.size(), MAX_SAMPLED_POINTS);
    for (int i = 1; i < limit; i++) {
      Duration delta =
          Duration.between(
              sortedPoints.get(i - 1).getTimestamp(), sortedPoints.get(i).getTimestamp());
      if (!delta.isNegative() && !delta.isZero()) {
        deltas.add(delta);
      }
    }
    if (deltas.isEmpty()) {
      return DEFAULT_INTERVAL;
    }
    Collections.sort(deltas);
    return deltas.get(deltas.size() / 2);
  }
}
