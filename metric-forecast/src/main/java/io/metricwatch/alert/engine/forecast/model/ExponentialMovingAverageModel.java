package io.metricwatch.alert.engine.forecast.model;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Exponential smoothing seeded with the first value, with {@code alpha = 2 / (min(n, 10) + 1)}.
 * A trend taken from the last {@code min(5, n)} values is added per step and the interval widens
 * as {@code z * stdDev * sqrt(1 + 0.1 * step)}.
 */
public class ExponentialMovingAverageModel implements ForecastModel {
  private static final int MAX_SPAN = 10;
  private static final int TREND_LOOKBACK = 5;
  private static final double MARGIN_GROWTH_PER_STEP = 0.1;

  @Override
  public FittedModel fit(List<Double> values) {
    int n = values.size();
    double alpha = 2.0 / (Math.min(n, MAX_SPAN) + 1);

    double ewma = values.get(0);
    for (int i = 1; i < n; i++) {
      ewma = alpha * values.get(i) + (1 - alpha) * ewma;
    }

    double weightedVariance = 0;
    double weightSum = 0;
    for (int i = 0; i < n; i++) {
      double weight = Math.pow(1 - alpha, n - 1 - i);
      weightedVariance += weight * Math.pow(values.get(i) - ewma, 2);
      weightSum += weight;
    }
    double stdDev = Math.sqrt(weightedVariance / weightSum);

    int lookback = Math.min(TREND_LOOKBACK, n);
    double trend = (values.get(n - 1) - values.get(n - lookback)) / lookback;

    double smoothed = ewma;
    return new FittedModel() {
      @Override
      public double predict(int step) {
        return smoothed + trend * step;
      }

      @Override
      public double margin(int step, double zScore) {
        return zScore * stdDev * Math.sqrt(1 + step * MARGIN_GROWTH_PER_STEP);
      }

      @Override
      public Map<String, Object> getParameters() {
        return ImmutableMap.<String, Object>of(
            "alpha", alpha, "ewma", smoothed, "stdDev", stdDev, "trend", trend);
      }
    };
  }
}
