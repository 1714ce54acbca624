package io.metricwatch.alert.engine.forecast.model;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Flat forecast at the mean of the most recent {@code min(n/2, 10)} values. The interval widens
 * as {@code z * stdDev * sqrt(1 + step / window)}.
 */
public class SimpleMovingAverageModel implements ForecastModel {
  private static final int MAX_WINDOW = 10;

  @Override
  public FittedModel fit(List<Double> values) {
    int windowSize = Math.min(values.size() / 2, MAX_WINDOW);
    List<Double> window = values.subList(values.size() - windowSize, values.size());

    double sum = 0;
    for (double value : window) {
      sum += value;
    }
    double sma = sum / windowSize;

    double squaredDeviations = 0;
    for (double value : window) {
      squaredDeviations += Math.pow(value - sma, 2);
    }
    double stdDev = Math.sqrt(squaredDeviations / windowSize);

    return new FittedModel() {
      @Override
      public double predict(int step) {
        return sma;
      }

      @Override
      public double margin(int step, double zScore) {
        return zScore * stdDev * Math.sqrt(1 + (double) step / windowSize);
      }

      @Override
      public Map<String, Object> getParameters() {
        return ImmutableMap.<String, Object>of(
            "windowSize", windowSize, "sma", sma, "stdDev", stdDev);
      }
    };
  }
}
