package io.metricwatch.alert.engine.forecast.model;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares of value on index. Prediction intervals use {@code stdError * sqrt(1 +
 * 1/n + (x - xMean)^2 / Sxx)}. With two points there are no residual degrees of freedom and the
 * standard error is 0. A constant series has {@code r2 = 1}.
 */
public class LinearTrendModel implements ForecastModel {

  @Override
  public FittedModel fit(List<Double> values) {
    int n = values.size();
    double xMean = (n - 1) / 2.0;

    double ySum = 0;
    for (double value : values) {
      ySum += value;
    }
    double yMean = ySum / n;

    double sxy = 0;
    double sxx = 0;
    for (int i = 0; i < n; i++) {
      sxy += (i - xMean) * (values.get(i) - yMean);
      sxx += Math.pow(i - xMean, 2);
    }
    double slope = sxy / sxx;
    double intercept = yMean - slope * xMean;

    double sse = 0;
    double tss = 0;
    for (int i = 0; i < n; i++) {
      sse += Math.pow(values.get(i) - (intercept + slope * i), 2);
      tss += Math.pow(values.get(i) - yMean, 2);
    }
    double stdError = n > 2 ? Math.sqrt(sse / (n - 2)) : 0;
    double r2 = tss == 0 ? 1 : 1 - sse / tss;

    double sumOfSquaresX = sxx;
    return new FittedModel() {
      @Override
      public double predict(int step) {
        return intercept + slope * index(step);
      }

      @Override
      public double margin(int step, double zScore) {
        double x = index(step);
        return zScore
            * stdError
            * Math.sqrt(1 + 1.0 / n + Math.pow(x - xMean, 2) / sumOfSquaresX);
      }

      @Override
      public Map<String, Object> getParameters() {
        return ImmutableMap.<String, Object>of(
            "slope", slope, "intercept", intercept, "stdError", stdError, "r2", r2);
      }

      private double index(int step) {
        return n - 1 + step;
      }
    };
  }
}
