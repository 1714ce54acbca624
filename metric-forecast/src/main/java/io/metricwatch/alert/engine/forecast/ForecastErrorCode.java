package io.metricwatch.alert.engine.forecast;

public enum ForecastErrorCode {
  INSUFFICIENT_DATA,
  INVALID_HORIZON
}
