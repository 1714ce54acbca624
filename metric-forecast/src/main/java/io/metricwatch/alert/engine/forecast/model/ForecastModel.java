package io.metricwatch.alert.engine.forecast.model;

import java.util.List;

public interface ForecastModel {

  /** Fits the model to values ordered oldest first. At least two values are required. */
  FittedModel fit(List<Double> values);
}
