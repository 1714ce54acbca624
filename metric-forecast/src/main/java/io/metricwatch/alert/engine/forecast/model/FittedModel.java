package io.metricwatch.alert.engine.forecast.model;

import java.util.Map;

/** A model fitted to a history, able to project any future step. Steps start at 1. */
public interface FittedModel {

  double predict(int step);

  /** Half-width of the confidence interval at {@code step} for the given z-score. */
  double margin(int step, double zScore);

  Map<String, Object> getParameters();
}
