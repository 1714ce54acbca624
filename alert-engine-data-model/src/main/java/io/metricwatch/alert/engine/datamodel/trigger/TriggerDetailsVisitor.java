package io.metricwatch.alert.engine.datamodel.trigger;

public interface TriggerDetailsVisitor<T> {
  T visit(ThresholdTrigger thresholdTrigger);

  T visit(ForecastTrigger forecastTrigger);

  T visit(AnomalyTrigger anomalyTrigger);
}
