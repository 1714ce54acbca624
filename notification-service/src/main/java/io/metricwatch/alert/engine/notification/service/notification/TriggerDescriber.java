package io.metricwatch.alert.engine.notification.service.notification;

import io.metricwatch.alert.engine.datamodel.trigger.AnomalyTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.ForecastTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.ThresholdTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.TriggerDetails;
import io.metricwatch.alert.engine.datamodel.trigger.TriggerDetailsVisitor;
import java.util.Locale;

/** One-line human readable description of why an alert fired. */
public class TriggerDescriber implements TriggerDetailsVisitor<String> {

  public static String describe(TriggerDetails triggerDetails) {
    return triggerDetails == null ? null : triggerDetails.accept(new TriggerDescriber());
  }

  @Override
  public String visit(ThresholdTrigger thresholdTrigger) {
    return String.format(
        Locale.ROOT,
        "Observed value %.2f is %s the threshold %.2f",
        thresholdTrigger.getObservedValue(),
        thresholdTrigger.getOperator().getDescription(),
        thresholdTrigger.getThreshold());
  }

  @Override
  public String visit(ForecastTrigger forecastTrigger) {
    return String.format(
        Locale.ROOT,
        "Forecast %.2f [%.2f, %.2f] at %s is %s the threshold %.2f within %d days",
        forecastTrigger.getPredictedValue(),
        forecastTrigger.getConfidenceLower(),
        forecastTrigger.getConfidenceUpper(),
        forecastTrigger.getPredictionTimestamp(),
        forecastTrigger.getOperator().getDescription(),
        forecastTrigger.getThreshold(),
        forecastTrigger.getHorizonDays());
  }

  @Override
  public String visit(AnomalyTrigger anomalyTrigger) {
    return String.format(
        Locale.ROOT,
        "Observed value %.2f is outside the expected range [%.2f, %.2f]"
            + " (expected %.2f, %.0f%% confidence)",
        anomalyTrigger.getObservedValue(),
        anomalyTrigger.getLowerBound(),
        anomalyTrigger.getUpperBound(),
        anomalyTrigger.getExpectedValue(),
        anomalyTrigger.getConfidenceLevel() * 100);
  }
}
