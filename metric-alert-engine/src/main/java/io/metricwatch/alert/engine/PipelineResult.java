package io.metricwatch.alert.engine;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.forecast.ForecastOutcome;
import io.metricwatch.alert.engine.notification.service.AlertDispatchSummary;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of running one rule. The alert event and dispatch summary are present only when the
 * forecast succeeded and the rule fired.
 */
@ToString
public class PipelineResult {
  @Getter private final String ruleId;
  @Getter private final ForecastOutcome forecastOutcome;
  private final AlertEvent alertEvent;
  private final AlertDispatchSummary summary;

  PipelineResult(
      String ruleId,
      ForecastOutcome forecastOutcome,
      AlertEvent alertEvent,
      AlertDispatchSummary summary) {
    this.ruleId = ruleId;
    this.forecastOutcome = forecastOutcome;
    this.alertEvent = alertEvent;
    this.summary = summary;
  }

  public Optional<AlertEvent> getAlertEvent() {
    return Optional.ofNullable(alertEvent);
  }

  public Optional<AlertDispatchSummary> getSummary() {
    return Optional.ofNullable(summary);
  }

  public boolean isAlertFired() {
    return alertEvent != null;
  }
}
