package io.metricwatch.alert.engine.incident;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Alerts that fired within one window of the group's first alert. */
@Getter
@ToString
public class CorrelationGroup {
  private final List<AlertEvent> alerts;
  private final TimeSpan timeSpan;

  /** Distinct metric keys in order of first appearance. */
  private final List<String> relatedMetrics;

  CorrelationGroup(List<AlertEvent> alerts, TimeSpan timeSpan, List<String> relatedMetrics) {
    this.alerts = List.copyOf(alerts);
    this.timeSpan = timeSpan;
    this.relatedMetrics = List.copyOf(relatedMetrics);
  }
}
