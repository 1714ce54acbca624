package io.metricwatch.alert.engine.evaluator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.metricwatch.alert.engine.datamodel.Severity;

/** Sensitivity level configured on anomaly rules. */
public enum SeverityThreshold {
  LOW("low", Severity.INFO),
  MEDIUM("medium", Severity.WARNING),
  HIGH("high", Severity.CRITICAL),
  CRITICAL("critical", Severity.CRITICAL);

  private final String value;
  private final Severity severity;

  SeverityThreshold(String value, Severity severity) {
    this.value = value;
    this.severity = severity;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public Severity toSeverity() {
    return severity;
  }

  @JsonCreator
  public static SeverityThreshold fromValue(String value) {
    for (SeverityThreshold threshold : values()) {
      if (threshold.value.equalsIgnoreCase(value)) {
        return threshold;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid severity threshold:%s", value));
  }
}
