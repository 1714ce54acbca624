package io.metricwatch.alert.engine.evaluator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertRuleType {
  THRESHOLD("threshold"),
  ANOMALY("anomaly");

  private final String value;

  AlertRuleType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static AlertRuleType fromValue(String value) {
    for (AlertRuleType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid alert rule type:%s", value));
  }
}
