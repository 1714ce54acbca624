package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Alert severity, ordered from least to most severe. */
public enum Severity {
  INFO("info"),
  WARNING("warning"),
  CRITICAL("critical");

  private final String value;

  Severity(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isAtLeast(Severity other) {
    return this.ordinal() >= other.ordinal();
  }

  @JsonCreator
  public static Severity fromValue(String value) {
    for (Severity severity : values()) {
      if (severity.value.equalsIgnoreCase(value)) {
        return severity;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid severity:%s", value));
  }
}
