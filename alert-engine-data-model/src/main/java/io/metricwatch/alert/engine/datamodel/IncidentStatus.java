package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Incident lifecycle. Legal transitions are open to acknowledged, open to resolved and
 * acknowledged to resolved. Nothing leaves resolved.
 */
public enum IncidentStatus {
  OPEN("open"),
  ACKNOWLEDGED("acknowledged"),
  RESOLVED("resolved");

  private final String value;

  IncidentStatus(String value) {
    this.value = value;
  }

  public boolean canTransitionTo(IncidentStatus target) {
    switch (this) {
      case OPEN:
        return target == ACKNOWLEDGED || target == RESOLVED;
      case ACKNOWLEDGED:
        return target == RESOLVED;
      case RESOLVED:
        return false;
      default:
        throw new UnsupportedOperationException("Unsupported incident status: " + this);
    }
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static IncidentStatus fromValue(String value) {
    for (IncidentStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid incident status:%s", value));
  }
}
