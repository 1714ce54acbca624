package io.metricwatch.alert.engine.notification.service;

import io.metricwatch.alert.engine.datamodel.Severity;

/** How a preference's severity is compared with an alert's severity. */
public enum SeverityMatchPolicy {
  /** The alert severity must equal the preference severity. */
  EXACT("exact"),
  /** The alert severity must be the preference severity or more severe. */
  AT_LEAST("at_least");

  private final String value;

  SeverityMatchPolicy(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public boolean matches(Severity preferenceSeverity, Severity alertSeverity) {
    if (preferenceSeverity == null || alertSeverity == null) {
      return false;
    }
    switch (this) {
      case EXACT:
        return preferenceSeverity == alertSeverity;
      case AT_LEAST:
        return alertSeverity.isAtLeast(preferenceSeverity);
      default:
        throw new UnsupportedOperationException("Unsupported severity match policy: " + this);
    }
  }

  public static SeverityMatchPolicy fromValue(String value) {
    for (SeverityMatchPolicy policy : values()) {
      if (policy.value.equalsIgnoreCase(value)) {
        return policy;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid severity match policy:%s", value));
  }
}
