package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThresholdOperator {
  GT("gt", "greater than"),
  LT("lt", "less than"),
  GTE("gte", "greater than or equal to"),
  LTE("lte", "less than or equal to");

  private final String value;
  private final String description;

  ThresholdOperator(String value, String description) {
    this.value = value;
    this.description = description;
  }

  public boolean test(double lhs, double rhs) {
    switch (this) {
      case GT:
        return lhs > rhs;
      case LT:
        return lhs < rhs;
      case GTE:
        return lhs >= rhs;
      case LTE:
        return lhs <= rhs;
      default:
        throw new UnsupportedOperationException("Unsupported threshold operator: " + this);
    }
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  @JsonCreator
  public static ThresholdOperator fromValue(String value) {
    for (ThresholdOperator operator : values()) {
      if (operator.value.equalsIgnoreCase(value)) {
        return operator;
      }
    }
    throw new IllegalArgumentException(
        String.format("Invalid threshold operator:%s, expected one of gt, lt, gte, lte", value));
  }
}
