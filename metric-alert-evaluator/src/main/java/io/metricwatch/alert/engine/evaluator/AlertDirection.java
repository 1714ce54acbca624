package io.metricwatch.alert.engine.evaluator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.metricwatch.alert.engine.datamodel.ThresholdOperator;

/** Legacy rule direction. {@code above} is strictly greater than, {@code below} strictly less. */
public enum AlertDirection {
  ABOVE("above", ThresholdOperator.GT),
  BELOW("below", ThresholdOperator.LT);

  private final String value;
  private final ThresholdOperator operator;

  AlertDirection(String value, ThresholdOperator operator) {
    this.value = value;
    this.operator = operator;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public ThresholdOperator toOperator() {
    return operator;
  }

  @JsonCreator
  public static AlertDirection fromValue(String value) {
    for (AlertDirection direction : values()) {
      if (direction.value.equalsIgnoreCase(value)) {
        return direction;
      }
    }
    throw new IllegalArgumentException(
        String.format("Invalid direction:%s, expected above or below", value));
  }
}
