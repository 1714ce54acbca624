package io.metricwatch.alert.engine.forecast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastMethod {
  SMA("sma"),
  EWMA("ewma"),
  LINEAR("linear");

  private final String value;

  ForecastMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ForecastMethod fromValue(String value) {
    for (ForecastMethod method : values()) {
      if (method.value.equalsIgnoreCase(value)) {
        return method;
      }
    }
    throw new IllegalArgumentException(
        String.format("Invalid forecast method:%s, expected one of sma, ewma, linear", value));
  }
}
