package io.metricwatch.alert.engine.forecast;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ForecastError {
  private final ForecastErrorCode code;
  private final String message;

  public ForecastError(ForecastErrorCode code, String message) {
    this.code = code;
    this.message = message;
  }

  RuntimeException toException() {
    switch (code) {
      case INSUFFICIENT_DATA:
        return new InsufficientDataException(message);
      case INVALID_HORIZON:
        return new IllegalArgumentException(message);
      default:
        throw new UnsupportedOperationException("Unsupported forecast error code: " + code);
    }
  }
}
