package io.metricwatch.alert.engine.forecast;

public class InsufficientDataException extends RuntimeException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
