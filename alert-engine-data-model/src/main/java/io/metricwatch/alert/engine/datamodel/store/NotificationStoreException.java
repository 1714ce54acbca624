package io.metricwatch.alert.engine.datamodel.store;

/** Raised when notification configuration or incidents cannot be read or written. */
public class NotificationStoreException extends RuntimeException {

  public NotificationStoreException(String message) {
    super(message);
  }

  public NotificationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
