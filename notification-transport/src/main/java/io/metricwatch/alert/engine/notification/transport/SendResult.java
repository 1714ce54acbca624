package io.metricwatch.alert.engine.notification.transport;

import lombok.Getter;
import lombok.ToString;

/** Outcome of a single delivery attempt. */
@Getter
@ToString
public class SendResult {
  private final boolean success;
  private final String messageId;
  private final String error;

  private SendResult(boolean success, String messageId, String error) {
    this.success = success;
    this.messageId = messageId;
    this.error = error;
  }

  public static SendResult success(String messageId) {
    return new SendResult(true, messageId, null);
  }

  public static SendResult failure(String error) {
    return new SendResult(false, null, error);
  }
}
