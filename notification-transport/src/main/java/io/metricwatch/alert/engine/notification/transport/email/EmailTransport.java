package io.metricwatch.alert.engine.notification.transport.email;

import io.metricwatch.alert.engine.notification.transport.SendResult;

/** Transactional email provider. */
public interface EmailTransport {

  /** False when credentials are missing; {@link #send} then fails without a network call. */
  boolean isConfigured();

  String getFromAddress();

  SendResult send(EmailMessage message);
}
