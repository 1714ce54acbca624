package io.metricwatch.alert.engine.notification.transport.webhook.slack;

/** An interactive or context element placed inside a block. */
public interface Element {
  String getType();
}
