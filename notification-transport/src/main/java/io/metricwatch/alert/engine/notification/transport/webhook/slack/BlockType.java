package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import java.util.Locale;

public enum BlockType {
  SECTION,
  ACTIONS,
  CONTEXT;

  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
