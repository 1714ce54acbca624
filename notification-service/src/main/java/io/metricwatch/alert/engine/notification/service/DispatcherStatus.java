package io.metricwatch.alert.engine.notification.service;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DispatcherStatus {
  private final boolean emailConfigured;
  private final String fromAddress;

  public DispatcherStatus(boolean emailConfigured, String fromAddress) {
    this.emailConfigured = emailConfigured;
    this.fromAddress = fromAddress;
  }
}
