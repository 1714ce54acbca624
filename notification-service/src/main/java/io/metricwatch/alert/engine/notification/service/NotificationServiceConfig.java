package io.metricwatch.alert.engine.notification.service;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import io.metricwatch.alert.engine.notification.transport.NotificationSenderConfig;
import lombok.Getter;

@Getter
public class NotificationServiceConfig {
  static final String SEVERITY_MATCH_CONFIG = "severityMatch";
  static final String DISPATCH_PARALLELISM_CONFIG = "dispatch.parallelism";
  private static final int DEFAULT_DISPATCH_PARALLELISM = 4;

  private final SeverityMatchPolicy severityMatchPolicy;
  private final int dispatchParallelism;
  private final NotificationSenderConfig senderConfig;

  public NotificationServiceConfig(Config notificationConfig) {
    this.severityMatchPolicy =
        notificationConfig.hasPath(SEVERITY_MATCH_CONFIG)
            ? SeverityMatchPolicy.fromValue(notificationConfig.getString(SEVERITY_MATCH_CONFIG))
            : SeverityMatchPolicy.EXACT;
    this.dispatchParallelism =
        notificationConfig.hasPath(DISPATCH_PARALLELISM_CONFIG)
            ? notificationConfig.getInt(DISPATCH_PARALLELISM_CONFIG)
            : DEFAULT_DISPATCH_PARALLELISM;
    Preconditions.checkArgument(
        dispatchParallelism > 0, "dispatch.parallelism must be positive: %s", dispatchParallelism);
    this.senderConfig = NotificationSenderConfig.from(notificationConfig);
  }
}
