package io.metricwatch.alert.engine.notification.transport;

import com.typesafe.config.Config;
import lombok.Getter;

/** Delivery settings read from the {@code notification} config block. */
@Getter
public class NotificationSenderConfig {
  private static final String EMAIL_API_URL = "email.apiUrl";
  private static final String EMAIL_FROM_ADDRESS = "email.fromAddress";
  private static final String EMAIL_API_KEY_SECRET = "email.apiKeySecret";
  private static final String SLACK_DELIVERY_ENABLED = "slack.delivery.enabled";
  private static final String WEBHOOK_DELIVERY_ENABLED = "webhook.delivery.enabled";
  private static final String DASHBOARD_URL = "dashboardUrl";

  private static final String DEFAULT_EMAIL_API_URL = "https://api.resend.com/emails";
  private static final String DEFAULT_FROM_ADDRESS = "alerts@metricwatch.io";
  private static final String DEFAULT_API_KEY_SECRET = "email-api-key";
  private static final String DEFAULT_DASHBOARD_URL = "https://app.metricwatch.io";

  private final String emailApiUrl;
  private final String emailFromAddress;
  private final String emailApiKeySecret;
  private final boolean slackDeliveryEnabled;
  private final boolean webhookDeliveryEnabled;
  private final String dashboardUrl;

  public static NotificationSenderConfig from(Config notificationConfig) {
    return new NotificationSenderConfig(notificationConfig);
  }

  private NotificationSenderConfig(Config notificationConfig) {
    this.emailApiUrl = getString(notificationConfig, EMAIL_API_URL, DEFAULT_EMAIL_API_URL);
    this.emailFromAddress =
        getString(notificationConfig, EMAIL_FROM_ADDRESS, DEFAULT_FROM_ADDRESS);
    this.emailApiKeySecret =
        getString(notificationConfig, EMAIL_API_KEY_SECRET, DEFAULT_API_KEY_SECRET);
    this.slackDeliveryEnabled =
        notificationConfig.hasPath(SLACK_DELIVERY_ENABLED)
            && notificationConfig.getBoolean(SLACK_DELIVERY_ENABLED);
    this.webhookDeliveryEnabled =
        notificationConfig.hasPath(WEBHOOK_DELIVERY_ENABLED)
            && notificationConfig.getBoolean(WEBHOOK_DELIVERY_ENABLED);
    this.dashboardUrl = getString(notificationConfig, DASHBOARD_URL, DEFAULT_DASHBOARD_URL);
  }

  private static String getString(Config config, String path, String defaultValue) {
    return config.hasPath(path) ? config.getString(path) : defaultValue;
  }
}
