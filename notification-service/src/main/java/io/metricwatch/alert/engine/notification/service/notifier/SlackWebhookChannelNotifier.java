package io.metricwatch.alert.engine.notification.service.notifier;

import com.google.common.base.Strings;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;
import io.metricwatch.alert.engine.notification.service.notification.AlertSlackMessage;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import io.metricwatch.alert.engine.notification.transport.webhook.WebhookSender;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts an {@link AlertSlackMessage} to a Slack incoming webhook. With delivery disabled the
 * message is rendered and logged but not sent, and a synthetic {@code slack-stub-<millis>} id is
 * returned.
 */
public class SlackWebhookChannelNotifier implements ChannelNotifier<SlackWebhookChannelConfig> {
  private static final Logger LOGGER = LoggerFactory.getLogger(SlackWebhookChannelNotifier.class);
  static final String MISSING_URL_ERROR = "Slack webhook URL not configured";
  private static final String MESSAGE_ID_PREFIX = "slack";
  private static final String STUB_MESSAGE_ID_PREFIX = "slack-stub-";

  private final WebhookSender webhookSender;
  private final boolean deliveryEnabled;
  private final String dashboardUrl;
  private final Clock clock;

  public SlackWebhookChannelNotifier(
      WebhookSender webhookSender, boolean deliveryEnabled, String dashboardUrl, Clock clock) {
    this.webhookSender = webhookSender;
    this.deliveryEnabled = deliveryEnabled;
    this.dashboardUrl = dashboardUrl;
    this.clock = clock;
  }

  @Override
  public DispatchResult notify(
      SlackWebhookChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    Instant sentAt = clock.instant();
    String webhookUrl = channel.getWebhookUrl();
    if (Strings.isNullOrEmpty(webhookUrl)) {
      return DispatchResult.failure(channel, MISSING_URL_ERROR, sentAt);
    }

    AlertSlackMessage slackMessage =
        AlertSlackMessage.getMessage(alertEvent, incident, dashboardUrl);
    if (!deliveryEnabled) {
      LOGGER.info(
          "Slack delivery disabled, not posting alert {} to channel {}",
          alertEvent.getId(),
          channel.getChannelId());
      return DispatchResult.of(
          channel,
          webhookUrl,
          SendResult.success(STUB_MESSAGE_ID_PREFIX + sentAt.toEpochMilli()),
          sentAt);
    }
    return DispatchResult.of(
        channel,
        webhookUrl,
        webhookSender.send(webhookUrl, slackMessage, MESSAGE_ID_PREFIX),
        sentAt);
  }
}
