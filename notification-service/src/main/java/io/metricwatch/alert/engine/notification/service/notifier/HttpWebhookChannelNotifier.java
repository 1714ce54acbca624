package io.metricwatch.alert.engine.notification.service.notifier;

import com.google.common.base.Strings;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;
import io.metricwatch.alert.engine.notification.service.notification.AlertWebhookPayload;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import io.metricwatch.alert.engine.notification.transport.webhook.WebhookSender;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts an {@link AlertWebhookPayload} to a generic HTTP endpoint, or stubs it when disabled. */
public class HttpWebhookChannelNotifier implements ChannelNotifier<HttpWebhookChannelConfig> {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWebhookChannelNotifier.class);
  static final String MISSING_URL_ERROR = "HTTP webhook URL not configured";
  private static final String MESSAGE_ID_PREFIX = "webhook";
  private static final String STUB_MESSAGE_ID_PREFIX = "webhook-stub-";

  private final WebhookSender webhookSender;
  private final boolean deliveryEnabled;
  private final Clock clock;

  public HttpWebhookChannelNotifier(
      WebhookSender webhookSender, boolean deliveryEnabled, Clock clock) {
    this.webhookSender = webhookSender;
    this.deliveryEnabled = deliveryEnabled;
    this.clock = clock;
  }

  @Override
  public DispatchResult notify(
      HttpWebhookChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    Instant sentAt = clock.instant();
    String webhookUrl = channel.getWebhookUrl();
    if (Strings.isNullOrEmpty(webhookUrl)) {
      return DispatchResult.failure(channel, MISSING_URL_ERROR, sentAt);
    }

    AlertWebhookPayload payload = AlertWebhookPayload.of(alertEvent, incident, sentAt);
    if (!deliveryEnabled) {
      LOGGER.info(
          "Webhook delivery disabled, not posting alert {} to {}", alertEvent.getId(), webhookUrl);
      return DispatchResult.of(
          channel,
          webhookUrl,
          SendResult.success(STUB_MESSAGE_ID_PREFIX + sentAt.toEpochMilli()),
          sentAt);
    }
    return DispatchResult.of(
        channel, webhookUrl, webhookSender.send(webhookUrl, payload, MESSAGE_ID_PREFIX), sentAt);
  }
}
