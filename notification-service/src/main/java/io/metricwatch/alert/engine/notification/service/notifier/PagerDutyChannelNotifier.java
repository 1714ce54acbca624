package io.metricwatch.alert.engine.notification.service.notifier;

import com.google.common.base.Strings;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.PagerDutyChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PagerDuty is not integrated yet: the routing key is validated and a synthetic success is
 * returned. The destination only shows the first 8 characters of the key.
 */
public class PagerDutyChannelNotifier implements ChannelNotifier<PagerDutyChannelConfig> {
  private static final Logger LOGGER = LoggerFactory.getLogger(PagerDutyChannelNotifier.class);
  static final String MISSING_ROUTING_KEY_ERROR = "PagerDuty routing key not configured";
  private static final String STUB_MESSAGE_ID_PREFIX = "pagerduty-stub-";
  private static final int VISIBLE_KEY_CHARS = 8;

  private final Clock clock;

  public PagerDutyChannelNotifier(Clock clock) {
    this.clock = clock;
  }

  @Override
  public DispatchResult notify(
      PagerDutyChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    Instant sentAt = clock.instant();
    String routingKey = channel.getRoutingKey();
    if (Strings.isNullOrEmpty(routingKey)) {
      return DispatchResult.failure(channel, MISSING_ROUTING_KEY_ERROR, sentAt);
    }

    String destination =
        "pd:" + routingKey.substring(0, Math.min(VISIBLE_KEY_CHARS, routingKey.length())) + "...";
    LOGGER.info(
        "PagerDuty notification for alert {} ({}) to {}",
        alertEvent.getId(),
        alertEvent.getSeverity(),
        destination);
    return DispatchResult.of(
        channel,
        destination,
        SendResult.success(STUB_MESSAGE_ID_PREFIX + sentAt.toEpochMilli()),
        sentAt);
  }
}
