package io.metricwatch.alert.engine.notification.service.notifier;

import com.google.common.base.Strings;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;
import io.metricwatch.alert.engine.notification.service.notification.AlertEmailFormatter;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import io.metricwatch.alert.engine.notification.transport.email.EmailMessage;
import io.metricwatch.alert.engine.notification.transport.email.EmailTag;
import io.metricwatch.alert.engine.notification.transport.email.EmailTransport;
import java.time.Clock;
import java.time.Instant;

public class EmailChannelNotifier implements ChannelNotifier<EmailChannelConfig> {
  static final String MISSING_ADDRESS_ERROR = "Email address not configured for channel";

  private final EmailTransport emailTransport;
  private final AlertEmailFormatter formatter;
  private final Clock clock;

  public EmailChannelNotifier(
      EmailTransport emailTransport, AlertEmailFormatter formatter, Clock clock) {
    this.emailTransport = emailTransport;
    this.formatter = formatter;
    this.clock = clock;
  }

  @Override
  public DispatchResult notify(
      EmailChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    Instant sentAt = clock.instant();
    if (Strings.isNullOrEmpty(channel.getEmailAddress())) {
      return DispatchResult.failure(channel, MISSING_ADDRESS_ERROR, sentAt);
    }

    EmailMessage.EmailMessageBuilder<?, ?> message =
        EmailMessage.builder()
            .recipient(channel.getEmailAddress())
            .subject(formatter.subject(alertEvent))
            .html(formatter.html(alertEvent, incident))
            .text(formatter.text(alertEvent, incident))
            .tag(new EmailTag("org", alertEvent.getOrgId()))
            .tag(new EmailTag("severity", alertEvent.getSeverity().getValue()))
            .tag(new EmailTag("metric", alertEvent.getMetricKey()));
    if (incident != null) {
      message.tag(new EmailTag("incident", incident.getId()));
    }
    SendResult sendResult = emailTransport.send(message.build());
    return DispatchResult.of(channel, channel.getEmailAddress(), sendResult, sentAt);
  }
}
