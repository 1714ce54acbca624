package io.metricwatch.alert.engine.notification.service.notifier;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.ChannelConfigVisitor;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.PagerDutyChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;

/** Routes each channel to the notifier for its type. */
public class ChannelNotifierRegistry {
  private final ChannelNotifier<EmailChannelConfig> emailNotifier;
  private final ChannelNotifier<SlackWebhookChannelConfig> slackWebhookNotifier;
  private final ChannelNotifier<HttpWebhookChannelConfig> httpWebhookNotifier;
  private final ChannelNotifier<PagerDutyChannelConfig> pagerDutyNotifier;

  public ChannelNotifierRegistry(
      ChannelNotifier<EmailChannelConfig> emailNotifier,
      ChannelNotifier<SlackWebhookChannelConfig> slackWebhookNotifier,
      ChannelNotifier<HttpWebhookChannelConfig> httpWebhookNotifier,
      ChannelNotifier<PagerDutyChannelConfig> pagerDutyNotifier) {
    this.emailNotifier = emailNotifier;
    this.slackWebhookNotifier = slackWebhookNotifier;
    this.httpWebhookNotifier = httpWebhookNotifier;
    this.pagerDutyNotifier = pagerDutyNotifier;
  }

  public DispatchResult notify(
      NotificationChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    return channel.accept(
        new ChannelConfigVisitor<DispatchResult>() {
          @Override
          public DispatchResult visit(EmailChannelConfig emailChannel) {
            return emailNotifier.notify(emailChannel, alertEvent, incident);
          }

          @Override
          public DispatchResult visit(SlackWebhookChannelConfig slackChannel) {
            return slackWebhookNotifier.notify(slackChannel, alertEvent, incident);
          }

          @Override
          public DispatchResult visit(HttpWebhookChannelConfig webhookChannel) {
            return httpWebhookNotifier.notify(webhookChannel, alertEvent, incident);
          }

          @Override
          public DispatchResult visit(PagerDutyChannelConfig pagerDutyChannel) {
            return pagerDutyNotifier.notify(pagerDutyChannel, alertEvent, incident);
          }
        });
  }
}
