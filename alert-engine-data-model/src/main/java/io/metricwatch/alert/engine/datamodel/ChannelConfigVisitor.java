package io.metricwatch.alert.engine.datamodel;

import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.PagerDutyChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;

public interface ChannelConfigVisitor<T> {
  T visit(EmailChannelConfig channel);

  T visit(SlackWebhookChannelConfig channel);

  T visit(HttpWebhookChannelConfig channel);

  T visit(PagerDutyChannelConfig channel);
}
