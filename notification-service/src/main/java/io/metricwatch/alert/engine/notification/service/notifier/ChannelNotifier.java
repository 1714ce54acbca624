package io.metricwatch.alert.engine.notification.service.notifier;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.notification.service.DispatchResult;

/**
 * Delivers an alert to one kind of channel. Configuration problems and delivery failures are
 * returned as failed results, never thrown.
 *
 * @param <C> the channel configuration this notifier understands
 */
public interface ChannelNotifier<C extends NotificationChannelConfig> {

  /** @param incident the incident the alert was correlated into, or null */
  DispatchResult notify(C channel, AlertEvent alertEvent, AlertIncident incident);
}
