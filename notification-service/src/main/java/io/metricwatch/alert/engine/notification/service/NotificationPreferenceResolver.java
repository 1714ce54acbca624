package io.metricwatch.alert.engine.notification.service;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationPreference;
import io.metricwatch.alert.engine.datamodel.store.NotificationConfigStore;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the channels an alert should be delivered to from the tenant's stored preferences.
 * Store failures are not caught here: without preferences no channel can be determined.
 */
public class NotificationPreferenceResolver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(NotificationPreferenceResolver.class);

  private final NotificationConfigStore configStore;
  private final SeverityMatchPolicy severityMatchPolicy;

  public NotificationPreferenceResolver(
      NotificationConfigStore configStore, SeverityMatchPolicy severityMatchPolicy) {
    this.configStore = configStore;
    this.severityMatchPolicy = severityMatchPolicy;
  }

  public List<NotificationPreference> findMatchingPreferences(AlertEvent alertEvent) {
    return configStore.getEnabledPreferences(alertEvent.getOrgId()).stream()
        .filter(NotificationPreference::isEnabled)
        .filter(
            preference ->
                severityMatchPolicy.matches(preference.getSeverity(), alertEvent.getSeverity()))
        .filter(preference -> preference.matchesMetric(alertEvent.getMetricKey()))
        .collect(Collectors.toList());
  }

  /**
   * Channel ids of all matching preferences, each resolved once in first-seen order. Unknown and
   * disabled channels are dropped.
   */
  public List<NotificationChannelConfig> getChannelsForAlert(AlertEvent alertEvent) {
    List<NotificationPreference> preferences = findMatchingPreferences(alertEvent);
    Set<String> channelIds = new LinkedHashSet<>();
    preferences.forEach(preference -> channelIds.addAll(preference.getChannels()));
    if (channelIds.isEmpty()) {
      LOGGER.debug(
          "No preference of org {} matches metric {} at severity {}",
          alertEvent.getOrgId(),
          alertEvent.getMetricKey(),
          alertEvent.getSeverity());
      return List.of();
    }

    List<NotificationChannelConfig> channels =
        configStore.getChannelsByIds(alertEvent.getOrgId(), channelIds).stream()
            .filter(NotificationChannelConfig::isEnabled)
            .collect(Collectors.toList());
    LOGGER.debug(
        "Alert {} matched {} preferences and {} enabled channels",
        alertEvent.getId(),
        preferences.size(),
        channels.size());
    return channels;
  }
}
