package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.ChannelConfigVisitor;
import io.metricwatch.alert.engine.datamodel.IdGenerator;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.PagerDutyChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationPreference;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/** Mutable store backing tests and single-node deployments. */
public class InMemoryNotificationConfigStore implements NotificationConfigStore {

  private final ConcurrentMap<String, ConcurrentMap<String, NotificationChannelConfig>>
      channelsByOrg = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, ConcurrentMap<String, NotificationPreference>>
      preferencesByOrg = new ConcurrentHashMap<>();

  @Override
  public List<NotificationPreference> getEnabledPreferences(String orgId) {
    return preferences(orgId).values().stream()
        .filter(NotificationPreference::isEnabled)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<NotificationChannelConfig> getChannelsByIds(
      String orgId, Collection<String> channelIds) {
    Map<String, NotificationChannelConfig> channels = channels(orgId);
    return channelIds.stream()
        .map(channels::get)
        .filter(Objects::nonNull)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public void recordChannelUsed(String orgId, String channelId, Instant usedAt) {
    channels(orgId).computeIfPresent(channelId, (id, channel) -> withLastUsedAt(channel, usedAt));
  }

  public NotificationChannelConfig upsertChannel(NotificationChannelConfig channel) {
    channels(channel.getOrgId()).put(channel.getChannelId(), channel);
    return channel;
  }

  public NotificationPreference upsertPreference(NotificationPreference preference) {
    NotificationPreference stored =
        preference.getId() == null
            ? preference.toBuilder().id(IdGenerator.generateId("pref")).build()
            : preference;
    preferences(stored.getOrgId()).put(stored.getId(), stored);
    return stored;
  }

  public boolean deleteChannel(String orgId, String channelId) {
    return channels(orgId).remove(channelId) != null;
  }

  public boolean deletePreference(String orgId, String preferenceId) {
    return preferences(orgId).remove(preferenceId) != null;
  }

  public List<NotificationChannelConfig> listChannels(String orgId) {
    return List.copyOf(channels(orgId).values());
  }

  public List<NotificationPreference> listPreferences(String orgId) {
    return List.copyOf(preferences(orgId).values());
  }

  private Map<String, NotificationChannelConfig> channels(String orgId) {
    return channelsByOrg.computeIfAbsent(orgId, k -> new ConcurrentHashMap<>());
  }

  private Map<String, NotificationPreference> preferences(String orgId) {
    return preferencesByOrg.computeIfAbsent(orgId, k -> new ConcurrentHashMap<>());
  }

  private static NotificationChannelConfig withLastUsedAt(
      NotificationChannelConfig channel, Instant usedAt) {
    return channel.accept(
        new ChannelConfigVisitor<NotificationChannelConfig>() {
          @Override
          public NotificationChannelConfig visit(EmailChannelConfig email) {
            return email.toBuilder().lastUsedAt(usedAt).build();
          }

          @Override
          public NotificationChannelConfig visit(SlackWebhookChannelConfig slack) {
            return slack.toBuilder().lastUsedAt(usedAt).build();
          }

          @Override
          public NotificationChannelConfig visit(HttpWebhookChannelConfig webhook) {
            return webhook.toBuilder().lastUsedAt(usedAt).build();
          }

          @Override
          public NotificationChannelConfig visit(PagerDutyChannelConfig pagerDuty) {
            return pagerDuty.toBuilder().lastUsedAt(usedAt).build();
          }
        });
  }
}
