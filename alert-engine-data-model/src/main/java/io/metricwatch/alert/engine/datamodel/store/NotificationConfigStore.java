package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationPreference;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/** Read access to a tenant's notification channels and preferences. */
public interface NotificationConfigStore {

  List<NotificationPreference> getEnabledPreferences(String orgId);

  /** Unknown ids are skipped. Disabled channels are returned; filtering is up to the caller. */
  List<NotificationChannelConfig> getChannelsByIds(String orgId, Collection<String> channelIds);

  void recordChannelUsed(String orgId, String channelId, Instant usedAt);
}
