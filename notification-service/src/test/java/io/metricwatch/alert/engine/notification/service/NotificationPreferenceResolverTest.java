package io.metricwatch.alert.engine.notification.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.MetricPattern;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationPreference;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.datamodel.store.InMemoryNotificationConfigStore;
import io.metricwatch.alert.engine.datamodel.store.NotificationConfigStore;
import io.metricwatch.alert.engine.datamodel.store.NotificationStoreException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationPreferenceResolverTest {

  private static final String ORG = "org-1";

  private InMemoryNotificationConfigStore store;

  @BeforeEach
  void setup() {
    store = new InMemoryNotificationConfigStore();
    store.upsertChannel(email("ch-stripe", true));
    store.upsertChannel(email("ch-sentry", true));
    store.upsertChannel(email("ch-all", true));
    store.upsertChannel(email("ch-off", false));
    store.upsertChannel(
        SlackWebhookChannelConfig.builder()
            .channelId("ch-slack")
            .orgId(ORG)
            .enabled(true)
            .webhookUrl("https://hooks.slack.com/services/T/B/X")
            .build());
  }

  @Test
  void testWildcardPatternMatchesOnlyItsPrefix() {
    store.upsertPreference(preference("p-stripe", Severity.CRITICAL, "stripe:*", "ch-stripe"));
    store.upsertPreference(preference("p-sentry", Severity.CRITICAL, "sentry:*", "ch-sentry"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);

    assertEquals(
        List.of("ch-stripe"), channelIds(resolver.getChannelsForAlert(alert(Severity.CRITICAL))));
  }

  @Test
  void testPreferenceWithoutPatternMatchesEveryMetric() {
    store.upsertPreference(preference("p-all", Severity.CRITICAL, null, "ch-all"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);

    assertEquals(
        List.of("ch-all"), channelIds(resolver.getChannelsForAlert(alert(Severity.CRITICAL))));
  }

  @Test
  void testChannelsAreDeduplicatedAndDisabledOnesDropped() {
    store.upsertPreference(
        preference("p-1", Severity.CRITICAL, "stripe:mrr", "ch-slack", "ch-stripe", "ch-off"));
    store.upsertPreference(preference("p-2", Severity.CRITICAL, "stripe:*", "ch-stripe", "ch-all"));
    store.upsertPreference(preference("p-3", Severity.CRITICAL, null, "ch-unknown", "ch-slack"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);
    List<String> channelIds = channelIds(resolver.getChannelsForAlert(alert(Severity.CRITICAL)));

    assertEquals(3, channelIds.size());
    assertEquals(Set.of("ch-slack", "ch-stripe", "ch-all"), new HashSet<>(channelIds));
  }

  @Test
  void testChannelOrderOfAPreferenceIsKept() {
    store.upsertPreference(
        preference("p-1", Severity.CRITICAL, "stripe:*", "ch-all", "ch-stripe", "ch-all"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);

    assertEquals(
        List.of("ch-all", "ch-stripe"),
        channelIds(resolver.getChannelsForAlert(alert(Severity.CRITICAL))));
  }

  @Test
  void testExactSeverityMatching() {
    store.upsertPreference(preference("p-warning", Severity.WARNING, "stripe:*", "ch-stripe"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);

    assertTrue(resolver.getChannelsForAlert(alert(Severity.CRITICAL)).isEmpty());
    assertEquals(1, resolver.getChannelsForAlert(alert(Severity.WARNING)).size());
    assertTrue(resolver.getChannelsForAlert(alert(Severity.INFO)).isEmpty());
  }

  @Test
  void testAtLeastSeverityMatching() {
    store.upsertPreference(preference("p-warning", Severity.WARNING, "stripe:*", "ch-stripe"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.AT_LEAST);

    assertEquals(1, resolver.getChannelsForAlert(alert(Severity.CRITICAL)).size());
    assertEquals(1, resolver.getChannelsForAlert(alert(Severity.WARNING)).size());
    assertTrue(resolver.getChannelsForAlert(alert(Severity.INFO)).isEmpty());
  }

  @Test
  void testDisabledPreferenceIsIgnored() {
    store.upsertPreference(
        preference("p-stripe", Severity.CRITICAL, "stripe:*", "ch-stripe").toBuilder()
            .enabled(false)
            .build());

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(store, SeverityMatchPolicy.EXACT);

    assertTrue(resolver.findMatchingPreferences(alert(Severity.CRITICAL)).isEmpty());
  }

  @Test
  void testStoreFailureIsPropagated() {
    NotificationConfigStore failingStore = mock(NotificationConfigStore.class);
    when(failingStore.getEnabledPreferences(ORG))
        .thenThrow(new NotificationStoreException("store unavailable"));

    NotificationPreferenceResolver resolver =
        new NotificationPreferenceResolver(failingStore, SeverityMatchPolicy.EXACT);

    assertThrows(
        NotificationStoreException.class,
        () -> resolver.getChannelsForAlert(alert(Severity.CRITICAL)));
  }

  private static AlertEvent alert(Severity severity) {
    return AlertEvent.builder()
        .id("alert-1")
        .orgId(ORG)
        .metricKey("stripe:mrr")
        .severity(severity)
        .title("MRR drop")
        .message("MRR is dropping")
        .occurredAt(Instant.parse("2024-03-01T12:00:00Z"))
        .build();
  }

  private static EmailChannelConfig email(String channelId, boolean enabled) {
    return EmailChannelConfig.builder()
        .channelId(channelId)
        .orgId(ORG)
        .enabled(enabled)
        .emailAddress(channelId + "@example.com")
        .build();
  }

  private static NotificationPreference preference(
      String id, Severity severity, String pattern, String... channels) {
    return NotificationPreference.builder()
        .id(id)
        .orgId(ORG)
        .severity(severity)
        .metricPattern(pattern == null ? null : MetricPattern.of(pattern))
        .channels(List.of(channels))
        .enabled(true)
        .build();
  }

  private static List<String> channelIds(List<NotificationChannelConfig> channels) {
    return channels.stream()
        .map(NotificationChannelConfig::getChannelId)
        .collect(Collectors.toList());
  }
}
