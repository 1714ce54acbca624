package io.metricwatch.alert.engine.incident;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.datamodel.store.InMemoryIncidentRepository;
import io.metricwatch.alert.engine.datamodel.store.IncidentQuery;
import io.metricwatch.alert.engine.datamodel.store.IncidentRepository;
import io.metricwatch.alert.engine.datamodel.store.IncidentUpdate;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IncidentCorrelatorTest {

  private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

  private Config incidentConfig;
  private InMemoryIncidentRepository repository;
  private IncidentCorrelator correlator;

  @BeforeEach
  void setup() throws URISyntaxException, MalformedURLException {
    incidentConfig =
        ConfigFactory.parseURL(
                Thread.currentThread()
                    .getContextClassLoader()
                    .getResource("application.conf")
                    .toURI()
                    .toURL())
            .getConfig("incident");
    repository = new InMemoryIncidentRepository();
    correlator =
        new IncidentCorrelator(
            repository, incidentConfig, Clock.fixed(T0.plus(Duration.ofHours(1)), ZoneOffset.UTC));
  }

  @Test
  void testFirstAlertOpensIncident() {
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));

    assertTrue(incident.getId().startsWith("inc_"));
    assertEquals(IncidentStatus.OPEN, incident.getStatus());
    assertEquals("Alert: stripe:mrr", incident.getTitle());
    assertEquals("1 alert for stripe:mrr", incident.getSummary());
    assertEquals(T0, incident.getStartedAt());
    assertEquals(List.of("evt-1"), incident.getAlertEventIds());
    assertEquals(List.of("stripe:mrr"), incident.getRelatedMetrics());
    assertEquals(10, incident.getCorrelationMetadata().getTimeWindowMinutes());
    assertTrue(correlator.getIncident("org-1", incident.getId()).isPresent());
  }

  @Test
  void testAlertsForSameMetricWithinWindowShareIncident() {
    AlertIncident first = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    AlertIncident second =
        correlator.findOrCreateIncident(
            event("evt-2", "stripe:mrr", T0.plus(Duration.ofMinutes(5))));

    assertEquals(first.getId(), second.getId());
    assertEquals(List.of("evt-1", "evt-2"), second.getAlertEventIds());
    assertEquals(List.of("stripe:mrr"), second.getRelatedMetrics());
    assertEquals("2 alerts across 1 metric: stripe:mrr", second.getSummary());
    assertEquals(1, correlator.listIncidents("org-1", ListIncidentsOptions.builder().build()).size());
  }

  @Test
  void testAlertsOutsideWindowOrForOtherMetricsOpenNewIncidents() {
    AlertIncident first = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    AlertIncident otherMetric =
        correlator.findOrCreateIncident(
            event("evt-2", "sentry:errors", T0.plus(Duration.ofMinutes(1))));
    AlertIncident late =
        correlator.findOrCreateIncident(
            event("evt-3", "stripe:mrr", T0.plus(Duration.ofMinutes(11))));

    assertNotEquals(first.getId(), otherMetric.getId());
    assertNotEquals(first.getId(), late.getId());
    assertEquals(List.of("evt-1"), repository.get("org-1", first.getId()).orElseThrow().getAlertEventIds());
  }

  @Test
  void testAlertsAreNotAddedToAcknowledgedIncidents() {
    AlertIncident first = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    correlator.acknowledgeIncident("org-1", first.getId(), "user-1");

    AlertIncident second =
        correlator.findOrCreateIncident(
            event("evt-2", "stripe:mrr", T0.plus(Duration.ofMinutes(2))));

    assertNotEquals(first.getId(), second.getId());
  }

  @Test
  void testTenantsAreIsolated() {
    AlertIncident first = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    AlertIncident other =
        correlator.findOrCreateIncident(
            event("evt-2", "stripe:mrr", T0.plus(Duration.ofMinutes(1))).toBuilder()
                .orgId("org-2")
                .build());

    assertNotEquals(first.getId(), other.getId());
  }

  @Test
  void testLifecycle() {
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));

    AlertIncident acknowledged =
        correlator.acknowledgeIncident("org-1", incident.getId(), null);
    assertEquals(IncidentStatus.ACKNOWLEDGED, acknowledged.getStatus());

    AlertIncident resolved = correlator.resolveIncident("org-1", incident.getId());
    assertEquals(IncidentStatus.RESOLVED, resolved.getStatus());
    assertEquals(T0.plus(Duration.ofHours(1)), resolved.getResolvedAt());

    assertThrows(
        IllegalIncidentTransitionException.class,
        () -> correlator.resolveIncident("org-1", incident.getId()));
    assertThrows(
        IllegalIncidentTransitionException.class,
        () -> correlator.acknowledgeIncident("org-1", incident.getId(), "user-1"));
  }

  @Test
  void testOpenIncidentCanBeResolvedDirectly() {
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));

    assertEquals(
        IncidentStatus.RESOLVED, correlator.resolveIncident("org-1", incident.getId()).getStatus());
  }

  @Test
  void testUnknownIncident() {
    assertThrows(
        IncidentNotFoundException.class, () -> correlator.resolveIncident("org-1", "inc_missing"));
    assertThrows(
        IncidentNotFoundException.class,
        () -> correlator.updateIncidentSummary("org-1", "inc_missing"));
    assertTrue(correlator.getIncident("org-1", "inc_missing").isEmpty());
  }

  @Test
  void testListIncidentsFiltersAndLimits() {
    correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    correlator.findOrCreateIncident(event("evt-2", "sentry:errors", T0.plus(Duration.ofMinutes(1))));
    AlertIncident newest =
        correlator.findOrCreateIncident(event("evt-3", "ga:sessions", T0.plus(Duration.ofMinutes(2))));
    correlator.resolveIncident("org-1", newest.getId());

    List<AlertIncident> all = correlator.listIncidents("org-1", ListIncidentsOptions.builder().build());
    assertEquals(2, all.size());
    assertEquals(newest.getId(), all.get(0).getId());

    List<AlertIncident> open =
        correlator.listIncidents(
            "org-1", ListIncidentsOptions.builder().status(IncidentStatus.OPEN).limit(10).build());
    assertEquals(2, open.size());

    List<AlertIncident> sentry =
        correlator.listIncidents(
            "org-1", ListIncidentsOptions.builder().metricKey("sentry:errors").build());
    assertEquals(1, sentry.size());
  }

  @Test
  void testVanishedIncidentFallsBackToNewIncident() {
    IncidentRepository incidentRepository = mock(IncidentRepository.class);
    AlertIncident stale =
        AlertIncident.builder()
            .id("inc_stale")
            .orgId("org-1")
            .status(IncidentStatus.OPEN)
            .startedAt(T0)
            .alertEventId("evt-0")
            .relatedMetric("stripe:mrr")
            .build();
    when(incidentRepository.query(eq("org-1"), any(IncidentQuery.class))).thenReturn(List.of(stale));
    when(incidentRepository.update(eq("org-1"), eq("inc_stale"), any(IncidentUpdate.class)))
        .thenReturn(Optional.empty());

    AlertIncident incident =
        new IncidentCorrelator(incidentRepository, incidentConfig)
            .findOrCreateIncident(event("evt-1", "stripe:mrr", T0.plus(Duration.ofMinutes(1))));

    assertNotEquals("inc_stale", incident.getId());
    assertEquals(List.of("evt-1"), incident.getAlertEventIds());
    verify(incidentRepository).put(eq("org-1"), any(AlertIncident.class));
  }

  @Test
  void testUpdateIncidentSummaryPluralises() {
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    repository.update(
        "org-1",
        incident.getId(),
        IncidentUpdate.builder()
            .alertEventIds(List.of("evt-1", "evt-2", "evt-3"))
            .relatedMetrics(List.of("stripe:mrr", "stripe:churn"))
            .build());

    AlertIncident updated = correlator.updateIncidentSummary("org-1", incident.getId());

    assertEquals("3 alerts across 2 metrics: stripe:mrr, stripe:churn", updated.getSummary());
    assertNotNull(updated.getUpdatedAt());
  }

  @Test
  void testCorrelateAlertsAnchorsWindowOnGroupStart() {
    List<AlertEvent> events =
        List.of(
            event("evt-3", "ga:sessions", T0.plus(Duration.ofMinutes(8))),
            event("evt-1", "stripe:mrr", T0),
            event("evt-2", "sentry:errors", T0.plus(Duration.ofMinutes(4))),
            event("evt-4", "stripe:mrr", T0.plus(Duration.ofMinutes(12))),
            event("evt-5", "stripe:mrr", T0.plus(Duration.ofMinutes(22))));

    CorrelationAnalysis analysis = correlator.correlateAlerts(events, 10);

    assertEquals(5, analysis.getTotalAlerts());
    assertEquals(2, analysis.getGroupCount());
    CorrelationGroup first = analysis.getGroups().get(0);
    assertEquals(3, first.getAlerts().size());
    assertEquals(List.of("stripe:mrr", "sentry:errors", "ga:sessions"), first.getRelatedMetrics());
    assertEquals(T0, first.getTimeSpan().getStart());
    assertEquals(T0.plus(Duration.ofMinutes(8)), first.getTimeSpan().getEnd());
    CorrelationGroup second = analysis.getGroups().get(1);
    assertEquals(2, second.getAlerts().size());
    assertEquals(T0.plus(Duration.ofMinutes(12)), second.getTimeSpan().getStart());
  }

  @Test
  void testCorrelateNoAlerts() {
    CorrelationAnalysis analysis = correlator.correlateAlerts(List.of());

    assertEquals(0, analysis.getGroupCount());
    assertEquals(0, analysis.getTotalAlerts());
  }

  @Test
  void testAcknowledgeDoesNotReopenIncidentResolvedConcurrently() {
    IncidentCorrelator otherCorrelator = new IncidentCorrelator(repository, incidentConfig);
    IncidentRepository racingRepository =
        new InMemoryIncidentRepository() {
          @Override
          public Optional<AlertIncident> update(
              String orgId, String incidentId, IncidentUpdate update) {
            otherCorrelator.resolveIncident(orgId, incidentId);
            return repository.update(orgId, incidentId, update);
          }

          @Override
          public Optional<AlertIncident> get(String orgId, String incidentId) {
            return repository.get(orgId, incidentId);
          }
        };
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));

    assertThrows(
        IllegalIncidentTransitionException.class,
        () ->
            new IncidentCorrelator(racingRepository, incidentConfig)
                .acknowledgeIncident("org-1", incident.getId(), "user-1"));

    AlertIncident stored = repository.get("org-1", incident.getId()).orElseThrow();
    assertEquals(IncidentStatus.RESOLVED, stored.getStatus());
    assertNotNull(stored.getResolvedAt());
  }

  @Test
  void testAlertIsNotAddedToIncidentAcknowledgedConcurrently() {
    AlertIncident incident = correlator.findOrCreateIncident(event("evt-1", "stripe:mrr", T0));
    IncidentRepository racingRepository =
        new InMemoryIncidentRepository() {
          @Override
          public List<AlertIncident> query(String orgId, IncidentQuery query) {
            List<AlertIncident> candidates = repository.query(orgId, query);
            correlator.acknowledgeIncident(orgId, incident.getId(), null);
            return candidates;
          }

          @Override
          public Optional<AlertIncident> update(
              String orgId, String incidentId, IncidentUpdate update) {
            return repository.update(orgId, incidentId, update);
          }

          @Override
          public void put(String orgId, AlertIncident newIncident) {
            repository.put(orgId, newIncident);
          }
        };

    AlertIncident second =
        new IncidentCorrelator(racingRepository, incidentConfig)
            .findOrCreateIncident(event("evt-2", "stripe:mrr", T0.plus(Duration.ofMinutes(1))));

    assertNotEquals(incident.getId(), second.getId());
    assertEquals(List.of("evt-2"), second.getAlertEventIds());
    AlertIncident acknowledged = repository.get("org-1", incident.getId()).orElseThrow();
    assertEquals(IncidentStatus.ACKNOWLEDGED, acknowledged.getStatus());
    assertEquals(List.of("evt-1"), acknowledged.getAlertEventIds());
  }

  private static AlertEvent event(String id, String metricKey, Instant occurredAt) {
    return AlertEvent.builder()
        .id(id)
        .orgId("org-1")
        .ruleId("rule-1")
        .metricKey(metricKey)
        .severity(Severity.CRITICAL)
        .title("Alert")
        .message("Threshold crossed")
        .occurredAt(occurredAt)
        .build();
  }
}
