package io.metricwatch.alert.engine.incident;

import com.typesafe.config.Config;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.AlertIncident.CorrelationMetadata;
import io.metricwatch.alert.engine.datamodel.IdGenerator;
import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import io.metricwatch.alert.engine.datamodel.store.IncidentQuery;
import io.metricwatch.alert.engine.datamodel.store.IncidentRepository;
import io.metricwatch.alert.engine.datamodel.store.IncidentStatusConflictException;
import io.metricwatch.alert.engine.datamodel.store.IncidentUpdate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups alert events into incidents and drives the incident lifecycle. This is the only writer
 * of incidents in the repository.
 */
public class IncidentCorrelator {

  private static final Logger LOGGER = LoggerFactory.getLogger(IncidentCorrelator.class);
  private static final String INCIDENT_ID_PREFIX = "inc";

  private final IncidentRepository incidentRepository;
  private final IncidentConfig incidentConfig;
  private final Clock clock;

  public IncidentCorrelator(IncidentRepository incidentRepository, Config incidentConfig) {
    this(incidentRepository, incidentConfig, Clock.systemUTC());
  }

  public IncidentCorrelator(
      IncidentRepository incidentRepository, Config incidentConfig, Clock clock) {
    this.incidentRepository = incidentRepository;
    this.incidentConfig = new IncidentConfig(incidentConfig);
    this.clock = clock;
  }

  public AlertIncident findOrCreateIncident(AlertEvent alertEvent) {
    return findOrCreateIncident(alertEvent, incidentConfig.getTimeWindowMinutes());
  }

  /**
   * Attaches the event to an open incident of the same org that started within the window before
   * the event and already involves its metric, or opens a new incident.
   *
   * <p>Reading candidates and writing the result are separate repository calls. Two concurrent
   * calls for the same metric and window can both miss each other and open two incidents. Closing
   * that gap needs a compare-and-swap or a serialized write path in the repository.
   */
  public AlertIncident findOrCreateIncident(AlertEvent alertEvent, int timeWindowMinutes) {
    String orgId = alertEvent.getOrgId();
    Instant windowStart =
        alertEvent.getOccurredAt().minus(Duration.ofMinutes(timeWindowMinutes));

    List<AlertIncident> candidates =
        incidentRepository.query(
            orgId,
            IncidentQuery.builder()
                .status(IncidentStatus.OPEN)
                .startedAtOrAfter(windowStart)
                .relatedMetric(alertEvent.getMetricKey())
                .build());

    Optional<AlertIncident> related =
        candidates.stream()
            .filter(incident -> incident.getRelatedMetrics().contains(alertEvent.getMetricKey()))
            .findFirst();
    if (related.isPresent()) {
      Optional<AlertIncident> updated = addAlertToIncident(related.get(), alertEvent);
      if (updated.isPresent()) {
        return updated.get();
      }
      LOGGER.warn(
          "Incident {} was closed or removed before alert {} could be added, creating a new one",
          related.get().getId(),
          alertEvent.getId());
    }
    return createIncident(alertEvent, timeWindowMinutes);
  }

  /** Recomputes the summary from the incident's current alerts and metrics. */
  public AlertIncident updateIncidentSummary(String orgId, String incidentId) {
    AlertIncident incident = getRequiredIncident(orgId, incidentId);
    return incidentRepository
        .update(
            orgId,
            incidentId,
            IncidentUpdate.builder()
                .summary(
                    IncidentSummaryFormatter.summarize(
                        incident.getAlertEventIds(), incident.getRelatedMetrics()))
                .updatedAt(clock.instant())
                .build())
        .orElseThrow(() -> new IncidentNotFoundException(orgId, incidentId));
  }

  public AlertIncident acknowledgeIncident(String orgId, String incidentId, String userId) {
    AlertIncident incident = transition(orgId, incidentId, IncidentStatus.ACKNOWLEDGED, null);
    if (userId != null) {
      LOGGER.info("Acknowledged incident {} of org {} by user {}", incidentId, orgId, userId);
    } else {
      LOGGER.info("Acknowledged incident {} of org {}", incidentId, orgId);
    }
    return incident;
  }

  public AlertIncident resolveIncident(String orgId, String incidentId) {
    AlertIncident incident =
        transition(orgId, incidentId, IncidentStatus.RESOLVED, clock.instant());
    LOGGER.info("Resolved incident {} of org {}", incidentId, orgId);
    return incident;
  }

  public Optional<AlertIncident> getIncident(String orgId, String incidentId) {
    return incidentRepository.get(orgId, incidentId);
  }

  /** Most recently started first. */
  public List<AlertIncident> listIncidents(String orgId, ListIncidentsOptions options) {
    return incidentRepository.query(
        orgId,
        IncidentQuery.builder()
            .status(options.getStatus())
            .relatedMetric(options.getMetricKey())
            .limit(options.getLimit() != null ? options.getLimit() : incidentConfig.getListLimit())
            .build());
  }

  public CorrelationAnalysis correlateAlerts(List<AlertEvent> alertEvents) {
    return correlateAlerts(alertEvents, incidentConfig.getTimeWindowMinutes());
  }

  /**
   * Offline grouping. Events are sorted by time and each group keeps accepting events until one
   * arrives more than {@code timeWindowMinutes} after the group's first event.
   */
  public CorrelationAnalysis correlateAlerts(List<AlertEvent> alertEvents, int timeWindowMinutes) {
    if (alertEvents.isEmpty()) {
      return new CorrelationAnalysis(List.of(), 0);
    }
    List<AlertEvent> sorted = new ArrayList<>(alertEvents);
    sorted.sort(Comparator.comparing(AlertEvent::getOccurredAt));
    Duration window = Duration.ofMinutes(timeWindowMinutes);

    List<CorrelationGroup> groups = new ArrayList<>();
    List<AlertEvent> current = new ArrayList<>();
    Instant groupStart = sorted.get(0).getOccurredAt();
    for (AlertEvent event : sorted) {
      if (Duration.between(groupStart, event.getOccurredAt()).compareTo(window) > 0) {
        groups.add(toGroup(current, groupStart));
        current = new ArrayList<>();
        groupStart = event.getOccurredAt();
      }
      current.add(event);
    }
    groups.add(toGroup(current, groupStart));

    return new CorrelationAnalysis(groups, alertEvents.size());
  }

  private Optional<AlertIncident> addAlertToIncident(
      AlertIncident incident, AlertEvent alertEvent) {
    List<String> alertEventIds = new ArrayList<>(incident.getAlertEventIds());
    alertEventIds.add(alertEvent.getId());
    Set<String> relatedMetrics = new LinkedHashSet<>(incident.getRelatedMetrics());
    relatedMetrics.add(alertEvent.getMetricKey());
    List<String> metrics = new ArrayList<>(relatedMetrics);

    Optional<AlertIncident> updated;
    try {
      updated =
          incidentRepository.update(
              alertEvent.getOrgId(),
              incident.getId(),
              IncidentUpdate.builder()
                  .alertEventIds(alertEventIds)
                  .relatedMetrics(metrics)
                  .summary(IncidentSummaryFormatter.summarize(alertEventIds, metrics))
                  .updatedAt(clock.instant())
                  .requiredCurrentStatuses(EnumSet.of(IncidentStatus.OPEN))
                  .build());
    } catch (IncidentStatusConflictException e) {
      LOGGER.debug("Incident {} is {}", e.getIncidentId(), e.getCurrentStatus().getValue());
      return Optional.empty();
    }
    updated.ifPresent(
        i ->
            LOGGER.info(
                "Added alert {} to incident {}, now {} alerts",
                alertEvent.getId(),
                i.getId(),
                i.getAlertEventIds().size()));
    return updated;
  }

  private AlertIncident createIncident(AlertEvent alertEvent, int timeWindowMinutes) {
    Instant now = clock.instant();
    AlertIncident incident =
        AlertIncident.builder()
            .id(IdGenerator.generateId(INCIDENT_ID_PREFIX))
            .orgId(alertEvent.getOrgId())
            .title("Alert: " + alertEvent.getMetricKey())
            .summary(
                IncidentSummaryFormatter.summarize(
                    List.of(alertEvent.getId()), List.of(alertEvent.getMetricKey())))
            .status(IncidentStatus.OPEN)
            .startedAt(alertEvent.getOccurredAt())
            .alertEventId(alertEvent.getId())
            .relatedMetric(alertEvent.getMetricKey())
            .correlationMetadata(
                CorrelationMetadata.builder().timeWindowMinutes(timeWindowMinutes).build())
            .createdAt(now)
            .updatedAt(now)
            .build();
    incidentRepository.put(alertEvent.getOrgId(), incident);
    LOGGER.info("Created incident {} for alert {}", incident.getId(), alertEvent.getId());
    return incident;
  }

  /** The status check runs inside the repository write, against the stored incident. */
  private AlertIncident transition(
      String orgId, String incidentId, IncidentStatus target, Instant resolvedAt) {
    EnumSet<IncidentStatus> allowedFrom = EnumSet.noneOf(IncidentStatus.class);
    for (IncidentStatus status : IncidentStatus.values()) {
      if (status.canTransitionTo(target)) {
        allowedFrom.add(status);
      }
    }
    try {
      return incidentRepository
          .update(
              orgId,
              incidentId,
              IncidentUpdate.builder()
                  .status(target)
                  .resolvedAt(resolvedAt)
                  .updatedAt(clock.instant())
                  .requiredCurrentStatuses(allowedFrom)
                  .build())
          .orElseThrow(() -> new IncidentNotFoundException(orgId, incidentId));
    } catch (IncidentStatusConflictException e) {
      throw new IllegalIncidentTransitionException(incidentId, e.getCurrentStatus(), target);
    }
  }

  private AlertIncident getRequiredIncident(String orgId, String incidentId) {
    return incidentRepository
        .get(orgId, incidentId)
        .orElseThrow(() -> new IncidentNotFoundException(orgId, incidentId));
  }

  private static CorrelationGroup toGroup(List<AlertEvent> alerts, Instant groupStart) {
    Set<String> metrics = new LinkedHashSet<>();
    alerts.forEach(alert -> metrics.add(alert.getMetricKey()));
    return new CorrelationGroup(
        alerts,
        new TimeSpan(groupStart, alerts.get(alerts.size() - 1).getOccurredAt()),
        new ArrayList<>(metrics));
  }
}
