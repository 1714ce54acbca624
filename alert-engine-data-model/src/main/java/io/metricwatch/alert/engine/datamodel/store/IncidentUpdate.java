package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Partial incident update. Null fields are left untouched. When {@code requiredCurrentStatuses}
 * is set, the update only applies to an incident whose stored status is one of them.
 */
@SuperBuilder
@Getter
@ToString
public class IncidentUpdate {
  private final IncidentStatus status;
  private final String summary;
  private final List<String> alertEventIds;
  private final List<String> relatedMetrics;
  private final Instant resolvedAt;
  private final Instant updatedAt;
  private final Set<IncidentStatus> requiredCurrentStatuses;

  /**
   * @throws IncidentStatusConflictException if the incident's status is not one of the required
   *     current statuses
   */
  public AlertIncident applyTo(AlertIncident incident) {
    if (requiredCurrentStatuses != null
        && !requiredCurrentStatuses.contains(incident.getStatus())) {
      throw new IncidentStatusConflictException(incident.getId(), incident.getStatus());
    }
    AlertIncident.AlertIncidentBuilder<?, ?> builder = incident.toBuilder();
    if (status != null) {
      builder.status(status);
    }
    if (summary != null) {
      builder.summary(summary);
    }
    if (alertEventIds != null) {
      builder.clearAlertEventIds().alertEventIds(alertEventIds);
    }
    if (relatedMetrics != null) {
      builder.clearRelatedMetrics().relatedMetrics(relatedMetrics);
    }
    if (resolvedAt != null) {
      builder.resolvedAt(resolvedAt);
    }
    if (updatedAt != null) {
      builder.updatedAt(updatedAt);
    }
    return builder.build();
  }
}
