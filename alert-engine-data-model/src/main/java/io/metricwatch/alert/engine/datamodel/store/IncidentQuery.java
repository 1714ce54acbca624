package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class IncidentQuery {
  private final IncidentStatus status;
  private final Instant startedAtOrAfter;
  private final String relatedMetric;
  private final Integer limit;

  public boolean matches(AlertIncident incident) {
    if (status != null && incident.getStatus() != status) {
      return false;
    }
    if (startedAtOrAfter != null && incident.getStartedAt().isBefore(startedAtOrAfter)) {
      return false;
    }
    return relatedMetric == null || incident.getRelatedMetrics().contains(relatedMetric);
  }
}
