package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import lombok.Getter;

/** Raised by an update whose status precondition no longer holds for the stored incident. */
@Getter
public class IncidentStatusConflictException extends RuntimeException {

  private final String incidentId;
  private final IncidentStatus currentStatus;

  public IncidentStatusConflictException(String incidentId, IncidentStatus currentStatus) {
    super(
        String.format(
            "Incident %s is %s, which the update does not expect",
            incidentId, currentStatus.getValue()));
    this.incidentId = incidentId;
    this.currentStatus = currentStatus;
  }
}
