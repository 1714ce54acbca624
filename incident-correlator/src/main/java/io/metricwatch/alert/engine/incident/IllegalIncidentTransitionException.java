package io.metricwatch.alert.engine.incident;

import io.metricwatch.alert.engine.datamodel.IncidentStatus;

public class IllegalIncidentTransitionException extends RuntimeException {

  public IllegalIncidentTransitionException(
      String incidentId, IncidentStatus from, IncidentStatus to) {
    super(
        String.format(
            "Incident %s cannot move from %s to %s", incidentId, from.getValue(), to.getValue()));
  }
}
