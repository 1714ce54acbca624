package io.metricwatch.alert.engine.incident;

public class IncidentNotFoundException extends RuntimeException {

  public IncidentNotFoundException(String orgId, String incidentId) {
    super(String.format("Incident %s not found for org %s", incidentId, orgId));
  }
}
