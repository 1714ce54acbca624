package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.AlertIncident;
import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped incident storage. Implementations only need equality and range filtering on
 * status and start time plus a contains check on related metrics.
 *
 * <p>No method here is transactional across calls. Callers that read then write (query followed
 * by update) can race with each other. A status precondition on {@link IncidentUpdate} makes a
 * lifecycle write conditional on the status it was decided from.
 */
public interface IncidentRepository {

  Optional<AlertIncident> get(String orgId, String incidentId);

  /** Returns matching incidents, most recently started first. */
  List<AlertIncident> query(String orgId, IncidentQuery query);

  void put(String orgId, AlertIncident incident);

  /**
   * Applies the partial update and returns the new version, or empty if the id is unknown. The
   * update's status precondition is checked against the stored incident atomically with the
   * write.
   *
   * @throws IncidentStatusConflictException if the stored status fails the precondition
   */
  Optional<AlertIncident> update(String orgId, String incidentId, IncidentUpdate update);
}
