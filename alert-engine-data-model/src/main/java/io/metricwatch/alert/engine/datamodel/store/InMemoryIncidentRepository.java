package io.metricwatch.alert.engine.datamodel.store;

import io.metricwatch.alert.engine.datamodel.AlertIncident;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class InMemoryIncidentRepository implements IncidentRepository {

  private final ConcurrentMap<String, ConcurrentMap<String, AlertIncident>> incidentsByOrg =
      new ConcurrentHashMap<>();

  @Override
  public Optional<AlertIncident> get(String orgId, String incidentId) {
    return Optional.ofNullable(tenant(orgId).get(incidentId));
  }

  @Override
  public List<AlertIncident> query(String orgId, IncidentQuery query) {
    Stream<AlertIncident> stream =
        tenant(orgId).values().stream()
            .filter(query::matches)
            .sorted(Comparator.comparing(AlertIncident::getStartedAt).reversed());
    if (query.getLimit() != null) {
      stream = stream.limit(query.getLimit());
    }
    return stream.collect(Collectors.toUnmodifiableList());
  }

  @Override
  public void put(String orgId, AlertIncident incident) {
    tenant(orgId).put(incident.getId(), incident);
  }

  @Override
  public Optional<AlertIncident> update(String orgId, String incidentId, IncidentUpdate update) {
    return Optional.ofNullable(
        tenant(orgId).computeIfPresent(incidentId, (id, existing) -> update.applyTo(existing)));
  }

  private Map<String, AlertIncident> tenant(String orgId) {
    return incidentsByOrg.computeIfAbsent(orgId, k -> new ConcurrentHashMap<>());
  }
}
