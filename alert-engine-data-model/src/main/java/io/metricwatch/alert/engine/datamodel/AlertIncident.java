package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import java.util.List;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A correlated group of alert events. Instances are immutable snapshots; the incident store holds
 * the current version and the correlator replaces it through partial updates.
 */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class AlertIncident {
  private final String id;
  private final String orgId;
  private final String title;
  private final String summary;
  private final IncidentStatus status;
  private final Instant startedAt;
  private final Instant resolvedAt;

  @Singular private final List<String> alertEventIds;
  @Singular private final List<String> relatedMetrics;

  private final CorrelationMetadata correlationMetadata;
  private final Instant createdAt;
  private final Instant updatedAt;

  @SuperBuilder
  @Getter
  @ToString
  public static class CorrelationMetadata {
    private final int timeWindowMinutes;
  }
}
