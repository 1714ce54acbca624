package io.metricwatch.alert.engine.incident;

import io.metricwatch.alert.engine.datamodel.IncidentStatus;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** All fields are optional. A missing limit uses the configured list limit. */
@SuperBuilder
@Getter
@ToString
public class ListIncidentsOptions {
  private final IncidentStatus status;
  private final Integer limit;
  private final String metricKey;
}
