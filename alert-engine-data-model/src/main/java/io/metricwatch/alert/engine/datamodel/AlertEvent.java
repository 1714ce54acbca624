package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.metricwatch.alert.engine.datamodel.trigger.TriggerDetails;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** A single alert trigger instance. Immutable once built. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class AlertEvent {
  private final String id;
  private final String orgId;
  private final String ruleId;
  private final String metricKey;
  private final Severity severity;
  private final String title;
  private final String message;

  @Singular("contextValue")
  private final Map<String, Object> context;

  private final Instant occurredAt;
  private final TriggerDetails triggerDetails;
}
