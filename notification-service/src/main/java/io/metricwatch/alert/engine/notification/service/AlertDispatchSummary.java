package io.metricwatch.alert.engine.notification.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import java.time.Instant;
import java.util.List;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Aggregate outcome of one dispatch. {@code channelsSelected == channelsNotified + channelsFailed}
 * always holds since the counts are derived from {@link #getResults()}.
 */
@SuperBuilder
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class AlertDispatchSummary {
  private final AlertEvent alertEvent;
  private final int channelsSelected;
  private final int channelsNotified;
  private final int channelsFailed;
  @Singular private final List<DispatchResult> results;
  private final Instant dispatchedAt;
  private final long durationMs;
  private final AlertIncident incident;
}
