package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Maps an alert severity and an optional metric pattern to a set of channel ids. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class NotificationPreference {
  private final String id;
  private final String orgId;
  private final String userId;
  private final Severity severity;

  /** Absent pattern matches every metric. */
  private final MetricPattern metricPattern;

  @Singular private final List<String> channels;
  private final boolean enabled;

  public boolean matchesMetric(String metricKey) {
    return metricPattern == null || metricPattern.matches(metricKey);
  }
}
