package io.metricwatch.alert.engine.evaluator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.metricwatch.alert.engine.datamodel.Severity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * A tenant's alert rule. The condition is given either as {@code condition} or in the legacy
 * {@code direction} plus {@code threshold} form; {@link #getEffectiveCondition()} normalises both.
 */
@SuperBuilder(toBuilder = true)
@Jacksonized
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class AlertRule {
  private static final int DEFAULT_HORIZON_DAYS = 7;

  private final String id;
  private final String orgId;
  private final String name;
  private final String description;
  @Builder.Default private final AlertRuleType type = AlertRuleType.THRESHOLD;
  private final String metricKey;
  private final ThresholdCondition condition;
  private final AlertDirection direction;
  private final Double threshold;
  private final Severity severity;
  private final SeverityThreshold severityThreshold;
  @Builder.Default private final int horizonDays = DEFAULT_HORIZON_DAYS;
  @Builder.Default private final boolean enabled = true;

  /**
   * Checks that the rule can be evaluated.
   *
   * @throws IllegalArgumentException if the metric key is missing, or a threshold rule carries
   *     neither a condition nor a direction with a threshold
   */
  public AlertRule validate() {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(metricKey), "Rule %s has no metricKey", id);
    Preconditions.checkArgument(horizonDays > 0, "Rule %s has a non-positive horizonDays", id);
    if (type == AlertRuleType.THRESHOLD) {
      getEffectiveCondition();
    }
    return this;
  }

  @JsonIgnore
  public ThresholdCondition getEffectiveCondition() {
    if (condition != null) {
      Preconditions.checkArgument(
          condition.getOperator() != null, "Rule %s has a condition without operator", id);
      return condition;
    }
    Preconditions.checkArgument(
        direction != null && threshold != null,
        "Rule %s needs either condition or direction and threshold",
        id);
    return ThresholdCondition.of(direction.toOperator(), threshold);
  }

  /** Explicit severity, else the one implied by severityThreshold, else warning. */
  @JsonIgnore
  public Severity getEffectiveSeverity() {
    if (severity != null) {
      return severity;
    }
    if (severityThreshold != null) {
      return severityThreshold.toSeverity();
    }
    return Severity.WARNING;
  }
}
