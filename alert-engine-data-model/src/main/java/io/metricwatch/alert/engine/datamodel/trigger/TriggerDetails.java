package io.metricwatch.alert.engine.datamodel.trigger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * What caused an alert to fire. The variants are {@link ThresholdTrigger}, {@link ForecastTrigger}
 * and {@link AnomalyTrigger}; consumers branch on them through {@link TriggerDetailsVisitor}.
 */
@SuperBuilder
@Getter
@ToString
public abstract class TriggerDetails {

  public abstract <T> T accept(TriggerDetailsVisitor<T> visitor);

  @JsonProperty("type")
  public abstract String getType();
}
