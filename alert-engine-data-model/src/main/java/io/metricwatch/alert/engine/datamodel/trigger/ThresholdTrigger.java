package io.metricwatch.alert.engine.datamodel.trigger;

import io.metricwatch.alert.engine.datamodel.ThresholdOperator;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** An observed metric value crossed the rule threshold. */
@SuperBuilder
@Getter
@ToString(callSuper = true)
public class ThresholdTrigger extends TriggerDetails {
  public static final String TYPE = "threshold";

  private final double observedValue;
  private final ThresholdOperator operator;
  private final double threshold;

  @Override
  public <T> T accept(TriggerDetailsVisitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public String getType() {
    return TYPE;
  }
}
