package io.metricwatch.alert.engine.datamodel.trigger;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** An observed value fell outside the confidence interval forecast for its timestamp. */
@SuperBuilder
@Getter
@ToString(callSuper = true)
public class AnomalyTrigger extends TriggerDetails {
  public static final String TYPE = "anomaly";

  private final double observedValue;
  private final double expectedValue;
  private final double lowerBound;
  private final double upperBound;
  private final double confidenceLevel;
  private final Instant observedAt;

  @Override
  public <T> T accept(TriggerDetailsVisitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public String getType() {
    return TYPE;
  }
}
