package io.metricwatch.alert.engine.datamodel.trigger;

import io.metricwatch.alert.engine.datamodel.ThresholdOperator;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** A forecast prediction inside the rule horizon crossed the rule threshold. */
@SuperBuilder
@Getter
@ToString(callSuper = true)
public class ForecastTrigger extends TriggerDetails {
  public static final String TYPE = "forecast";

  private final double predictedValue;
  private final double confidenceLower;
  private final double confidenceUpper;
  private final Instant predictionTimestamp;
  private final ThresholdOperator operator;
  private final double threshold;
  private final int horizonDays;

  @Override
  public <T> T accept(TriggerDetailsVisitor<T> visitor) {
    return visitor.visit(this);
  }

  @Override
  public String getType() {
    return TYPE;
  }
}
