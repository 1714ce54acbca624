package io.metricwatch.alert.engine.evaluator;

import io.metricwatch.alert.engine.datamodel.ThresholdOperator;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

@SuperBuilder
@Jacksonized
@Getter
@ToString
public class ThresholdCondition {
  private final ThresholdOperator operator;
  private final double value;

  public static ThresholdCondition of(ThresholdOperator operator, double value) {
    return ThresholdCondition.builder().operator(operator).value(value).build();
  }

  public boolean test(double observed) {
    return operator.test(observed, value);
  }
}
