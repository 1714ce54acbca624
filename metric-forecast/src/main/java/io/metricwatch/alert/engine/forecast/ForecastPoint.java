package io.metricwatch.alert.engine.forecast;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class ForecastPoint {
  private final Instant timestamp;
  private final double predictedValue;
  private final double confidenceLower;
  private final double confidenceUpper;
  private final double confidenceLevel;

  public boolean isWithinInterval(double value) {
    return value >= confidenceLower && value <= confidenceUpper;
  }
}
