package io.metricwatch.alert.engine.forecast;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class ForecastMetrics {
  private final int inputPoints;
  private final int outputPoints;
  private final long durationMs;
}
