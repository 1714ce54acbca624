package io.metricwatch.alert.engine.forecast;

import java.util.List;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Predictions for each requested horizon step, in timestamp order. */
@SuperBuilder
@Getter
@ToString
public class ForecastResult {
  @Singular private final List<ForecastPoint> predictions;
  private final ModelInfo modelInfo;
  private final ForecastMetrics metrics;
}
