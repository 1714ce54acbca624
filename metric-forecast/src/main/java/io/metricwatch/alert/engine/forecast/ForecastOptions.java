package io.metricwatch.alert.engine.forecast;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Per-call forecast options. {@code confidenceLevel} and {@code method} are optional and fall
 * back to the engine defaults. {@code tenantId} only tags latency metrics.
 */
@SuperBuilder
@Getter
@ToString
public class ForecastOptions {
  private final String tenantId;
  private final int horizonDays;
  private final Double confidenceLevel;
  private final ForecastMethod method;
}
