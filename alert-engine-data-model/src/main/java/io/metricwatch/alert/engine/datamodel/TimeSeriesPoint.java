package io.metricwatch.alert.engine.datamodel;

import java.time.Instant;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class TimeSeriesPoint {
  private final Instant timestamp;
  private final double value;

  private TimeSeriesPoint(Instant timestamp, double value) {
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.value = value;
  }

  public static TimeSeriesPoint of(Instant timestamp, double value) {
    return new TimeSeriesPoint(timestamp, value);
  }
}
