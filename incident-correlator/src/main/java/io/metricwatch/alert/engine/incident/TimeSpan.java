package io.metricwatch.alert.engine.incident;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class TimeSpan {
  private final Instant start;
  private final Instant end;

  public TimeSpan(Instant start, Instant end) {
    this.start = start;
    this.end = end;
  }
}
