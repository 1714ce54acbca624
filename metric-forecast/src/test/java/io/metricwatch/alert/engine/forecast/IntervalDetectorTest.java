package io.metricwatch.alert.engine.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntervalDetectorTest {

  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

  @Test
  void testMedianOfPositiveDeltas() {
    List<TimeSeriesPoint> points =
        List.of(
            TimeSeriesPoint.of(T0, 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(1)), 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(1)), 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(2)), 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(7)), 1));

    // deltas 1h, 0 (dropped), 1h, 5h
    assertEquals(Duration.ofHours(1), IntervalDetector.detectInterval(points));
  }

  @Test
  void testUpperMedianForEvenCount() {
    List<TimeSeriesPoint> points =
        List.of(
            TimeSeriesPoint.of(T0, 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofMinutes(10)), 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofMinutes(40)), 1));

    assertEquals(Duration.ofMinutes(30), IntervalDetector.detectInterval(points));
  }

  @Test
  void testDefaultsToOneDayWithoutPositiveDeltas() {
    List<TimeSeriesPoint> points = List.of(TimeSeriesPoint.of(T0, 1), TimeSeriesPoint.of(T0, 2));

    assertEquals(Duration.ofDays(1), IntervalDetector.detectInterval(points));
  }

  @Test
  void testZScoreLookup() {
    assertEquals(1.645, ZScoreTable.zScore(0.90));
    assertEquals(2.576, ZScoreTable.zScore(0.99));
    assertEquals(1.96, ZScoreTable.zScore(0.5));
  }
}
