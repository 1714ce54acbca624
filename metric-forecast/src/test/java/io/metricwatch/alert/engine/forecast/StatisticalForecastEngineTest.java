package io.metricwatch.alert.engine.forecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class StatisticalForecastEngineTest {

  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
  private static final double DELTA = 1e-9;

  private SimpleMeterRegistry meterRegistry;
  private StatisticalForecastEngine engine;

  @BeforeEach
  void setup() throws URISyntaxException, MalformedURLException {
    Config config =
        ConfigFactory.parseURL(
            Thread.currentThread()
                .getContextClassLoader()
                .getResource("application.conf")
                .toURI()
                .toURL());
    meterRegistry = new SimpleMeterRegistry();
    engine = new StatisticalForecastEngine(config.getConfig("forecast"), meterRegistry);
  }

  @Test
  void testSmaForecastOfThreeDailyPoints() {
    List<TimeSeriesPoint> points =
        List.of(
            TimeSeriesPoint.of(T0, 100),
            TimeSeriesPoint.of(T0.plus(Duration.ofDays(1)), 110),
            TimeSeriesPoint.of(T0.plus(Duration.ofDays(2)), 105));

    ForecastResult result =
        engine
            .forecast(
                points,
                ForecastOptions.builder().horizonDays(7).method(ForecastMethod.SMA).build())
            .orElseThrow();

    assertEquals(7, result.getPredictions().size());
    for (int i = 0; i < 7; i++) {
      ForecastPoint point = result.getPredictions().get(i);
      assertEquals(105, point.getPredictedValue(), DELTA);
      // one-point window, so the standard deviation and every margin are zero
      assertEquals(105, point.getConfidenceLower(), DELTA);
      assertEquals(105, point.getConfidenceUpper(), DELTA);
      assertEquals(T0.plus(Duration.ofDays(3 + i)), point.getTimestamp());
      assertEquals(0.95, point.getConfidenceLevel(), DELTA);
    }
    assertEquals("Statistical SMA", result.getModelInfo().getName());
    assertEquals("1.0.0", result.getModelInfo().getVersion());
    assertEquals(1, result.getModelInfo().getParameters().get("windowSize"));
    assertEquals(3, result.getMetrics().getInputPoints());
    assertEquals(7, result.getMetrics().getOutputPoints());
  }

  @Test
  void testSmaMarginWidensWithHorizon() {
    ForecastResult result =
        engine
            .forecast(
                daily(10, 20, 30, 40),
                ForecastOptions.builder().horizonDays(3).method(ForecastMethod.SMA).build())
            .orElseThrow();

    ForecastPoint first = result.getPredictions().get(0);
    assertEquals(35, first.getPredictedValue(), DELTA);
    assertEquals(1.96 * 5 * Math.sqrt(1.5), first.getConfidenceUpper() - 35, 1e-6);
    assertEquals(5.0, (double) result.getModelInfo().getParameters().get("stdDev"), DELTA);
  }

  @Test
  void testEwmaIsDefaultMethodAndAddsTrend() {
    ForecastResult result =
        engine.forecast(daily(10, 20), ForecastOptions.builder().horizonDays(2).build()).orElseThrow();

    double ewma = 2.0 / 3 * 20 + 1.0 / 3 * 10;
    assertEquals("Statistical EWMA", result.getModelInfo().getName());
    assertEquals(ewma + 5, result.getPredictions().get(0).getPredictedValue(), DELTA);
    assertEquals(ewma + 10, result.getPredictions().get(1).getPredictedValue(), DELTA);
    assertEquals(5.0, (double) result.getModelInfo().getParameters().get("trend"), DELTA);
  }

  @Test
  void testLinearFitsExactTrend() {
    ForecastResult result =
        engine
            .forecast(
                daily(1, 3, 5, 7),
                ForecastOptions.builder().horizonDays(2).method(ForecastMethod.LINEAR).build())
            .orElseThrow();

    assertEquals(9, result.getPredictions().get(0).getPredictedValue(), DELTA);
    assertEquals(11, result.getPredictions().get(1).getPredictedValue(), DELTA);
    assertEquals(2.0, (double) result.getModelInfo().getParameters().get("slope"), DELTA);
    assertEquals(1.0, (double) result.getModelInfo().getParameters().get("r2"), DELTA);
    assertEquals(0.0, (double) result.getModelInfo().getParameters().get("stdError"), DELTA);
  }

  @Test
  void testLinearWithTwoPointsHasZeroStandardError() {
    ForecastResult result =
        engine
            .forecast(
                daily(4, 8),
                ForecastOptions.builder().horizonDays(1).method(ForecastMethod.LINEAR).build())
            .orElseThrow();

    ForecastPoint point = result.getPredictions().get(0);
    assertEquals(12, point.getPredictedValue(), DELTA);
    assertEquals(point.getPredictedValue(), point.getConfidenceLower(), DELTA);
    assertEquals(point.getPredictedValue(), point.getConfidenceUpper(), DELTA);
  }

  @ParameterizedTest
  @EnumSource(ForecastMethod.class)
  void testIntervalsContainPredictionAndNeverNarrow(ForecastMethod method) {
    ForecastResult result =
        engine
            .forecast(
                daily(12, 15, 11, 19, 14, 22, 17, 25, 21, 28, 24, 30),
                ForecastOptions.builder().horizonDays(30).method(method).build())
            .orElseThrow();

    assertEquals(30, result.getPredictions().size());
    double previousMargin = -1;
    for (ForecastPoint point : result.getPredictions()) {
      assertTrue(point.getConfidenceLower() <= point.getPredictedValue());
      assertTrue(point.getPredictedValue() <= point.getConfidenceUpper());
      double margin = point.getConfidenceUpper() - point.getPredictedValue();
      assertTrue(margin >= previousMargin - DELTA);
      previousMargin = margin;
    }
  }

  @Test
  void testInputIsSortedBeforeFitting() {
    List<TimeSeriesPoint> points =
        List.of(
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(2)), 7),
            TimeSeriesPoint.of(T0, 1),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(3)), 9),
            TimeSeriesPoint.of(T0.plus(Duration.ofHours(1)), 3));

    ForecastResult result =
        engine
            .forecast(
                points, ForecastOptions.builder().horizonDays(1).method(ForecastMethod.LINEAR).build())
            .orElseThrow();

    assertEquals(T0.plus(Duration.ofHours(4)), result.getPredictions().get(0).getTimestamp());
    assertEquals(2.8, (double) result.getModelInfo().getParameters().get("slope"), 1e-9);
  }

  @Test
  void testInsufficientData() {
    ForecastOutcome outcome =
        engine.forecast(daily(42), ForecastOptions.builder().horizonDays(7).build());

    assertFalse(outcome.isSuccess());
    assertEquals(ForecastErrorCode.INSUFFICIENT_DATA, outcome.getError().orElseThrow().getCode());
    assertThrows(InsufficientDataException.class, outcome::orElseThrow);
    assertFalse(
        engine.forecast(List.of(), ForecastOptions.builder().horizonDays(7).build()).isSuccess());
  }

  @Test
  void testInvalidHorizon() {
    ForecastOutcome zero = engine.forecast(daily(1, 2), ForecastOptions.builder().horizonDays(0).build());
    ForecastOutcome tooFar =
        engine.forecast(daily(1, 2), ForecastOptions.builder().horizonDays(91).build());

    assertEquals(ForecastErrorCode.INVALID_HORIZON, zero.getError().orElseThrow().getCode());
    assertEquals(ForecastErrorCode.INVALID_HORIZON, tooFar.getError().orElseThrow().getCode());
    assertThrows(IllegalArgumentException.class, tooFar::orElseThrow);
  }

  @Test
  void testLatencyIsRecordedPerTenantAndMethod() {
    engine.forecast(
        daily(1, 2, 3),
        ForecastOptions.builder().tenantId("org-1").horizonDays(3).method(ForecastMethod.SMA).build());

    assertEquals(
        1,
        meterRegistry
            .get("metricwatch.forecast.latency")
            .tag("tenantId", "org-1")
            .tag("method", "sma")
            .timer()
            .count());
  }

  private static List<TimeSeriesPoint> daily(double... values) {
    List<TimeSeriesPoint> points = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      points.add(TimeSeriesPoint.of(T0.plus(Duration.ofDays(i)), values[i]));
    }
    return points;
  }
}
