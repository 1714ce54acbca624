package io.metricwatch.alert.engine.forecast;

import com.typesafe.config.Config;
import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import io.metricwatch.alert.engine.forecast.model.ExponentialMovingAverageModel;
import io.metricwatch.alert.engine.forecast.model.FittedModel;
import io.metricwatch.alert.engine.forecast.model.ForecastModel;
import io.metricwatch.alert.engine.forecast.model.LinearTrendModel;
import io.metricwatch.alert.engine.forecast.model.SimpleMovingAverageModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Closed-form statistical forecasts. Stateless apart from its latency timers. */
public class StatisticalForecastEngine implements ForecastEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatisticalForecastEngine.class);
  private static final String FORECAST_TIMER = "metricwatch.forecast.latency";
  private static final String DEFAULT_TENANT = "default";
  private static final String MODEL_VERSION = "1.0.0";
  private static final int MIN_POINTS = 2;

  private final ConcurrentMap<String, Timer> forecastTimers = new ConcurrentHashMap<>();
  private final ForecastConfig forecastConfig;
  private final MeterRegistry meterRegistry;

  public StatisticalForecastEngine(Config forecastConfig, MeterRegistry meterRegistry) {
    this.forecastConfig = new ForecastConfig(forecastConfig);
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String getType() {
    return "statistical";
  }

  @Override
  public String getName() {
    return "Statistical Forecast Engine";
  }

  @Override
  public ForecastOutcome forecast(List<TimeSeriesPoint> points, ForecastOptions options) {
    Instant startTime = Instant.now();
    if (points == null || points.size() < MIN_POINTS) {
      return ForecastOutcome.failure(
          ForecastErrorCode.INSUFFICIENT_DATA,
          String.format(
              "Insufficient data points for forecasting (minimum %d required, got %d)",
              MIN_POINTS, points == null ? 0 : points.size()));
    }
    int horizonDays = options.getHorizonDays();
    if (horizonDays < 1 || horizonDays > forecastConfig.getMaxHorizonDays()) {
      return ForecastOutcome.failure(
          ForecastErrorCode.INVALID_HORIZON,
          String.format(
              "horizonDays must be between 1 and %d, got %d",
              forecastConfig.getMaxHorizonDays(), horizonDays));
    }

    ForecastMethod method =
        options.getMethod() != null ? options.getMethod() : forecastConfig.getDefaultMethod();
    double confidenceLevel =
        options.getConfidenceLevel() != null
            ? options.getConfidenceLevel()
            : forecastConfig.getDefaultConfidenceLevel();

    List<TimeSeriesPoint> sortedPoints = new ArrayList<>(points);
    sortedPoints.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));
    List<Double> values =
        sortedPoints.stream().map(TimeSeriesPoint::getValue).collect(Collectors.toList());

    FittedModel model = modelFor(method).fit(values);
    double zScore = ZScoreTable.zScore(confidenceLevel);
    Duration interval = IntervalDetector.detectInterval(sortedPoints);
    Instant lastTimestamp = sortedPoints.get(sortedPoints.size() - 1).getTimestamp();

    LOGGER.debug(
        "Fitted {} model on {} points, interval {}, parameters {}",
        method.getValue(),
        values.size(),
        interval,
        model.getParameters());

    ForecastResult.ForecastResultBuilder<?, ?> result = ForecastResult.builder();
    for (int step = 1; step <= horizonDays; step++) {
      double predicted = model.predict(step);
      double margin = model.margin(step, zScore);
      result.prediction(
          ForecastPoint.builder()
              .timestamp(lastTimestamp.plus(interval.multipliedBy(step)))
              .predictedValue(predicted)
              .confidenceLower(predicted - margin)
              .confidenceUpper(predicted + margin)
              .confidenceLevel(confidenceLevel)
              .build());
    }

    Duration duration = Duration.between(startTime, Instant.now());
    forecastTimers
        .computeIfAbsent(
            tenantId(options) + ":" + method.getValue(),
            k ->
                Timer.builder(FORECAST_TIMER)
                    .tag("tenantId", tenantId(options))
                    .tag("method", method.getValue())
                    .register(meterRegistry))
        .record(duration.toMillis(), TimeUnit.MILLISECONDS);

    return ForecastOutcome.success(
        result
            .modelInfo(
                ModelInfo.builder()
                    .name("Statistical " + method.getValue().toUpperCase(Locale.ROOT))
                    .version(MODEL_VERSION)
                    .parameters(model.getParameters())
                    .build())
            .metrics(
                ForecastMetrics.builder()
                    .inputPoints(points.size())
                    .outputPoints(horizonDays)
                    .durationMs(duration.toMillis())
                    .build())
            .build());
  }

  private static ForecastModel modelFor(ForecastMethod method) {
    switch (method) {
      case SMA:
        return new SimpleMovingAverageModel();
      case EWMA:
        return new ExponentialMovingAverageModel();
      case LINEAR:
        return new LinearTrendModel();
      default:
        throw new UnsupportedOperationException("Unsupported forecast method: " + method);
    }
  }

  private static String tenantId(ForecastOptions options) {
    return options.getTenantId() != null ? options.getTenantId() : DEFAULT_TENANT;
  }
}
