package io.metricwatch.alert.engine.forecast;

import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import java.util.List;

public interface ForecastEngine {

  String getType();

  String getName();

  /**
   * Forecasts {@code options.horizonDays} future points from the given history. Input order is not
   * assumed. Validation problems are reported through the returned outcome, not thrown.
   */
  ForecastOutcome forecast(List<TimeSeriesPoint> points, ForecastOptions options);
}
