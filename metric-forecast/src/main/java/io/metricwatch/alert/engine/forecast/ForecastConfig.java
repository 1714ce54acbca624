package io.metricwatch.alert.engine.forecast;

import com.typesafe.config.Config;
import lombok.Getter;

@Getter
public class ForecastConfig {
  static final String DEFAULT_METHOD_CONFIG = "defaultMethod";
  static final String DEFAULT_CONFIDENCE_LEVEL_CONFIG = "defaultConfidenceLevel";
  static final String MAX_HORIZON_DAYS_CONFIG = "maxHorizonDays";

  private static final ForecastMethod DEFAULT_METHOD = ForecastMethod.EWMA;
  private static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
  private static final int DEFAULT_MAX_HORIZON_DAYS = 365;

  private final ForecastMethod defaultMethod;
  private final double defaultConfidenceLevel;
  private final int maxHorizonDays;

  public ForecastConfig(Config forecastConfig) {
    this.defaultMethod =
        forecastConfig.hasPath(DEFAULT_METHOD_CONFIG)
            ? ForecastMethod.fromValue(forecastConfig.getString(DEFAULT_METHOD_CONFIG))
            : DEFAULT_METHOD;
    this.defaultConfidenceLevel =
        forecastConfig.hasPath(DEFAULT_CONFIDENCE_LEVEL_CONFIG)
            ? forecastConfig.getDouble(DEFAULT_CONFIDENCE_LEVEL_CONFIG)
            : DEFAULT_CONFIDENCE_LEVEL;
    this.maxHorizonDays =
        forecastConfig.hasPath(MAX_HORIZON_DAYS_CONFIG)
            ? forecastConfig.getInt(MAX_HORIZON_DAYS_CONFIG)
            : DEFAULT_MAX_HORIZON_DAYS;
  }
}
