package io.metricwatch.alert.engine.incident;

import com.typesafe.config.Config;
import lombok.Getter;

@Getter
public class IncidentConfig {
  static final String TIME_WINDOW_MINUTES_CONFIG = "timeWindowMinutes";
  static final String LIST_LIMIT_CONFIG = "listLimit";
  private static final int DEFAULT_TIME_WINDOW_MINUTES = 10;
  private static final int DEFAULT_LIST_LIMIT = 50;

  private final int timeWindowMinutes;
  private final int listLimit;

  public IncidentConfig(Config incidentConfig) {
    this.timeWindowMinutes =
        incidentConfig.hasPath(TIME_WINDOW_MINUTES_CONFIG)
            ? incidentConfig.getInt(TIME_WINDOW_MINUTES_CONFIG)
            : DEFAULT_TIME_WINDOW_MINUTES;
    this.listLimit =
        incidentConfig.hasPath(LIST_LIMIT_CONFIG)
            ? incidentConfig.getInt(LIST_LIMIT_CONFIG)
            : DEFAULT_LIST_LIMIT;
  }
}
