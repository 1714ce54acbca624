package io.metricwatch.alert.engine.forecast;

import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class ModelInfo {
  private final String name;
  private final String version;

  /** Fitted statistics of the model, in the order they were computed. */
  private final Map<String, Object> parameters;
}
