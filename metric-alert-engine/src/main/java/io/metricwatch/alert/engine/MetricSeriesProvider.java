package io.metricwatch.alert.engine;

import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import java.util.List;

/** Supplies the recorded points of a tenant's metric. */
@FunctionalInterface
public interface MetricSeriesProvider {
  List<TimeSeriesPoint> getPoints(String orgId, String metricKey);
}
