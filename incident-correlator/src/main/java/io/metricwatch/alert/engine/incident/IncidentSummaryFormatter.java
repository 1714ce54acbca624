package io.metricwatch.alert.engine.incident;

import java.util.List;

class IncidentSummaryFormatter {

  private IncidentSummaryFormatter() {}

  static String summarize(List<String> alertEventIds, List<String> relatedMetrics) {
    String metrics = String.join(", ", relatedMetrics);
    if (alertEventIds.size() == 1) {
      return "1 alert for " + metrics;
    }
    return String.format(
        "%d alerts across %d metric%s: %s",
        alertEventIds.size(),
        relatedMetrics.size(),
        relatedMetrics.size() > 1 ? "s" : "",
        metrics);
  }
}
