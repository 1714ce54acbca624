package io.metricwatch.alert.engine.incident;

import java.util.List;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class CorrelationAnalysis {
  private final List<CorrelationGroup> groups;
  private final int totalAlerts;

  CorrelationAnalysis(List<CorrelationGroup> groups, int totalAlerts) {
    this.groups = List.copyOf(groups);
    this.totalAlerts = totalAlerts;
  }

  public int getGroupCount() {
    return groups.size();
  }
}
