package io.metricwatch.alert.engine.rule;

import io.metricwatch.alert.engine.evaluator.AlertRule;
import java.io.IOException;
import java.util.List;

public interface AlertRuleSource {
  List<AlertRule> getAllRules() throws IOException;

  List<AlertRule> getRulesForOrg(String orgId) throws IOException;
}
