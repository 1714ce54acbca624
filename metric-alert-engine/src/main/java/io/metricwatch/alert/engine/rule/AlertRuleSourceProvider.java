package io.metricwatch.alert.engine.rule;

import com.typesafe.config.Config;

public class AlertRuleSourceProvider {
  private static final String RULE_SOURCE_TYPE = "type";
  private static final String RULE_SOURCE_TYPE_FS = "fs";

  public static AlertRuleSource getProvider(Config ruleSourceConfig) {
    String sourceType = ruleSourceConfig.getString(RULE_SOURCE_TYPE);
    switch (sourceType) {
      case RULE_SOURCE_TYPE_FS:
        return new FSAlertRuleSource(ruleSourceConfig.getConfig(RULE_SOURCE_TYPE_FS));
      default:
        throw new IllegalArgumentException(
            String.format("Invalid alert rule source type:%s", sourceType));
    }
  }
}
