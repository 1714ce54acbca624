package io.metricwatch.alert.engine.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import io.metricwatch.alert.engine.evaluator.AlertRule;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads alert rules from a JSON array file. The file is re-read on every call. */
public class FSAlertRuleSource implements AlertRuleSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSAlertRuleSource.class);
  private static final String PATH_CONFIG = "path";
  private final Config fsConfig;
  private final ObjectMapper objectMapper = ObjectMapperProvider.get();

  public FSAlertRuleSource(Config fsConfig) {
    this.fsConfig = fsConfig;
  }

  /**
   * @throws IOException if the file cannot be read or is not an array
   * @throws IllegalArgumentException if a rule is malformed
   */
  @Override
  public List<AlertRule> getAllRules() throws IOException {
    String fsPath = fsConfig.getString(PATH_CONFIG);
    LOGGER.debug("Reading alert rules from file path:{}", fsPath);
    JsonNode jsonNode = objectMapper.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of alert rules");
    }

    List<AlertRule> rules = new ArrayList<>();
    for (JsonNode ruleNode : jsonNode) {
      rules.add(objectMapper.treeToValue(ruleNode, AlertRule.class).validate());
    }
    LOGGER.debug("Read {} alert rules from {}", rules.size(), fsPath);
    return rules;
  }

  @Override
  public List<AlertRule> getRulesForOrg(String orgId) throws IOException {
    return getAllRules().stream()
        .filter(rule -> orgId.equals(rule.getOrgId()))
        .collect(Collectors.toList());
  }
}
