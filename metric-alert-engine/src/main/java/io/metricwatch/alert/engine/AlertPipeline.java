package io.metricwatch.alert.engine;

import com.google.common.base.Preconditions;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.TimeSeriesPoint;
import io.metricwatch.alert.engine.evaluator.AlertRule;
import io.metricwatch.alert.engine.evaluator.AlertRuleEvaluator;
import io.metricwatch.alert.engine.evaluator.AlertRuleType;
import io.metricwatch.alert.engine.forecast.ForecastEngine;
import io.metricwatch.alert.engine.forecast.ForecastOptions;
import io.metricwatch.alert.engine.forecast.ForecastOutcome;
import io.metricwatch.alert.engine.notification.service.AlertDispatchSummary;
import io.metricwatch.alert.engine.notification.service.AlertDispatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one rule against a metric series: forecast, evaluate, and dispatch when the rule fires.
 *
 * <p>Threshold rules forecast {@code horizonDays} ahead of the series and fire on the first
 * prediction crossing the condition. Anomaly rules forecast one step from every point but the
 * latest and fire when the latest point falls outside that prediction's interval.
 */
public class AlertPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertPipeline.class);
  private static final int ANOMALY_HORIZON = 1;

  private final ForecastEngine forecastEngine;
  private final AlertRuleEvaluator ruleEvaluator;
  private final AlertDispatcher alertDispatcher;

  public AlertPipeline(
      ForecastEngine forecastEngine,
      AlertRuleEvaluator ruleEvaluator,
      AlertDispatcher alertDispatcher) {
    this.forecastEngine = forecastEngine;
    this.ruleEvaluator = ruleEvaluator;
    this.alertDispatcher = alertDispatcher;
  }

  /**
   * @throws IllegalArgumentException if the rule is malformed or belongs to another org
   */
  public PipelineResult run(String orgId, AlertRule rule, List<TimeSeriesPoint> points) {
    Preconditions.checkArgument(
        rule.getOrgId() == null || rule.getOrgId().equals(orgId),
        "Rule %s belongs to org %s, not %s",
        rule.getId(),
        rule.getOrgId(),
        orgId);
    AlertRule orgRule = rule.getOrgId() == null ? rule.toBuilder().orgId(orgId).build() : rule;
    orgRule.validate();

    ForecastOutcome outcome;
    Optional<AlertEvent> alertEvent;
    if (orgRule.getType() == AlertRuleType.ANOMALY) {
      List<TimeSeriesPoint> sorted = new ArrayList<>(points);
      sorted.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));
      List<TimeSeriesPoint> history =
          sorted.isEmpty() ? sorted : sorted.subList(0, sorted.size() - 1);
      outcome = forecastEngine.forecast(history, options(orgId, ANOMALY_HORIZON));
      alertEvent =
          outcome
              .getResult()
              .flatMap(
                  result ->
                      ruleEvaluator.evaluateAnomaly(
                          orgRule,
                          result.getPredictions().get(0),
                          sorted.get(sorted.size() - 1).getValue()));
    } else {
      outcome = forecastEngine.forecast(points, options(orgId, orgRule.getHorizonDays()));
      alertEvent =
          outcome.getResult().flatMap(result -> ruleEvaluator.evaluateForecast(orgRule, result));
    }

    if (!outcome.isSuccess()) {
      LOGGER.warn(
          "Forecast for rule {} of org {} failed: {}",
          orgRule.getId(),
          orgId,
          outcome.getError().get());
      return new PipelineResult(orgRule.getId(), outcome, null, null);
    }
    if (alertEvent.isEmpty()) {
      LOGGER.debug("Rule {} of org {} did not fire", orgRule.getId(), orgId);
      return new PipelineResult(orgRule.getId(), outcome, null, null);
    }

    AlertDispatchSummary summary = alertDispatcher.dispatchAlert(alertEvent.get());
    return new PipelineResult(orgRule.getId(), outcome, alertEvent.get(), summary);
  }

  private static ForecastOptions options(String orgId, int horizonDays) {
    return ForecastOptions.builder().tenantId(orgId).horizonDays(horizonDays).build();
  }
}
