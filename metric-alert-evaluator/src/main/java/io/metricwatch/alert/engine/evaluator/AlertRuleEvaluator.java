package io.metricwatch.alert.engine.evaluator;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.IdGenerator;
import io.metricwatch.alert.engine.datamodel.ThresholdOperator;
import io.metricwatch.alert.engine.datamodel.trigger.AnomalyTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.ForecastTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.ThresholdTrigger;
import io.metricwatch.alert.engine.datamodel.trigger.TriggerDetails;
import io.metricwatch.alert.engine.forecast.ForecastPoint;
import io.metricwatch.alert.engine.forecast.ForecastResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a rule plus an observation or forecast into at most one {@link AlertEvent}. Holds no
 * state besides the clock used for forecast windows.
 */
public class AlertRuleEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRuleEvaluator.class);
  private static final String ALERT_ID_PREFIX = "alert";

  private final Clock clock;

  public AlertRuleEvaluator() {
    this(Clock.systemUTC());
  }

  public AlertRuleEvaluator(Clock clock) {
    this.clock = clock;
  }

  /** Compares the latest observed value of the rule's metric with its threshold condition. */
  public Optional<AlertEvent> evaluateValue(AlertRule rule, double value, Instant observedAt) {
    if (!rule.isEnabled()) {
      LOGGER.debug("Skipping disabled rule {}", rule.getId());
      return Optional.empty();
    }
    ThresholdCondition condition = rule.getEffectiveCondition();
    if (!condition.test(value)) {
      LOGGER.debug("Rule {} normal. value {}, condition {}", rule.getId(), value, condition);
      return Optional.empty();
    }

    String message =
        String.format(
            Locale.ROOT,
            "%s is %s, %s the threshold of %s",
            rule.getMetricKey(),
            format(value),
            condition.getOperator().getDescription(),
            format(condition.getValue()));
    return Optional.of(
        buildEvent(
            rule,
            message,
            observedAt,
            ThresholdTrigger.builder()
                .observedValue(value)
                .operator(condition.getOperator())
                .threshold(condition.getValue())
                .build()));
  }

  public Optional<AlertEvent> evaluateForecast(AlertRule rule, ForecastResult forecast) {
    return evaluateForecast(rule, forecast, clock.instant());
  }

  /**
   * Scans the predictions whose timestamps fall in {@code [now, now + horizonDays]} in order and
   * fires on the first one satisfying the rule condition.
   */
  public Optional<AlertEvent> evaluateForecast(
      AlertRule rule, ForecastResult forecast, Instant now) {
    if (!rule.isEnabled()) {
      LOGGER.debug("Skipping disabled rule {}", rule.getId());
      return Optional.empty();
    }
    ThresholdCondition condition = rule.getEffectiveCondition();
    Instant horizonEnd = now.plus(Duration.ofDays(rule.getHorizonDays()));

    Optional<ForecastPoint> breach =
        forecast.getPredictions().stream()
            .filter(p -> !p.getTimestamp().isBefore(now) && !p.getTimestamp().isAfter(horizonEnd))
            .filter(p -> condition.test(p.getPredictedValue()))
            .findFirst();
    if (breach.isEmpty()) {
      LOGGER.debug(
          "Rule {} normal. No prediction within {} days {} {}",
          rule.getId(),
          rule.getHorizonDays(),
          condition.getOperator().getValue(),
          condition.getValue());
      return Optional.empty();
    }

    ForecastPoint point = breach.get();
    ThresholdOperator operator = condition.getOperator();
    String message =
        String.format(
            Locale.ROOT,
            "%s is forecast to reach %s at %s, %s the threshold of %s",
            rule.getMetricKey(),
            format(point.getPredictedValue()),
            point.getTimestamp(),
            operator.getDescription(),
            format(condition.getValue()));
    return Optional.of(
        buildEvent(
            rule,
            message,
            now,
            ForecastTrigger.builder()
                .predictedValue(point.getPredictedValue())
                .confidenceLower(point.getConfidenceLower())
                .confidenceUpper(point.getConfidenceUpper())
                .predictionTimestamp(point.getTimestamp())
                .operator(operator)
                .threshold(condition.getValue())
                .horizonDays(rule.getHorizonDays())
                .build()));
  }

  /** Fires when the observed value lies outside the confidence interval of {@code expected}. */
  public Optional<AlertEvent> evaluateAnomaly(
      AlertRule rule, ForecastPoint expected, double observedValue) {
    if (!rule.isEnabled()) {
      LOGGER.debug("Skipping disabled rule {}", rule.getId());
      return Optional.empty();
    }
    if (expected.isWithinInterval(observedValue)) {
      LOGGER.debug(
          "Rule {} normal. value {} within [{}, {}]",
          rule.getId(),
          observedValue,
          expected.getConfidenceLower(),
          expected.getConfidenceUpper());
      return Optional.empty();
    }

    String message =
        String.format(
            Locale.ROOT,
            "%s observed %s outside the expected range [%s, %s]",
            rule.getMetricKey(),
            format(observedValue),
            format(expected.getConfidenceLower()),
            format(expected.getConfidenceUpper()));
    return Optional.of(
        buildEvent(
            rule,
            message,
            expected.getTimestamp(),
            AnomalyTrigger.builder()
                .observedValue(observedValue)
                .expectedValue(expected.getPredictedValue())
                .lowerBound(expected.getConfidenceLower())
                .upperBound(expected.getConfidenceUpper())
                .confidenceLevel(expected.getConfidenceLevel())
                .observedAt(expected.getTimestamp())
                .build()));
  }

  private AlertEvent buildEvent(
      AlertRule rule, String message, Instant occurredAt, TriggerDetails triggerDetails) {
    AlertEvent.AlertEventBuilder<?, ?> builder =
        AlertEvent.builder()
            .id(IdGenerator.generateId(ALERT_ID_PREFIX))
            .orgId(rule.getOrgId())
            .ruleId(rule.getId())
            .metricKey(rule.getMetricKey())
            .severity(rule.getEffectiveSeverity())
            .title(title(rule))
            .message(message)
            .occurredAt(occurredAt)
            .triggerDetails(triggerDetails)
            .contextValue("ruleName", rule.getName() != null ? rule.getName() : rule.getId());
    if (rule.getDescription() != null) {
      builder.contextValue("description", rule.getDescription());
    }
    AlertEvent event = builder.build();
    LOGGER.debug("Alert event {}", event);
    return event;
  }

  private static String title(AlertRule rule) {
    return rule.getName() != null ? rule.getName() : "Alert: " + rule.getMetricKey();
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
