package io.metricwatch.alert.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.metricwatch.alert.engine.datamodel.store.InMemoryIncidentRepository;
import io.metricwatch.alert.engine.datamodel.store.IncidentRepository;
import io.metricwatch.alert.engine.datamodel.store.NotificationConfigStore;
import io.metricwatch.alert.engine.datamodel.store.NotificationConfigStoreProvider;
import io.metricwatch.alert.engine.evaluator.AlertRule;
import io.metricwatch.alert.engine.evaluator.AlertRuleEvaluator;
import io.metricwatch.alert.engine.forecast.ForecastEngine;
import io.metricwatch.alert.engine.forecast.StatisticalForecastEngine;
import io.metricwatch.alert.engine.incident.IncidentCorrelator;
import io.metricwatch.alert.engine.notification.service.AlertDispatcher;
import io.metricwatch.alert.engine.notification.service.NotificationPreferenceResolver;
import io.metricwatch.alert.engine.notification.service.NotificationServiceConfig;
import io.metricwatch.alert.engine.notification.service.notification.AlertEmailFormatter;
import io.metricwatch.alert.engine.notification.service.notifier.ChannelNotifierRegistry;
import io.metricwatch.alert.engine.notification.service.notifier.EmailChannelNotifier;
import io.metricwatch.alert.engine.notification.service.notifier.HttpWebhookChannelNotifier;
import io.metricwatch.alert.engine.notification.service.notifier.PagerDutyChannelNotifier;
import io.metricwatch.alert.engine.notification.service.notifier.SlackWebhookChannelNotifier;
import io.metricwatch.alert.engine.notification.transport.NotificationSecretFinder;
import io.metricwatch.alert.engine.notification.transport.NotificationSenderConfig;
import io.metricwatch.alert.engine.notification.transport.email.EmailTransport;
import io.metricwatch.alert.engine.notification.transport.email.HttpEmailTransport;
import io.metricwatch.alert.engine.notification.transport.http.HttpWithJsonSender;
import io.metricwatch.alert.engine.notification.transport.webhook.WebhookSender;
import io.metricwatch.alert.engine.rule.AlertRuleSource;
import io.metricwatch.alert.engine.rule.AlertRuleSourceProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds every component once from the application config and hands out the shared instances.
 * Nothing here is static; tests and services each create and close their own engine.
 */
@Getter
public class MetricAlertEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricAlertEngine.class);

  static final String FORECAST_CONFIG = "forecast";
  static final String INCIDENT_CONFIG = "incident";
  static final String NOTIFICATION_CONFIG = "notification";
  static final String NOTIFICATION_CONFIG_SOURCE = "notificationConfigSource";
  static final String ALERT_RULES_SOURCE = "alertRulesSource";
  static final String SECRETS_PATH = "secrets.path";

  private static final String PIPELINE_ERROR_COUNTER = "metricwatch.alert.pipeline.error";
  private static final String PIPELINE_TIMER = "metricwatch.alert.pipeline.latency";
  private static final String TENANT_ID_TAG = "tenantId";

  private final ForecastEngine forecastEngine;
  private final AlertRuleEvaluator ruleEvaluator;
  private final IncidentCorrelator incidentCorrelator;
  private final NotificationPreferenceResolver preferenceResolver;
  private final AlertDispatcher alertDispatcher;
  private final AlertPipeline alertPipeline;
  private final AlertRuleSource ruleSource;

  @Getter(AccessLevel.NONE)
  private final MeterRegistry meterRegistry;

  @Getter(AccessLevel.NONE)
  private final ConcurrentMap<String, Counter> pipelineErrorCounters = new ConcurrentHashMap<>();

  @Getter(AccessLevel.NONE)
  private final ConcurrentMap<String, Timer> pipelineTimers = new ConcurrentHashMap<>();

  private MetricAlertEngine(
      ForecastEngine forecastEngine,
      AlertRuleEvaluator ruleEvaluator,
      IncidentCorrelator incidentCorrelator,
      NotificationPreferenceResolver preferenceResolver,
      AlertDispatcher alertDispatcher,
      AlertRuleSource ruleSource,
      MeterRegistry meterRegistry) {
    this.forecastEngine = forecastEngine;
    this.ruleEvaluator = ruleEvaluator;
    this.incidentCorrelator = incidentCorrelator;
    this.preferenceResolver = preferenceResolver;
    this.alertDispatcher = alertDispatcher;
    this.alertPipeline = new AlertPipeline(forecastEngine, ruleEvaluator, alertDispatcher);
    this.ruleSource = ruleSource;
    this.meterRegistry = meterRegistry;
  }

  /** Loads {@code application.conf} and reports to the global Micrometer registry. */
  public static MetricAlertEngine create() {
    return create(ConfigFactory.load(), Metrics.globalRegistry);
  }

  /**
   * Uses an in-memory incident repository and the notification config store named by {@code
   * notificationConfigSource}, in-memory when absent.
   */
  public static MetricAlertEngine create(Config appConfig, MeterRegistry meterRegistry) {
    NotificationConfigStore configStore =
        appConfig.hasPath(NOTIFICATION_CONFIG_SOURCE)
            ? NotificationConfigStoreProvider.getProvider(
                appConfig.getConfig(NOTIFICATION_CONFIG_SOURCE))
            : NotificationConfigStoreProvider.getProvider(
                ConfigFactory.parseMap(Map.of("type", "memory")));
    return create(
        appConfig,
        meterRegistry,
        new InMemoryIncidentRepository(),
        configStore,
        Clock.systemUTC());
  }

  public static MetricAlertEngine create(
      Config appConfig,
      MeterRegistry meterRegistry,
      IncidentRepository incidentRepository,
      NotificationConfigStore configStore,
      Clock clock) {
    NotificationServiceConfig serviceConfig =
        new NotificationServiceConfig(getConfig(appConfig, NOTIFICATION_CONFIG));
    NotificationSenderConfig senderConfig = serviceConfig.getSenderConfig();
    NotificationSecretFinder secretFinder =
        appConfig.hasPath(SECRETS_PATH)
            ? new NotificationSecretFinder(appConfig.getString(SECRETS_PATH))
            : new NotificationSecretFinder();

    HttpWithJsonSender httpSender = new HttpWithJsonSender();
    EmailTransport emailTransport = new HttpEmailTransport(httpSender, senderConfig, secretFinder);
    WebhookSender webhookSender = new WebhookSender(httpSender);
    ChannelNotifierRegistry notifierRegistry =
        new ChannelNotifierRegistry(
            new EmailChannelNotifier(
                emailTransport, new AlertEmailFormatter(senderConfig.getDashboardUrl()), clock),
            new SlackWebhookChannelNotifier(
                webhookSender,
                senderConfig.isSlackDeliveryEnabled(),
                senderConfig.getDashboardUrl(),
                clock),
            new HttpWebhookChannelNotifier(
                webhookSender, senderConfig.isWebhookDeliveryEnabled(), clock),
            new PagerDutyChannelNotifier(clock));

    IncidentCorrelator incidentCorrelator =
        new IncidentCorrelator(incidentRepository, getConfig(appConfig, INCIDENT_CONFIG), clock);
    NotificationPreferenceResolver preferenceResolver =
        new NotificationPreferenceResolver(configStore, serviceConfig.getSeverityMatchPolicy());
    AlertDispatcher alertDispatcher =
        new AlertDispatcher(
            preferenceResolver,
            incidentCorrelator,
            notifierRegistry,
            configStore,
            emailTransport,
            meterRegistry,
            serviceConfig.getDispatchParallelism(),
            clock);

    AlertRuleSource ruleSource =
        appConfig.hasPath(ALERT_RULES_SOURCE)
            ? AlertRuleSourceProvider.getProvider(appConfig.getConfig(ALERT_RULES_SOURCE))
            : null;

    LOGGER.info(
        "Metric alert engine created. severityMatch: {}, email configured: {}, rule source: {}",
        serviceConfig.getSeverityMatchPolicy().getValue(),
        emailTransport.isConfigured(),
        ruleSource == null ? "none" : ruleSource.getClass().getSimpleName());
    return new MetricAlertEngine(
        new StatisticalForecastEngine(getConfig(appConfig, FORECAST_CONFIG), meterRegistry),
        new AlertRuleEvaluator(clock),
        incidentCorrelator,
        preferenceResolver,
        alertDispatcher,
        ruleSource,
        meterRegistry);
  }

  /**
   * Runs every enabled rule of the org from the configured rule source. A rule that fails is
   * logged and counted and does not stop the remaining rules.
   *
   * @throws IllegalStateException if no rule source is configured
   * @throws IOException if the rules cannot be read
   */
  public List<PipelineResult> evaluateRules(String orgId, MetricSeriesProvider seriesProvider)
      throws IOException {
    if (ruleSource == null) {
      throw new IllegalStateException("No " + ALERT_RULES_SOURCE + " configured");
    }
    List<PipelineResult> results = new ArrayList<>();
    for (AlertRule rule : ruleSource.getRulesForOrg(orgId)) {
      if (!rule.isEnabled()) {
        LOGGER.debug("Skipping disabled rule {}", rule.getId());
        continue;
      }
      Instant startTime = Instant.now();
      try {
        results.add(
            alertPipeline.run(orgId, rule, seriesProvider.getPoints(orgId, rule.getMetricKey())));
      } catch (RuntimeException e) {
        pipelineErrorCounters
            .computeIfAbsent(
                orgId,
                k ->
                    Counter.builder(PIPELINE_ERROR_COUNTER)
                        .tag(TENANT_ID_TAG, k)
                        .register(meterRegistry))
            .increment();
        LOGGER.error("Exception processing rule {} of org {}", rule.getId(), orgId, e);
      }
      pipelineTimers
          .computeIfAbsent(
              orgId,
              k -> Timer.builder(PIPELINE_TIMER).tag(TENANT_ID_TAG, k).register(meterRegistry))
          .record(Duration.between(startTime, Instant.now()));
    }
    return results;
  }

  @Override
  public void close() {
    alertDispatcher.close();
  }

  private static Config getConfig(Config appConfig, String path) {
    return appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty();
  }
}
