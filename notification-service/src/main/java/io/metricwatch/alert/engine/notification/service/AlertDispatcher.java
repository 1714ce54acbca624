package io.metricwatch.alert.engine.notification.service;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.store.NotificationConfigStore;
import io.metricwatch.alert.engine.incident.IncidentCorrelator;
import io.metricwatch.alert.engine.notification.service.notifier.ChannelNotifierRegistry;
import io.metricwatch.alert.engine.notification.transport.email.EmailTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers an alert to every channel its tenant's preferences select. Incident correlation is
 * best effort, channels are notified concurrently and one channel failing never stops the others.
 * Only a failure to read the preferences themselves escapes {@link #dispatchAlert(AlertEvent)}.
 * A closed dispatcher rejects new alerts before touching incidents.
 */
public class AlertDispatcher implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDispatcher.class);
  private static final String CHANNEL_COUNTER = "metricwatch.alert.dispatch.channel.count";
  private static final String CORRELATION_ERROR_COUNTER = "metricwatch.incident.correlation.error";
  private static final String TENANT_ID_TAG = "tenantId";
  private static final String CHANNEL_TYPE_TAG = "channelType";
  private static final String OUTCOME_TAG = "outcome";

  private final ConcurrentMap<String, Counter> channelCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> correlationErrorCounters =
      new ConcurrentHashMap<>();
  private final NotificationPreferenceResolver preferenceResolver;
  private final IncidentCorrelator incidentCorrelator;
  private final ChannelNotifierRegistry notifierRegistry;
  private final NotificationConfigStore configStore;
  private final EmailTransport emailTransport;
  private final MeterRegistry meterRegistry;
  private final ExecutorService dispatchExecutor;
  private final ExecutorService backgroundExecutor;
  private final Clock clock;

  public AlertDispatcher(
      NotificationPreferenceResolver preferenceResolver,
      IncidentCorrelator incidentCorrelator,
      ChannelNotifierRegistry notifierRegistry,
      NotificationConfigStore configStore,
      EmailTransport emailTransport,
      MeterRegistry meterRegistry,
      int dispatchParallelism,
      Clock clock) {
    this(
        preferenceResolver,
        incidentCorrelator,
        notifierRegistry,
        configStore,
        emailTransport,
        meterRegistry,
        Executors.newFixedThreadPool(
            dispatchParallelism,
            new ThreadFactoryBuilder().setNameFormat("alert-dispatch-%d").setDaemon(true).build()),
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("channel-last-used-%d")
                .setDaemon(true)
                .build()),
        clock);
  }

  AlertDispatcher(
      NotificationPreferenceResolver preferenceResolver,
      IncidentCorrelator incidentCorrelator,
      ChannelNotifierRegistry notifierRegistry,
      NotificationConfigStore configStore,
      EmailTransport emailTransport,
      MeterRegistry meterRegistry,
      ExecutorService dispatchExecutor,
      ExecutorService backgroundExecutor,
      Clock clock) {
    this.preferenceResolver = preferenceResolver;
    this.incidentCorrelator = incidentCorrelator;
    this.notifierRegistry = notifierRegistry;
    this.configStore = configStore;
    this.emailTransport = emailTransport;
    this.meterRegistry = meterRegistry;
    this.dispatchExecutor = dispatchExecutor;
    this.backgroundExecutor = backgroundExecutor;
    this.clock = clock;
  }

  /** @throws IllegalStateException if the dispatcher has been closed */
  public AlertDispatchSummary dispatchAlert(AlertEvent alertEvent) {
    Preconditions.checkState(
        !dispatchExecutor.isShutdown(),
        "Alert dispatcher is closed, rejecting alert %s",
        alertEvent.getId());
    long startMillis = clock.millis();
    Instant dispatchedAt = clock.instant();
    LOGGER.info(
        "Dispatching alert {} of org {}, metric {}, severity {}",
        alertEvent.getId(),
        alertEvent.getOrgId(),
        alertEvent.getMetricKey(),
        alertEvent.getSeverity());

    AlertIncident incident = correlate(alertEvent);
    List<NotificationChannelConfig> channels = preferenceResolver.getChannelsForAlert(alertEvent);
    if (channels.isEmpty()) {
      LOGGER.info("No channels configured for alert {}", alertEvent.getId());
      return AlertDispatchSummary.builder()
          .alertEvent(alertEvent)
          .channelsSelected(0)
          .channelsNotified(0)
          .channelsFailed(0)
          .results(List.of())
          .dispatchedAt(dispatchedAt)
          .durationMs(clock.millis() - startMillis)
          .incident(incident)
          .build();
    }

    List<CompletableFuture<DispatchResult>> pending =
        channels.stream()
            .map(
                channel ->
                    CompletableFuture.supplyAsync(
                        () -> notifyChannel(channel, alertEvent, incident), dispatchExecutor))
            .collect(Collectors.toList());
    List<DispatchResult> results =
        pending.stream().map(CompletableFuture::join).collect(Collectors.toList());

    int notified = 0;
    for (DispatchResult result : results) {
      channelCounter(alertEvent.getOrgId(), result).increment();
      if (result.isSuccess()) {
        notified++;
        recordChannelUsed(alertEvent.getOrgId(), result.getChannelId(), result.getSentAt());
      } else {
        LOGGER.warn(
            "Channel {} ({}) failed for alert {}: {}",
            result.getChannelId(),
            result.getChannelType(),
            alertEvent.getId(),
            result.getError());
      }
    }

    AlertDispatchSummary summary =
        AlertDispatchSummary.builder()
            .alertEvent(alertEvent)
            .channelsSelected(channels.size())
            .channelsNotified(notified)
            .channelsFailed(results.size() - notified)
            .results(results)
            .dispatchedAt(dispatchedAt)
            .durationMs(clock.millis() - startMillis)
            .incident(incident)
            .build();
    LOGGER.info(
        "Dispatch of alert {} complete: selected {}, notified {}, failed {}, incident {}, {} ms",
        alertEvent.getId(),
        summary.getChannelsSelected(),
        summary.getChannelsNotified(),
        summary.getChannelsFailed(),
        incident == null ? null : incident.getId(),
        summary.getDurationMs());
    return summary;
  }

  public DispatcherStatus getDispatcherStatus() {
    return new DispatcherStatus(emailTransport.isConfigured(), emailTransport.getFromAddress());
  }

  @Override
  public void close() {
    dispatchExecutor.shutdown();
    backgroundExecutor.shutdown();
  }

  private AlertIncident correlate(AlertEvent alertEvent) {
    try {
      AlertIncident incident = incidentCorrelator.findOrCreateIncident(alertEvent);
      LOGGER.debug(
          "Alert {} associated with incident {} ({} alerts)",
          alertEvent.getId(),
          incident.getId(),
          incident.getAlertEventIds().size());
      return incident;
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Failed to correlate alert {} into an incident, dispatching without one",
          alertEvent.getId(),
          e);
      correlationErrorCounters
          .computeIfAbsent(
              alertEvent.getOrgId(),
              tenantId ->
                  Counter.builder(CORRELATION_ERROR_COUNTER)
                      .tag(TENANT_ID_TAG, tenantId)
                      .register(meterRegistry))
          .increment();
      return null;
    }
  }

  private DispatchResult notifyChannel(
      NotificationChannelConfig channel, AlertEvent alertEvent, AlertIncident incident) {
    try {
      return notifierRegistry.notify(channel, alertEvent, incident);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Unexpected error notifying channel {} for alert {}",
          channel.getChannelId(),
          alertEvent.getId(),
          e);
      return DispatchResult.failure(channel, String.valueOf(e.getMessage()), clock.instant());
    }
  }

  private void recordChannelUsed(String orgId, String channelId, Instant usedAt) {
    CompletableFuture.runAsync(
            () -> configStore.recordChannelUsed(orgId, channelId, usedAt), backgroundExecutor)
        .whenComplete(
            (ignored, throwable) -> {
              if (throwable != null) {
                LOGGER.error(
                    "Failed to record last use of channel {} of org {}",
                    channelId,
                    orgId,
                    throwable);
              }
            });
  }

  private Counter channelCounter(String tenantId, DispatchResult result) {
    String outcome = result.isSuccess() ? "success" : "failure";
    String channelType = result.getChannelType().getValue();
    return channelCounters.computeIfAbsent(
        tenantId + ":" + channelType + ":" + outcome,
        key ->
            Counter.builder(CHANNEL_COUNTER)
                .tag(TENANT_ID_TAG, tenantId)
                .tag(CHANNEL_TYPE_TAG, channelType)
                .tag(OUTCOME_TAG, outcome)
                .register(meterRegistry));
  }
}
