package io.metricwatch.alert.engine.notification.service.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** JSON body POSTed to generic HTTP webhooks. */
@SuperBuilder
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class AlertWebhookPayload {
  public static final String ALERT_TRIGGERED_EVENT = "alert.triggered";

  @Builder.Default private final String event = ALERT_TRIGGERED_EVENT;
  private final AlertEvent alert;
  private final String triggerDescription;
  private final AlertIncident incident;
  private final Instant sentAt;

  public static AlertWebhookPayload of(
      AlertEvent alertEvent, AlertIncident incident, Instant sentAt) {
    return AlertWebhookPayload.builder()
        .alert(alertEvent)
        .triggerDescription(TriggerDescriber.describe(alertEvent.getTriggerDetails()))
        .incident(incident)
        .sentAt(sentAt)
        .build();
  }
}
