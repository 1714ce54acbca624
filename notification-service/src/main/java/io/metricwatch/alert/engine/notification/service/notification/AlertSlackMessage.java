package io.metricwatch.alert.engine.notification.service.notification;

import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.ActionBlock;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.Attachment;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.Block;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.Button;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.ContextBlock;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.SectionBlock;
import io.metricwatch.alert.engine.notification.transport.webhook.slack.Text;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Slack incoming-webhook body for an alert: one coloured attachment per message. */
public class AlertSlackMessage implements SlackMessage {

  public static final String METRIC = "Metric";
  public static final String SEVERITY = "Severity";
  public static final String ORGANIZATION = "Organization";
  public static final String OCCURRED_AT = "Occurred At";
  public static final String TRIGGER = "Trigger";
  public static final String INCIDENT = "Incident";
  private final String text;
  private final List<Attachment> attachments;

  public AlertSlackMessage(String text, List<Attachment> attachments) {
    this.text = text;
    this.attachments = attachments;
  }

  public static AlertSlackMessage getMessage(
      AlertEvent alertEvent, AlertIncident incident, String dashboardUrl) {
    String severity =
        alertEvent.getSeverity() == null
            ? "UNKNOWN"
            : alertEvent.getSeverity().getValue().toUpperCase(Locale.ROOT);
    String titleMessage = "*[" + severity + "] " + alertEvent.getTitle() + "*";
    if (alertEvent.getMessage() != null) {
      titleMessage += "\n" + alertEvent.getMessage();
    }
    SectionBlock titleBlock = SlackMessage.getTitleBlock(titleMessage);

    List<Text> metadataFields = new ArrayList<>();
    SlackMessage.addIfNotEmpty(metadataFields, alertEvent.getMetricKey(), METRIC);
    SlackMessage.addIfNotEmpty(metadataFields, severity, SEVERITY);
    SlackMessage.addIfNotEmpty(metadataFields, alertEvent.getOrgId(), ORGANIZATION);
    SlackMessage.addTimestamp(metadataFields, alertEvent.getOccurredAt(), OCCURRED_AT);
    SlackMessage.addIfNotEmpty(
        metadataFields, TriggerDescriber.describe(alertEvent.getTriggerDetails()), TRIGGER);
    if (incident != null) {
      SlackMessage.addIfNotEmpty(metadataFields, incident.getSummary(), INCIDENT);
    }
    SectionBlock metadataBlock = new SectionBlock();
    metadataBlock.setFields(metadataFields);

    List<Block> blocks = new ArrayList<>();
    blocks.add(titleBlock);
    blocks.add(metadataBlock);
    if (dashboardUrl != null) {
      Button button = new Button(Text.plain("View Dashboard"));
      button.setActionId("view_dashboard");
      button.setStyle(
          alertEvent.getSeverity() == Severity.CRITICAL
              ? Button.DANGER_STYLE
              : Button.PRIMARY_STYLE);
      button.setUrl(dashboardUrl);
      ActionBlock actionBlock = new ActionBlock();
      actionBlock.setElements(List.of(button));
      blocks.add(actionBlock);
    }
    if (alertEvent.getId() != null) {
      blocks.add(new ContextBlock(List.of(Text.markdown("Alert `" + alertEvent.getId() + "`"))));
    }

    Attachment attachment = new Attachment(color(alertEvent.getSeverity()), blocks);
    return new AlertSlackMessage(
        "[" + severity + "] " + alertEvent.getTitle(), List.of(attachment));
  }

  /** Fallback text shown in notifications where blocks are not rendered. */
  public String getText() {
    return text;
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  private static String color(Severity severity) {
    if (severity == null) {
      return Attachment.BLUE;
    }
    switch (severity) {
      case CRITICAL:
        return Attachment.RED;
      case WARNING:
        return Attachment.ORANGE;
      default:
        return Attachment.BLUE;
    }
  }
}
