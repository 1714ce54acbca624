package io.metricwatch.alert.engine.notification.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.AlertIncident;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an alert as an email subject, an HTML body and a plain text body. Every value placed in
 * the HTML body goes through the HTML escaper; the text body is left as is.
 */
public class AlertEmailFormatter {
  private static final Escaper HTML_ESCAPER = HtmlEscapers.htmlEscaper();
  private static final DateTimeFormatter OCCURRED_AT_FORMATTER =
      DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' HH:mm:ss 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);
  private static final String DEFAULT_COLOR = "#757575";
  private static final String CELL_STYLE = "padding: 8px 0; border-bottom: 1px solid #eee;";
  private static final String LABEL_STYLE = CELL_STYLE + " color: #666; width: 120px;";

  private final String dashboardUrl;

  public AlertEmailFormatter(String dashboardUrl) {
    this.dashboardUrl = dashboardUrl;
  }

  public String subject(AlertEvent alertEvent) {
    return "[" + severityLabel(alertEvent) + "] " + alertEvent.getTitle();
  }

  public String html(AlertEvent alertEvent, AlertIncident incident) {
    String color = severityColor(alertEvent.getSeverity());
    StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html>\n<head>\n")
        .append("  <meta charset=\"utf-8\">\n")
        .append("  <title>")
        .append(escape(alertEvent.getTitle()))
        .append("</title>\n</head>\n")
        .append(
            "<body style=\"font-family: -apple-system, 'Segoe UI', Roboto, sans-serif;"
                + " line-height: 1.6; color: #333; max-width: 600px; margin: 0 auto;"
                + " padding: 20px;\">\n")
        .append("  <div style=\"border-left: 4px solid ")
        .append(color)
        .append("; padding-left: 16px; margin-bottom: 20px;\">\n")
        .append("    <h1 style=\"margin: 0 0 8px 0; font-size: 24px; color: #111;\">")
        .append(escape(alertEvent.getTitle()))
        .append("</h1>\n")
        .append("    <span style=\"display: inline-block; background: ")
        .append(color)
        .append(
            "; color: white; padding: 4px 12px; border-radius: 4px; font-size: 12px;"
                + " font-weight: 600; text-transform: uppercase;\">")
        .append(escape(severityLabel(alertEvent)))
        .append("</span>\n  </div>\n")
        .append("  <p style=\"font-size: 16px; margin: 16px 0;\">")
        .append(escape(alertEvent.getMessage()))
        .append("</p>\n");
    appendTable(html, detailRows(alertEvent, incident));
    if (alertEvent.getContext() != null && !alertEvent.getContext().isEmpty()) {
      Map<String, String> contextRows = new LinkedHashMap<>();
      alertEvent.getContext().forEach((key, value) -> contextRows.put(key, toJson(value)));
      html.append("  <h2 style=\"font-size: 16px; margin: 20px 0 0 0; color: #111;\">")
          .append("Context</h2>\n");
      appendTable(html, contextRows);
    }
    html.append(
            "  <div style=\"margin-top: 30px; padding-top: 20px; border-top: 1px solid #eee;"
                + " color: #666; font-size: 12px;\">\n")
        .append("    <p style=\"margin: 0;\">This alert was generated by <strong>MetricWatch")
        .append("</strong>.<br>\n")
        .append("      <a href=\"")
        .append(escape(dashboardUrl))
        .append("\" style=\"color: #2196F3;\">View Dashboard</a></p>\n")
        .append("  </div>\n</body>\n</html>");
    return html.toString();
  }

  public String text(AlertEvent alertEvent, AlertIncident incident) {
    StringBuilder text = new StringBuilder();
    text.append(subject(alertEvent))
        .append("\n\n")
        .append(nullToEmpty(alertEvent.getMessage()))
        .append("\n\nDetails:\n")
        .append("- Metric: ")
        .append(alertEvent.getMetricKey())
        .append('\n')
        .append("- Organization: ")
        .append(alertEvent.getOrgId())
        .append('\n')
        .append("- Occurred At: ")
        .append(formatInstant(alertEvent.getOccurredAt()))
        .append('\n');
    String trigger = TriggerDescriber.describe(alertEvent.getTriggerDetails());
    if (trigger != null) {
      text.append("- Trigger: ").append(trigger).append('\n');
    }
    if (incident != null) {
      text.append("\nIncident:\n")
          .append("- Id: ")
          .append(incident.getId())
          .append('\n')
          .append("- Summary: ")
          .append(incident.getSummary())
          .append('\n');
    }
    if (alertEvent.getContext() != null && !alertEvent.getContext().isEmpty()) {
      text.append("\nContext:\n");
      alertEvent
          .getContext()
          .forEach(
              (key, value) ->
                  text.append("- ").append(key).append(": ").append(toJson(value)).append('\n'));
    }
    text.append("\n---\nThis alert was generated by MetricWatch.\n").append(dashboardUrl);
    return text.toString();
  }

  private Map<String, String> detailRows(AlertEvent alertEvent, AlertIncident incident) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Metric", alertEvent.getMetricKey());
    rows.put("Organization", alertEvent.getOrgId());
    rows.put("Occurred At", formatInstant(alertEvent.getOccurredAt()));
    String trigger = TriggerDescriber.describe(alertEvent.getTriggerDetails());
    if (trigger != null) {
      rows.put("Trigger", trigger);
    }
    if (incident != null) {
      rows.put("Incident", incident.getId());
      rows.put("Incident Summary", incident.getSummary());
    }
    return rows;
  }

  private static void appendTable(StringBuilder html, Map<String, String> rows) {
    html.append("  <table style=\"width: 100%; border-collapse: collapse; margin: 20px 0;\">\n");
    for (Map.Entry<String, String> row : rows.entrySet()) {
      html.append("    <tr>\n")
          .append("      <td style=\"")
          .append(LABEL_STYLE)
          .append("\">")
          .append(escape(row.getKey()))
          .append("</td>\n")
          .append("      <td style=\"")
          .append(CELL_STYLE)
          .append("\">")
          .append(escape(row.getValue()))
          .append("</td>\n")
          .append("    </tr>\n");
    }
    html.append("  </table>\n");
  }

  static String severityColor(Severity severity) {
    if (severity == null) {
      return DEFAULT_COLOR;
    }
    switch (severity) {
      case INFO:
        return "#2196F3";
      case WARNING:
        return "#FF9800";
      case CRITICAL:
        return "#F44336";
      default:
        return DEFAULT_COLOR;
    }
  }

  private static String severityLabel(AlertEvent alertEvent) {
    return alertEvent.getSeverity() == null
        ? "UNKNOWN"
        : alertEvent.getSeverity().getValue().toUpperCase(Locale.ROOT);
  }

  private static String formatInstant(Instant instant) {
    return instant == null ? "" : OCCURRED_AT_FORMATTER.format(instant);
  }

  private static String escape(String value) {
    return HTML_ESCAPER.escape(nullToEmpty(value));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String toJson(Object value) {
    try {
      return ObjectMapperProvider.get().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      return String.valueOf(value);
    }
  }
}
