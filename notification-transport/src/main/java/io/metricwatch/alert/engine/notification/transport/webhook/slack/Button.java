package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Link button. Slack opens {@code url} and still posts the action to the app, if any. */
public class Button implements Element {
  public static final String TYPE = "button";
  public static final String PRIMARY_STYLE = "primary";
  public static final String DANGER_STYLE = "danger";
  private final Text text;
  private String actionId;
  private String url;
  private String style;

  public Button(Text text) {
    this.text = text;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  public Text getText() {
    return text;
  }

  @JsonProperty("action_id")
  public String getActionId() {
    return actionId;
  }

  public void setActionId(String actionId) {
    this.actionId = actionId;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getStyle() {
    return style;
  }

  public void setStyle(String style) {
    this.style = style;
  }
}
