package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelType {
  EMAIL("email"),
  SLACK_WEBHOOK("slack_webhook"),
  HTTP_WEBHOOK("http_webhook"),
  PAGERDUTY("pagerduty");

  private final String value;

  ChannelType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ChannelType fromValue(String value) {
    for (ChannelType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException(String.format("Invalid channel type:%s", value));
  }
}
