package io.metricwatch.alert.engine.notification.transport.email;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Provider-side label attached to a message for filtering and analytics. */
@Getter
@ToString
@EqualsAndHashCode
public class EmailTag {
  private final String name;
  private final String value;

  public EmailTag(String name, String value) {
    this.name = name;
    this.value = value;
  }
}
