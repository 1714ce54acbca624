package io.metricwatch.alert.engine.notification.transport.email;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Request body of the email API. {@code from} is filled in by the transport. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString(exclude = {"html", "text"})
@JsonInclude(Include.NON_NULL)
public class EmailMessage {
  private final String from;
  @Singular("recipient") private final List<String> to;
  private final String subject;
  private final String html;
  private final String text;

  @JsonProperty("reply_to")
  private final String replyTo;

  @Singular private final List<EmailTag> tags;
}
