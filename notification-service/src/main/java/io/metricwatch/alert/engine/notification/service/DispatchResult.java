package io.metricwatch.alert.engine.notification.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import io.metricwatch.alert.engine.datamodel.ChannelType;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Outcome of delivering one alert to one channel. */
@SuperBuilder
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public class DispatchResult {
  public static final String UNKNOWN_DESTINATION = "unknown";

  private final boolean success;
  private final String channelId;
  private final ChannelType channelType;
  private final String destination;
  private final String messageId;
  private final String error;
  private final Instant sentAt;

  public static DispatchResult of(
      NotificationChannelConfig channel,
      String destination,
      SendResult sendResult,
      Instant sentAt) {
    return DispatchResult.builder()
        .success(sendResult.isSuccess())
        .channelId(channel.getChannelId())
        .channelType(channel.getChannelType())
        .destination(destination)
        .messageId(sendResult.getMessageId())
        .error(sendResult.getError())
        .sentAt(sentAt)
        .build();
  }

  public static DispatchResult failure(
      NotificationChannelConfig channel, String error, Instant sentAt) {
    return of(channel, UNKNOWN_DESTINATION, SendResult.failure(error), sentAt);
  }
}
