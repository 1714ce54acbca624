package io.metricwatch.alert.engine.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A configured notification destination owned by a tenant. Destination fields live on the
 * type-specific subclasses and may be missing; senders validate them before use.
 */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
@JsonInclude(Include.NON_NULL)
public abstract class NotificationChannelConfig {
  private final String channelId;
  private final String orgId;
  private final String channelName;
  private final boolean enabled;
  private final Instant lastUsedAt;

  public abstract ChannelType getChannelType();

  public abstract <T> T accept(ChannelConfigVisitor<T> visitor);

  @SuperBuilder(toBuilder = true)
  @Getter
  @ToString(callSuper = true)
  public static class EmailChannelConfig extends NotificationChannelConfig {
    private final String emailAddress;

    @Override
    public ChannelType getChannelType() {
      return ChannelType.EMAIL;
    }

    @Override
    public <T> T accept(ChannelConfigVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  @SuperBuilder(toBuilder = true)
  @Getter
  @ToString(callSuper = true)
  public static class SlackWebhookChannelConfig extends NotificationChannelConfig {
    private final String webhookUrl;

    @Override
    public ChannelType getChannelType() {
      return ChannelType.SLACK_WEBHOOK;
    }

    @Override
    public <T> T accept(ChannelConfigVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  @SuperBuilder(toBuilder = true)
  @Getter
  @ToString(callSuper = true)
  public static class HttpWebhookChannelConfig extends NotificationChannelConfig {
    private final String webhookUrl;

    @Override
    public ChannelType getChannelType() {
      return ChannelType.HTTP_WEBHOOK;
    }

    @Override
    public <T> T accept(ChannelConfigVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }

  @SuperBuilder(toBuilder = true)
  @Getter
  @ToString(callSuper = true, exclude = "routingKey")
  public static class PagerDutyChannelConfig extends NotificationChannelConfig {
    private final String routingKey;

    @Override
    public ChannelType getChannelType() {
      return ChannelType.PAGERDUTY;
    }

    @Override
    public <T> T accept(ChannelConfigVisitor<T> visitor) {
      return visitor.visit(this);
    }
  }
}
