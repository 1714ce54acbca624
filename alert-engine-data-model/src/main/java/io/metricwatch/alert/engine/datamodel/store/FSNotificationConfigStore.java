package io.metricwatch.alert.engine.datamodel.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.metricwatch.alert.engine.datamodel.ChannelType;
import io.metricwatch.alert.engine.datamodel.MetricPattern;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.EmailChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.PagerDutyChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationPreference;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only store backed by a JSON document of the form {@code {"channels": [...],
 * "preferences": [...]}}. The file is re-read on every lookup so edits are picked up without a
 * restart.
 */
public class FSNotificationConfigStore implements NotificationConfigStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FSNotificationConfigStore.class);
  private static final String PATH_CONFIG = "path";
  private static final String CHANNELS = "channels";
  private static final String PREFERENCES = "preferences";
  private static final String ORG_ID = "orgId";
  private static final String CHANNEL_ID = "channelId";
  private static final String CHANNEL_NAME = "channelName";
  private static final String CHANNEL_TYPE = "type";
  private static final String ENABLED = "enabled";
  private static final String EMAIL_ADDRESS = "emailAddress";
  private static final String WEBHOOK_URL = "webhookUrl";
  private static final String ROUTING_KEY = "routingKey";
  private static final String PREFERENCE_ID = "id";
  private static final String USER_ID = "userId";
  private static final String SEVERITY = "severity";
  private static final String METRIC_KEY = "metricKey";

  private final ObjectMapper objectMapper = ObjectMapperProvider.get();
  private final String path;

  public FSNotificationConfigStore(Config fsConfig) {
    this.path = fsConfig.getString(PATH_CONFIG);
  }

  @Override
  public List<NotificationPreference> getEnabledPreferences(String orgId) {
    return stream(readDocument().get(PREFERENCES))
        .filter(node -> orgId.equals(text(node, ORG_ID)))
        .map(this::toPreference)
        .filter(NotificationPreference::isEnabled)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<NotificationChannelConfig> getChannelsByIds(
      String orgId, Collection<String> channelIds) {
    Set<String> wanted = Set.copyOf(channelIds);
    return stream(readDocument().get(CHANNELS))
        .filter(node -> orgId.equals(text(node, ORG_ID)))
        .filter(node -> wanted.contains(text(node, CHANNEL_ID)))
        .map(this::toChannel)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public void recordChannelUsed(String orgId, String channelId, Instant usedAt) {
    LOGGER.debug(
        "Ignoring last-used update for channel {} of org {}: file store is read-only",
        channelId,
        orgId);
  }

  private JsonNode readDocument() {
    LOGGER.debug("Reading notification configuration from file path:{}", path);
    try {
      JsonNode document = objectMapper.readTree(new File(path).getAbsoluteFile());
      if (document == null || !document.isObject()) {
        throw new NotificationStoreException(
            "File should contain an object with channels and preferences: " + path);
      }
      return document;
    } catch (IOException e) {
      throw new NotificationStoreException("Unable to read notification configuration " + path, e);
    }
  }

  private NotificationChannelConfig toChannel(JsonNode node) {
    ChannelType type = ChannelType.fromValue(text(node, CHANNEL_TYPE));
    NotificationChannelConfig.NotificationChannelConfigBuilder<?, ?> builder;
    switch (type) {
      case EMAIL:
        builder = EmailChannelConfig.builder().emailAddress(text(node, EMAIL_ADDRESS));
        break;
      case SLACK_WEBHOOK:
        builder = SlackWebhookChannelConfig.builder().webhookUrl(text(node, WEBHOOK_URL));
        break;
      case HTTP_WEBHOOK:
        builder = HttpWebhookChannelConfig.builder().webhookUrl(text(node, WEBHOOK_URL));
        break;
      case PAGERDUTY:
        builder = PagerDutyChannelConfig.builder().routingKey(text(node, ROUTING_KEY));
        break;
      default:
        throw new UnsupportedOperationException("Unsupported channel type: " + type);
    }
    return builder
        .channelId(text(node, CHANNEL_ID))
        .orgId(text(node, ORG_ID))
        .channelName(text(node, CHANNEL_NAME))
        .enabled(node.path(ENABLED).asBoolean(true))
        .build();
  }

  private NotificationPreference toPreference(JsonNode node) {
    String metricKey = text(node, METRIC_KEY);
    return NotificationPreference.builder()
        .id(text(node, PREFERENCE_ID))
        .orgId(text(node, ORG_ID))
        .userId(text(node, USER_ID))
        .severity(Severity.fromValue(text(node, SEVERITY)))
        .metricPattern(metricKey == null ? null : MetricPattern.of(metricKey))
        .channels(
            stream(node.get(CHANNELS)).map(JsonNode::asText).collect(Collectors.toList()))
        .enabled(node.path(ENABLED).asBoolean(true))
        .build();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static Stream<JsonNode> stream(JsonNode arrayNode) {
    if (arrayNode == null || !arrayNode.isArray()) {
      return Stream.empty();
    }
    return StreamSupport.stream(arrayNode.spliterator(), false);
  }
}
