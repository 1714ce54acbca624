package io.metricwatch.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import io.metricwatch.alert.engine.notification.transport.http.HttpResponse;
import io.metricwatch.alert.engine.notification.transport.http.HttpWithJsonSender;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a payload to JSON and POSTs it to a Slack or generic webhook URL. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  /**
   * Any 2xx answer counts as delivered; the message id is {@code prefix-<epochMillis>} since
   * webhooks do not return one.
   */
  public SendResult send(String url, Object payload, String messageIdPrefix) {
    Preconditions.checkArgument(url != null, "Webhook url is missing");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (IOException e) {
      LOGGER.error("Failed to serialize webhook payload: {}", payload, e);
      // nothing to send
      return SendResult.failure("Unable to serialize webhook payload: " + e.getMessage());
    }

    Optional<HttpResponse> responseOptional = sender.send(url, jsonString);
    if (responseOptional.isEmpty()) {
      LOGGER.error("Failed sending webhook payload to {}", url);
      return SendResult.failure("Unable to reach webhook " + url);
    }
    HttpResponse response = responseOptional.get();
    if (!response.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook. Response Code: {}, Response Message: {} \n"
              + " Attempted Notification: {}",
          response.getCode(),
          response.getMessage(),
          jsonString);
      return SendResult.failure(
          String.format("Webhook responded %d %s", response.getCode(), response.getMessage()));
    }
    LOGGER.debug("Webhook {} accepted payload with code {}", url, response.getCode());
    return SendResult.success(messageIdPrefix + "-" + System.currentTimeMillis());
  }
}
