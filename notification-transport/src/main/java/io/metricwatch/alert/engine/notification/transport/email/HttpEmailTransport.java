package io.metricwatch.alert.engine.notification.transport.email;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import io.metricwatch.alert.engine.notification.transport.NotificationSecretFinder;
import io.metricwatch.alert.engine.notification.transport.NotificationSenderConfig;
import io.metricwatch.alert.engine.notification.transport.SendResult;
import io.metricwatch.alert.engine.notification.transport.http.HttpResponse;
import io.metricwatch.alert.engine.notification.transport.http.HttpWithJsonSender;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends email through a Resend-compatible JSON API: {@code POST apiUrl} with a bearer API key,
 * answering {@code {"id": "..."}} on success and {@code {"message": "..."}} on error.
 */
public class HttpEmailTransport implements EmailTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpEmailTransport.class);
  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String BEARER_PREFIX = "Bearer ";

  private final HttpWithJsonSender sender;
  private final String apiUrl;
  private final String fromAddress;
  private final Optional<String> apiKey;
  private final ObjectMapper objectMapper = ObjectMapperProvider.get();

  public HttpEmailTransport(
      HttpWithJsonSender sender,
      NotificationSenderConfig senderConfig,
      NotificationSecretFinder secretFinder) {
    this.sender = sender;
    this.apiUrl = senderConfig.getEmailApiUrl();
    this.fromAddress = senderConfig.getEmailFromAddress();
    this.apiKey = secretFinder.findSecret(senderConfig.getEmailApiKeySecret());
    if (apiKey.isEmpty()) {
      LOGGER.warn(
          "Email API key {} not found, email alerts are disabled",
          senderConfig.getEmailApiKeySecret());
    }
  }

  @Override
  public boolean isConfigured() {
    return apiKey.isPresent();
  }

  @Override
  public String getFromAddress() {
    return fromAddress;
  }

  @Override
  public SendResult send(EmailMessage message) {
    if (apiKey.isEmpty()) {
      return SendResult.failure("Email API key not configured");
    }
    EmailMessage outgoing = message.toBuilder().from(fromAddress).build();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(outgoing);
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to serialize email {}", outgoing, e);
      return SendResult.failure("Unable to serialize email: " + e.getMessage());
    }

    LOGGER.info("Sending email to {} with subject {}", outgoing.getTo(), outgoing.getSubject());
    Optional<HttpResponse> responseOptional =
        sender.send(apiUrl, jsonString, Map.of(AUTHORIZATION_HEADER, BEARER_PREFIX + apiKey.get()));
    if (responseOptional.isEmpty()) {
      return SendResult.failure("Unable to reach email API " + apiUrl);
    }

    HttpResponse response = responseOptional.get();
    Optional<JsonNode> body = parse(response.getBody());
    if (!response.isSuccessful()) {
      String reason =
          body.map(node -> node.path("message").asText(null)).orElse(response.getMessage());
      LOGGER.error("Email API error. Response Code: {}, Message: {}", response.getCode(), reason);
      return SendResult.failure("Email API error: " + reason);
    }

    Optional<String> messageId = body.map(node -> node.path("id").asText(null));
    if (messageId.isEmpty()) {
      return SendResult.failure("Email API did not return a message ID");
    }
    LOGGER.info("Email sent, message id {}", messageId.get());
    return SendResult.success(messageId.get());
  }

  private Optional<JsonNode> parse(String body) {
    if (body == null || body.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(body));
    } catch (JsonProcessingException e) {
      LOGGER.debug("Email API answered with a non JSON body: {}", body);
      return Optional.empty();
    }
  }
}
