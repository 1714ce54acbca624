package io.metricwatch.alert.engine.notification.service.notifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import io.metricwatch.alert.engine.datamodel.AlertEvent;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.HttpWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.NotificationChannelConfig.SlackWebhookChannelConfig;
import io.metricwatch.alert.engine.datamodel.Severity;
import io.metricwatch.alert.engine.datamodel.ThresholdOperator;
import io.metricwatch.alert.engine.datamodel.json.ObjectMapperProvider;
import io.metricwatch.alert.engine.datamodel.trigger.ThresholdTrigger;
import io.metricwatch.alert.engine.notification.service.DispatchResult;
import io.metricwatch.alert.engine.notification.transport.http.HttpWithJsonSender;
import io.metricwatch.alert.engine.notification.transport.webhook.WebhookSender;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookChannelNotifierTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private MockWebServer mockWebServer;
  private WebhookSender webhookSender;
  private Clock clock;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    webhookSender = new WebhookSender(new HttpWithJsonSender());
    clock = Clock.fixed(NOW, ZoneOffset.UTC);
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testSlackStubDoesNotCallTheWebhook() {
    SlackWebhookChannelNotifier notifier =
        new SlackWebhookChannelNotifier(webhookSender, false, "https://dashboard.example.com", clock);

    DispatchResult result = notifier.notify(slackChannel(), alert(), null);

    assertTrue(result.isSuccess());
    assertEquals("slack-stub-" + NOW.toEpochMilli(), result.getMessageId());
    assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testSlackDeliveryPostsBlocks() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
    SlackWebhookChannelNotifier notifier =
        new SlackWebhookChannelNotifier(webhookSender, true, "https://dashboard.example.com", clock);

    DispatchResult result = notifier.notify(slackChannel(), alert(), null);

    assertTrue(result.isSuccess());
    assertTrue(result.getMessageId().startsWith("slack-"));
    JsonNode body =
        ObjectMapperProvider.get().readTree(mockWebServer.takeRequest().getBody().readUtf8());
    assertEquals("[CRITICAL] MRR drop", body.get("text").asText());
    JsonNode attachment = body.get("attachments").get(0);
    assertEquals("#d41729", attachment.get("color").asText());
    assertEquals("section", attachment.get("blocks").get(0).get("type").asText());
    JsonNode fields = attachment.get("blocks").get(1).get("fields");
    assertEquals("*Metric:*\nstripe:mrr", fields.get(0).get("text").asText());
    assertEquals("actions", attachment.get("blocks").get(2).get("type").asText());
    assertEquals(
        "danger", attachment.get("blocks").get(2).get("elements").get(0).get("style").asText());
  }

  @Test
  void testSlackRejectionIsAFailedResult() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("no_service"));
    SlackWebhookChannelNotifier notifier =
        new SlackWebhookChannelNotifier(webhookSender, true, null, clock);

    DispatchResult result = notifier.notify(slackChannel(), alert(), null);

    assertFalse(result.isSuccess());
    assertTrue(result.getError().startsWith("Webhook responded 404"));
  }

  @Test
  void testHttpWebhookDeliveryPostsAlertPayload() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202));
    HttpWebhookChannelNotifier notifier = new HttpWebhookChannelNotifier(webhookSender, true, clock);
    HttpWebhookChannelConfig channel =
        HttpWebhookChannelConfig.builder()
            .channelId("ch-hook")
            .orgId("org-1")
            .enabled(true)
            .webhookUrl(mockWebServer.url("/alerts").toString())
            .build();

    DispatchResult result = notifier.notify(channel, alert(), null);

    assertTrue(result.isSuccess());
    assertEquals(channel.getWebhookUrl(), result.getDestination());
    JsonNode body =
        ObjectMapperProvider.get().readTree(mockWebServer.takeRequest().getBody().readUtf8());
    assertEquals("alert.triggered", body.get("event").asText());
    assertEquals("alert-1", body.get("alert").get("id").asText());
    assertEquals("threshold", body.get("alert").get("triggerDetails").get("type").asText());
    assertEquals("lt", body.get("alert").get("triggerDetails").get("operator").asText());
    assertEquals(
        "Observed value 950.00 is less than the threshold 1000.00",
        body.get("triggerDescription").asText());
    assertEquals("2024-03-01T12:00:00Z", body.get("sentAt").asText());
    assertFalse(body.has("incident"));
  }

  @Test
  void testHttpWebhookStubReturnsSyntheticId() {
    HttpWebhookChannelNotifier notifier = new HttpWebhookChannelNotifier(webhookSender, false, clock);
    HttpWebhookChannelConfig channel =
        HttpWebhookChannelConfig.builder()
            .channelId("ch-hook")
            .orgId("org-1")
            .enabled(true)
            .webhookUrl("https://example.com/hook")
            .build();

    DispatchResult result = notifier.notify(channel, alert(), null);

    assertTrue(result.isSuccess());
    assertEquals("webhook-stub-" + NOW.toEpochMilli(), result.getMessageId());
  }

  private SlackWebhookChannelConfig slackChannel() {
    return SlackWebhookChannelConfig.builder()
        .channelId("ch-slack")
        .orgId("org-1")
        .enabled(true)
        .webhookUrl(mockWebServer.url("/services/T/B/X").toString())
        .build();
  }

  private static AlertEvent alert() {
    return AlertEvent.builder()
        .id("alert-1")
        .orgId("org-1")
        .metricKey("stripe:mrr")
        .severity(Severity.CRITICAL)
        .title("MRR drop")
        .message("MRR fell below 1000")
        .occurredAt(NOW)
        .triggerDetails(
            ThresholdTrigger.builder()
                .observedValue(950)
                .operator(ThresholdOperator.LT)
                .threshold(1000)
                .build())
        .build();
  }
}
