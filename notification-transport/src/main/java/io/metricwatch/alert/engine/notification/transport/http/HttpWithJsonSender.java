package io.metricwatch.alert.engine.notification.transport.http;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic sender that POSTs a JSON string to a URL. Stateless apart from the shared OkHttp client;
 * one instance is created by the composition root and shared by all senders.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private final OkHttpClient client;

  public HttpWithJsonSender() {
    this(new OkHttpClient());
  }

  public HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public Optional<HttpResponse> send(String url, String jsonString) {
    return send(url, jsonString, Map.of());
  }

  /** Returns empty when the call could not be made at all (I/O failure, unreachable host). */
  public Optional<HttpResponse> send(String url, String jsonString, Map<String, String> headers) {
    LOGGER.debug("Sending json string to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request.Builder requestBuilder = new Request.Builder().url(url).post(body);
    headers.forEach(requestBuilder::header);
    try (Response response = client.newCall(requestBuilder.build()).execute()) {
      ResponseBody responseBody = response.body();
      return Optional.of(
          new HttpResponse(
              response.code(),
              response.message(),
              responseBody == null ? "" : responseBody.string()));
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}", url, ioe);
    }
    return Optional.empty();
  }
}
