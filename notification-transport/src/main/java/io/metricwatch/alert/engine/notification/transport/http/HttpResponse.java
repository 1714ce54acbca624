package io.metricwatch.alert.engine.notification.transport.http;

import lombok.Getter;
import lombok.ToString;

/** Status line and body of a completed HTTP call, read before the connection is released. */
@Getter
@ToString
public class HttpResponse {
  private final int code;
  private final String message;
  private final String body;

  public HttpResponse(int code, String message, String body) {
    this.code = code;
    this.message = message;
    this.body = body;
  }

  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }
}
