package io.metricwatch.alert.engine.notification.transport;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up a secret by key, first in the system property {@code metricwatch.secret.<key>}, then in
 * the file {@code <root>/<key>}.
 */
public class NotificationSecretFinder {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationSecretFinder.class);
  private static final String DEFAULT_ROOT_PATH = "/var/metricwatch/secrets";
  private static final String SECRET_SYS_PROP_PREFIX = "metricwatch.secret.";

  private final String rootPath;

  public NotificationSecretFinder() {
    this(DEFAULT_ROOT_PATH);
  }

  public NotificationSecretFinder(String rootPath) {
    this.rootPath = rootPath;
  }

  public Optional<String> findSecret(String key) {
    String value = System.getProperty(SECRET_SYS_PROP_PREFIX + key);
    if (value != null) {
      return Optional.of(value);
    }

    File file = new File(rootPath + "/" + key);
    if (!file.exists() || !file.canRead()) {
      LOG.warn("Unable to read secret file: {}", file.getPath());
      return Optional.empty();
    }

    StringBuilder secret = new StringBuilder();
    try (Stream<String> stream = Files.lines(file.toPath(), StandardCharsets.UTF_8)) {
      stream.forEach(secret::append);
      return secret.length() == 0 ? Optional.empty() : Optional.of(secret.toString().trim());
    } catch (IOException e) {
      LOG.error("Unable to read lines from secret file: {}", file.getPath(), e);
      return Optional.empty();
    }
  }
}
