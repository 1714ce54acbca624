package io.metricwatch.alert.engine.datamodel;

import java.util.UUID;

public class IdGenerator {

  private IdGenerator() {}

  /** Returns an id of the form {@code <prefix>_<base36 millis>_<random>}. */
  public static String generateId(String prefix) {
    String timestamp = Long.toString(System.currentTimeMillis(), 36);
    String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return prefix + "_" + timestamp + "_" + random;
  }
}
