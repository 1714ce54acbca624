package io.metricwatch.alert.engine.datamodel.store;

import com.typesafe.config.Config;

public class NotificationConfigStoreProvider {
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";
  private static final String SOURCE_TYPE_MEMORY = "memory";

  public static NotificationConfigStore getProvider(Config sourceConfig) {
    String sourceType = sourceConfig.getString(SOURCE_TYPE);
    switch (sourceType) {
      case SOURCE_TYPE_FS:
        return new FSNotificationConfigStore(sourceConfig.getConfig(SOURCE_TYPE_FS));
      case SOURCE_TYPE_MEMORY:
        return new InMemoryNotificationConfigStore();
      default:
        throw new IllegalArgumentException(
            String.format("Invalid notification config source type:%s", sourceType));
    }
  }
}
