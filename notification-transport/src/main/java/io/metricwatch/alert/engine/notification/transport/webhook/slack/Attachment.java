package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** Coloured side bar wrapping a list of blocks. */
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#ff9800";
  public static final String BLUE = "#2196f3";
  private final String color;
  private final List<Block> blocks;

  public Attachment(String color, List<Block> blocks) {
    this.color = color;
    this.blocks = blocks;
  }

  public String getColor() {
    return color;
  }

  public List<Block> getBlocks() {
    return blocks;
  }
}
