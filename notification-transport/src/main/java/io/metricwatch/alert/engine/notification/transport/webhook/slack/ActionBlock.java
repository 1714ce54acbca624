package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ActionBlock implements Block {
  private List<Element> elements;
  private String blockId;

  @Override
  public String getType() {
    return BlockType.ACTIONS.getValue();
  }

  public List<Element> getElements() {
    return elements;
  }

  public void setElements(List<Element> elements) {
    this.elements = elements;
  }

  @JsonProperty("block_id")
  public String getBlockId() {
    return blockId;
  }

  public void setBlockId(String blockId) {
    this.blockId = blockId;
  }
}
