package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SectionBlock implements Block {
  private Text text;
  private String blockId;
  private List<Text> fields;
  private Element accessory;

  @Override
  public String getType() {
    return BlockType.SECTION.getValue();
  }

  public Text getText() {
    return text;
  }

  public void setText(Text text) {
    this.text = text;
  }

  @JsonProperty("block_id")
  public String getBlockId() {
    return blockId;
  }

  public void setBlockId(String blockId) {
    this.blockId = blockId;
  }

  public List<Text> getFields() {
    return fields;
  }

  public void setFields(List<Text> fields) {
    this.fields = fields;
  }

  public Element getAccessory() {
    return accessory;
  }

  public void setAccessory(Element accessory) {
    this.accessory = accessory;
  }
}
