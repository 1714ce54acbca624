package io.metricwatch.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** Small grey footer line made of text elements. */
public class ContextBlock implements Block {
  private final List<Element> elements;

  public ContextBlock(List<Element> elements) {
    this.elements = elements;
  }

  @Override
  public String getType() {
    return BlockType.CONTEXT.getValue();
  }

  public List<Element> getElements() {
    return elements;
  }
}
