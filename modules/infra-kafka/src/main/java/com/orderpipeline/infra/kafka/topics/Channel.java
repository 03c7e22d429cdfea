package com.orderpipeline.infra.kafka.topics;

public enum Channel {
  PRIMARY(TopicNames.ORDERS),
  RETRY(TopicNames.ORDERS_RETRY),
  DEAD_LETTER(TopicNames.ORDERS_DLQ);

  private final String topic;

  Channel(String topic) {
    TopicNameValidator.assertValid(topic);
    this.topic = topic;
  }

  public String topic() {
    return topic;
  }
}
