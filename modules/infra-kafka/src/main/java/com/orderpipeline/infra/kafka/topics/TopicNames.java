package com.orderpipeline.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String ORDERS = "orders";
  public static final String ORDERS_RETRY = "orders-retry";
  public static final String ORDERS_DLQ = "orders-dlq";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(ORDERS, ORDERS_RETRY, ORDERS_DLQ);
  }
}
