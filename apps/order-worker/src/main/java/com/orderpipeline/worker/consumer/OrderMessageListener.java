package com.orderpipeline.worker.consumer;

import com.orderpipeline.infra.kafka.consumer.InboundMessage;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import com.orderpipeline.worker.delivery.OrderDeliveryOrchestrator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
public class OrderMessageListener {
  private final OrderDeliveryOrchestrator orchestrator;

  public OrderMessageListener(OrderDeliveryOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @KafkaListener(
      topics = {TopicNames.ORDERS, TopicNames.ORDERS_RETRY},
      groupId = "${infra.kafka.consumer.group-id:order-processing-group}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, byte[]> record, Acknowledgment ack) {
    orchestrator.handle(InboundMessage.from(record));
    ack.acknowledge();
  }
}
