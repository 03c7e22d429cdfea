package com.orderpipeline.worker.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import com.orderpipeline.infra.kafka.consumer.InboundMessage;
import com.orderpipeline.infra.kafka.contract.MessageHeaders;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import com.orderpipeline.worker.delivery.DeliveryOutcome;
import com.orderpipeline.worker.delivery.OrderDeliveryOrchestrator;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

@ExtendWith(MockitoExtension.class)
class OrderMessageListenerTest {
  @Mock private OrderDeliveryOrchestrator orchestrator;
  @Mock private Acknowledgment acknowledgment;

  @Test
  void shouldHandRecordToOrchestratorThenAcknowledge() {
    when(orchestrator.handle(any())).thenReturn(DeliveryOutcome.dropped("1001"));
    ConsumerRecord<String, byte[]> record =
        new ConsumerRecord<>(TopicNames.ORDERS_RETRY, 2, 41L, "1001", new byte[] {1, 2});
    record
        .headers()
        .add(MessageHeaders.RETRY_ATTEMPT, "2".getBytes(StandardCharsets.UTF_8));

    new OrderMessageListener(orchestrator).onMessage(record, acknowledgment);

    ArgumentCaptor<InboundMessage> message = ArgumentCaptor.forClass(InboundMessage.class);
    InOrder order = inOrder(orchestrator, acknowledgment);
    order.verify(orchestrator).handle(message.capture());
    order.verify(acknowledgment).acknowledge();
    assertEquals(TopicNames.ORDERS_RETRY, message.getValue().topic());
    assertEquals(2, message.getValue().partition());
    assertEquals(41L, message.getValue().offset());
    assertEquals("1001", message.getValue().key());
    assertEquals("2", message.getValue().headers().get(MessageHeaders.RETRY_ATTEMPT));
  }
}
