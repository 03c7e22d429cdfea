package com.orderpipeline.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.orderpipeline.infra.kafka.contract.MessageHeaders;
import com.orderpipeline.infra.kafka.observability.KafkaTelemetry;
import com.orderpipeline.infra.kafka.observability.NoOpKafkaTelemetry;
import com.orderpipeline.infra.kafka.topics.Channel;
import com.orderpipeline.infra.kafka.topics.TopicNames;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaChannelPublisherTest {
  private static final byte[] PAYLOAD = {0x08, 0x31, 0x30, 0x30, 0x31};

  @Test
  void shouldPublishToChannelTopicWithKeyAndHeaders() throws Exception {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, byte[]> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaChannelPublisher publisher =
        new KafkaChannelPublisher(kafkaTemplate, new NoOpKafkaTelemetry());

    ProducerRecord<String, byte[]> mockedResultRecord =
        new ProducerRecord<>(TopicNames.ORDERS, "1001", PAYLOAD);
    CompletableFuture<SendResult<String, byte[]>> sendFuture =
        CompletableFuture.completedFuture(new SendResult<>(mockedResultRecord, null));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(sendFuture);

    publisher
        .publish(
            Channel.PRIMARY,
            "1001",
            PAYLOAD,
            Map.of(
                MessageHeaders.CONTENT_TYPE,
                MessageHeaders.APPLICATION_AVRO,
                MessageHeaders.TIMESTAMP,
                "1700000000000"))
        .get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, byte[]>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, byte[]> actualRecord = captor.getValue();

    assertEquals(TopicNames.ORDERS, actualRecord.topic());
    assertEquals("1001", actualRecord.key());
    assertArrayEquals(PAYLOAD, actualRecord.value());
    assertEquals(
        MessageHeaders.APPLICATION_AVRO, headerValue(actualRecord, MessageHeaders.CONTENT_TYPE));
    assertEquals("1700000000000", headerValue(actualRecord, MessageHeaders.TIMESTAMP));
  }

  @Test
  void shouldWrapPublishFailureWithKafkaPublishException() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, byte[]> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaTelemetry telemetry = mock(KafkaTelemetry.class);
    KafkaChannelPublisher publisher =
        new KafkaChannelPublisher(kafkaTemplate, telemetry, Duration.ZERO);

    CompletableFuture<SendResult<String, byte[]>> failedFuture = new CompletableFuture<>();
    failedFuture.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failedFuture);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(Channel.RETRY, "1001", PAYLOAD, Map.of()).get());
    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
    KafkaPublishException publishException = (KafkaPublishException) ex.getCause();
    assertEquals(TopicNames.ORDERS_RETRY, publishException.getTopic());
    assertEquals("1001", publishException.getKey());
    verify(telemetry).onPublishFailure(eq(TopicNames.ORDERS_RETRY), eq("1001"), any());
  }

  @Test
  void shouldWrapSynchronousSendFailure() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, byte[]> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaChannelPublisher publisher =
        new KafkaChannelPublisher(kafkaTemplate, new NoOpKafkaTelemetry());
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenThrow(new IllegalStateException("producer closed"));

    CompletableFuture<SendResult<String, byte[]>> result =
        publisher.publish(Channel.DEAD_LETTER, "1001", PAYLOAD, Map.of());

    ExecutionException ex = assertThrows(ExecutionException.class, result::get);
    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
  }

  @Test
  void shouldTimeOutWhenBrokerNeverAcknowledges() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, byte[]> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaChannelPublisher publisher =
        new KafkaChannelPublisher(
            kafkaTemplate, new NoOpKafkaTelemetry(), Duration.ofMillis(50));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(Channel.PRIMARY, "1001", PAYLOAD, Map.of()).get());
    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
    assertTrue(ex.getCause().getCause() instanceof TimeoutException);
  }

  @Test
  void shouldRejectBlankKey() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, byte[]> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaChannelPublisher publisher =
        new KafkaChannelPublisher(kafkaTemplate, new NoOpKafkaTelemetry());

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish(Channel.PRIMARY, " ", PAYLOAD, Map.of()));
    verifyNoInteractions(kafkaTemplate);
  }

  private static String headerValue(ProducerRecord<String, byte[]> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
