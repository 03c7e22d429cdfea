package com.orderpipeline.infra.kafka.consumer;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

public record InboundMessage(
    String topic, int partition, long offset, String key, byte[] payload, Map<String, String> headers) {
  public InboundMessage {
    Objects.requireNonNull(topic, "topic must not be null");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static InboundMessage from(ConsumerRecord<String, byte[]> record) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (Header header : record.headers()) {
      if (header.value() != null) {
        headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
      }
    }
    return new InboundMessage(
        record.topic(), record.partition(), record.offset(), record.key(), record.value(), headers);
  }
}
