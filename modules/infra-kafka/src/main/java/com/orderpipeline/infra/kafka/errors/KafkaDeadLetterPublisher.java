package com.orderpipeline.infra.kafka.errors;

import com.orderpipeline.infra.kafka.contract.DeadLetterEnvelope;
import com.orderpipeline.infra.kafka.contract.MessageHeaders;
import com.orderpipeline.infra.kafka.producer.ChannelPublisher;
import com.orderpipeline.infra.kafka.topics.Channel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaDeadLetterPublisher implements DeadLetterPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

  private final ChannelPublisher channelPublisher;

  public KafkaDeadLetterPublisher(ChannelPublisher channelPublisher) {
    this.channelPublisher =
        Objects.requireNonNull(channelPublisher, "channelPublisher must not be null");
  }

  @Override
  public CompletableFuture<Void> publish(DeadLetterEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope must not be null");
    Map<String, String> headers = deadLetterHeaders(envelope);

    return channelPublisher
        .publish(Channel.DEAD_LETTER, envelope.key(), envelope.payload(), headers)
        .whenComplete(
            (result, throwable) -> {
              if (throwable != null) {
                log.error(
                    "Failed to publish DLQ record order_id={} source_topic={} target_topic={}",
                    envelope.key(),
                    envelope.sourceTopic(),
                    Channel.DEAD_LETTER.topic(),
                    throwable);
                return;
              }
              log.warn(
                  "Published DLQ record order_id={} source_topic={} target_topic={} retry_attempts={} error={}",
                  envelope.key(),
                  envelope.sourceTopic(),
                  Channel.DEAD_LETTER.topic(),
                  envelope.retryAttempts(),
                  envelope.errorMessage());
            })
        .thenApply(result -> (Void) null);
  }

  static Map<String, String> deadLetterHeaders(DeadLetterEnvelope envelope) {
    Map<String, String> headers = new LinkedHashMap<>(envelope.originalHeaders());
    headers.put(MessageHeaders.ERROR_MESSAGE, envelope.errorMessage());
    headers.put(MessageHeaders.ERROR_TYPE, envelope.errorType());
    headers.put(
        MessageHeaders.DLQ_TIMESTAMP, Long.toString(envelope.deadLetteredAt().toEpochMilli()));
    headers.put(MessageHeaders.RETRY_ATTEMPTS, Integer.toString(envelope.retryAttempts()));
    headers.put(MessageHeaders.DLQ_SOURCE_TOPIC, envelope.sourceTopic());
    return headers;
  }
}
