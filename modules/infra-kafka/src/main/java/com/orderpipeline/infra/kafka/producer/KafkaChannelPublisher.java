package com.orderpipeline.infra.kafka.producer;

import com.orderpipeline.infra.kafka.observability.KafkaTelemetry;
import com.orderpipeline.infra.kafka.topics.Channel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaChannelPublisher implements ChannelPublisher {
  private final KafkaTemplate<String, byte[]> kafkaTemplate;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaChannelPublisher(KafkaTemplate<String, byte[]> kafkaTemplate, KafkaTelemetry telemetry) {
    this(kafkaTemplate, telemetry, Duration.ZERO);
  }

  public KafkaChannelPublisher(
      KafkaTemplate<String, byte[]> kafkaTemplate, KafkaTelemetry telemetry, Duration sendTimeout) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public CompletableFuture<SendResult<String, byte[]>> publish(
      Channel channel, String key, byte[] payload, Map<String, String> headers) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }

    String topic = channel.topic();
    long started = System.nanoTime();
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, payload);
    if (headers != null) {
      headers.forEach(
          (name, value) -> {
            if (value != null) {
              record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
            }
          });
    }

    CompletableFuture<SendResult<String, byte[]>> sendFuture;
    try {
      sendFuture = applyTimeout(kafkaTemplate.send(record));
    } catch (RuntimeException ex) {
      sendFuture = CompletableFuture.failedFuture(ex);
    }

    CompletableFuture<SendResult<String, byte[]>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, key, System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }

          KafkaPublishException publishException = wrapPublishException(topic, key, throwable);
          telemetry.onPublishFailure(topic, key, publishException);
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private CompletableFuture<SendResult<String, byte[]>> applyTimeout(
      CompletableFuture<SendResult<String, byte[]>> sendFuture) {
    if (sendTimeout.isZero() || sendTimeout.isNegative()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private KafkaPublishException wrapPublishException(String topic, String key, Throwable throwable) {
    Throwable cause = unwrap(throwable);
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }

    String message;
    if (cause instanceof TimeoutException) {
      message = "Timed out publishing order to Kafka topic=" + topic + " key=" + key;
    } else {
      message = "Failed to publish order to Kafka topic=" + topic + " key=" + key;
    }
    return new KafkaPublishException(topic, key, message, cause);
  }

  private Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }
}
