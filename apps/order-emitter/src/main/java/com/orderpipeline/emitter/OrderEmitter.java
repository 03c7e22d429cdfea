package com.orderpipeline.emitter;

import com.orderpipeline.infra.kafka.contract.MessageHeaders;
import com.orderpipeline.infra.kafka.contract.OrderRecord;
import com.orderpipeline.infra.kafka.producer.ChannelPublisher;
import com.orderpipeline.infra.kafka.serde.OrderAvroCodec;
import com.orderpipeline.infra.kafka.topics.Channel;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    prefix = "emitter",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OrderEmitter {
  private static final Logger log = LoggerFactory.getLogger(OrderEmitter.class);

  private final OrderGenerator generator;
  private final OrderAvroCodec codec;
  private final ChannelPublisher channelPublisher;
  private final Clock clock;
  private final AtomicLong nextSequence;

  public OrderEmitter(
      OrderGenerator generator,
      OrderAvroCodec codec,
      ChannelPublisher channelPublisher,
      EmitterProperties properties,
      Clock emitterClock) {
    this.generator = generator;
    this.codec = codec;
    this.channelPublisher = channelPublisher;
    this.clock = emitterClock;
    this.nextSequence = new AtomicLong(properties.getStartSequence());
  }

  @Scheduled(fixedRateString = "${emitter.interval-ms:2000}")
  public void emitScheduled() {
    emitNext();
  }

  public boolean emitNext() {
    long sequence = nextSequence.get();
    OrderRecord order = generator.generate(sequence);
    try {
      byte[] payload = codec.encode(order);
      Map<String, String> headers = new LinkedHashMap<>();
      headers.put(MessageHeaders.CONTENT_TYPE, MessageHeaders.APPLICATION_AVRO);
      headers.put(MessageHeaders.TIMESTAMP, Long.toString(clock.millis()));

      SendResult<String, byte[]> result =
          channelPublisher.publish(Channel.PRIMARY, order.orderId(), payload, headers).join();
      nextSequence.compareAndSet(sequence, sequence + 1);

      log.info(
          "Order emitted order_id={} product={} price={} topic={} offset={}",
          order.orderId(),
          order.product(),
          order.displayPrice(),
          Channel.PRIMARY.topic(),
          result == null || result.getRecordMetadata() == null
              ? -1L
              : result.getRecordMetadata().offset());
      return true;
    } catch (Exception ex) {
      log.warn(
          "Order emit failed order_id={} topic={} error={}",
          order.orderId(),
          Channel.PRIMARY.topic(),
          errorMessage(unwrap(ex)));
      return false;
    }
  }

  public long nextSequence() {
    return nextSequence.get();
  }

  private static Throwable unwrap(Exception ex) {
    if (ex instanceof CompletionException && ex.getCause() != null) {
      return ex.getCause();
    }
    return ex;
  }

  private static String errorMessage(Throwable ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return message;
  }
}
