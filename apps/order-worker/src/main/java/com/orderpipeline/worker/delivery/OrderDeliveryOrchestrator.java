package com.orderpipeline.worker.delivery;

import com.orderpipeline.domain.orders.AggregationSnapshot;
import com.orderpipeline.domain.orders.Delivery;
import com.orderpipeline.domain.orders.DeliveryState;
import com.orderpipeline.domain.orders.FailureRegistration;
import com.orderpipeline.domain.orders.OrderAggregation;
import com.orderpipeline.domain.orders.RetryLedger;
import com.orderpipeline.infra.kafka.consumer.InboundMessage;
import com.orderpipeline.infra.kafka.contract.DeadLetterEnvelope;
import com.orderpipeline.infra.kafka.contract.MessageHeaders;
import com.orderpipeline.infra.kafka.contract.OrderRecord;
import com.orderpipeline.infra.kafka.errors.DeadLetterPublisher;
import com.orderpipeline.infra.kafka.errors.RetryPolicy;
import com.orderpipeline.infra.kafka.observability.KafkaTelemetry;
import com.orderpipeline.infra.kafka.producer.ChannelPublisher;
import com.orderpipeline.infra.kafka.serde.OrderAvroCodec;
import com.orderpipeline.infra.kafka.serde.OrderDecodeException;
import com.orderpipeline.infra.kafka.topics.Channel;
import com.orderpipeline.worker.processing.OrderProcessor;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OrderDeliveryOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(OrderDeliveryOrchestrator.class);

  private final OrderAvroCodec codec;
  private final OrderProcessor processor;
  private final RetryLedger ledger;
  private final OrderAggregation aggregation;
  private final RetryPolicy retryPolicy;
  private final RetryScheduler retryScheduler;
  private final ChannelPublisher channelPublisher;
  private final DeadLetterPublisher deadLetterPublisher;
  private final KafkaTelemetry telemetry;
  private final Clock clock;

  public OrderDeliveryOrchestrator(
      OrderAvroCodec codec,
      OrderProcessor processor,
      RetryLedger ledger,
      OrderAggregation aggregation,
      RetryPolicy retryPolicy,
      RetryScheduler retryScheduler,
      ChannelPublisher channelPublisher,
      DeadLetterPublisher deadLetterPublisher,
      KafkaTelemetry telemetry,
      Clock clock) {
    this.codec = codec;
    this.processor = processor;
    this.ledger = ledger;
    this.aggregation = aggregation;
    this.retryPolicy = retryPolicy;
    this.retryScheduler = retryScheduler;
    this.channelPublisher = channelPublisher;
    this.deadLetterPublisher = deadLetterPublisher;
    this.telemetry = telemetry;
    this.clock = clock;
  }

  public DeliveryOutcome handle(InboundMessage message) {
    try {
      return route(message);
    } catch (RuntimeException ex) {
      log.error(
          "Unexpected failure handling order record topic={} partition={} offset={} key={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.key(),
          ex);
      return DeliveryOutcome.dropped(message.key());
    }
  }

  private DeliveryOutcome route(InboundMessage message) {
    long started = System.nanoTime();
    OrderRecord order;
    try {
      order = codec.decode(message.payload());
    } catch (OrderDecodeException ex) {
      telemetry.onDecodeFailure(message.topic(), ex);
      log.warn(
          "Dropping undecodable order record topic={} partition={} offset={} key={} error={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.key(),
          ex.getMessage());
      return DeliveryOutcome.dropped(message.key());
    }

    Delivery delivery =
        Delivery.received(order.orderId(), ledger.attempts(order.orderId()))
            .transitionTo(DeliveryState.PROCESSING);
    try {
      processor.process(order);
    } catch (Exception ex) {
      telemetry.onConsumeFailure(message.topic(), order.orderId(), ex);
      return handleFailure(message, order, delivery, ex);
    }

    AggregationSnapshot snapshot = aggregation.record(order.price());
    ledger.clear(order.orderId());
    telemetry.onConsumeSuccess(
        message.topic(),
        order.orderId(),
        message.partition(),
        message.offset(),
        System.nanoTime() - started);
    log.info(
        "Processed order order_id={} product={} price={} running_average={} total_orders={}",
        order.orderId(),
        order.product(),
        order.displayPrice(),
        snapshot.displayAverage(),
        snapshot.orderCount());
    return DeliveryOutcome.of(delivery.transitionTo(DeliveryState.SUCCEEDED), Duration.ZERO);
  }

  private DeliveryOutcome handleFailure(
      InboundMessage message, OrderRecord order, Delivery delivery, Exception ex) {
    if (!retryPolicy.isRetryable(ex)) {
      return deadLetter(message, order, delivery, ex, ledger.attempts(order.orderId()));
    }

    FailureRegistration registration =
        ledger.registerFailure(order.orderId(), retryPolicy.maxRetries());
    if (registration.exhausted()) {
      return deadLetter(message, order, delivery, ex, registration.attempts());
    }

    int attempt = registration.attempts();
    Duration backoff = retryPolicy.backoffForRetry(attempt);
    Map<String, String> headers = new LinkedHashMap<>(message.headers());
    headers.put(MessageHeaders.RETRY_ATTEMPT, Integer.toString(attempt));
    retryScheduler.schedule(backoff, () -> publishRetry(order, message.payload(), headers));
    telemetry.onRetryScheduled(message.topic(), order.orderId(), attempt, backoff);

    log.warn(
        "Order processing failed, retry scheduled order_id={} attempt={} max_retries={} backoff_ms={} error={}",
        order.orderId(),
        attempt,
        retryPolicy.maxRetries(),
        backoff.toMillis(),
        ex.getMessage());
    return DeliveryOutcome.of(
        delivery.transitionTo(DeliveryState.RETRY_SCHEDULED, attempt), backoff);
  }

  private void publishRetry(OrderRecord order, byte[] payload, Map<String, String> headers) {
    Map<String, String> retryHeaders = new LinkedHashMap<>(headers);
    retryHeaders.put(MessageHeaders.RETRY_TIMESTAMP, Long.toString(clock.millis()));
    channelPublisher
        .publish(Channel.RETRY, order.orderId(), payload, retryHeaders)
        .whenComplete(
            (result, throwable) -> {
              if (throwable != null) {
                log.error(
                    "Failed to publish order to retry channel order_id={} attempt={} topic={}",
                    order.orderId(),
                    retryHeaders.get(MessageHeaders.RETRY_ATTEMPT),
                    Channel.RETRY.topic(),
                    throwable);
                return;
              }
              log.info(
                  "Sent order to retry channel order_id={} attempt={} topic={}",
                  order.orderId(),
                  retryHeaders.get(MessageHeaders.RETRY_ATTEMPT),
                  Channel.RETRY.topic());
            });
  }

  private DeliveryOutcome deadLetter(
      InboundMessage message, OrderRecord order, Delivery delivery, Exception ex, int attempts) {
    DeadLetterEnvelope envelope =
        new DeadLetterEnvelope(
            order,
            message.payload(),
            message.headers(),
            message.topic(),
            ex.getMessage(),
            ex.getClass().getSimpleName(),
            attempts,
            clock.instant());
    ledger.clear(order.orderId());
    telemetry.onDeadLetter(message.topic(), order.orderId(), envelope.errorType());

    log.error(
        "Order exhausted retries, dead-lettering order_id={} retry_attempts={} error_type={} error={}",
        order.orderId(),
        attempts,
        envelope.errorType(),
        envelope.errorMessage());
    try {
      deadLetterPublisher.publish(envelope);
    } catch (RuntimeException publishFailure) {
      log.error(
          "Failed to hand order to dead-letter publisher order_id={}",
          order.orderId(),
          publishFailure);
    }
    return DeliveryOutcome.of(
        delivery.transitionTo(DeliveryState.DEAD_LETTERED, attempts), Duration.ZERO);
  }
}
