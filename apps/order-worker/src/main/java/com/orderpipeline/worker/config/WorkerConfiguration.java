package com.orderpipeline.worker.config;

import com.orderpipeline.domain.orders.InMemoryRetryLedger;
import com.orderpipeline.domain.orders.OrderAggregation;
import com.orderpipeline.domain.orders.RetryLedger;
import com.orderpipeline.infra.kafka.errors.DeadLetterPublisher;
import com.orderpipeline.infra.kafka.errors.RetryPolicy;
import com.orderpipeline.infra.kafka.observability.KafkaTelemetry;
import com.orderpipeline.infra.kafka.producer.ChannelPublisher;
import com.orderpipeline.infra.kafka.serde.OrderAvroCodec;
import com.orderpipeline.worker.delivery.OrderDeliveryOrchestrator;
import com.orderpipeline.worker.delivery.RetryScheduler;
import com.orderpipeline.worker.delivery.ScheduledExecutorRetryScheduler;
import com.orderpipeline.worker.processing.FailurePredicate;
import com.orderpipeline.worker.processing.OrderProcessor;
import com.orderpipeline.worker.processing.RandomFailurePredicate;
import com.orderpipeline.worker.processing.SimulatedOrderProcessor;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

@Configuration
public class WorkerConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public RetryLedger retryLedger() {
    return new InMemoryRetryLedger();
  }

  @Bean
  public OrderAggregation orderAggregation() {
    return new OrderAggregation();
  }

  @Bean
  @ConditionalOnMissingBean
  public FailurePredicate failurePredicate(WorkerProperties properties) {
    return new RandomFailurePredicate(
        properties.getProcessing().getFailureProbability(), new Random());
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderProcessor orderProcessor(FailurePredicate failurePredicate) {
    return new SimulatedOrderProcessor(failurePredicate);
  }

  @Bean(destroyMethod = "close")
  @DependsOn({"infraKafkaTemplate", "infraKafkaProducerFactory"})
  public ScheduledExecutorRetryScheduler retryScheduler(WorkerProperties properties) {
    long drainTimeoutMs = Math.max(0L, properties.getShutdown().getRetryDrainTimeoutMs());
    return new ScheduledExecutorRetryScheduler(Duration.ofMillis(drainTimeoutMs));
  }

  @Bean
  public Clock workerClock() {
    return Clock.systemUTC();
  }

  @Bean
  public OrderDeliveryOrchestrator orderDeliveryOrchestrator(
      OrderAvroCodec codec,
      OrderProcessor orderProcessor,
      RetryLedger retryLedger,
      OrderAggregation orderAggregation,
      RetryPolicy retryPolicy,
      RetryScheduler retryScheduler,
      ChannelPublisher channelPublisher,
      DeadLetterPublisher deadLetterPublisher,
      KafkaTelemetry kafkaTelemetry,
      Clock workerClock) {
    return new OrderDeliveryOrchestrator(
        codec,
        orderProcessor,
        retryLedger,
        orderAggregation,
        retryPolicy,
        retryScheduler,
        channelPublisher,
        deadLetterPublisher,
        kafkaTelemetry,
        workerClock);
  }
}
