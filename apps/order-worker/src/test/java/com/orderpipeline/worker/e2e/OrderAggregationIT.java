package com.orderpipeline.worker.e2e;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.orderpipeline.infra.kafka.contract.OrderRecord;
import com.orderpipeline.infra.kafka.producer.ChannelPublisher;
import com.orderpipeline.infra.kafka.serde.OrderAvroCodec;
import com.orderpipeline.infra.kafka.topics.Channel;
import com.orderpipeline.testsupport.containers.KafkaContainerBaseIT;
import com.orderpipeline.worker.WorkerApplication;
import com.orderpipeline.worker.report.AggregationReporter;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    classes = WorkerApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    properties = {
      "infra.kafka.consumer.group-id=order-aggregation-it",
      "infra.kafka.consumer.auto-offset-reset=earliest",
      "worker.processing.failure-probability=0.0",
      "worker.report.enabled=false"
    })
class OrderAggregationIT extends KafkaContainerBaseIT {
  @Autowired private ChannelPublisher channelPublisher;
  @Autowired private OrderAvroCodec codec;
  @Autowired private AggregationReporter reporter;

  @Test
  void shouldAggregateEveryPublishedOrder() throws Exception {
    List<OrderRecord> orders =
        List.of(
            new OrderRecord("6001", "Item1", 10.0d),
            new OrderRecord("6002", "Item2", 15.0d),
            new OrderRecord("6003", "Item3", 20.0d));
    for (OrderRecord order : orders) {
      channelPublisher
          .publish(Channel.PRIMARY, order.orderId(), codec.encode(order), Map.of())
          .get(10, TimeUnit.SECONDS);
    }

    Instant deadline = Instant.now().plus(Duration.ofSeconds(20));
    while (reporter.orderCount() < orders.size() && Instant.now().isBefore(deadline)) {
      Thread.sleep(100L);
    }

    assertEquals(3L, reporter.orderCount());
    assertEquals(15.0d, reporter.runningAverage(), 1e-9);
  }
}
