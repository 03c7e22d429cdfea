package com.orderpipeline.worker.report;

import com.orderpipeline.domain.orders.AggregationSnapshot;
import com.orderpipeline.domain.orders.OrderAggregation;
import com.orderpipeline.worker.config.WorkerProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AggregationReporter {
  private static final Logger log = LoggerFactory.getLogger(AggregationReporter.class);

  private final OrderAggregation aggregation;
  private final WorkerProperties properties;

  public AggregationReporter(
      OrderAggregation aggregation, WorkerProperties properties, MeterRegistry meterRegistry) {
    this.aggregation = aggregation;
    this.properties = properties;
    Gauge.builder("orders.processed.count", aggregation, agg -> agg.snapshot().orderCount())
        .description("Orders processed successfully since startup")
        .register(meterRegistry);
    Gauge.builder(
            "orders.processed.average.price",
            aggregation,
            agg -> agg.snapshot().runningAverage())
        .description("Running average price of successfully processed orders")
        .register(meterRegistry);
  }

  public long orderCount() {
    return aggregation.snapshot().orderCount();
  }

  public double runningAverage() {
    return aggregation.snapshot().runningAverage();
  }

  @Scheduled(
      fixedDelayString = "${worker.report.interval-ms:30000}",
      initialDelayString = "${worker.report.interval-ms:30000}")
  public void report() {
    if (!properties.getReport().isEnabled()) {
      return;
    }
    AggregationSnapshot snapshot = aggregation.snapshot();
    log.info(
        "Order aggregation total_orders={} running_average={}",
        snapshot.orderCount(),
        snapshot.displayAverage());
  }
}
