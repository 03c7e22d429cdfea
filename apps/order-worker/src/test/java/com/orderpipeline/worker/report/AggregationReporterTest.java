package com.orderpipeline.worker.report;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.orderpipeline.domain.orders.OrderAggregation;
import com.orderpipeline.worker.config.WorkerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class AggregationReporterTest {
  @Test
  void shouldExposeRunningTotalsAsGauges() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    OrderAggregation aggregation = new OrderAggregation();
    AggregationReporter reporter =
        new AggregationReporter(aggregation, new WorkerProperties(), registry);

    aggregation.record(10.0d);
    aggregation.record(15.0d);
    aggregation.record(20.0d);

    assertEquals(3L, reporter.orderCount());
    assertEquals(15.0d, reporter.runningAverage(), 1e-9);
    assertEquals(3.0d, registry.get("orders.processed.count").gauge().value(), 1e-9);
    assertEquals(15.0d, registry.get("orders.processed.average.price").gauge().value(), 1e-9);
  }

  @Test
  void shouldReportZeroAverageBeforeAnyOrder() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    AggregationReporter reporter =
        new AggregationReporter(new OrderAggregation(), new WorkerProperties(), registry);

    reporter.report();

    assertEquals(0L, reporter.orderCount());
    assertEquals(0.0d, registry.get("orders.processed.average.price").gauge().value(), 1e-9);
  }
}
