package com.orderpipeline.worker.processing;

import com.orderpipeline.infra.kafka.contract.OrderRecord;
import com.orderpipeline.infra.kafka.errors.TransientProcessingException;
import java.util.Objects;

public class SimulatedOrderProcessor implements OrderProcessor {
  private final FailurePredicate failurePredicate;

  public SimulatedOrderProcessor(FailurePredicate failurePredicate) {
    this.failurePredicate =
        Objects.requireNonNull(failurePredicate, "failurePredicate must not be null");
  }

  @Override
  public void process(OrderRecord order) {
    if (failurePredicate.shouldFail(order)) {
      throw new TransientProcessingException(
          "Temporary processing failure for order " + order.orderId());
    }
  }
}
