package com.orderpipeline.worker.processing;

import com.orderpipeline.infra.kafka.contract.OrderRecord;

@FunctionalInterface
public interface FailurePredicate {
  boolean shouldFail(OrderRecord order);

  static FailurePredicate never() {
    return order -> false;
  }

  static FailurePredicate always() {
    return order -> true;
  }
}
