package com.orderpipeline.worker.processing;

import com.orderpipeline.infra.kafka.contract.OrderRecord;

public interface OrderProcessor {
  void process(OrderRecord order);
}
