package com.orderpipeline.infra.kafka.errors;

import com.orderpipeline.infra.kafka.contract.DeadLetterEnvelope;
import java.util.concurrent.CompletableFuture;

public interface DeadLetterPublisher {
  CompletableFuture<Void> publish(DeadLetterEnvelope envelope);
}
