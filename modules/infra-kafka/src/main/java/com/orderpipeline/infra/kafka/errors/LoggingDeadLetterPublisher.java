package com.orderpipeline.infra.kafka.errors;

import com.orderpipeline.infra.kafka.contract.DeadLetterEnvelope;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeadLetterPublisher implements DeadLetterPublisher {
  private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterPublisher.class);

  @Override
  public CompletableFuture<Void> publish(DeadLetterEnvelope envelope) {
    log.warn(
        "Dead-lettering order order_id={} source_topic={} retry_attempts={} error_type={} error={}",
        envelope.key(),
        envelope.sourceTopic(),
        envelope.retryAttempts(),
        envelope.errorType(),
        envelope.errorMessage());
    return CompletableFuture.completedFuture(null);
  }
}
