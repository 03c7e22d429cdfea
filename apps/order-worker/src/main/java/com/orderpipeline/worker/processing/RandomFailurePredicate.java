package com.orderpipeline.worker.processing;

import com.orderpipeline.infra.kafka.contract.OrderRecord;
import java.util.Objects;
import java.util.Random;

public class RandomFailurePredicate implements FailurePredicate {
  private final double failureProbability;
  private final Random random;

  public RandomFailurePredicate(double failureProbability, Random random) {
    if (Double.isNaN(failureProbability) || failureProbability < 0.0d || failureProbability > 1.0d) {
      throw new IllegalArgumentException("failureProbability must be between 0 and 1");
    }
    this.failureProbability = failureProbability;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  @Override
  public boolean shouldFail(OrderRecord order) {
    return random.nextDouble() < failureProbability;
  }
}
