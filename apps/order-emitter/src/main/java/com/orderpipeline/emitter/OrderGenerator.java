package com.orderpipeline.emitter;

import com.orderpipeline.infra.kafka.contract.OrderRecord;
import java.util.Objects;
import java.util.Random;

public class OrderGenerator {
  static final int PRODUCT_COUNT = 5;
  static final int MIN_PRICE_CENTS = 1_000;
  static final int PRICE_RANGE_CENTS = 10_000;

  private final Random random;

  public OrderGenerator(Random random) {
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  public synchronized OrderRecord generate(long sequence) {
    String product = "Item" + (random.nextInt(PRODUCT_COUNT) + 1);
    int cents = MIN_PRICE_CENTS + random.nextInt(PRICE_RANGE_CENTS);
    double price = cents / 100.0d;
    return new OrderRecord(Long.toString(sequence), product, price);
  }
}
