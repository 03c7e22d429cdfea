package com.orderpipeline.domain.orders;

import java.util.concurrent.locks.ReentrantLock;

public class OrderAggregation {
  private final ReentrantLock lock = new ReentrantLock();
  private long orderCount;
  private double totalPrice;

  public AggregationSnapshot record(double price) {
    if (Double.isNaN(price) || Double.isInfinite(price) || price < 0.0d) {
      throw new IllegalArgumentException("price must be a finite non-negative number");
    }
    lock.lock();
    try {
      orderCount++;
      totalPrice += price;
      return new AggregationSnapshot(orderCount, totalPrice);
    } finally {
      lock.unlock();
    }
  }

  public AggregationSnapshot snapshot() {
    lock.lock();
    try {
      return new AggregationSnapshot(orderCount, totalPrice);
    } finally {
      lock.unlock();
    }
  }
}
