package com.orderpipeline.domain.orders;

import java.util.Locale;

public record AggregationSnapshot(long orderCount, double totalPrice) {
  public static final AggregationSnapshot EMPTY = new AggregationSnapshot(0L, 0.0d);

  public double runningAverage() {
    return orderCount == 0L ? 0.0d : totalPrice / orderCount;
  }

  public String displayAverage() {
    return String.format(Locale.ROOT, "%.2f", runningAverage());
  }
}
