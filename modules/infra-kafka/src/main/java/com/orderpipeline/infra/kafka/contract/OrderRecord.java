package com.orderpipeline.infra.kafka.contract;

import java.util.Locale;

public record OrderRecord(String orderId, String product, double price) {
  public String displayPrice() {
    return String.format(Locale.ROOT, "%.2f", price);
  }
}
