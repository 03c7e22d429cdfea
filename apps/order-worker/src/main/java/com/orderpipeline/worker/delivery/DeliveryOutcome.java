package com.orderpipeline.worker.delivery;

import com.orderpipeline.domain.orders.Delivery;
import com.orderpipeline.domain.orders.DeliveryState;
import java.time.Duration;

public record DeliveryOutcome(String orderId, DeliveryState state, int attempt, Duration backoff) {
  public static DeliveryOutcome of(Delivery delivery, Duration backoff) {
    return new DeliveryOutcome(
        delivery.orderId(), delivery.state(), delivery.attempts(), backoff);
  }

  public static DeliveryOutcome dropped(String key) {
    return new DeliveryOutcome(key, DeliveryState.UNSEEN, 0, Duration.ZERO);
  }

  public boolean dropped() {
    return state == DeliveryState.UNSEEN;
  }
}
