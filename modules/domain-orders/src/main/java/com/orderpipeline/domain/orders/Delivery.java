package com.orderpipeline.domain.orders;

import java.util.Objects;

public record Delivery(String orderId, DeliveryState state, int attempts) {
  public Delivery {
    if (orderId == null || orderId.isBlank()) {
      throw new DeliveryStateException("orderId must not be blank");
    }
    Objects.requireNonNull(state, "state must not be null");
    if (attempts < 0) {
      throw new DeliveryStateException("attempts must be >= 0");
    }
  }

  public static Delivery received(String orderId, int attempts) {
    return new Delivery(
        orderId, attempts > 0 ? DeliveryState.RETRY_SCHEDULED : DeliveryState.UNSEEN, attempts);
  }

  public Delivery transitionTo(DeliveryState toState) {
    return transitionTo(toState, attempts);
  }

  public Delivery transitionTo(DeliveryState toState, int nextAttempts) {
    DeliveryStateMachine.validateTransition(state, toState);
    return new Delivery(orderId, toState, nextAttempts);
  }
}
