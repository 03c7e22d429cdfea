package com.orderpipeline.domain.orders;

public enum DeliveryState {
  UNSEEN,
  PROCESSING,
  SUCCEEDED,
  RETRY_SCHEDULED,
  DEAD_LETTERED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == DEAD_LETTERED;
  }
}
