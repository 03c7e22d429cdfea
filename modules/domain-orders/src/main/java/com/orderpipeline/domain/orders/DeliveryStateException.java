package com.orderpipeline.domain.orders;

public class DeliveryStateException extends RuntimeException {
  public DeliveryStateException(String message) {
    super(message);
  }
}
