package com.orderpipeline.infra.kafka.serde;

public class OrderDecodeException extends RuntimeException {
  public OrderDecodeException(String message) {
    super(message);
  }

  public OrderDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
