package com.orderpipeline.infra.kafka.contract;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record DeadLetterEnvelope(
    OrderRecord order,
    byte[] payload,
    Map<String, String> originalHeaders,
    String sourceTopic,
    String errorMessage,
    String errorType,
    int retryAttempts,
    Instant deadLetteredAt) {
  public DeadLetterEnvelope {
    Objects.requireNonNull(order, "order must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    originalHeaders = originalHeaders == null ? Map.of() : Map.copyOf(originalHeaders);
    requireNonBlank(sourceTopic, "sourceTopic");
    errorMessage = errorMessage == null || errorMessage.isBlank() ? "no-message" : errorMessage;
    requireNonBlank(errorType, "errorType");
    if (retryAttempts < 0) {
      throw new IllegalArgumentException("retryAttempts must be >= 0");
    }
    Objects.requireNonNull(deadLetteredAt, "deadLetteredAt must not be null");
  }

  public String key() {
    return order.orderId();
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
