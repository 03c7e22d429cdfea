package com.orderpipeline.infra.kafka.serde;

public class SchemaViolationException extends RuntimeException {
  private final String field;

  public SchemaViolationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
