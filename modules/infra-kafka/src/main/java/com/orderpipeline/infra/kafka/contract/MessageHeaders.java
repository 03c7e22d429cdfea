package com.orderpipeline.infra.kafka.contract;

public final class MessageHeaders {
  public static final String CONTENT_TYPE = "content-type";
  public static final String APPLICATION_AVRO = "application/avro";
  public static final String TIMESTAMP = "timestamp";

  public static final String RETRY_ATTEMPT = "retry-attempt";
  public static final String RETRY_TIMESTAMP = "retry-timestamp";

  public static final String ERROR_MESSAGE = "error-message";
  public static final String ERROR_TYPE = "error-type";
  public static final String DLQ_TIMESTAMP = "dlq-timestamp";
  // Retries made before dead-lettering: the cap when exhausted, fewer for non-retryable failures.
  public static final String RETRY_ATTEMPTS = "retry-attempts";
  public static final String DLQ_SOURCE_TOPIC = "dlq-source-topic";

  private MessageHeaders() {}
}
