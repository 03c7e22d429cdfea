package com.orderpipeline.infra.kafka.observability;

import java.time.Duration;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, String key, long durationNanos);

  void onPublishFailure(String topic, String key, Throwable error);

  void onConsumeSuccess(String topic, String key, int partition, long offset, long durationNanos);

  void onConsumeFailure(String topic, String key, Throwable error);

  void onDecodeFailure(String topic, Throwable error);

  void onRetryScheduled(String topic, String key, int retryAttempt, Duration backoff);

  void onDeadLetter(String sourceTopic, String key, String errorType);
}
