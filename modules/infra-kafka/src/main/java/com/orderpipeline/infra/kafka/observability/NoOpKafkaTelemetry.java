package com.orderpipeline.infra.kafka.observability;

import java.time.Duration;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
  @Override
  public void onPublishSuccess(String topic, String key, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String key, Throwable error) {}

  @Override
  public void onConsumeSuccess(
      String topic, String key, int partition, long offset, long durationNanos) {}

  @Override
  public void onConsumeFailure(String topic, String key, Throwable error) {}

  @Override
  public void onDecodeFailure(String topic, Throwable error) {}

  @Override
  public void onRetryScheduled(String topic, String key, int retryAttempt, Duration backoff) {}

  @Override
  public void onDeadLetter(String sourceTopic, String key, String errorType) {}
}
