package com.orderpipeline.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.orderpipeline.infra.kafka.errors.ExceptionFilteringRetryPolicy;
import com.orderpipeline.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.orderpipeline.infra.kafka.errors.RetryPolicy;
import com.orderpipeline.infra.kafka.errors.TransientProcessingException;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetryPolicyFactoryTest {
  @Test
  void shouldDefaultToThreeExponentialRetriesOfTransientFailures() {
    RetryPolicy policy = RetryPolicyFactory.create(new InfraKafkaProperties.Retry());

    assertTrue(policy instanceof ExceptionFilteringRetryPolicy);
    assertEquals(3, policy.maxRetries());
    assertEquals(1000L, policy.backoffForRetry(1).toMillis());
    assertEquals(2000L, policy.backoffForRetry(2).toMillis());
    assertEquals(4000L, policy.backoffForRetry(3).toMillis());
    assertTrue(policy.isRetryable(new TransientProcessingException("flaky")));
    assertFalse(policy.isRetryable(new IllegalStateException("bug")));
  }

  @Test
  void shouldFallBackToDefaultSettingsWhenRetryIsUnset() {
    RetryPolicy policy = RetryPolicyFactory.create(null);

    assertEquals(3, policy.maxRetries());
    assertEquals(4000L, policy.backoffForRetry(3).toMillis());
    assertFalse(policy.isRetryable(new IllegalStateException("bug")));
  }

  @Test
  void shouldTreatBlankModeAsExponential() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setMode(" ");
    retry.setRetryableExceptions(List.of());

    assertTrue(RetryPolicyFactory.create(retry) instanceof ExponentialBackoffRetryPolicy);
  }

  @Test
  void shouldCreateFixedRetryPolicy() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setMode("fixed");
    retry.setMaxRetries(5);
    retry.setFixedBackoffMs(200);
    retry.setRetryableExceptions(List.of());

    RetryPolicy policy = RetryPolicyFactory.create(retry);
    assertEquals(5, policy.maxRetries());
    assertEquals(200L, policy.backoffForRetry(1).toMillis());
    assertEquals(200L, policy.backoffForRetry(4).toMillis());
    assertTrue(policy.isRetryable(new IllegalStateException("anything")));
  }

  @Test
  void shouldCreateExponentialRetryPolicyWithoutAllowList() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setMode("EXPONENTIAL");
    retry.setInitialBackoffMs(100);
    retry.setMaxBackoffMs(1000);
    retry.setMultiplier(2.0d);
    retry.setRetryableExceptions(List.of());

    RetryPolicy policy = RetryPolicyFactory.create(retry);
    assertTrue(policy instanceof ExponentialBackoffRetryPolicy);
    assertEquals(100L, policy.backoffForRetry(1).toMillis());
    assertEquals(200L, policy.backoffForRetry(2).toMillis());
  }

  @Test
  void shouldFailOnUnknownRetryableExceptionType() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setRetryableExceptions(List.of("com.example.DoesNotExist"));

    assertThrows(IllegalArgumentException.class, () -> RetryPolicyFactory.create(retry));
  }

  @Test
  void shouldFailOnNonThrowableRetryableType() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setRetryableExceptions(List.of(String.class.getName()));

    assertThrows(IllegalArgumentException.class, () -> RetryPolicyFactory.create(retry));
  }

  @Test
  void shouldFailOnUnsupportedRetryMode() {
    InfraKafkaProperties.Retry retry = new InfraKafkaProperties.Retry();
    retry.setMode("unknown");

    assertThrows(IllegalArgumentException.class, () -> RetryPolicyFactory.create(retry));
  }
}
