package com.orderpipeline.infra.kafka.config;

import com.orderpipeline.infra.kafka.errors.ExceptionFilteringRetryPolicy;
import com.orderpipeline.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.orderpipeline.infra.kafka.errors.FixedBackoffRetryPolicy;
import com.orderpipeline.infra.kafka.errors.RetryPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class RetryPolicyFactory {
  enum RetryMode {
    EXPONENTIAL,
    FIXED;

    static RetryMode parse(String value) {
      if (value == null || value.isBlank()) {
        return EXPONENTIAL;
      }
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Unsupported infra.kafka.retry.mode: " + value, ex);
      }
    }
  }

  private RetryPolicyFactory() {}

  public static RetryPolicy create(InfraKafkaProperties.Retry retry) {
    InfraKafkaProperties.Retry settings =
        Objects.requireNonNullElseGet(retry, InfraKafkaProperties.Retry::new);
    RetryPolicy backoff = backoffPolicy(settings);

    List<Class<? extends Throwable>> allowList = retryableTypes(settings.getRetryableExceptions());
    return allowList.isEmpty() ? backoff : new ExceptionFilteringRetryPolicy(backoff, allowList);
  }

  private static RetryPolicy backoffPolicy(InfraKafkaProperties.Retry settings) {
    int maxRetries = settings.getMaxRetries();
    switch (RetryMode.parse(settings.getMode())) {
      case FIXED:
        return new FixedBackoffRetryPolicy(maxRetries, millis(settings.getFixedBackoffMs()));
      case EXPONENTIAL:
      default:
        return new ExponentialBackoffRetryPolicy(
            maxRetries,
            millis(settings.getInitialBackoffMs()),
            millis(settings.getMaxBackoffMs()),
            settings.getMultiplier());
    }
  }

  private static Duration millis(long value) {
    return Duration.ofMillis(Math.max(0L, value));
  }

  private static List<Class<? extends Throwable>> retryableTypes(List<String> classNames) {
    if (classNames == null) {
      return List.of();
    }
    return classNames.stream()
        .filter(name -> name != null && !name.isBlank())
        .map(String::trim)
        .<Class<? extends Throwable>>map(RetryPolicyFactory::throwableType)
        .toList();
  }

  private static Class<? extends Throwable> throwableType(String className) {
    Class<?> type;
    try {
      type = Class.forName(className, false, RetryPolicyFactory.class.getClassLoader());
    } catch (ClassNotFoundException ex) {
      throw new IllegalArgumentException("Retryable exception type not found: " + className, ex);
    }
    if (!Throwable.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException(
          "Retryable exception type is not a Throwable: " + className);
    }
    return type.asSubclass(Throwable.class);
  }
}
