package com.orderpipeline.domain.orders;

public interface RetryLedger {
  int attempts(String orderId);

  void record(String orderId, int attempts);

  void clear(String orderId);

  FailureRegistration registerFailure(String orderId, int maxRetries);
}
