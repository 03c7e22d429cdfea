package com.orderpipeline.domain.orders;

public record FailureRegistration(int previousAttempts, int attempts, boolean exhausted) {
  public static FailureRegistration retry(int previousAttempts) {
    return new FailureRegistration(previousAttempts, previousAttempts + 1, false);
  }

  public static FailureRegistration exhausted(int previousAttempts) {
    return new FailureRegistration(previousAttempts, previousAttempts, true);
  }
}
