package com.orderpipeline.domain.orders;

import java.util.EnumSet;
import java.util.Map;

public final class DeliveryStateMachine {
  private static final Map<DeliveryState, EnumSet<DeliveryState>> ALLOWED_TRANSITIONS =
      Map.of(
          DeliveryState.UNSEEN, EnumSet.of(DeliveryState.PROCESSING),
          DeliveryState.PROCESSING,
              EnumSet.of(
                  DeliveryState.SUCCEEDED,
                  DeliveryState.RETRY_SCHEDULED,
                  DeliveryState.DEAD_LETTERED),
          DeliveryState.RETRY_SCHEDULED, EnumSet.of(DeliveryState.PROCESSING),
          DeliveryState.SUCCEEDED, EnumSet.noneOf(DeliveryState.class),
          DeliveryState.DEAD_LETTERED, EnumSet.noneOf(DeliveryState.class));

  private DeliveryStateMachine() {}

  public static boolean canTransition(DeliveryState from, DeliveryState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<DeliveryState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(DeliveryState from, DeliveryState to) {
    if (!canTransition(from, to)) {
      throw new DeliveryStateException(
          "Invalid delivery state transition from " + from + " to " + to);
    }
  }
}
