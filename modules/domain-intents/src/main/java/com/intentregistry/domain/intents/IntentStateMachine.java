package com.intentregistry.domain.intents;

import java.util.EnumSet;
import java.util.Map;

public final class IntentStateMachine {
  private static final Map<IntentStatus, EnumSet<IntentStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          IntentStatus.PENDING, EnumSet.of(IntentStatus.EXECUTED, IntentStatus.CANCELLED),
          IntentStatus.EXECUTED, EnumSet.noneOf(IntentStatus.class),
          IntentStatus.CANCELLED, EnumSet.noneOf(IntentStatus.class));

  private IntentStateMachine() {}

  public static boolean canTransition(IntentStatus from, IntentStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<IntentStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  /**
   * Rejects any transition out of a terminal state with the error naming that state, so a
   * caller trying to cancel an executed intent sees {@code ALREADY_EXECUTED}.
   */
  public static void validateTransition(long intentId, IntentStatus from, IntentStatus to) {
    if (canTransition(from, to)) {
      return;
    }
    if (from == IntentStatus.EXECUTED) {
      throw new RegistryStateException(
          RegistryErrorCode.ALREADY_EXECUTED, "Intent " + intentId + " is already executed");
    }
    if (from == IntentStatus.CANCELLED) {
      throw new RegistryStateException(
          RegistryErrorCode.ALREADY_CANCELLED, "Intent " + intentId + " is already cancelled");
    }
    throw new IllegalArgumentException(
        "Invalid intent status transition from " + from + " to " + to);
  }
}
