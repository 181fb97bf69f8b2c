package com.dronetrack.tracker.dispatch;

/**
 * Result of one guarded outbound call.
 *
 * @param target low-cardinality name of the destination (for example {@code cot} or a sink name)
 * @param success whether the call completed without throwing
 * @param error the failure cause, or {@code null} on success
 */
public record DeliveryOutcome(String target, boolean success, Throwable error) {

  public static DeliveryOutcome succeeded(String target) {
    return new DeliveryOutcome(target, true, null);
  }

  public static DeliveryOutcome failed(String target, Throwable error) {
    return new DeliveryOutcome(target, false, error);
  }

  /** Runs {@code call}, converting any runtime failure into a failed outcome. */
  public static DeliveryOutcome attempt(String target, Runnable call) {
    try {
      call.run();
      return succeeded(target);
    } catch (RuntimeException ex) {
      return failed(target, ex);
    }
  }
}
