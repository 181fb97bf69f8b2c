package com.dronetrack.tracker.dispatch;

import java.util.concurrent.CompletableFuture;

/** Executes outbound calls away from the ingest loop thread. */
@FunctionalInterface
public interface CallDispatcher extends AutoCloseable {

  /**
   * Schedules one independent outbound call.
   *
   * @param target destination label used for logging and metrics
   * @param call the call; runtime exceptions are captured in the outcome
   * @return a future completed with the outcome, never exceptionally
   */
  CompletableFuture<DeliveryOutcome> submit(String target, Runnable call);

  /** Releases worker threads. Inline dispatchers hold none. */
  @Override
  default void close() {
  }

  /** Runs every call on the caller thread. */
  static CallDispatcher inline() {
    return (target, call) -> CompletableFuture.completedFuture(DeliveryOutcome.attempt(target, call));
  }
}
