package com.dronetrack.tracker.dispatch;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CallDispatcher} backed by a fixed worker pool.
 *
 * <p>Each call gets a fixed time budget counted from the moment a worker starts it; a call still
 * running when it expires is interrupted and reported as failed with a {@link TimeoutException}.
 * With a single thread the dispatcher is a serial lane: calls start in submission order.
 */
public class TimeBoundedCallDispatcher implements CallDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(TimeBoundedCallDispatcher.class);

  private final String name;
  private final ExecutorService workers;
  private final ScheduledExecutorService canceller;
  private final Duration callTimeout;
  private final Duration shutdownGrace;

  public TimeBoundedCallDispatcher(int threads, Duration callTimeout, Duration shutdownGrace) {
    this("dispatch", threads, callTimeout, shutdownGrace);
  }

  public TimeBoundedCallDispatcher(String name, int threads, Duration callTimeout, Duration shutdownGrace) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be positive: " + threads);
    }
    this.name = name;
    this.workers = Executors.newFixedThreadPool(threads, daemonFactory(name + "-worker"));
    this.canceller = Executors.newSingleThreadScheduledExecutor(daemonFactory(name + "-timeout"));
    this.callTimeout = callTimeout;
    this.shutdownGrace = shutdownGrace;
  }

  /** Creates a single-threaded dispatcher whose calls run one at a time, in order. */
  public static TimeBoundedCallDispatcher serialLane(String name, Duration callTimeout, Duration shutdownGrace) {
    return new TimeBoundedCallDispatcher(name, 1, callTimeout, shutdownGrace);
  }

  @Override
  public CompletableFuture<DeliveryOutcome> submit(String target, Runnable call) {
    BoundedCall bounded = new BoundedCall(target, call);
    try {
      workers.execute(bounded);
    } catch (RejectedExecutionException ex) {
      bounded.result.complete(DeliveryOutcome.failed(target, ex));
    }
    return bounded.result;
  }

  /**
   * Stops accepting calls and waits up to the grace period for queued ones. Calls that never
   * started are completed as failed.
   */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Calls on {} still running after {} ms; interrupting", name, shutdownGrace.toMillis());
        abandon(workers.shutdownNow());
      }
    } catch (InterruptedException ex) {
      abandon(workers.shutdownNow());
      Thread.currentThread().interrupt();
    } finally {
      canceller.shutdownNow();
    }
  }

  private void abandon(List<Runnable> neverStarted) {
    for (Runnable runnable : neverStarted) {
      if (runnable instanceof BoundedCall bounded) {
        bounded.result.complete(DeliveryOutcome.failed(
            bounded.target, new RejectedExecutionException(name + " closed before the call started")));
      }
    }
  }

  private static ThreadFactory daemonFactory(String prefix) {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private final class BoundedCall implements Runnable {
    private final String target;
    private final Runnable call;
    private final CompletableFuture<DeliveryOutcome> result = new CompletableFuture<>();
    private Thread worker;

    private BoundedCall(String target, Runnable call) {
      this.target = target;
      this.call = call;
    }

    @Override
    public void run() {
      synchronized (this) {
        worker = Thread.currentThread();
      }
      ScheduledFuture<?> deadline = scheduleDeadline();
      try {
        result.complete(DeliveryOutcome.attempt(target, call));
      } finally {
        synchronized (this) {
          worker = null;
        }
        if (deadline != null) {
          deadline.cancel(false);
        }
        // An expiry racing with completion must not interrupt the next call on this worker.
        Thread.interrupted();
      }
    }

    private ScheduledFuture<?> scheduleDeadline() {
      try {
        return canceller.schedule(this::expire, callTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        LOGGER.debug("No timeout scheduled for call to {}", target, ex);
        return null;
      }
    }

    private void expire() {
      TimeoutException timeout =
          new TimeoutException("call to " + target + " exceeded " + callTimeout.toMillis() + " ms");
      if (result.complete(DeliveryOutcome.failed(target, timeout))) {
        synchronized (this) {
          if (worker != null) {
            worker.interrupt();
          }
        }
      }
    }
  }
}
