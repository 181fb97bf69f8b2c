package com.dronetrack.tracker.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TimeBoundedCallDispatcherTest {
  private final TimeBoundedCallDispatcher dispatcher =
      new TimeBoundedCallDispatcher(2, Duration.ofMillis(200), Duration.ofSeconds(1));

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  @Test
  void submit_reportsSuccess() throws Exception {
    CountDownLatch ran = new CountDownLatch(1);

    DeliveryOutcome outcome = dispatcher.submit("cot", ran::countDown).get(2, TimeUnit.SECONDS);

    assertTrue(outcome.success());
    assertEquals("cot", outcome.target());
    assertNull(outcome.error());
    assertEquals(0, ran.getCount());
  }

  @Test
  void submit_capturesFailure() throws Exception {
    DeliveryOutcome outcome = dispatcher.submit("sinks", () -> {
      throw new IllegalStateException("sink offline");
    }).get(2, TimeUnit.SECONDS);

    assertFalse(outcome.success());
    assertEquals("sink offline", outcome.error().getMessage());
  }

  @Test
  void submit_interruptsCallsThatExceedTheBudget() throws Exception {
    CountDownLatch interrupted = new CountDownLatch(1);

    DeliveryOutcome outcome = dispatcher.submit("cot", () -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException ex) {
        interrupted.countDown();
        Thread.currentThread().interrupt();
      }
    }).get(2, TimeUnit.SECONDS);

    assertFalse(outcome.success());
    assertInstanceOf(TimeoutException.class, outcome.error());
    assertTrue(interrupted.await(2, TimeUnit.SECONDS));
  }

  @Test
  void submit_slowCallDoesNotDelayOthers() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    dispatcher.submit("slow", () -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });

    DeliveryOutcome fast = dispatcher.submit("fast", () -> { }).get(1, TimeUnit.SECONDS);

    assertTrue(fast.success());
    release.countDown();
  }

  @Test
  void submit_afterCloseIsRejected() throws Exception {
    dispatcher.close();

    DeliveryOutcome outcome = dispatcher.submit("cot", () -> { }).get(1, TimeUnit.SECONDS);

    assertFalse(outcome.success());
    assertInstanceOf(RejectedExecutionException.class, outcome.error());
  }

  @Test
  void serialLane_runsCallsInSubmissionOrder() throws Exception {
    List<Integer> order = new CopyOnWriteArrayList<>();
    TimeBoundedCallDispatcher lane =
        TimeBoundedCallDispatcher.serialLane("lane", Duration.ofSeconds(1), Duration.ofSeconds(1));
    try {
      CompletableFuture<DeliveryOutcome> last = null;
      for (int i = 0; i < 20; i++) {
        int call = i;
        last = lane.submit("lane", () -> order.add(call));
      }
      last.get(2, TimeUnit.SECONDS);

      assertEquals(IntStream.range(0, 20).boxed().toList(), order);
    } finally {
      lane.close();
    }
  }

  @Test
  void serialLane_budgetStartsWhenTheCallRuns() throws Exception {
    TimeBoundedCallDispatcher lane =
        TimeBoundedCallDispatcher.serialLane("lane", Duration.ofMillis(300), Duration.ofSeconds(1));
    try {
      CompletableFuture<DeliveryOutcome> first = lane.submit("lane", () -> pause(200));
      CompletableFuture<DeliveryOutcome> second = lane.submit("lane", () -> pause(200));

      assertTrue(first.get(2, TimeUnit.SECONDS).success());
      assertTrue(second.get(2, TimeUnit.SECONDS).success());
    } finally {
      lane.close();
    }
  }

  @Test
  void close_failsCallsThatNeverStarted() throws Exception {
    TimeBoundedCallDispatcher lane =
        TimeBoundedCallDispatcher.serialLane("lane", Duration.ofSeconds(5), Duration.ofMillis(100));
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    lane.submit("lane", () -> {
      started.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    CompletableFuture<DeliveryOutcome> queued = lane.submit("lane", () -> { });
    assertTrue(started.await(1, TimeUnit.SECONDS));

    lane.close();

    DeliveryOutcome outcome = queued.get(1, TimeUnit.SECONDS);
    assertFalse(outcome.success());
    assertInstanceOf(RejectedExecutionException.class, outcome.error());
  }

  @Test
  void inline_runsOnCallerThread() throws Exception {
    Thread caller = Thread.currentThread();
    Thread[] ranOn = new Thread[1];

    DeliveryOutcome outcome = CallDispatcher.inline()
        .submit("cot", () -> ranOn[0] = Thread.currentThread())
        .get();

    assertTrue(outcome.success());
    assertEquals(caller, ranOn[0]);
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted", ex);
    }
  }
}
