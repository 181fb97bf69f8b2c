package com.dronetrack.tracker.ingest;

import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.dispatch.DispatchScheduler;
import com.dronetrack.tracker.dispatch.TimeBoundedCallDispatcher;
import com.dronetrack.tracker.sink.SinkRouter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Control loop of the tracker.
 *
 * <p>A single daemon thread:
 * <ul>
 *   <li>pops Remote-ID JSON payloads from the Redis input list</li>
 *   <li>applies them to the drone registry</li>
 *   <li>forwards a pending sensor status report, if any, without waiting for one</li>
 *   <li>runs a dispatch tick after every pop, including empty ones</li>
 * </ul>
 *
 * <p>The registry and scheduler are only touched from this thread.
 */
@Component
@ConditionalOnProperty(prefix = "dronetrack.ingest", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisTelemetryLoop {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedisTelemetryLoop.class);

  private final StringRedisTemplate redisTemplate;
  private final TrackerProperties properties;
  private final TelemetryIngestService ingestService;
  private final StatusIngestService statusService;
  private final DispatchScheduler scheduler;
  private final TimeBoundedCallDispatcher dispatcher;
  private final SinkRouter sinkRouter;
  private final Clock clock;
  private final ExecutorService executor;
  private final Counter errorCounter;
  private final AtomicLong lastTickEpoch;

  public RedisTelemetryLoop(
      StringRedisTemplate redisTemplate,
      TrackerProperties properties,
      TelemetryIngestService ingestService,
      StatusIngestService statusService,
      DispatchScheduler scheduler,
      TimeBoundedCallDispatcher dispatcher,
      SinkRouter sinkRouter,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
    this.ingestService = ingestService;
    this.statusService = statusService;
    this.scheduler = scheduler;
    this.dispatcher = dispatcher;
    this.sinkRouter = sinkRouter;
    this.clock = clock;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "tracker-loop");
      thread.setDaemon(true);
      return thread;
    });
    this.errorCounter = meterRegistry.counter("tracker.loop.errors");
    this.lastTickEpoch = meterRegistry.gauge("tracker.loop.last_tick_epoch", new AtomicLong(0));
  }

  /** Starts the control loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    LOGGER.info(
        "Tracker loop consuming {} (status: {})",
        properties.getRedis().getInputKey(),
        properties.getRedis().getStatusKey());
    executor.submit(this::runLoop);
  }

  /** Stops the loop, drains pending outbound calls and closes the sinks. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
    dispatcher.close();
    sinkRouter.closeAll();
    LOGGER.info("Tracker loop stopped");
  }

  private void runLoop() {
    Duration timeout = Duration.ofMillis(properties.getIngest().getPollTimeoutMs());
    String statusKey = properties.getRedis().getStatusKey();
    boolean statusEnabled = statusKey != null && !statusKey.isBlank();
    while (!Thread.currentThread().isInterrupted()) {
      try {
        String payload = redisTemplate.opsForList().rightPop(properties.getRedis().getInputKey(), timeout);
        if (payload != null) {
          ingestService.ingestPayload(payload);
        }
        if (statusEnabled) {
          String status = redisTemplate.opsForList().rightPop(statusKey);
          if (status != null) {
            statusService.ingestPayload(status);
          }
        }
        scheduler.tick(clock.instant());
        lastTickEpoch.set(clock.instant().getEpochSecond());
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          LOGGER.debug("Tracker loop interrupted during shutdown");
          return;
        }
        errorCounter.increment();
        LOGGER.warn("Tracker loop error", ex);
      }
    }
  }

  static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
