package com.dronetrack.tracker.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.cot.CotEncoder;
import com.dronetrack.tracker.dispatch.DispatchScheduler;
import com.dronetrack.tracker.dispatch.TimeBoundedCallDispatcher;
import com.dronetrack.tracker.registry.DroneEvictionListener;
import com.dronetrack.tracker.registry.DroneRegistry;
import com.dronetrack.tracker.sink.SinkRouter;
import com.dronetrack.tracker.sink.redis.RedisDroneSink;
import com.dronetrack.tracker.status.SystemStatusParser;
import com.dronetrack.tracker.telemetry.TelemetryNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RedisTelemetryLoopIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private StringRedisTemplate redisTemplate;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
  }

  @Test
  void loop_consumesInputListAndPublishesDroneState() {
    TrackerProperties properties = new TrackerProperties();
    properties.getIngest().setPollTimeoutMs(200);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.systemUTC();

    TimeBoundedCallDispatcher dispatcher =
        new TimeBoundedCallDispatcher(2, Duration.ofSeconds(2), Duration.ofSeconds(1));
    SinkRouter router = new SinkRouter(
        List.of(new RedisDroneSink(redisTemplate, objectMapper, properties)),
        name -> TimeBoundedCallDispatcher.serialLane("sink-" + name, Duration.ofSeconds(2), Duration.ofSeconds(1)),
        meterRegistry);
    DroneEvictionListener evictionListener = router::onEvict;
    DroneRegistry registry =
        new DroneRegistry(30, Duration.ofSeconds(60), clock, evictionListener, meterRegistry);
    DispatchScheduler scheduler = new DispatchScheduler(
        registry,
        new CotEncoder(new XmlMapper(), clock),
        Optional.empty(),
        router,
        evictionListener,
        dispatcher,
        Duration.ofSeconds(1),
        meterRegistry);
    TelemetryIngestService ingestService = new TelemetryIngestService(
        new TelemetryNormalizer(), registry, objectMapper, Optional.empty(), properties, meterRegistry);
    StatusIngestService statusService =
        new StatusIngestService(new SystemStatusParser(), scheduler, objectMapper, meterRegistry);
    RedisTelemetryLoop loop = new RedisTelemetryLoop(
        redisTemplate, properties, ingestService, statusService, scheduler, dispatcher, router, clock, meterRegistry);

    String inputKey = properties.getRedis().getInputKey();
    redisTemplate.opsForList().rightPush(inputKey, "{broken");
    redisTemplate.opsForList().rightPush(inputKey, """
        [
          {"MAC": "aa:bb:cc:dd:ee:ff", "RSSI": -55},
          {"Basic ID": {"id_type": "Serial Number (ANSI/CTA-2063-A)", "id": "SN-LOOP", "ua_type": 2}},
          {"Location/Vector Message": {"latitude": 48.1, "longitude": 2.1}}
        ]
        """);
    redisTemplate.opsForList().rightPush(properties.getRedis().getStatusKey(), """
        {"serial_number": "WD-7", "gps_data": {"latitude": 48.0, "longitude": 2.0}}
        """);

    loop.start();
    try {
      String stateKey = properties.getSinks().getRedis().getStateKey();
      String systemStateKey = properties.getSinks().getRedis().getSystemStateKey();
      waitUntil(() -> redisTemplate.opsForHash().hasKey(stateKey, "drone-SN-LOOP"), Duration.ofSeconds(10));
      waitUntil(() -> redisTemplate.opsForHash().hasKey(systemStateKey, "WD-7"), Duration.ofSeconds(10));

      assertEquals(1, registry.size());
      assertEquals(0L, redisTemplate.opsForList().size(properties.getRedis().getStatusKey()));
      assertEquals(
          1.0, meterRegistry.counter("tracker.messages.dropped", "reason", "invalid_json").count());
      assertTrue(meterRegistry.counter("tracker.dispatch.updates").count() >= 1.0);
    } finally {
      loop.stop();
    }
  }

  @Test
  void isInterruptedShutdown_followsCauseChain() {
    Exception wrapped = new IllegalStateException("redis", new RuntimeException(new InterruptedException()));

    assertTrue(RedisTelemetryLoop.isInterruptedShutdown(wrapped));
    assertTrue(!RedisTelemetryLoop.isInterruptedShutdown(new IllegalStateException("redis")));
  }

  private static void waitUntil(BooleanSupplier condition, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return;
      }
      LockSupport.parkNanos(Duration.ofMillis(50).toNanos());
    }
    fail("Condition not met within " + timeout);
  }
}
