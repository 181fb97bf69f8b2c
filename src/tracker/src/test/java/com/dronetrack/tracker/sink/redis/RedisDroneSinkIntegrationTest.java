package com.dronetrack.tracker.sink.redis;

import static com.dronetrack.tracker.support.Observations.serial;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.status.SystemStatus;
import com.dronetrack.tracker.support.Snapshots;
import com.dronetrack.tracker.telemetry.Observation;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
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
class RedisDroneSinkIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private StringRedisTemplate redisTemplate;
  private TrackerProperties properties;

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
    properties = new TrackerProperties();
  }

  @Test
  void publishDrone_writesSnakeCaseStateIntoConfiguredHash() throws Exception {
    RedisDroneSink sink = new RedisDroneSink(redisTemplate, objectMapper, properties);
    Observation observation = serial("drone-1", "aa:bb", 48.8566, 2.3522);
    observation.setUaType(2);
    observation.setUaTypeName("Helicopter or Multirotor");

    sink.publishDrone(Snapshots.of(observation));

    Map<String, Object> state = readState("drone-1");
    assertEquals("drone-1", state.get("id"));
    assertEquals(48.8566, ((Number) state.get("lat")).doubleValue());
    assertEquals("aa:bb", state.get("mac"));
    assertEquals(2, ((Number) state.get("ua_type")).intValue());
    assertEquals("Helicopter or Multirotor", state.get("ua_type_name"));
    assertEquals("unknown", state.get("affiliation"));
  }

  @Test
  void publishPilotAndHome_mergeIntoDroneState() throws Exception {
    RedisDroneSink sink = new RedisDroneSink(redisTemplate, objectMapper, properties);
    sink.publishDrone(Snapshots.of(serial("drone-1", 48.0, 2.0)));

    sink.publishPilot("drone-1", 47.9, 1.9, 0.0);
    sink.publishHome("drone-1", 47.8, 1.8, 0.0);

    Map<String, Object> state = readState("drone-1");
    assertEquals(48.0, ((Number) state.get("lat")).doubleValue());
    assertEquals(47.9, ((Number) state.get("pilot_lat")).doubleValue());
    assertEquals(1.8, ((Number) state.get("home_lon")).doubleValue());
    assertEquals(0.0, ((Number) state.get("home_alt")).doubleValue());
  }

  @Test
  void markInactive_removesDroneState() throws Exception {
    RedisDroneSink sink = new RedisDroneSink(redisTemplate, objectMapper, properties);
    sink.publishDrone(Snapshots.of(serial("drone-1", 48.0, 2.0)));
    sink.publishDrone(Snapshots.of(serial("drone-2", 49.0, 3.0)));

    sink.markInactive("drone-1");

    String stateKey = properties.getSinks().getRedis().getStateKey();
    assertFalse(redisTemplate.opsForHash().hasKey(stateKey, "drone-1"));
    assertTrue(redisTemplate.opsForHash().hasKey(stateKey, "drone-2"));

    sink.publishPilot("drone-1", 47.9, 1.9, 0.0);
    Map<String, Object> restarted = readState("drone-1");
    assertFalse(restarted.containsKey("lat"));
  }

  @Test
  void publishSystem_keepsSensorStateApartFromDrones() throws Exception {
    RedisDroneSink sink = new RedisDroneSink(redisTemplate, objectMapper, properties);
    sink.publishSystem(new SystemStatus(
        "WD-1", 48.1, 2.1, 35.0, 0.0, 0.0, 12.5, 3896.0, 2048.0, 29000.0, 12000.0, 51.3, 3600.0,
        "44.2", "N/A"));

    Object payload = redisTemplate.opsForHash()
        .get(properties.getSinks().getRedis().getSystemStateKey(), "WD-1");
    assertNotNull(payload, "sensor state must be written");
    Map<String, Object> state = objectMapper.readValue(payload.toString(), new TypeReference<>() {});
    assertEquals("WD-1", state.get("serial_number"));
    assertEquals(12.5, ((Number) state.get("cpu_usage")).doubleValue());
    assertEquals("N/A", state.get("zynq_temp"));
    assertFalse(redisTemplate.opsForHash().hasKey(properties.getSinks().getRedis().getStateKey(), "WD-1"));
  }

  private Map<String, Object> readState(String droneId) throws Exception {
    Object payload = redisTemplate.opsForHash()
        .get(properties.getSinks().getRedis().getStateKey(), droneId);
    assertNotNull(payload, "state for " + droneId + " must be written");
    return objectMapper.readValue(payload.toString(), new TypeReference<>() {});
  }
}
