package com.dronetrack.tracker.sink.redis;

import com.dronetrack.tracker.config.TrackerProperties;
import com.dronetrack.tracker.registry.DroneSnapshot;
import com.dronetrack.tracker.sink.DroneSink;
import com.dronetrack.tracker.sink.SinkCapability;
import com.dronetrack.tracker.status.SystemStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Publishes drone state to Redis.
 *
 * <p>The latest JSON state of each drone is kept in a hash (field = drone id) and every change is
 * also published on a pub/sub channel. Pilot and home positions are merged into the drone state
 * so consumers read one document per drone. Sensor status reports are kept in a second hash keyed by
 * serial number and published on the same channel.
 */
public class RedisDroneSink implements DroneSink {
  private static final Logger log = LoggerFactory.getLogger(RedisDroneSink.class);
  private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String stateKey;
  private final String channel;
  private final String systemStateKey;
  private final ConcurrentHashMap<String, Map<String, Object>> stateCache = new ConcurrentHashMap<>();

  public RedisDroneSink(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      TrackerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.stateKey = properties.getSinks().getRedis().getStateKey();
    this.channel = properties.getSinks().getRedis().getChannel();
    this.systemStateKey = properties.getSinks().getRedis().getSystemStateKey();
  }

  @Override
  public String name() {
    return "redis";
  }

  @Override
  public Set<SinkCapability> capabilities() {
    return EnumSet.allOf(SinkCapability.class);
  }

  @Override
  public void publishDrone(DroneSnapshot drone) {
    Map<String, Object> fields = objectMapper.convertValue(drone, STATE_TYPE);
    write(drone.id(), merge(drone.id(), fields));
  }

  @Override
  public void publishPilot(String droneId, double lat, double lon, double alt) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("pilot_lat", lat);
    fields.put("pilot_lon", lon);
    fields.put("pilot_alt", alt);
    write(droneId, merge(droneId, fields));
  }

  @Override
  public void publishHome(String droneId, double lat, double lon, double alt) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("home_lat", lat);
    fields.put("home_lon", lon);
    fields.put("home_alt", alt);
    write(droneId, merge(droneId, fields));
  }

  @Override
  public void publishSystem(SystemStatus status) {
    String payload = serialize(status.serialNumber(), objectMapper.convertValue(status, STATE_TYPE));
    redisTemplate.opsForHash().put(systemStateKey, status.serialNumber(), payload);
    redisTemplate.convertAndSend(channel, payload);
  }

  @Override
  public void markInactive(String droneId) {
    stateCache.remove(droneId);
    redisTemplate.opsForHash().delete(stateKey, droneId);
    Map<String, Object> event = new LinkedHashMap<>();
    event.put("id", droneId);
    event.put("status", "inactive");
    redisTemplate.convertAndSend(channel, serialize(droneId, event));
    log.debug("Removed drone {} from {}", droneId, stateKey);
  }

  @Override
  public void close() {
    stateCache.clear();
  }

  private Map<String, Object> merge(String droneId, Map<String, Object> fields) {
    return stateCache.compute(droneId, (id, previous) -> {
      Map<String, Object> next = previous == null ? new LinkedHashMap<>() : new LinkedHashMap<>(previous);
      next.putAll(fields);
      next.put("id", id);
      return next;
    });
  }

  private void write(String droneId, Map<String, Object> state) {
    String payload = serialize(droneId, state);
    redisTemplate.opsForHash().put(stateKey, droneId, payload);
    redisTemplate.convertAndSend(channel, payload);
  }

  private String serialize(String key, Map<String, Object> state) {
    try {
      return objectMapper.writeValueAsString(state);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize state of " + key, ex);
    }
  }
}
