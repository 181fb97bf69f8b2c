package com.dronetrack.tracker.registry;

import com.dronetrack.tracker.telemetry.Observation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, insertion-ordered store of live drone state.
 *
 * <p>This component:
 * <ul>
 *   <li>creates a record on the first observation of an id and merges later ones into it</li>
 *   <li>evicts the oldest-inserted record when a new id arrives at capacity</li>
 *   <li>correlates id-less observations to an existing record by MAC address</li>
 *   <li>reports records whose last update is older than the inactivity timeout</li>
 * </ul>
 *
 * <p>Not thread-safe: all calls happen on the ingest loop thread.
 */
public class DroneRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(DroneRegistry.class);

  private final LinkedHashMap<String, DroneRecord> records = new LinkedHashMap<>();
  private final int capacity;
  private final Duration inactivityTimeout;
  private final Clock clock;
  private final DroneEvictionListener evictionListener;
  private final Counter capacityEvictions;

  public DroneRegistry(
      int capacity,
      Duration inactivityTimeout,
      Clock clock,
      DroneEvictionListener evictionListener,
      MeterRegistry meterRegistry) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.inactivityTimeout = inactivityTimeout;
    this.clock = clock;
    this.evictionListener = evictionListener;
    this.capacityEvictions =
        meterRegistry.counter("tracker.drones.evicted", "reason", "capacity");
    meterRegistry.gauge("tracker.drones.active", records, Map::size);
  }

  /**
   * Creates or merges the record keyed by the observation id.
   *
   * @param observation an observation carrying an id
   * @return the affected record
   */
  public DroneRecord upsert(Observation observation) {
    if (!observation.hasId()) {
      throw new IllegalArgumentException("observation has no id");
    }
    Instant now = clock.instant();
    DroneRecord existing = records.get(observation.getId());
    if (existing != null) {
      existing.merge(observation, now);
      return existing;
    }
    if (records.size() >= capacity) {
      evictEldest();
    }
    DroneRecord created = new DroneRecord(observation.getId(), observation, now);
    records.put(created.getId(), created);
    LOGGER.debug("Tracking new drone {} ({} active)", created.getId(), records.size());
    return created;
  }

  /**
   * Merges an id-less observation into the first record whose MAC matches.
   *
   * @return true when a record was updated
   */
  public boolean correlateByMac(Observation observation) {
    if (!observation.hasMac()) {
      return false;
    }
    for (DroneRecord record : records.values()) {
      if (observation.getMac().equals(record.getMac())) {
        record.merge(observation, clock.instant());
        return true;
      }
    }
    return false;
  }

  /**
   * Lists ids idle for longer than the inactivity timeout, oldest-inserted first.
   *
   * <p>Nothing is removed here; callers notify downstream consumers and then call
   * {@link #remove(String)}.
   */
  public List<String> sweep(Instant now) {
    List<String> expired = new ArrayList<>();
    for (DroneRecord record : records.values()) {
      if (isExpired(record, now)) {
        expired.add(record.getId());
      }
    }
    return expired;
  }

  public boolean isExpired(DroneRecord record, Instant now) {
    return Duration.between(record.getLastUpdateTime(), now).compareTo(inactivityTimeout) > 0;
  }

  public Optional<DroneRecord> remove(String id) {
    return Optional.ofNullable(records.remove(id));
  }

  public Optional<DroneRecord> get(String id) {
    return Optional.ofNullable(records.get(id));
  }

  /** Snapshot of the live records in insertion order; safe to iterate while mutating. */
  public List<DroneRecord> activeRecords() {
    return new ArrayList<>(records.values());
  }

  public int size() {
    return records.size();
  }

  public int capacity() {
    return capacity;
  }

  public Duration inactivityTimeout() {
    return inactivityTimeout;
  }

  private void evictEldest() {
    Iterator<String> eldest = records.keySet().iterator();
    String id = eldest.next();
    try {
      evictionListener.onEvict(id);
    } catch (RuntimeException ex) {
      LOGGER.warn("Eviction listener failed for drone {}", id, ex);
    }
    eldest.remove();
    capacityEvictions.increment();
    LOGGER.info("Registry at capacity ({}), evicted oldest drone {}", capacity, id);
  }
}
