package com.dronetrack.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the tracker service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code dronetrack.*} prefix.
 */
@ConfigurationProperties(prefix = "dronetrack")
public class TrackerProperties {
  private final Registry registry = new Registry();
  private final Dispatch dispatch = new Dispatch();
  private final Ingest ingest = new Ingest();
  private final Redis redis = new Redis();
  private final Cot cot = new Cot();
  private final Sinks sinks = new Sinks();
  private final Affiliation affiliation = new Affiliation();

  public Registry getRegistry() {
    return registry;
  }

  public Dispatch getDispatch() {
    return dispatch;
  }

  public Ingest getIngest() {
    return ingest;
  }

  public Redis getRedis() {
    return redis;
  }

  public Cot getCot() {
    return cot;
  }

  public Sinks getSinks() {
    return sinks;
  }

  public Affiliation getAffiliation() {
    return affiliation;
  }

  /** Bounds of the in-memory drone registry. */
  public static class Registry {
    private int maxDrones = 30;
    private double inactivityTimeoutSeconds = 60.0;

    public int getMaxDrones() {
      return maxDrones;
    }

    public void setMaxDrones(int maxDrones) {
      this.maxDrones = maxDrones;
    }

    public double getInactivityTimeoutSeconds() {
      return inactivityTimeoutSeconds;
    }

    public void setInactivityTimeoutSeconds(double inactivityTimeoutSeconds) {
      this.inactivityTimeoutSeconds = inactivityTimeoutSeconds;
    }
  }

  /** Rate limiting and outbound call execution settings. */
  public static class Dispatch {
    private double rateLimitSeconds = 1.0;
    private long callTimeoutMs = 5_000;
    private int threads = 4;
    private long shutdownGraceMs = 2_000;

    public double getRateLimitSeconds() {
      return rateLimitSeconds;
    }

    public void setRateLimitSeconds(double rateLimitSeconds) {
      this.rateLimitSeconds = rateLimitSeconds;
    }

    public long getCallTimeoutMs() {
      return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
      this.callTimeoutMs = callTimeoutMs;
    }

    public int getThreads() {
      return threads;
    }

    public void setThreads(int threads) {
      this.threads = threads;
    }

    public long getShutdownGraceMs() {
      return shutdownGraceMs;
    }

    public void setShutdownGraceMs(long shutdownGraceMs) {
      this.shutdownGraceMs = shutdownGraceMs;
    }
  }

  /** Input loop settings. */
  public static class Ingest {
    private boolean enabled = true;
    private long pollTimeoutMs = 1_000;
    private String idPrefix = "drone-";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getPollTimeoutMs() {
      return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
    }

    public String getIdPrefix() {
      return idPrefix;
    }

    public void setIdPrefix(String idPrefix) {
      this.idPrefix = idPrefix;
    }
  }

  /** Redis key names used by the input path. An empty status key disables status input. */
  public static class Redis {
    private String inputKey = "dronetrack:telemetry:queue";
    private String statusKey = "dronetrack:status:queue";

    public String getInputKey() {
      return inputKey;
    }

    public void setInputKey(String inputKey) {
      this.inputKey = inputKey;
    }

    public String getStatusKey() {
      return statusKey;
    }

    public void setStatusKey(String statusKey) {
      this.statusKey = statusKey;
    }
  }

  /** Outbound CoT datagram transport. */
  public static class Cot {
    private boolean enabled = false;
    private String host = "239.2.3.1";
    private int port = 6969;
    private int multicastTtl = 1;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public int getMulticastTtl() {
      return multicastTtl;
    }

    public void setMulticastTtl(int multicastTtl) {
      this.multicastTtl = multicastTtl;
    }
  }

  /** Downstream sink settings. */
  public static class Sinks {
    private final RedisSink redis = new RedisSink();

    public RedisSink getRedis() {
      return redis;
    }
  }

  /** Redis hash + pub/sub sink. */
  public static class RedisSink {
    private boolean enabled = false;
    private String stateKey = "dronetrack:drones:state";
    private String channel = "dronetrack:drones:events";
    private String systemStateKey = "dronetrack:systems:state";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getStateKey() {
      return stateKey;
    }

    public void setStateKey(String stateKey) {
      this.stateKey = stateKey;
    }

    public String getChannel() {
      return channel;
    }

    public void setChannel(String channel) {
      this.channel = channel;
    }

    public String getSystemStateKey() {
      return systemStateKey;
    }

    public void setSystemStateKey(String systemStateKey) {
      this.systemStateKey = systemStateKey;
    }
  }

  /** UID affiliation file settings. */
  public static class Affiliation {
    private boolean enabled = false;
    private String path = "affiliation.ini";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }
  }
}
