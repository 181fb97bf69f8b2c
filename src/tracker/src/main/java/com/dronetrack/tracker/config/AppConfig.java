package com.dronetrack.tracker.config;

import com.dronetrack.tracker.affiliation.AffiliationResolver;
import com.dronetrack.tracker.cot.CotEncoder;
import com.dronetrack.tracker.cot.CotTransport;
import com.dronetrack.tracker.dispatch.DispatchScheduler;
import com.dronetrack.tracker.dispatch.TimeBoundedCallDispatcher;
import com.dronetrack.tracker.ingest.StatusIngestService;
import com.dronetrack.tracker.ingest.TelemetryIngestService;
import com.dronetrack.tracker.registry.DroneEvictionListener;
import com.dronetrack.tracker.registry.DroneRegistry;
import com.dronetrack.tracker.sink.DroneSink;
import com.dronetrack.tracker.sink.SinkRouter;
import com.dronetrack.tracker.status.SystemStatusParser;
import com.dronetrack.tracker.telemetry.TelemetryNormalizer;
import com.dronetrack.tracker.util.GeoUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CotEncoder cotEncoder(Clock clock) {
    // Kept out of the context so Boot's JSON ObjectMapper stays the primary mapper.
    XmlMapper xmlMapper = new XmlMapper();
    xmlMapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
    return new CotEncoder(xmlMapper, clock);
  }

  @Bean
  public TimeBoundedCallDispatcher callDispatcher(TrackerProperties properties) {
    TrackerProperties.Dispatch dispatch = properties.getDispatch();
    return new TimeBoundedCallDispatcher(
        dispatch.getThreads(),
        Duration.ofMillis(dispatch.getCallTimeoutMs()),
        Duration.ofMillis(dispatch.getShutdownGraceMs()));
  }

  @Bean(destroyMethod = "closeAll")
  public SinkRouter sinkRouter(
      ObjectProvider<DroneSink> sinks,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    TrackerProperties.Dispatch dispatch = properties.getDispatch();
    return new SinkRouter(
        sinks.orderedStream().toList(),
        name -> TimeBoundedCallDispatcher.serialLane(
            "sink-" + name,
            Duration.ofMillis(dispatch.getCallTimeoutMs()),
            Duration.ofMillis(dispatch.getShutdownGraceMs())),
        meterRegistry);
  }

  @Bean
  public DroneEvictionListener droneEvictionListener(SinkRouter sinkRouter) {
    return sinkRouter::onEvict;
  }

  @Bean
  public DroneRegistry droneRegistry(
      TrackerProperties properties,
      Clock clock,
      DroneEvictionListener evictionListener,
      MeterRegistry meterRegistry) {
    TrackerProperties.Registry registry = properties.getRegistry();
    return new DroneRegistry(
        registry.getMaxDrones(),
        GeoUtils.seconds(registry.getInactivityTimeoutSeconds()),
        clock,
        evictionListener,
        meterRegistry);
  }

  @Bean
  public DispatchScheduler dispatchScheduler(
      DroneRegistry droneRegistry,
      CotEncoder cotEncoder,
      Optional<CotTransport> cotTransport,
      SinkRouter sinkRouter,
      DroneEvictionListener evictionListener,
      TimeBoundedCallDispatcher callDispatcher,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    return new DispatchScheduler(
        droneRegistry,
        cotEncoder,
        cotTransport,
        sinkRouter,
        evictionListener,
        callDispatcher,
        GeoUtils.seconds(properties.getDispatch().getRateLimitSeconds()),
        meterRegistry);
  }

  @Bean
  public TelemetryIngestService telemetryIngestService(
      TelemetryNormalizer normalizer,
      DroneRegistry droneRegistry,
      ObjectMapper objectMapper,
      Optional<AffiliationResolver> affiliationResolver,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    return new TelemetryIngestService(
        normalizer, droneRegistry, objectMapper, affiliationResolver, properties, meterRegistry);
  }

  @Bean
  public StatusIngestService statusIngestService(
      SystemStatusParser parser,
      DispatchScheduler dispatchScheduler,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    return new StatusIngestService(parser, dispatchScheduler, objectMapper, meterRegistry);
  }
}
