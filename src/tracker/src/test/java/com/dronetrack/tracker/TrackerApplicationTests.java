package com.dronetrack.tracker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dronetrack.tracker.affiliation.AffiliationResolver;
import com.dronetrack.tracker.cot.CotTransport;
import com.dronetrack.tracker.dispatch.DispatchScheduler;
import com.dronetrack.tracker.ingest.RedisTelemetryLoop;
import com.dronetrack.tracker.ingest.StatusIngestService;
import com.dronetrack.tracker.sink.SinkRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class TrackerApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @MockBean
  private RedisTelemetryLoop redisTelemetryLoop;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
    assertNotNull(applicationContext.getBean(DispatchScheduler.class));
    assertNotNull(applicationContext.getBean(StatusIngestService.class));
  }

  @Test
  void optionalCollaboratorsAreOffByDefault() {
    assertEquals(0, applicationContext.getBean(SinkRouter.class).sinkCount());
    assertTrue(applicationContext.getBeansOfType(CotTransport.class).isEmpty());
    assertTrue(applicationContext.getBeansOfType(AffiliationResolver.class).isEmpty());
  }
}
