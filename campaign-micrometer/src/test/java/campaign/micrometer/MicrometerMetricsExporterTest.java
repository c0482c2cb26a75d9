package campaign.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void claimCounters() {
    exporter.incrementClaimed(5);
    exporter.incrementClaimed(2);
    exporter.incrementReclaimed(1);
    assertEquals(7.0, counter("campaign.actions.claimed").count());
    assertEquals(1.0, counter("campaign.actions.reclaimed").count());
  }

  @Test
  void dispatchOutcomeCounters() {
    exporter.incrementSent();
    exporter.incrementSent();
    exporter.incrementDeduplicated();
    exporter.incrementSkipped();
    exporter.incrementDeferred();
    exporter.incrementRetried();
    exporter.incrementFailed();
    exporter.incrementEventsApplied();

    assertEquals(2.0, counter("campaign.dispatch.sent").count());
    assertEquals(1.0, counter("campaign.dispatch.deduplicated").count());
    assertEquals(1.0, counter("campaign.dispatch.skipped").count());
    assertEquals(1.0, counter("campaign.dispatch.deferred").count());
    assertEquals(1.0, counter("campaign.dispatch.retried").count());
    assertEquals(1.0, counter("campaign.dispatch.failed").count());
    assertEquals(1.0, counter("campaign.events.applied").count());
  }

  @Test
  void gauges() {
    exporter.recordWorkQueueDepth(42);
    exporter.recordOldestDueLagMs(12345L);
    assertEquals(42.0, gauge("campaign.queue.work.depth").value());
    assertEquals(12345.0, gauge("campaign.lag.oldest.ms").value());

    exporter.recordWorkQueueDepth(0);
    assertEquals(0.0, gauge("campaign.queue.work.depth").value());
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "sales.campaign");
    custom.incrementSent();
    custom.recordOldestDueLagMs(500L);

    assertEquals(1.0, counter("sales.campaign.dispatch.sent").count());
    assertEquals(500.0, gauge("sales.campaign.lag.oldest.ms").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementSent();
    assertNull(registry.find("campaign.dispatch.sent").counter());
    assertNull(registry.find("campaign.lag.oldest.ms").gauge());
  }

  @Test
  void invalidArguments() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "campaign."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
