package worklease.micrometer;

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
  void claimedAddsBatchCounts() {
    exporter.incrementClaimed(10);
    exporter.incrementClaimed(0);
    exporter.incrementClaimed(5);
    assertEquals(15.0, counter("worklease.claimed").count());
  }

  @Test
  void outcomeCounters() {
    exporter.incrementSucceeded();
    exporter.incrementSucceeded();
    exporter.incrementRetried();
    exporter.incrementFailed();

    assertEquals(2.0, counter("worklease.succeeded").count());
    assertEquals(1.0, counter("worklease.retried").count());
    assertEquals(1.0, counter("worklease.failed").count());
  }

  @Test
  void reclaimedIgnoresEmptySweeps() {
    exporter.incrementReclaimed(0);
    exporter.incrementReclaimed(3);
    assertEquals(3.0, counter("worklease.reclaimed").count());
  }

  @Test
  void leaseLostAndStoreErrors() {
    exporter.incrementLeaseLost();
    exporter.incrementStoreErrors();
    exporter.incrementStoreErrors();

    assertEquals(1.0, counter("worklease.lease.lost").count());
    assertEquals(2.0, counter("worklease.store.errors").count());
  }

  @Test
  void batchGaugeTracksLastClaim() {
    exporter.recordBatchSize(50);
    exporter.recordBatchSize(7);

    Gauge gauge = registry.find("worklease.batch.last.size").gauge();
    assertNotNull(gauge);
    assertEquals(7.0, gauge.value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "developers.enrich");

    prefixed.incrementSucceeded();

    assertNotNull(custom.find("developers.enrich.succeeded").counter());
    assertNull(custom.find("worklease.succeeded").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "app."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementSucceeded();
    exporter.close();

    assertNull(registry.find("worklease.succeeded").counter());
    assertNull(registry.find("worklease.batch.last.size").gauge());
    exporter.incrementSucceeded();
    exporter.recordBatchSize(3);
  }

  private Counter counter(String name) {
    Counter counter = registry.find(name).counter();
    assertNotNull(counter, "Counter not found: " + name);
    return counter;
  }
}
