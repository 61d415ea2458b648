package ca.gc.cra.logmerge.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previous;

  @BeforeEach
  void setUp() {
    previous = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void tearDown() {
    if (previous == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previous);
    }
  }

  @Test
  void exporterNoneYieldsNoopMeter() {
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop());
      assertDoesNotThrow(() -> result.meter().counterBuilder("merge.test").build().add(1));
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "prometheus");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void noOpAdapterAcceptsEverything() {
    NoOpMetricsAdapter adapter = new NoOpMetricsAdapter();

    assertDoesNotThrow(() -> {
      adapter.increment("merge.records.parsed");
      adapter.observe("merge.run.durationMillis", 5);
    });
  }
}
