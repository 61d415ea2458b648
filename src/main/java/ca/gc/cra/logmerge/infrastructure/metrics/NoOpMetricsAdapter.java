package ca.gc.cra.logmerge.infrastructure.metrics;

import ca.gc.cra.logmerge.application.port.MetricsPort;

/**
 * Metrics adapter selected when {@code metricsExporter=none}; discards all observations.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
