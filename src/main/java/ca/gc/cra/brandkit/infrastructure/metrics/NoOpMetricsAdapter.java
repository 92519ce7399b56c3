package ca.gc.cra.brandkit.infrastructure.metrics;

import ca.gc.cra.brandkit.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; wired when {@code metricsExporter=none}.
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
