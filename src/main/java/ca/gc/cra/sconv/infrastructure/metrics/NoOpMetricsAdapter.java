package ca.gc.cra.sconv.infrastructure.metrics;

import ca.gc.cra.sconv.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
