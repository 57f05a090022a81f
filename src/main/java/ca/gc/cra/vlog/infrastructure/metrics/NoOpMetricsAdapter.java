package ca.gc.cra.vlog.infrastructure.metrics;

import ca.gc.cra.vlog.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Stateless; selected when validation metrics are disabled in configuration.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /**
   * Discards the increment request.
   *
   * @param key metric identifier; ignored
   */
  @Override
  public void increment(String key) {}
}
