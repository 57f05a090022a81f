package ca.gc.cra.vlog.config;

import ca.gc.cra.vlog.application.ScopedValidationLogger;
import ca.gc.cra.vlog.application.port.MetricsPort;
import ca.gc.cra.vlog.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.vlog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vlog.infrastructure.report.Slf4jReportWriter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root wiring loggers and report writers from a {@link ValidationConfig}.
 *
 * <p>One root serves many validation passes: the metrics adapter is built once and shared by every
 * logger from {@link #newLogger()}, while each pass still gets a fresh logger. Closing the root
 * shuts down the adapter it built; a caller-supplied {@link MetricsPort} stays owned by the caller.</p>
 *
 * <pre>{@code
 * try (ValidationLoggers loggers = new ValidationLoggers(config)) {
 *   for (Order order : orders) {
 *     ScopedValidationLogger logger = loggers.newLogger();
 *     validator.validate(order, logger);
 *   }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ValidationLoggers implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ValidationLoggers.class);

  private final ValidationConfig config;
  private final MetricsPort metrics;
  private final boolean ownsMetrics;
  private boolean closed;

  /**
   * Creates a root whose metrics adapter is selected by {@code config.metricsEnabled()}.
   *
   * @param config settings
   */
  public ValidationLoggers(ValidationConfig config) {
    this(config, metricsFor(Objects.requireNonNull(config, "config")), true);
  }

  /**
   * Creates a root reporting counters to a caller-supplied metrics port.
   *
   * @param config settings providing the enabled levels and report budget
   * @param metrics counter sink; not closed by {@link #close()}
   */
  public ValidationLoggers(ValidationConfig config, MetricsPort metrics) {
    this(config, metrics, false);
  }

  private ValidationLoggers(ValidationConfig config, MetricsPort metrics, boolean ownsMetrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ownsMetrics = ownsMetrics;
  }

  /**
   * Creates a logger for one validation pass.
   *
   * @return fresh logger with the configured enabled levels, sharing this root's metrics port
   * @throws IllegalStateException if the root has been closed
   */
  public ScopedValidationLogger newLogger() {
    if (closed) {
      throw new IllegalStateException("validation logger root is closed");
    }
    log.debug("Creating validation logger with enabled levels {}", config.enabledLevels());
    return new ScopedValidationLogger(config.enabledLevels(), metrics);
  }

  /**
   * Builds an SLF4J report writer using the configured message budget.
   *
   * @return report writer
   */
  public Slf4jReportWriter reportWriter() {
    return new Slf4jReportWriter(config.reportMaxMessageBytes());
  }

  /** Metrics port shared by every logger from this root. */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Settings this root was built from. */
  public ValidationConfig config() {
    return config;
  }

  /** Shuts down the metrics adapter when this root created it; repeated calls are no-ops. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (ownsMetrics && metrics instanceof OpenTelemetryMetricsAdapter adapter) {
      adapter.close();
    }
  }

  static MetricsPort metricsFor(ValidationConfig config) {
    return config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }
}
