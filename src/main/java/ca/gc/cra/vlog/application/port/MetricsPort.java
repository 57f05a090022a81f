package ca.gc.cra.vlog.application.port;

/**
 * <strong>What:</strong> Port abstracting validation metrics emission.
 * <p><strong>Why:</strong> Lets the logger count scopes and messages without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations decide; the validation logger calls them from its single owner thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code validation.message.recorded}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code validation.scope.opened}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = key -> {};
}
