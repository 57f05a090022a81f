/**
 * Metrics adapters that bridge the validation {@code MetricsPort} to OpenTelemetry or no-op implementations.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code validation.*} namespace.</p>
 * <p><strong>Security:</strong> Only counters are exported; message text never leaves the process through metrics.</p>
 */
package ca.gc.cra.vlog.infrastructure.metrics;
