/**
 * <strong>Purpose:</strong> The validation logger: scope tracking, level filtering, counters, and report rendering.
 * <p><strong>Role:</strong> Application layer used directly by validators; depends only on the domain types and
 * the {@link ca.gc.cra.vlog.application.port.MetricsPort} port.
 * <p><strong>Concurrency:</strong> Single-owner, single-threaded. Scope handles belong to the thread that opened them.
 * <p><strong>Observability:</strong> SLF4J at TRACE/DEBUG for scope and rejection events; counters via the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vlog.application;
