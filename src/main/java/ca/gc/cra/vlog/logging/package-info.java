/**
 * <strong>Purpose:</strong> Helpers that sanitize validation text before it is emitted through SLF4J.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vlog.logging;
