/**
 * <strong>Purpose:</strong> Value types describing validation messages: severity flags and recorded entries.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.
 * <p><strong>Observability:</strong> No logging or metrics; these are plain values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vlog.domain;
