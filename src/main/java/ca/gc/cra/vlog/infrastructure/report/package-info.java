/**
 * Report adapters that publish recorded validation messages to logging backends.
 * <p><strong>Role:</strong> Driven-side adapters; read-only consumers of the logger's message list.</p>
 */
package ca.gc.cra.vlog.infrastructure.report;
