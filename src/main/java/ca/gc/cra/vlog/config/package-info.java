/**
 * Configuration records, loaders, and the composition root for validation loggers.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Formats:</strong> Java properties files and sectioned YAML documents (SnakeYAML).</p>
 */
package ca.gc.cra.vlog.config;
