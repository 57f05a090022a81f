package ca.gc.cra.vlog.application;

import ca.gc.cra.vlog.domain.ValidationLevel;

/**
 * Contract used by validators to report findings while they walk a nested structure.
 *
 * <p>Typical use wraps each nested element in a scope:
 * <pre>{@code
 * try (ValidationScope scope = logger.beginScope("order 42")) {
 *   logger.error("quantity", "must be positive");
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public interface ValidationLogger {

  /**
   * Enters a named scope. Messages logged until the returned handle is closed carry the name.
   *
   * @param scopeName scope label; duplicates, empty and {@code null} names are allowed
   * @return handle that leaves the scope when closed
   */
  ValidationScope beginScope(String scopeName);

  /**
   * Logs a message at a single severity.
   *
   * @param level exactly one of Trace, Debug, Information, Warning, or Error
   * @param propertyName property the message refers to
   * @param message message text
   * @throws IllegalArgumentException if {@code level} is not a single severity
   */
  void log(ValidationLevel level, String propertyName, String message);

  /**
   * Returns the levels currently recorded by {@link #log}.
   *
   * @return enabled mask
   */
  ValidationLevel enabledLevels();

  /**
   * Checks whether messages at {@code level} would be recorded.
   *
   * @param level level or mask to test
   * @return {@code true} when any bit of {@code level} is enabled
   */
  boolean isEnabled(ValidationLevel level);

  default void trace(String propertyName, String message) {
    log(ValidationLevel.TRACE, propertyName, message);
  }

  default void debug(String propertyName, String message) {
    log(ValidationLevel.DEBUG, propertyName, message);
  }

  default void info(String propertyName, String message) {
    log(ValidationLevel.INFORMATION, propertyName, message);
  }

  default void warning(String propertyName, String message) {
    log(ValidationLevel.WARNING, propertyName, message);
  }

  default void error(String propertyName, String message) {
    log(ValidationLevel.ERROR, propertyName, message);
  }
}
