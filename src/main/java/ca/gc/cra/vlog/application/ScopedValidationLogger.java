package ca.gc.cra.vlog.application;

import ca.gc.cra.vlog.application.port.MetricsPort;
import ca.gc.cra.vlog.domain.LogMessage;
import ca.gc.cra.vlog.domain.ValidationLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Accumulates validation messages under nested scopes and renders them as an
 * indented report.
 * <p><strong>Why:</strong> Validators walking nested structures need to collect every finding,
 * decide pass/fail afterwards, and show where in the structure each finding came from.</p>
 * <p><strong>Role:</strong> Application service owned by one validation pass; create a fresh
 * instance per run, there is no reset.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Filter messages against the enabled level mask.</li>
 *   <li>Track the scope stack and snapshot it into each recorded message.</li>
 *   <li>Count warnings and errors, including those filtered out.</li>
 *   <li>Render the recorded messages through {@link ValidationReportRenderer}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single owner, single thread.</p>
 * <p><strong>Observability:</strong> Scope entry/exit at TRACE, rejected levels at DEBUG, and
 * {@code validation.*} counters through the {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class ScopedValidationLogger implements ValidationLogger {
  private static final Logger log = LoggerFactory.getLogger(ScopedValidationLogger.class);

  static final String METRIC_SCOPE_OPENED = "validation.scope.opened";
  static final String METRIC_RECORDED = "validation.message.recorded";
  static final String METRIC_FILTERED = "validation.message.filtered";
  static final String METRIC_REJECTED = "validation.message.rejected";
  private static final String METRIC_LEVEL_PREFIX = "validation.message.";

  private final List<LogMessage> messages = new ArrayList<>();
  private final List<LogMessage> messagesView = Collections.unmodifiableList(messages);
  private final List<String> scope = new ArrayList<>();
  private final MetricsPort metrics;
  private ValidationLevel enabledLevels;
  private ValidationLevel loggedLevels = ValidationLevel.NONE;
  private int errors;
  private int warnings;

  /** Creates a logger recording Information, Warning, and Error messages. */
  public ScopedValidationLogger() {
    this(ValidationLevel.DEFAULT);
  }

  /**
   * Creates a logger recording the given levels.
   *
   * @param enabledLevels initial enabled mask
   */
  public ScopedValidationLogger(ValidationLevel enabledLevels) {
    this(enabledLevels, MetricsPort.NO_OP);
  }

  /**
   * Creates a logger recording the given levels and reporting counters to {@code metrics}.
   *
   * @param enabledLevels initial enabled mask
   * @param metrics counter sink
   * @throws NullPointerException if either argument is {@code null}
   */
  public ScopedValidationLogger(ValidationLevel enabledLevels, MetricsPort metrics) {
    this.enabledLevels = Objects.requireNonNull(enabledLevels, "enabledLevels");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public ValidationScope beginScope(String scopeName) {
    scope.add(scopeName);
    int depth = scope.size();
    metrics.increment(METRIC_SCOPE_OPENED);
    log.trace("Entered validation scope '{}' at depth {}", scopeName, depth);
    return new ValidationScope(this::endScope, depth);
  }

  private void endScope(int depth) {
    if (depth > 0 && scope.size() >= depth) {
      int closed = scope.size() - depth + 1;
      scope.subList(depth - 1, scope.size()).clear();
      log.trace("Left validation scope at depth {} ({} scope(s) closed)", depth, closed);
    }
  }

  @Override
  public void log(ValidationLevel level, String propertyName, String message) {
    if (level == null || !level.isSingle()) {
      metrics.increment(METRIC_REJECTED);
      log.debug("Rejected validation message for property '{}' with level {}", propertyName, level);
      throw new IllegalArgumentException(
          "level must be Trace, Debug, Information, Warning, or Error (was " + level + ")");
    }
    if (ValidationLevel.WARNING.equals(level)) {
      warnings++;
    } else if (ValidationLevel.ERROR.equals(level)) {
      errors++;
    }

    if (!enabledLevels.intersects(level)) {
      metrics.increment(METRIC_FILTERED);
      return;
    }
    loggedLevels = loggedLevels.or(level);
    messages.add(new LogMessage(scope, level, propertyName, message));
    metrics.increment(METRIC_RECORDED);
    metrics.increment(METRIC_LEVEL_PREFIX + level.toString().toLowerCase(Locale.ROOT));
  }

  @Override
  public ValidationLevel enabledLevels() {
    return enabledLevels;
  }

  /**
   * Replaces the enabled mask. Already recorded messages are kept.
   *
   * @param enabledLevels new mask
   * @throws NullPointerException if {@code enabledLevels} is {@code null}
   */
  public void setEnabledLevels(ValidationLevel enabledLevels) {
    this.enabledLevels = Objects.requireNonNull(enabledLevels, "enabledLevels");
  }

  @Override
  public boolean isEnabled(ValidationLevel level) {
    return enabledLevels.intersects(level);
  }

  /** Union of the levels of every recorded message. */
  public ValidationLevel loggedLevels() {
    return loggedLevels;
  }

  /** Number of Error messages logged, including those filtered out. */
  public int errors() {
    return errors;
  }

  /** Number of Warning messages logged, including those filtered out. */
  public int warnings() {
    return warnings;
  }

  /**
   * Indicates whether no Error message was recorded.
   *
   * @return {@code false} once an enabled Error has been logged
   */
  public boolean passedValidation() {
    return !loggedLevels.intersects(ValidationLevel.ERROR);
  }

  /** Returns {@code true} when a Warning message was recorded. */
  public boolean hasWarning() {
    return loggedLevels.intersects(ValidationLevel.WARNING);
  }

  /**
   * Checks whether any of the given levels was recorded.
   *
   * @param level level or mask to test against the logged levels
   * @return {@code true} when at least one bit matches
   */
  public boolean hasFlag(ValidationLevel level) {
    return loggedLevels.intersects(level);
  }

  /**
   * Returns the recorded messages in logging order.
   *
   * @return read-only live view
   */
  public List<LogMessage> logMessages() {
    return messagesView;
  }

  /** Current scope depth. */
  public int scopeDepth() {
    return scope.size();
  }

  /**
   * Renders the recorded messages as a brace-nested report.
   *
   * @return report text, empty when nothing was recorded
   */
  @Override
  public String toString() {
    return ValidationReportRenderer.render(messages);
  }
}
