package ca.gc.cra.vlog.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A single recorded validation message.
 * <p><strong>Role:</strong> Domain record appended by the logger and consumed by renderers and
 * report writers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the scope list is an unmodifiable copy taken when the
 * message was logged, so later scope changes never reach it.</p>
 *
 * @param scope scope names active when the message was logged, outermost first; may contain
 *     {@code null} or duplicate names
 * @param level singular severity of the message
 * @param propertyName property the message refers to; may be {@code null}
 * @param message message text; may be {@code null}
 * @since 0.1.0
 */
public record LogMessage(List<String> scope, ValidationLevel level, String propertyName, String message) {

  /**
   * Creates a message and snapshots the supplied scope.
   *
   * @throws NullPointerException if {@code scope} or {@code level} is {@code null}
   * @throws IllegalArgumentException if {@code level} is not exactly one of Trace, Debug,
   *     Information, Warning or Error
   */
  public LogMessage {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(level, "level");
    if (!level.isSingle()) {
      throw new IllegalArgumentException("message level must be a single severity (was " + level + ")");
    }
    // List.copyOf rejects null elements, which are legal scope names here.
    scope = Collections.unmodifiableList(new ArrayList<>(scope));
  }

  /** Number of scopes enclosing this message. */
  public int depth() {
    return scope.size();
  }
}
