package ca.gc.cra.vlog.infrastructure.report;

import ca.gc.cra.vlog.domain.LogMessage;
import ca.gc.cra.vlog.domain.ValidationLevel;
import ca.gc.cra.vlog.logging.Logs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Replays recorded validation messages into an SLF4J logger.
 *
 * <p>Levels map one to one: Trace to {@code trace}, Debug to {@code debug}, Information to
 * {@code info}, Warning to {@code warn}, Error to {@code error}. Each event reads
 * {@code [outer > inner] Property: message}; messages at depth zero have no bracket prefix.
 * The target logger's own level still applies.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jReportWriter {
  private final int maxMessageBytes;

  /**
   * Creates a writer that shortens property names and message text beyond {@code maxMessageBytes}
   * UTF-8 bytes each.
   *
   * @param maxMessageBytes per-message byte budget; must be positive
   * @throws IllegalArgumentException if {@code maxMessageBytes} is not positive
   */
  public Slf4jReportWriter(int maxMessageBytes) {
    if (maxMessageBytes <= 0) {
      throw new IllegalArgumentException("maxMessageBytes must be positive (was " + maxMessageBytes + ")");
    }
    this.maxMessageBytes = maxMessageBytes;
  }

  /**
   * Writes every message to {@code target} in order.
   *
   * @param messages recorded messages, typically {@code ScopedValidationLogger.logMessages()}
   * @param target destination logger
   * @return number of messages written
   */
  public int write(List<LogMessage> messages, Logger target) {
    Objects.requireNonNull(messages, "messages");
    Objects.requireNonNull(target, "target");
    for (LogMessage message : messages) {
      String line = format(message);
      ValidationLevel level = message.level();
      if (ValidationLevel.ERROR.equals(level)) {
        target.error(line);
      } else if (ValidationLevel.WARNING.equals(level)) {
        target.warn(line);
      } else if (ValidationLevel.INFORMATION.equals(level)) {
        target.info(line);
      } else if (ValidationLevel.DEBUG.equals(level)) {
        target.debug(line);
      } else {
        target.trace(line);
      }
    }
    return messages.size();
  }

  /**
   * Formats one message as {@code [outer > inner] Property: message}.
   *
   * @param message recorded message
   * @return log line with the property name and message text each shortened to the byte budget
   */
  public String format(LogMessage message) {
    StringBuilder sb = new StringBuilder();
    if (!message.scope().isEmpty()) {
      sb.append('[').append(Logs.scopePath(message.scope())).append("] ");
    }
    sb.append(Logs.truncate(message.propertyName(), maxMessageBytes))
        .append(": ")
        .append(Logs.truncate(message.message(), maxMessageBytes));
    return sb.toString();
  }
}
