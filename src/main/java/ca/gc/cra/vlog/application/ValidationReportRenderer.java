package ca.gc.cra.vlog.application;

import ca.gc.cra.vlog.domain.LogMessage;
import java.util.List;
import java.util.Objects;

/**
 * Renders recorded validation messages as an indented, brace-nested report.
 *
 * <p>Messages are stored flat, each with its own scope snapshot. The renderer compares every
 * message's scope with the previous one, closes the scopes that are no longer shared and opens the
 * new ones, so consecutive messages in the same scope share a single block:</p>
 * <pre>
 * Scope1 {
 *   Warning: Something: Danger
 *   Scope2 {
 *     Error: CPU: CPU failure imminent.
 *   }
 * }
 * </pre>
 *
 * <p>Two spaces per nesting level; every line ends with {@code '\n'}.</p> *
 * @since 0.1.0
 */
public final class ValidationReportRenderer {
  private static final String INDENT = "  ";
  private static final char NEWLINE = '\n';

  private ValidationReportRenderer() {
    // Utility
  }

  /**
   * Renders the messages in the given order.
   *
   * @param messages recorded messages; scopes are expected to follow push/pop order but any
   *     sequence renders
   * @return report text, or an empty string when {@code messages} is empty
   */
  public static String render(List<LogMessage> messages) {
    StringBuilder sb = new StringBuilder();
    List<String> previous = List.of();
    for (LogMessage message : messages) {
      List<String> current = message.scope();
      int match = commonPrefixLength(previous, current);

      closeScopes(sb, previous.size(), match);
      previous = current;

      for (int i = match; i < current.size(); i++) {
        indent(sb, i);
        sb.append(text(current.get(i))).append(" {").append(NEWLINE);
      }

      indent(sb, current.size());
      sb.append(message.level())
          .append(": ")
          .append(text(message.propertyName()))
          .append(": ")
          .append(text(message.message()))
          .append(NEWLINE);
    }
    closeScopes(sb, previous.size(), 0);
    return sb.toString();
  }

  private static int commonPrefixLength(List<String> a, List<String> b) {
    int limit = Math.min(a.size(), b.size());
    int match = 0;
    while (match < limit && Objects.equals(a.get(match), b.get(match))) {
      match++;
    }
    return match;
  }

  // Closes depths from 'from' down to 'to' + 1; a closing brace sits at its opening brace's indent.
  private static void closeScopes(StringBuilder sb, int from, int to) {
    for (int depth = from; depth > to; depth--) {
      indent(sb, depth - 1);
      sb.append('}').append(NEWLINE);
    }
  }

  private static void indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  private static String text(String value) {
    return value == null ? "" : value;
  }
}
