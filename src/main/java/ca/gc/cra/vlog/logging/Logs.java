package ca.gc.cra.vlog.logging;

import java.util.List;

/**
 * <strong>What:</strong> Text helpers that turn recorded validation messages into bounded log lines.
 * <p><strong>Why:</strong> Validation messages and property names often quote the offending value;
 * an oversized value should not flood operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  /** Separator between scope names in a flattened scope path. */
  public static final String SCOPE_SEPARATOR = " > ";

  private Logs() {
    // Utility
  }

  /**
   * Shortens {@code value} to at most {@code maxBytes} UTF-8 bytes, never splitting a character.
   *
   * @param value text to shorten; {@code null} is treated as empty, as the report renderer does
   * @param maxBytes UTF-8 byte budget for the kept prefix; must be positive
   * @return {@code value} unchanged when it fits, otherwise the longest whole-character prefix
   *     followed by {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive (was " + maxBytes + ")");
    }
    if (value == null) {
      return "";
    }
    int total = utf8Length(value);
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Joins a scope snapshot as {@code outer > inner}; {@code null} names contribute empty text.
   *
   * @param scope scope names, outermost first
   * @return flattened path, empty for a top-level message
   */
  public static String scopePath(List<String> scope) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < scope.size(); i++) {
      if (i > 0) {
        sb.append(SCOPE_SEPARATOR);
      }
      String name = scope.get(i);
      sb.append(name == null ? "" : name);
    }
    return sb.toString();
  }

  /** Number of bytes {@code value} occupies in UTF-8; unpaired surrogates count as {@code '?'}. */
  static int utf8Length(String value) {
    int length = 0;
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      length += utf8Width(codePoint);
      i += Character.charCount(codePoint);
    }
    return length;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    if (Character.isSurrogate((char) codePoint)) {
      return 1;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
