package ca.gc.cra.vlog.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Severity flags attached to validation messages.
 * <p><strong>Why:</strong> Loggers are enabled for an arbitrary subset of severities (for example
 * only warnings and errors), so a level is a bitmask rather than a single ordinal.</p>
 * <p><strong>Role:</strong> Domain value type shared by the logger, renderer, and configuration.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the five singular severities plus {@link #NONE} and {@link #ALL}.</li>
 *   <li>Combine and test masks with bitwise semantics.</li>
 *   <li>Format and parse the textual names used in reports and config files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param bits raw flag bits; values outside {@link #ALL} are representable but never singular
 * @since 0.1.0
 */
public record ValidationLevel(int bits) {
  /** No messages. */
  public static final ValidationLevel NONE = new ValidationLevel(0);
  /** Verbose tracing of the validation process. */
  public static final ValidationLevel TRACE = new ValidationLevel(1);
  /** Diagnostics about the validator itself. */
  public static final ValidationLevel DEBUG = new ValidationLevel(2);
  /** Facts about the validated element unrelated to its validity. */
  public static final ValidationLevel INFORMATION = new ValidationLevel(4);
  /** A tolerable problem, or one the validator corrected unambiguously. */
  public static final ValidationLevel WARNING = new ValidationLevel(8);
  /** The element failed validation. */
  public static final ValidationLevel ERROR = new ValidationLevel(16);
  /** Union of every flag. */
  public static final ValidationLevel ALL = new ValidationLevel(31);
  /** Levels enabled when a logger is created without an explicit mask. */
  public static final ValidationLevel DEFAULT = new ValidationLevel(4 | 8 | 16);

  private static final List<ValidationLevel> SINGULAR = List.of(TRACE, DEBUG, INFORMATION, WARNING, ERROR);
  private static final List<String> SINGULAR_NAMES = List.of("Trace", "Debug", "Information", "Warning", "Error");
  private static final Pattern SEPARATORS = Pattern.compile("[|,\\s]+");

  /**
   * Returns the five singular severities in ascending bit order.
   *
   * @return immutable list of {@link #TRACE} through {@link #ERROR}
   */
  public static List<ValidationLevel> singularLevels() {
    return SINGULAR;
  }

  /**
   * Combines several levels into one mask.
   *
   * @param levels levels to union; {@code null} entries are rejected
   * @return union of {@code levels}, or {@link #NONE} when empty
   */
  public static ValidationLevel of(ValidationLevel... levels) {
    int bits = 0;
    for (ValidationLevel level : levels) {
      bits |= Objects.requireNonNull(level, "level").bits;
    }
    return new ValidationLevel(bits);
  }

  /**
   * Parses a level mask from configuration text.
   *
   * <p>Accepts level names (case-insensitive, {@code info} as shorthand for {@code Information}),
   * {@code None}, {@code All}, a decimal integer, or any list of those separated by {@code |},
   * {@code ,} or whitespace.</p>
   *
   * @param text configuration value such as {@code "Warning|Error"}
   * @return parsed mask
   * @throws IllegalArgumentException if the text is blank, holds only separators, or contains an
   *     unknown token
   */
  public static ValidationLevel parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("validation level must not be blank");
    }
    int bits = 0;
    int tokens = 0;
    for (String token : SEPARATORS.split(text.trim())) {
      if (token.isEmpty()) {
        continue;
      }
      bits |= parseToken(token);
      tokens++;
    }
    if (tokens == 0) {
      throw new IllegalArgumentException("validation level has no level names: \"" + text + "\"");
    }
    return new ValidationLevel(bits);
  }

  private static int parseToken(String token) {
    String lower = token.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "none":
        return NONE.bits;
      case "all":
        return ALL.bits;
      case "info":
        return INFORMATION.bits;
      default:
        break;
    }
    for (int i = 0; i < SINGULAR.size(); i++) {
      if (SINGULAR_NAMES.get(i).toLowerCase(Locale.ROOT).equals(lower)) {
        return SINGULAR.get(i).bits;
      }
    }
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("unknown validation level: " + token, ex);
    }
  }

  /**
   * Bitwise union.
   *
   * @param other mask to merge
   * @return mask holding the bits of both operands
   */
  public ValidationLevel or(ValidationLevel other) {
    return new ValidationLevel(bits | other.bits);
  }

  /**
   * Bitwise intersection.
   *
   * @param other mask to intersect with
   * @return mask holding only the bits common to both operands
   */
  public ValidationLevel and(ValidationLevel other) {
    return new ValidationLevel(bits & other.bits);
  }

  /** Returns {@code true} when every bit of {@code other} is set here. */
  public boolean contains(ValidationLevel other) {
    return (bits & other.bits) == other.bits;
  }

  /** Returns {@code true} when at least one bit is shared with {@code other}. */
  public boolean intersects(ValidationLevel other) {
    return (bits & other.bits) != 0;
  }

  /** Returns {@code true} when no flag is set. */
  public boolean isNone() {
    return bits == 0;
  }

  /**
   * Indicates whether this value is exactly one of the five singular severities.
   *
   * @return {@code true} for Trace, Debug, Information, Warning, or Error
   */
  public boolean isSingle() {
    return (bits & ALL.bits) == bits && Integer.bitCount(bits) == 1;
  }

  /**
   * Formats the level the way validation reports print it.
   *
   * @return {@code Information} for singular levels, {@code Warning, Error} for combinations,
   *     {@code None}/{@code All} for the special masks, or the decimal value when unknown bits are set
   */
  @Override
  public String toString() {
    if (bits == NONE.bits) {
      return "None";
    }
    if (bits == ALL.bits) {
      return "All";
    }
    if ((bits & ~ALL.bits) != 0) {
      return Integer.toString(bits);
    }
    List<String> names = new ArrayList<>(SINGULAR.size());
    for (int i = 0; i < SINGULAR.size(); i++) {
      if ((bits & SINGULAR.get(i).bits) != 0) {
        names.add(SINGULAR_NAMES.get(i));
      }
    }
    return String.join(", ", names);
  }
}
