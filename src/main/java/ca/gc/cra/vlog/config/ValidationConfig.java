package ca.gc.cra.vlog.config;

import ca.gc.cra.vlog.domain.ValidationLevel;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for building a validation logger.
 * <p><strong>Role:</strong> Configuration record consumed by {@link ValidationLoggers}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param enabledLevels levels the logger records
 * @param metricsEnabled whether counters are exported through OpenTelemetry
 * @param reportMaxMessageBytes byte budget per message when forwarding reports to SLF4J
 * @since 0.1.0
 */
public record ValidationConfig(
    ValidationLevel enabledLevels,
    boolean metricsEnabled,
    int reportMaxMessageBytes) {

  static final String KEY_ENABLED_LEVELS = "enabledLevels";
  static final String KEY_METRICS_ENABLED = "metrics.enabled";
  static final String KEY_REPORT_MAX_BYTES = "report.maxMessageBytes";
  static final int MIN_REPORT_BYTES = 16;
  static final int MAX_REPORT_BYTES = 1_048_576;

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if {@code enabledLevels} is {@code null}
   * @throws IllegalArgumentException if {@code reportMaxMessageBytes} is outside 16..1048576
   */
  public ValidationConfig {
    Objects.requireNonNull(enabledLevels, KEY_ENABLED_LEVELS);
    if (reportMaxMessageBytes < MIN_REPORT_BYTES || reportMaxMessageBytes > MAX_REPORT_BYTES) {
      throw new IllegalArgumentException(KEY_REPORT_MAX_BYTES + " must be between " + MIN_REPORT_BYTES
          + " and " + MAX_REPORT_BYTES + " (was " + reportMaxMessageBytes + ")");
    }
  }

  /**
   * Default settings: Information, Warning and Error enabled, metrics off, 4 KiB messages.
   *
   * @return default configuration record
   */
  public static ValidationConfig defaults() {
    return new ValidationConfig(ValidationLevel.DEFAULT, false, 4096);
  }

  /**
   * Builds a configuration from flattened key/value pairs, falling back to {@link #defaults()}.
   *
   * @param values flattened settings such as those returned by {@link YamlConfigLoader#load}
   * @return configuration with supplied values overriding defaults
   * @throws IllegalArgumentException if a value cannot be parsed; the message names the key
   */
  public static ValidationConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ValidationConfig defaults = defaults();

    ValidationLevel levels = defaults.enabledLevels();
    String rawLevels = values.get(KEY_ENABLED_LEVELS);
    if (rawLevels != null && !rawLevels.isBlank()) {
      try {
        levels = ValidationLevel.parse(rawLevels);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(KEY_ENABLED_LEVELS + ": " + ex.getMessage(), ex);
      }
    }

    boolean metrics = parseBoolean(values.get(KEY_METRICS_ENABLED), defaults.metricsEnabled());

    int maxBytes = defaults.reportMaxMessageBytes();
    String rawBytes = values.get(KEY_REPORT_MAX_BYTES);
    if (rawBytes != null && !rawBytes.isBlank()) {
      try {
        maxBytes = Integer.parseInt(rawBytes.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            KEY_REPORT_MAX_BYTES + " must be numeric (was " + rawBytes + ")", ex);
      }
    }
    return new ValidationConfig(levels, metrics, maxBytes);
  }

  private static boolean parseBoolean(String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(
          KEY_METRICS_ENABLED + " must be true or false (was " + raw + ")");
    };
  }
}
