package ca.gc.cra.logmerge.validation;

/**
 * Range checks and strict parsing for numeric CLI and YAML settings.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal setting and checks its range.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or is out of range
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a whole number (was " + trimmed + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
