package ca.gc.cra.rinex.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing.
 * <p><strong>Why:</strong> Rejects out-of-range worker counts and non-positive intervals before a decode
 * allocates resources.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics; {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException when the value is outside the range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a strictly positive, finite decimal.
   *
   * @param name parameter name used in diagnostics
   * @param text candidate text
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a positive finite number
   */
  public static double parsePositive(String name, String text) {
    double value;
    try {
      value = Double.parseDouble(Strings.requireNonBlank(name, text));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + text + "')", ex);
    }
    if (!(value > 0) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + text + ")");
    }
    return value;
  }

  /**
   * Parses an integer within an inclusive range.
   *
   * @param name parameter name used in diagnostics
   * @param text candidate text
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer in range
   */
  public static int parseIntInRange(String name, String text, int min, int max) {
    try {
      return (int) requireRange(name, Integer.parseInt(Strings.requireNonBlank(name, text)), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + text + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
