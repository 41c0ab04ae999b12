package ca.gc.cra.rinex.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers.
 * <p><strong>Why:</strong> Source lines quoted in warnings can be arbitrarily long or contain binary
 * garbage; log lines stay bounded and printable.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Shortens text to at most {@code maxChars} characters and replaces control characters with
   * {@code '?'}.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxChars maximum number of characters kept; must be positive
   * @return printable text, suffixed with {@code "... (truncated, N chars)"} when shortened
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    int keep = Math.min(value.length(), maxChars);
    StringBuilder out = new StringBuilder(keep + 32);
    for (int i = 0; i < keep; i++) {
      char c = value.charAt(i);
      out.append(Character.isISOControl(c) ? '?' : c);
    }
    if (value.length() > maxChars) {
      out.append("... (truncated, ").append(value.length()).append(" chars)");
    }
    return out.toString();
  }
}
