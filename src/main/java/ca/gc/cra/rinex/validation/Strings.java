package ca.gc.cra.rinex.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * String validation helpers for configuration values.
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name used in diagnostics; {@code "value"} when {@code null}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Splits a comma- or whitespace-separated list, dropping empty tokens.
   *
   * @param name parameter name used in diagnostics
   * @param value list text; {@code null} or blank yields an empty list
   * @return trimmed tokens in order
   * @throws IllegalArgumentException if a token contains control characters
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : value.split("[,\\s]+")) {
      if (!token.isEmpty()) {
        tokens.add(requireNonBlank(name, token));
      }
    }
    return List.copyOf(tokens);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
