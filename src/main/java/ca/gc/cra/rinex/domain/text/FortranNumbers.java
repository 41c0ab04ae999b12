package ca.gc.cra.rinex.domain.text;

import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Decoder for Fortran-style fixed-width numeric fields.
 * <p><strong>Why:</strong> RINEX writers emit {@code F}, {@code E} and {@code D} edit descriptors, leave
 * unavailable values blank, and occasionally put stray text in numeric columns. Blank must stay
 * distinguishable from zero, and stray text must never be coerced.</p>
 * <p><strong>Role:</strong> Leaf utility shared by the header parser and every grammar.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept {@code D}, {@code d}, {@code E}, {@code e} exponent markers interchangeably.</li>
 *   <li>Accept unsigned exponents and fields without a decimal point.</li>
 *   <li>Report blank fields as empty optionals.</li>
 *   <li>Reject anything else with {@link MalformedNumericFieldException} carrying line and columns.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Validation runs before {@link Double#parseDouble(String)} because the JDK parser also
 *     accepts {@code NaN}, {@code Infinity}, hexadecimal literals and {@code f}/{@code d} suffixes.
 * @since 0.1.0
 */
public final class FortranNumbers {
  private static final Pattern REAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[EeDd][+-]?\\d+)?");
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

  private FortranNumbers() {
    // Utility
  }

  /**
   * Decodes a real-valued field.
   *
   * @param field raw field text (may be shorter than the declared width)
   * @param lineNumber 1-based line used for diagnostics
   * @param start 0-based first column used for diagnostics
   * @param width declared field width used for diagnostics
   * @return decoded value, or empty when the field is blank
   * @throws MalformedNumericFieldException when the field is non-blank and not a number
   */
  public static OptionalDouble decodeReal(String field, int lineNumber, int start, int width)
      throws MalformedNumericFieldException {
    String token = field == null ? "" : field.trim();
    if (token.isEmpty()) {
      return OptionalDouble.empty();
    }
    if (!REAL.matcher(token).matches()) {
      throw malformed(field, lineNumber, start, width, "Malformed numeric field");
    }
    return OptionalDouble.of(Double.parseDouble(normalizeExponent(token)));
  }

  /**
   * Decodes an integer field.
   *
   * @param field raw field text (may be shorter than the declared width)
   * @param lineNumber 1-based line used for diagnostics
   * @param start 0-based first column used for diagnostics
   * @param width declared field width used for diagnostics
   * @return decoded value, or empty when the field is blank
   * @throws MalformedNumericFieldException when the field is non-blank and not an integer
   */
  public static OptionalInt decodeInt(String field, int lineNumber, int start, int width)
      throws MalformedNumericFieldException {
    String token = field == null ? "" : field.trim();
    if (token.isEmpty()) {
      return OptionalInt.empty();
    }
    if (!INTEGER.matcher(token).matches()) {
      throw malformed(field, lineNumber, start, width, "Malformed integer field");
    }
    try {
      return OptionalInt.of(Integer.parseInt(token));
    } catch (NumberFormatException ex) {
      throw malformed(field, lineNumber, start, width, "Integer field out of range");
    }
  }

  public static OptionalDouble decodeReal(Line line, int start, int width)
      throws MalformedNumericFieldException {
    return decodeReal(line.slice(start, width), line.number(), start, width);
  }

  public static OptionalInt decodeInt(Line line, int start, int width)
      throws MalformedNumericFieldException {
    return decodeInt(line.slice(start, width), line.number(), start, width);
  }

  /**
   * Decodes a real field that must be present.
   *
   * @param line source line
   * @param start 0-based first column
   * @param width field width
   * @return decoded value
   * @throws MalformedNumericFieldException when the field is blank or malformed
   */
  public static double requireReal(Line line, int start, int width) throws MalformedNumericFieldException {
    OptionalDouble value = decodeReal(line, start, width);
    if (value.isEmpty()) {
      throw malformed(line.slice(start, width), line.number(), start, width, "Missing required numeric field");
    }
    return value.getAsDouble();
  }

  /**
   * Decodes an integer field that must be present.
   *
   * @param line source line
   * @param start 0-based first column
   * @param width field width
   * @return decoded value
   * @throws MalformedNumericFieldException when the field is blank or malformed
   */
  public static int requireInt(Line line, int start, int width) throws MalformedNumericFieldException {
    OptionalInt value = decodeInt(line, start, width);
    if (value.isEmpty()) {
      throw malformed(line.slice(start, width), line.number(), start, width, "Missing required integer field");
    }
    return value.getAsInt();
  }

  /**
   * Rewrites a Fortran {@code D} exponent marker to the {@code E} form understood by the JDK.
   *
   * @param token trimmed numeric token
   * @return token with {@code D}/{@code d} replaced by {@code E}
   */
  static String normalizeExponent(String token) {
    return token.replace('D', 'E').replace('d', 'E');
  }

  static MalformedNumericFieldException malformed(
      String field, int lineNumber, int start, int width, String reason) {
    return new MalformedNumericFieldException(
        lineNumber, start + 1, start + width, field == null ? "" : field, reason);
  }
}
