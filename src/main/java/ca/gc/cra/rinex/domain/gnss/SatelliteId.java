package ca.gc.cra.rinex.domain.gnss;

import java.util.Locale;
import java.util.Objects;

/**
 * Satellite identifier: constellation plus PRN (or slot) number.
 *
 * <p>{@link #toString()} yields the canonical three-character RINEX form, e.g. {@code G07}, which is
 * also how {@code "G 7"} and {@code " 7"} normalize.</p>
 *
 * @param constellation owning constellation
 * @param prn PRN or slot number, 1..999
 * @since 0.1.0
 */
public record SatelliteId(Constellation constellation, int prn) {
  public SatelliteId {
    Objects.requireNonNull(constellation, "constellation");
    if (prn < 0 || prn > 999) {
      throw new IllegalArgumentException("prn must be between 0 and 999 (was " + prn + ")");
    }
  }

  /**
   * Parses a canonical identifier such as {@code G01} or {@code R 3}.
   *
   * @param text identifier text
   * @return parsed identifier
   * @throws IllegalArgumentException when the letter or number is invalid
   */
  public static SatelliteId parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.strip();
    if (trimmed.length() < 2) {
      throw new IllegalArgumentException("satellite id too short: '" + text + "'");
    }
    Constellation constellation = Constellation.fromCode(trimmed.charAt(0))
        .orElseThrow(() -> new IllegalArgumentException("unknown constellation in '" + text + "'"));
    try {
      return new SatelliteId(constellation, Integer.parseInt(trimmed.substring(1).trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid satellite number in '" + text + "'", ex);
    }
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%c%02d", constellation.code(), prn);
  }
}
