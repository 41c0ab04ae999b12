package ca.gc.cra.rinex.domain.gnss;

import java.util.Optional;

/**
 * <strong>What:</strong> GNSS constellations identified by the leading letter of a RINEX satellite id.
 * <p><strong>Role:</strong> Domain enumeration used to select observation-type lists and navigation
 * parameter tables.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Constellation {
  GPS('G', "GPS"),
  GLONASS('R', "GLO"),
  GALILEO('E', "GAL"),
  QZSS('J', "QZS"),
  BEIDOU('C', "BDT"),
  IRNSS('I', "IRN"),
  SBAS('S', "GPS");

  private final char code;
  private final String timeSystem;

  Constellation(char code, String timeSystem) {
    this.code = code;
    this.timeSystem = timeSystem;
  }

  /**
   * Returns the single-letter system identifier used in RINEX.
   *
   * @return system letter
   */
  public char code() {
    return code;
  }

  /**
   * Returns the three-letter time system the constellation broadcasts in.
   *
   * @return time system identifier as used in {@code TIME OF FIRST OBS}
   */
  public String timeSystem() {
    return timeSystem;
  }

  /**
   * Resolves a system letter.
   *
   * @param code system letter (case-insensitive)
   * @return matching constellation, or empty for unknown letters
   */
  public static Optional<Constellation> fromCode(char code) {
    char upper = Character.toUpperCase(code);
    for (Constellation constellation : values()) {
      if (constellation.code == upper) {
        return Optional.of(constellation);
      }
    }
    return Optional.empty();
  }
}
