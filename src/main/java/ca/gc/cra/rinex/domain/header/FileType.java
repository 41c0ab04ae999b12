package ca.gc.cra.rinex.domain.header;

import java.util.Optional;

/**
 * File family declared in column 21 of the {@code RINEX VERSION / TYPE} record.
 *
 * @since 0.1.0
 */
public enum FileType {
  /** Observation data ({@code O}). */
  OBS,
  /** Navigation message ({@code N}; version 2 also uses {@code G} for GLONASS and {@code H} for SBAS). */
  NAV;

  /**
   * Maps a file-type letter.
   *
   * @param code letter from the version record
   * @return file family, or empty for unsupported families (meteorological, clock, ...)
   */
  public static Optional<FileType> fromCode(char code) {
    return switch (Character.toUpperCase(code)) {
      case 'O' -> Optional.of(OBS);
      case 'N', 'G', 'H' -> Optional.of(NAV);
      default -> Optional.empty();
    };
  }
}
