package ca.gc.cra.rinex.domain.header;

import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of supported format variants.
 * <p><strong>Why:</strong> The dispatcher selects exactly one variant per file; each variant owns its
 * grammar, so no shared code branches on version internally.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum RinexVariant {
  V2_NAV(2, FileType.NAV),
  V2_OBS(2, FileType.OBS),
  V3_NAV(3, FileType.NAV),
  V3_OBS(3, FileType.OBS);

  private final int majorVersion;
  private final FileType fileType;

  RinexVariant(int majorVersion, FileType fileType) {
    this.majorVersion = majorVersion;
    this.fileType = fileType;
  }

  public int majorVersion() {
    return majorVersion;
  }

  public FileType fileType() {
    return fileType;
  }

  /**
   * Finds the variant for a major version and file family.
   *
   * @param majorVersion integral part of the declared version
   * @param fileType file family
   * @return matching variant, or empty when unsupported
   */
  public static Optional<RinexVariant> of(int majorVersion, FileType fileType) {
    for (RinexVariant variant : values()) {
      if (variant.majorVersion == majorVersion && variant.fileType == fileType) {
        return Optional.of(variant);
      }
    }
    return Optional.empty();
  }
}
