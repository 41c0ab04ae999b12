package ca.gc.cra.rinex.domain.error;

/**
 * Raised when the declared version or file type has no matching grammar.
 *
 * @since 0.1.0
 */
public final class UnsupportedVersionException extends RinexDecodeException {
  private final double version;
  private final char fileType;

  /**
   * Creates the exception.
   *
   * @param version declared format version
   * @param fileType declared file-type letter
   * @param lineNumber line of the {@code RINEX VERSION / TYPE} record
   */
  public UnsupportedVersionException(double version, char fileType, int lineNumber) {
    super("Unsupported RINEX version " + version + " with file type '" + fileType + "'", lineNumber);
    this.version = version;
    this.fileType = fileType;
  }

  /**
   * Returns the declared version.
   *
   * @return version number as written in the header
   */
  public double version() {
    return version;
  }

  /**
   * Returns the declared file-type letter.
   *
   * @return file type letter from column 21 of the version record
   */
  public char fileType() {
    return fileType;
  }
}
