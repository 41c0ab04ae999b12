package ca.gc.cra.rinex.domain.error;

/**
 * Raised when the header block ends without a {@code RINEX VERSION / TYPE} record.
 *
 * @since 0.1.0
 */
public final class MissingVersionHeaderException extends RinexDecodeException {
  /**
   * Creates the exception.
   *
   * @param lineNumber line where the header block ended
   */
  public MissingVersionHeaderException(int lineNumber) {
    super("No RINEX VERSION / TYPE record before line " + lineNumber, lineNumber);
  }
}
