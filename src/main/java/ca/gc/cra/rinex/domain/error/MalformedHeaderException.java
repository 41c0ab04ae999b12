package ca.gc.cra.rinex.domain.error;

/**
 * Raised when the header block is structurally unusable: it is not terminated, or an observation
 * file declares no usable observation-type list.
 *
 * @since 0.1.0
 */
public final class MalformedHeaderException extends RinexDecodeException {
  /**
   * Creates the exception.
   *
   * @param message description of the structural problem
   * @param lineNumber offending line, or {@code 0}
   */
  public MalformedHeaderException(String message, int lineNumber) {
    super(message, lineNumber);
  }
}
