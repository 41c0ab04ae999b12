package ca.gc.cra.rinex.domain.error;

/**
 * <strong>What:</strong> Base type for fatal RINEX decode failures.
 * <p><strong>Why:</strong> Lets callers catch every whole-file abort in one place while subclasses keep
 * the precise failure category.</p>
 * <p><strong>Role:</strong> Domain error raised by the header parser, the grammars, and the dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public class RinexDecodeException extends Exception {
  private final int lineNumber;

  /**
   * Creates an exception tied to a source line.
   *
   * @param message human-readable description
   * @param lineNumber 1-based line number in the source text; {@code 0} when not applicable
   */
  public RinexDecodeException(String message, int lineNumber) {
    super(message);
    this.lineNumber = lineNumber;
  }

  /**
   * Creates an exception tied to a source line with an underlying cause.
   *
   * @param message human-readable description
   * @param lineNumber 1-based line number in the source text; {@code 0} when not applicable
   * @param cause root cause
   */
  public RinexDecodeException(String message, int lineNumber, Throwable cause) {
    super(message, cause);
    this.lineNumber = lineNumber;
  }

  /**
   * Returns the 1-based line number the failure refers to.
   *
   * @return line number, or {@code 0} when the failure is not tied to one line
   */
  public int lineNumber() {
    return lineNumber;
  }
}
