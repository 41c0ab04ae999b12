package ca.gc.cra.rinex.domain.error;

/**
 * Raised when a fixed-size record ends before all of its lines are present.
 *
 * @since 0.1.0
 */
public final class TruncatedRecordException extends RinexDecodeException {
  private final int expectedLines;
  private final int foundLines;

  /**
   * Creates the exception.
   *
   * @param what record description, e.g. {@code "G05 navigation record"}
   * @param lineNumber line of the record start
   * @param expectedLines number of lines the record requires
   * @param foundLines number of lines actually present
   */
  public TruncatedRecordException(String what, int lineNumber, int expectedLines, int foundLines) {
    super(what + " starting at line " + lineNumber + " is truncated: expected "
        + expectedLines + " lines, found " + foundLines, lineNumber);
    this.expectedLines = expectedLines;
    this.foundLines = foundLines;
  }

  public int expectedLines() {
    return expectedLines;
  }

  public int foundLines() {
    return foundLines;
  }
}
