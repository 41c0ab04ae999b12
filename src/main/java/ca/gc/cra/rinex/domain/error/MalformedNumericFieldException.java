package ca.gc.cra.rinex.domain.error;

/**
 * Raised when a fixed-width numeric field holds text that is not a number.
 *
 * <p>Columns are reported 1-based and inclusive, matching the column tables of the RINEX format
 * documents, so the offending byte range can be located directly in the source file.</p>
 *
 * @since 0.1.0
 */
public final class MalformedNumericFieldException extends RinexDecodeException {
  private final int startColumn;
  private final int endColumn;
  private final String fieldText;

  /**
   * Creates an exception for one field.
   *
   * @param lineNumber 1-based source line
   * @param startColumn 1-based first column of the field
   * @param endColumn 1-based last column of the field (inclusive)
   * @param fieldText raw field text as found in the source
   * @param reason short description of the problem
   */
  public MalformedNumericFieldException(
      int lineNumber, int startColumn, int endColumn, String fieldText, String reason) {
    super(reason + " '" + fieldText + "' at line " + lineNumber
        + ", columns " + startColumn + "-" + endColumn, lineNumber);
    this.startColumn = startColumn;
    this.endColumn = endColumn;
    this.fieldText = fieldText;
  }

  /**
   * Returns the 1-based first column of the field.
   *
   * @return first column
   */
  public int startColumn() {
    return startColumn;
  }

  /**
   * Returns the 1-based last column of the field.
   *
   * @return last column, inclusive
   */
  public int endColumn() {
    return endColumn;
  }

  /**
   * Returns the raw field text.
   *
   * @return text as found in the source line
   */
  public String fieldText() {
    return fieldText;
  }
}
