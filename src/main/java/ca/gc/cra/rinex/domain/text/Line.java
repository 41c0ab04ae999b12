package ca.gc.cra.rinex.domain.text;

import java.util.Objects;

/**
 * One physical line of RINEX text together with its 1-based position in the source.
 *
 * <p>Slicing is lenient: columns beyond the end of the line read as blanks, because many writers
 * strip trailing whitespace from fixed-column records.</p>
 *
 * @param number 1-based line number
 * @param text line content without the terminator
 * @since 0.1.0
 */
public record Line(int number, String text) {
  public Line {
    text = Objects.requireNonNull(text, "text");
  }

  /**
   * Returns the characters in {@code [start, start + width)}, clipped to the line length.
   *
   * @param start 0-based first column
   * @param width field width
   * @return slice, possibly shorter than {@code width} or empty
   */
  public String slice(int start, int width) {
    if (start >= text.length()) {
      return "";
    }
    return text.substring(start, Math.min(text.length(), start + width));
  }

  /**
   * Returns the character at a 0-based column, or a blank when the line is shorter.
   *
   * @param column 0-based column
   * @return character or {@code ' '}
   */
  public char charAt(int column) {
    return column < text.length() ? text.charAt(column) : ' ';
  }

  /**
   * Returns whether the given column range is entirely blank.
   *
   * @param start 0-based first column
   * @param width width of the range
   * @return {@code true} when every column in range is whitespace or missing
   */
  public boolean isBlank(int start, int width) {
    return slice(start, width).isBlank();
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
