package ca.gc.cra.rinex.domain.header;

import ca.gc.cra.rinex.domain.text.Line;
import java.util.Objects;

/**
 * Header record split into its 60-column content and its label (columns 61-80).
 *
 * @param number 1-based source line
 * @param content columns 1-60, untrimmed so fixed-column parsers can slice it
 * @param label trimmed label
 * @since 0.1.0
 */
public record HeaderLine(int number, String content, String label) {
  static final int LABEL_COLUMN = 60;

  public HeaderLine {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(label, "label");
  }

  /**
   * Splits a raw line at column 61.
   *
   * @param line source line
   * @return header line
   */
  public static HeaderLine of(Line line) {
    String text = line.text();
    if (text.length() <= LABEL_COLUMN) {
      return new HeaderLine(line.number(), text, "");
    }
    return new HeaderLine(
        line.number(), text.substring(0, LABEL_COLUMN), text.substring(LABEL_COLUMN).trim());
  }

  /**
   * Returns the content columns as a {@link Line} for fixed-column decoding.
   *
   * @return content line carrying the original line number
   */
  public Line contentLine() {
    return new Line(number, content);
  }
}
