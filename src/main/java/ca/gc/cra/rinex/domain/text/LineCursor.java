package ca.gc.cra.rinex.domain.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * <strong>What:</strong> Forward-only cursor over the lines of one RINEX source.
 * <p><strong>Why:</strong> The grammars are line-synchronized state machines; a single cursor with a
 * one-line lookahead keeps the line count exact for error reporting.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one cursor belongs to one decode.</p>
 *
 * @since 0.1.0
 */
public final class LineCursor implements AutoCloseable {
  private final BufferedReader reader;
  private int lineNumber;
  private Line peeked;

  /**
   * Creates a cursor over the given reader.
   *
   * @param reader character source; buffered internally when needed
   */
  public LineCursor(Reader reader) {
    Objects.requireNonNull(reader, "reader");
    this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
  }

  /**
   * Consumes and returns the next line.
   *
   * @return next line, or {@code null} at end of input
   * @throws IOException when the underlying reader fails
   */
  public Line next() throws IOException {
    if (peeked != null) {
      Line line = peeked;
      peeked = null;
      return line;
    }
    return read();
  }

  /**
   * Returns the next line without consuming it.
   *
   * @return next line, or {@code null} at end of input
   * @throws IOException when the underlying reader fails
   */
  public Line peek() throws IOException {
    if (peeked == null) {
      peeked = read();
    }
    return peeked;
  }

  /**
   * Returns the number of the last line read from the source (including a peeked line).
   *
   * @return 1-based line number, {@code 0} before the first read
   */
  public int lineNumber() {
    return lineNumber;
  }

  private Line read() throws IOException {
    String text = reader.readLine();
    if (text == null) {
      return null;
    }
    lineNumber++;
    return new Line(lineNumber, text);
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
