package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.error.TruncatedRecordException;
import ca.gc.cra.rinex.domain.text.FortranNumbers;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.domain.text.LineCursor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the broadcast-orbit lines of a navigation record.
 *
 * <p>Orbit lines are indented (3 columns in version 2, 4 in version 3) and carry up to four
 * {@code D19.12} values. A line whose indent is not blank starts the next record, so meeting one
 * before the record is complete means the record was truncated.</p>
 */
final class OrbitLines {
  static final int VALUE_WIDTH = 19;

  private OrbitLines() {
    // Utility
  }

  /**
   * Reads and decodes the orbit lines of one record.
   *
   * @param cursor cursor positioned after the record's first line
   * @param first first line of the record
   * @param what record description for errors
   * @param layout parameter table
   * @param indent width of the blank indent
   * @return orbit values aligned with {@link NavMessageLayout#orbitNames()}, {@code NaN} when blank
   * @throws IOException when the source fails
   * @throws TruncatedRecordException when input ends or a new record starts early
   * @throws RinexDecodeException when a value is malformed
   */
  static List<Double> read(LineCursor cursor, Line first, String what, NavMessageLayout layout, int indent)
      throws IOException, RinexDecodeException {
    int expected = layout.orbitLines() + 1;
    List<Double> values = new ArrayList<>(layout.orbitNames().size());
    for (int i = 0; i < layout.orbitLines(); i++) {
      Line next = cursor.peek();
      if (next == null || !next.isBlank(0, indent)) {
        throw new TruncatedRecordException(what, first.number(), expected, i + 1);
      }
      Line line = cursor.next();
      for (int k = 0; k < layout.valuesOnLine(i); k++) {
        values.add(FortranNumbers.decodeReal(line, indent + k * VALUE_WIDTH, VALUE_WIDTH).orElse(Double.NaN));
      }
    }
    return values;
  }

  /**
   * Consumes continuation lines of a record that will not be decoded.
   *
   * @param cursor cursor positioned after the record's first line
   * @param indent width of the blank indent
   * @return number of lines consumed
   * @throws IOException when the source fails
   */
  static int skip(LineCursor cursor, int indent) throws IOException {
    int skipped = 0;
    Line next;
    while ((next = cursor.peek()) != null && !next.isBlank() && next.isBlank(0, indent)) {
      cursor.next();
      skipped++;
    }
    return skipped;
  }
}
