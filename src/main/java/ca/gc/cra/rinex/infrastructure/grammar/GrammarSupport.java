package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import ca.gc.cra.rinex.domain.error.TruncatedRecordException;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.domain.gnss.EpochFlag;
import ca.gc.cra.rinex.domain.gnss.EpochTimes;
import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.text.DecodedRecord;
import ca.gc.cra.rinex.domain.text.FieldSpec;
import ca.gc.cra.rinex.domain.text.FortranNumbers;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.domain.text.LineCursor;
import ca.gc.cra.rinex.domain.text.RecordLayout;
import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Helpers shared by the four grammars.
 *
 * <p>Epoch layouts name their date fields {@code year}, {@code month}, {@code day}, {@code hour},
 * {@code minute} and {@code second}; {@link #epochTime} relies on that.</p>
 */
final class GrammarSupport {
  private GrammarSupport() {
    // Utility
  }

  /**
   * Builds the timestamp of an epoch or record start line.
   *
   * @param record decoded line
   * @param layout layout the line was decoded with
   * @return timestamp
   * @throws MalformedNumericFieldException when a date field is blank, malformed or out of range
   */
  static Instant epochTime(DecodedRecord record, RecordLayout layout) throws MalformedNumericFieldException {
    FieldSpec first = layout.field("year");
    FieldSpec last = layout.field("second");
    int end = last.start() + last.width();
    return EpochTimes.toInstant(
        EpochTimes.expandTwoDigitYear(record.requireInt("year")),
        record.requireInt("month"),
        record.requireInt("day"),
        record.requireInt("hour"),
        record.requireInt("minute"),
        record.requireReal("second"),
        record.line().number(),
        first.start(),
        end,
        record.line().slice(first.start(), end - first.start()));
  }

  /**
   * Decodes the epoch flag field; a blank flag means {@link EpochFlag#OK}.
   *
   * @param record decoded epoch line
   * @param layout layout declaring a {@code flag} field
   * @return epoch flag
   * @throws MalformedNumericFieldException when the flag is not 0..6
   */
  static EpochFlag epochFlag(DecodedRecord record, RecordLayout layout) throws MalformedNumericFieldException {
    OptionalInt code = record.integer("flag");
    if (code.isEmpty()) {
      return EpochFlag.OK;
    }
    Optional<EpochFlag> flag = EpochFlag.fromCode(code.getAsInt());
    if (flag.isEmpty()) {
      FieldSpec spec = layout.field("flag");
      throw new MalformedNumericFieldException(
          record.line().number(), spec.start() + 1, spec.start() + spec.width(),
          record.line().slice(spec.start(), spec.width()), "Invalid epoch flag");
    }
    return flag.get();
  }

  /**
   * Parses a three-column satellite identifier ({@code G07}, {@code G 7}, {@code  7}).
   *
   * <p>A blank system letter resolves to {@code fallback}. An unknown letter is reported once per
   * letter as {@link WarningKind#UNKNOWN_CONSTELLATION} and yields an empty result.</p>
   *
   * @param line source line
   * @param start 0-based column of the system letter
   * @param fallback constellation used for a blank letter
   * @param context warning accumulator
   * @return satellite identifier, or empty when the letter is unknown
   * @throws MalformedNumericFieldException when the number is blank or malformed
   */
  static Optional<SatelliteId> satellite(Line line, int start, Constellation fallback, DecodeContext context)
      throws MalformedNumericFieldException {
    char letter = line.charAt(start);
    int prn = FortranNumbers.requireInt(line, start + 1, 2);
    if (letter == ' ') {
      return Optional.of(new SatelliteId(fallback, prn));
    }
    Optional<Constellation> constellation = Constellation.fromCode(letter);
    if (constellation.isEmpty()) {
      context.warnOnce(WarningKind.UNKNOWN_CONSTELLATION, String.valueOf(letter), line.number(),
          "Unknown constellation letter '" + letter + "'; records skipped");
      return Optional.empty();
    }
    return Optional.of(new SatelliteId(constellation.get(), prn));
  }

  /**
   * Reads a line that a fixed-size record requires.
   *
   * @param cursor body cursor
   * @param what record description for the error
   * @param startLine line of the record start
   * @param expected total lines the record requires
   * @param found lines of the record already read
   * @return next line
   * @throws IOException when the source fails
   * @throws TruncatedRecordException at end of input
   */
  static Line requireLine(LineCursor cursor, String what, int startLine, int expected, int found)
      throws IOException, TruncatedRecordException {
    Line line = cursor.next();
    if (line == null) {
      throw new TruncatedRecordException(what, startLine, expected, found);
    }
    return line;
  }
}
