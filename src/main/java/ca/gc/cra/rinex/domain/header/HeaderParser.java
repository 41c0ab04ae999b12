package ca.gc.cra.rinex.domain.header;

import ca.gc.cra.rinex.domain.error.MalformedHeaderException;
import ca.gc.cra.rinex.domain.error.MissingVersionHeaderException;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.error.UnsupportedVersionException;
import ca.gc.cra.rinex.domain.gnss.EpochTimes;
import ca.gc.cra.rinex.domain.text.DecodedRecord;
import ca.gc.cra.rinex.domain.text.FieldSpec;
import ca.gc.cra.rinex.domain.text.FortranNumbers;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.domain.text.LineCursor;
import ca.gc.cra.rinex.domain.text.RecordLayout;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * <strong>What:</strong> Reads and interprets the labeled header block of a RINEX file.
 * <p><strong>Why:</strong> Header records are not strictly ordered, so interpretation dispatches on the
 * label in columns 61-80 rather than on position.</p>
 * <p><strong>Role:</strong> Domain service used in two steps: {@link #readBlock(LineCursor)} collects the
 * raw block and the version record so the dispatcher can pick a grammar, then
 * {@link #parse(HeaderBlock, HeaderRecordHandler)} interprets the records shared by every version and
 * offers the rest to the grammar's handler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fail with {@link MissingVersionHeaderException} when no version record precedes the end marker.</li>
 *   <li>Fail with {@link MalformedHeaderException} when input ends before the end marker.</li>
 *   <li>Keep labels nobody interprets as pass-through attributes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class HeaderParser {
  public static final String VERSION_LABEL = "RINEX VERSION / TYPE";
  public static final String END_LABEL = "END OF HEADER";
  public static final String COMMENT_LABEL = "COMMENT";

  static final RecordLayout VERSION = RecordLayout.of(
      "RINEX VERSION / TYPE",
      FieldSpec.real("version", 0, 9),
      FieldSpec.text("fileType", 20, 1),
      FieldSpec.text("system", 40, 1));

  static final RecordLayout APPROX_POSITION = RecordLayout.of(
      "APPROX POSITION XYZ",
      FieldSpec.real("x", 0, 14),
      FieldSpec.real("y", 14, 14),
      FieldSpec.real("z", 28, 14));

  static final RecordLayout INTERVAL = RecordLayout.of(
      "INTERVAL",
      FieldSpec.real("interval", 0, 10));

  static final RecordLayout TIME_OF_FIRST_OBS = RecordLayout.of(
      "TIME OF FIRST OBS",
      FieldSpec.integer("year", 0, 6),
      FieldSpec.integer("month", 6, 6),
      FieldSpec.integer("day", 12, 6),
      FieldSpec.integer("hour", 18, 6),
      FieldSpec.integer("minute", 24, 6),
      FieldSpec.real("second", 30, 13),
      FieldSpec.text("system", 48, 3));

  static final RecordLayout SINGLE_INTEGER = RecordLayout.of(
      "integer record",
      FieldSpec.integer("value", 0, 6));

  static final RecordLayout MARKER_NAME = RecordLayout.of(
      "MARKER NAME",
      FieldSpec.text("name", 0, 60));

  private HeaderParser() {
    // Utility
  }

  /**
   * Reads header records up to and including {@code END OF HEADER}.
   *
   * @param cursor cursor positioned at the start of the file
   * @return raw header block with the decoded version record
   * @throws IOException when the source fails
   * @throws MissingVersionHeaderException when no version record precedes the end marker
   * @throws MalformedHeaderException when input ends before the end marker
   * @throws RinexDecodeException when the version record itself is malformed
   */
  public static HeaderBlock readBlock(LineCursor cursor) throws IOException, RinexDecodeException {
    Objects.requireNonNull(cursor, "cursor");
    List<HeaderLine> lines = new ArrayList<>();
    DecodedRecord version = null;
    Line line;
    while ((line = cursor.next()) != null) {
      HeaderLine headerLine = HeaderLine.of(line);
      if (isEndOfHeader(headerLine, line)) {
        if (version == null) {
          throw new MissingVersionHeaderException(line.number());
        }
        return toBlock(lines, version, line.number());
      }
      if (version == null && VERSION_LABEL.equals(headerLine.label())) {
        version = VERSION.decode(headerLine.contentLine());
      }
      lines.add(headerLine);
    }
    if (version == null) {
      throw new MissingVersionHeaderException(cursor.lineNumber());
    }
    throw new MalformedHeaderException(
        "Header block not terminated by " + END_LABEL, cursor.lineNumber());
  }

  /**
   * Interprets a header block.
   *
   * @param block raw header block
   * @param handler version-specific handler offered every record the shared parser does not own
   * @return immutable metadata
   * @throws UnsupportedVersionException when the file type letter is not supported
   * @throws RinexDecodeException when a record is malformed
   */
  public static HeaderMetadata parse(HeaderBlock block, HeaderRecordHandler handler)
      throws RinexDecodeException {
    Objects.requireNonNull(block, "block");
    Objects.requireNonNull(handler, "handler");
    FileType fileType = block.fileType().orElseThrow(() -> new UnsupportedVersionException(
        block.version(), block.fileTypeCode(), block.versionLineNumber()));
    HeaderMetadata.Builder builder =
        HeaderMetadata.builder(block.version(), block.fileTypeCode(), fileType, block.systemCode());
    ListIterator<HeaderLine> it = block.lines().listIterator();
    while (it.hasNext()) {
      HeaderLine line = it.next();
      String label = line.label();
      switch (label) {
        case VERSION_LABEL, COMMENT_LABEL, "" -> {
          // Nothing to keep.
        }
        case "MARKER NAME" -> builder.markerName(MARKER_NAME.decode(line.contentLine()).text("name"));
        case "APPROX POSITION XYZ" -> {
          DecodedRecord rec = APPROX_POSITION.decode(line.contentLine());
          builder.approxPosition(
              new Position(rec.realOrNaN("x"), rec.realOrNaN("y"), rec.realOrNaN("z")));
        }
        case "INTERVAL" -> INTERVAL.decode(line.contentLine()).real("interval").ifPresent(builder::interval);
        case "TIME OF FIRST OBS" -> parseTimeOfFirstObs(line, builder);
        case "LEAP SECONDS" ->
            SINGLE_INTEGER.decode(line.contentLine()).integer("value").ifPresent(builder::leapSeconds);
        case "RCV CLOCK OFFS APPL" -> SINGLE_INTEGER.decode(line.contentLine())
            .integer("value").ifPresent(builder::receiverClockOffsetApplied);
        default -> {
          if (!handler.handle(line, it, builder)) {
            builder.passthrough(label, line.content());
          }
        }
      }
    }
    return builder.build();
  }

  /**
   * Collects whitespace-separated codes from a record and its continuation records.
   *
   * <p>Continuation records carry the same label and leave the count columns blank; collection
   * stops once {@code expected} codes are read or the next record has a different label.</p>
   *
   * @param first record holding the count
   * @param following iterator positioned after {@code first}
   * @param expected declared number of codes
   * @param tokenStart 0-based column where codes start on every record
   * @return codes in file order, at most {@code expected}
   */
  public static List<String> readCodeList(
      HeaderLine first, ListIterator<HeaderLine> following, int expected, int tokenStart) {
    List<String> codes = new ArrayList<>(Math.max(expected, 0));
    addTokens(first, tokenStart, codes);
    while (codes.size() < expected && following.hasNext()) {
      HeaderLine next = following.next();
      if (!next.label().equals(first.label())) {
        following.previous();
        break;
      }
      addTokens(next, tokenStart, codes);
    }
    return codes.size() > expected ? List.copyOf(codes.subList(0, expected)) : codes;
  }

  private static void addTokens(HeaderLine line, int tokenStart, List<String> codes) {
    String text = line.contentLine().slice(tokenStart, HeaderLine.LABEL_COLUMN - tokenStart).trim();
    if (!text.isEmpty()) {
      codes.addAll(Arrays.asList(text.split("\\s+")));
    }
  }

  private static void parseTimeOfFirstObs(HeaderLine line, HeaderMetadata.Builder builder)
      throws RinexDecodeException {
    DecodedRecord rec = TIME_OF_FIRST_OBS.decode(line.contentLine());
    builder.declaredTimeSystem(rec.text("system"));
    if (rec.integer("year").isEmpty()) {
      return;
    }
    Line content = line.contentLine();
    builder.timeOfFirstObs(EpochTimes.toInstant(
        EpochTimes.expandTwoDigitYear(rec.requireInt("year")),
        rec.requireInt("month"),
        rec.requireInt("day"),
        rec.requireInt("hour"),
        rec.requireInt("minute"),
        rec.requireReal("second"),
        line.number(), 0, 43, content.slice(0, 43)));
  }

  private static boolean isEndOfHeader(HeaderLine headerLine, Line line) {
    if (END_LABEL.equals(headerLine.label())) {
      return true;
    }
    // Misaligned terminator: only a line with no label and nothing but the marker qualifies.
    return headerLine.label().isEmpty() && END_LABEL.equals(line.text().trim());
  }

  private static HeaderBlock toBlock(List<HeaderLine> lines, DecodedRecord version, int endLine)
      throws RinexDecodeException {
    double declared = version.requireReal("version");
    return new HeaderBlock(
        lines,
        declared,
        firstChar(version.text("fileType")),
        firstChar(version.text("system")),
        version.line().number(),
        endLine);
  }

  private static char firstChar(String text) {
    return text.isEmpty() ? ' ' : text.charAt(0);
  }

  /**
   * Decodes one real field of a header record, mapping blanks to {@code NaN}.
   *
   * @param line header record
   * @param start 0-based first column
   * @param width field width
   * @return value or NaN
   * @throws RinexDecodeException when the field is not numeric
   */
  public static double realOrNaN(HeaderLine line, int start, int width) throws RinexDecodeException {
    return FortranNumbers.decodeReal(line.contentLine(), start, width).orElse(Double.NaN);
  }
}
