package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.application.port.RecordSink;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.error.MalformedHeaderException;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.domain.gnss.EpochFlag;
import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderLine;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.HeaderParser;
import ca.gc.cra.rinex.domain.header.ObservationTypeTable;
import ca.gc.cra.rinex.domain.header.RinexVariant;
import ca.gc.cra.rinex.domain.record.ObsEpoch;
import ca.gc.cra.rinex.domain.record.ObsSatelliteRecord;
import ca.gc.cra.rinex.domain.record.ObservationValue;
import ca.gc.cra.rinex.domain.text.DecodedRecord;
import ca.gc.cra.rinex.domain.text.FieldSpec;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.domain.text.LineCursor;
import ca.gc.cra.rinex.domain.text.RecordLayout;
import ca.gc.cra.rinex.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Grammar for RINEX 2.x observation files.
 * <p><strong>Why:</strong> Version 2 lists the satellites of an epoch on the epoch line (12 per line,
 * continuing onto extra lines) and spreads each satellite's observations over lines of 5 slots.</p>
 * <p><strong>Role:</strong> {@link RinexVariant#V2_OBS} implementation of {@link RinexGrammar}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the global {@code # / TYPES OF OBSERV} list, including continuation records.</li>
 *   <li>Consume special-record epochs (flags 2-5) and cycle-slip epochs (flag 6) without emitting data.</li>
 *   <li>Consume every line of a filtered or skipped epoch so the cursor stays on epoch boundaries.</li>
 *   <li>Skip stray lines where an epoch record is expected, with a {@link WarningKind#SKIPPED_LINE} warning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Version2ObsGrammar implements RinexGrammar {
  private static final Logger log = LoggerFactory.getLogger(Version2ObsGrammar.class);

  static final String TYPES_LABEL = "# / TYPES OF OBSERV";
  static final int SATELLITES_PER_LINE = 12;
  static final int SLOTS_PER_LINE = 5;
  static final int SATELLITE_LIST_COLUMN = 32;

  static final RecordLayout EPOCH = RecordLayout.of(
      "v2 observation epoch",
      FieldSpec.integer("year", 1, 2),
      FieldSpec.integer("month", 4, 2),
      FieldSpec.integer("day", 7, 2),
      FieldSpec.integer("hour", 10, 2),
      FieldSpec.integer("minute", 13, 2),
      FieldSpec.real("second", 15, 11),
      FieldSpec.integer("flag", 28, 1),
      FieldSpec.integer("count", 29, 3),
      FieldSpec.real("clockOffset", 68, 12));

  private static final RecordLayout TYPES = RecordLayout.of(
      TYPES_LABEL,
      FieldSpec.integer("count", 0, 6));

  @Override
  public RinexVariant variant() {
    return RinexVariant.V2_OBS;
  }

  @Override
  public HeaderMetadata parseHeader(HeaderBlock block) throws RinexDecodeException {
    HeaderMetadata header = HeaderParser.parse(block, Version2ObsGrammar::handleHeaderRecord);
    if (header.observationTypes().isEmpty()) {
      throw new MalformedHeaderException(
          "Observation header declares no " + TYPES_LABEL, block.endLineNumber());
    }
    return header;
  }

  private static boolean handleHeaderRecord(
      HeaderLine line, ListIterator<HeaderLine> following, HeaderMetadata.Builder builder)
      throws RinexDecodeException {
    if (!TYPES_LABEL.equals(line.label())) {
      return false;
    }
    int count = TYPES.decode(line.contentLine()).requireInt("count");
    List<String> codes = HeaderParser.readCodeList(line, following, count, 6);
    builder.observationTypes(ObservationTypeTable.global(codes));
    return true;
  }

  @Override
  public void parseBody(LineCursor cursor, HeaderMetadata header, DecodeContext context, RecordSink sink)
      throws IOException, RinexDecodeException {
    List<String> types = header.observationTypes().typesFor(header.defaultConstellation()).orElseThrow();
    int linesPerSatellite = Math.max(1, (types.size() + SLOTS_PER_LINE - 1) / SLOTS_PER_LINE);
    Line line;
    while ((line = cursor.next()) != null) {
      if (line.isBlank()) {
        continue;
      }
      if (!looksLikeEpoch(line)) {
        context.warn(WarningKind.SKIPPED_LINE, line.number(),
            "Expected epoch record, skipped '" + Logs.truncate(line.text(), 80) + "'");
        continue;
      }
      DecodedRecord epoch = EPOCH.decode(line);
      EpochFlag flag = GrammarSupport.epochFlag(epoch, EPOCH);
      int count = epoch.integer("count").orElse(0);
      if (flag.announcesSpecialRecords()) {
        skipSpecialRecords(cursor, line, flag, count);
        continue;
      }
      Instant time = GrammarSupport.epochTime(epoch, EPOCH);
      List<Optional<SatelliteId>> satellites = readSatelliteList(cursor, line, count, header, context);
      String what = "epoch " + time;
      List<ObsSatelliteRecord> records = new ArrayList<>(satellites.size());
      int expectedLines = 1 + linesPerSatellite * satellites.size();
      for (int i = 0; i < satellites.size(); i++) {
        Optional<SatelliteId> sat = satellites.get(i);
        boolean keep = sat.isPresent() && context.options().acceptsConstellation(sat.get().constellation());
        Map<String, ObservationValue> values = new LinkedHashMap<>();
        for (int j = 0; j < linesPerSatellite; j++) {
          Line data = GrammarSupport.requireLine(
              cursor, what, line.number(), expectedLines, 1 + linesPerSatellite * i + j);
          if (keep) {
            int from = j * SLOTS_PER_LINE;
            ObservationSlots.decode(
                data, 0, types, from, Math.min(types.size(), from + SLOTS_PER_LINE), context.options(), values);
          }
        }
        if (keep) {
          records.add(new ObsSatelliteRecord(sat.get(), values));
        }
      }
      if (flag == EpochFlag.CYCLE_SLIP) {
        log.debug("Discarded cycle-slip epoch {} at line {}", time, line.number());
        continue;
      }
      switch (context.admit(time)) {
        case STOP -> {
          return;
        }
        case SKIP -> {
          continue;
        }
        default -> sink.acceptEpoch(new ObsEpoch(
            time, flag, epoch.real("clockOffset"), records, line.number()));
      }
    }
  }

  /**
   * Checks the fixed punctuation of an epoch line. Each two-column date field is preceded by a blank
   * and ends in a digit; column 29 holds the flag. Event epochs may leave the whole date blank.
   *
   * @param line candidate line
   * @return whether the line can be decoded as an epoch record
   */
  static boolean looksLikeEpoch(Line line) {
    if (line.charAt(0) != ' ') {
      return false;
    }
    char flag = line.charAt(28);
    if (line.isBlank(0, 26)) {
      return Character.isDigit(flag);
    }
    for (int column = 0; column < 15; column += 3) {
      if (line.charAt(column) != ' ' || !Character.isDigit(line.charAt(column + 2))) {
        return false;
      }
    }
    return flag == ' ' || Character.isDigit(flag);
  }

  private static void skipSpecialRecords(LineCursor cursor, Line epochLine, EpochFlag flag, int count)
      throws IOException, RinexDecodeException {
    for (int i = 0; i < count; i++) {
      GrammarSupport.requireLine(cursor, "event epoch (flag " + flag.code() + ")",
          epochLine.number(), count + 1, i + 1);
    }
    log.debug("Skipped {} special records of flag {} epoch at line {}", count, flag.code(), epochLine.number());
  }

  private static List<Optional<SatelliteId>> readSatelliteList(
      LineCursor cursor, Line epochLine, int count, HeaderMetadata header, DecodeContext context)
      throws IOException, RinexDecodeException {
    List<Optional<SatelliteId>> satellites = new ArrayList<>(count);
    Constellation fallback = header.defaultConstellation();
    Line current = epochLine;
    int listLines = (count + SATELLITES_PER_LINE - 1) / SATELLITES_PER_LINE;
    for (int i = 0; i < count; i++) {
      int slot = i % SATELLITES_PER_LINE;
      if (i > 0 && slot == 0) {
        current = GrammarSupport.requireLine(cursor, "satellite list", epochLine.number(),
            listLines, i / SATELLITES_PER_LINE);
      }
      satellites.add(GrammarSupport.satellite(
          current, SATELLITE_LIST_COLUMN + 3 * slot, fallback, context));
    }
    return satellites;
  }
}
