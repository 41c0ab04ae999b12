package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.application.port.RecordSink;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.error.MalformedHeaderException;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.error.TruncatedRecordException;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.domain.gnss.EpochFlag;
import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderLine;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.HeaderParser;
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
 * <strong>What:</strong> Grammar for RINEX 3.x observation files.
 * <p><strong>Why:</strong> Version 3 starts every epoch with a {@code >} record and every satellite
 * line with its identifier; the observation list is chosen per line from the satellite's
 * constellation letter.</p>
 * <p><strong>Role:</strong> {@link RinexVariant#V3_OBS} implementation of {@link RinexGrammar}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read {@code SYS / # / OBS TYPES} lists per constellation, including continuation records.</li>
 *   <li>Report satellites whose constellation has no list as
 *       {@link WarningKind#UNKNOWN_CONSTELLATION_OBSERVATION_SET}, keeping them with no fields.</li>
 *   <li>Skip stray lines where an epoch record is expected, with a {@link WarningKind#SKIPPED_LINE} warning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Version3ObsGrammar implements RinexGrammar {
  private static final Logger log = LoggerFactory.getLogger(Version3ObsGrammar.class);

  static final String TYPES_LABEL = "SYS / # / OBS TYPES";
  static final char EPOCH_MARKER = '>';
  static final int FIRST_SLOT_COLUMN = 3;

  static final RecordLayout EPOCH = RecordLayout.of(
      "v3 observation epoch",
      FieldSpec.integer("year", 2, 4),
      FieldSpec.integer("month", 7, 2),
      FieldSpec.integer("day", 10, 2),
      FieldSpec.integer("hour", 13, 2),
      FieldSpec.integer("minute", 16, 2),
      FieldSpec.real("second", 18, 11),
      FieldSpec.integer("flag", 31, 1),
      FieldSpec.integer("count", 32, 3),
      FieldSpec.real("clockOffset", 41, 15));

  private static final RecordLayout TYPES = RecordLayout.of(
      TYPES_LABEL,
      FieldSpec.text("system", 0, 1),
      FieldSpec.integer("count", 3, 3));

  @Override
  public RinexVariant variant() {
    return RinexVariant.V3_OBS;
  }

  @Override
  public HeaderMetadata parseHeader(HeaderBlock block) throws RinexDecodeException {
    HeaderMetadata header = HeaderParser.parse(block, Version3ObsGrammar::handleHeaderRecord);
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
    DecodedRecord record = TYPES.decode(line.contentLine());
    String system = record.text("system");
    if (system.isBlank()) {
      // Orphaned continuation record.
      return false;
    }
    int count = record.requireInt("count");
    List<String> codes = HeaderParser.readCodeList(line, following, count, 7);
    Optional<Constellation> constellation = Constellation.fromCode(system.charAt(0));
    if (constellation.isEmpty()) {
      return false;
    }
    builder.constellationObservationTypes(constellation.get(), codes);
    return true;
  }

  @Override
  public void parseBody(LineCursor cursor, HeaderMetadata header, DecodeContext context, RecordSink sink)
      throws IOException, RinexDecodeException {
    Line line;
    while ((line = cursor.next()) != null) {
      if (line.isBlank()) {
        continue;
      }
      if (line.charAt(0) != EPOCH_MARKER) {
        context.warn(WarningKind.SKIPPED_LINE, line.number(),
            "Expected epoch record, skipped '" + Logs.truncate(line.text(), 80) + "'");
        continue;
      }
      DecodedRecord epoch = EPOCH.decode(line);
      EpochFlag flag = GrammarSupport.epochFlag(epoch, EPOCH);
      int count = epoch.integer("count").orElse(0);
      if (flag.announcesSpecialRecords()) {
        for (int i = 0; i < count; i++) {
          GrammarSupport.requireLine(cursor, "event epoch (flag " + flag.code() + ")",
              line.number(), count + 1, i + 1);
        }
        log.debug("Skipped {} special records of flag {} epoch at line {}", count, flag.code(), line.number());
        continue;
      }
      Instant time = GrammarSupport.epochTime(epoch, EPOCH);
      List<ObsSatelliteRecord> records = readSatellites(cursor, line, time, count, header, context);
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

  private static List<ObsSatelliteRecord> readSatellites(
      LineCursor cursor, Line epochLine, Instant time, int count, HeaderMetadata header, DecodeContext context)
      throws IOException, RinexDecodeException {
    List<ObsSatelliteRecord> records = new ArrayList<>(count);
    String what = "epoch " + time;
    for (int i = 0; i < count; i++) {
      Line data = GrammarSupport.requireLine(cursor, what, epochLine.number(), count + 1, i + 1);
      if (data.charAt(0) == EPOCH_MARKER) {
        throw new TruncatedRecordException(what, epochLine.number(), count + 1, i + 1);
      }
      Optional<SatelliteId> satellite =
          GrammarSupport.satellite(data, 0, header.defaultConstellation(), context);
      if (satellite.isEmpty() || !context.options().acceptsConstellation(satellite.get().constellation())) {
        continue;
      }
      Constellation constellation = satellite.get().constellation();
      Optional<List<String>> types = header.observationTypes().typesFor(constellation);
      Map<String, ObservationValue> values = new LinkedHashMap<>();
      if (types.isEmpty()) {
        context.warnOnce(WarningKind.UNKNOWN_CONSTELLATION_OBSERVATION_SET, constellation.name(), data.number(),
            "No observation types declared for constellation " + constellation.code()
                + "; " + satellite.get() + " kept without observations");
      } else {
        List<String> codes = types.get();
        ObservationSlots.decode(data, FIRST_SLOT_COLUMN, codes, 0, codes.size(), context.options(), values);
      }
      records.add(new ObsSatelliteRecord(satellite.get(), values));
    }
    return records;
  }
}
