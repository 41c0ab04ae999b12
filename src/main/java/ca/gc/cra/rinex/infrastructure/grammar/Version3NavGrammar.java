package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.application.port.RecordSink;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderLine;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.HeaderParser;
import ca.gc.cra.rinex.domain.header.IonosphericCorrection;
import ca.gc.cra.rinex.domain.header.RinexVariant;
import ca.gc.cra.rinex.domain.header.TimeSystemCorrection;
import ca.gc.cra.rinex.domain.record.NavRecord;
import ca.gc.cra.rinex.domain.text.DecodedRecord;
import ca.gc.cra.rinex.domain.text.FieldSpec;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.domain.text.LineCursor;
import ca.gc.cra.rinex.domain.text.RecordLayout;
import ca.gc.cra.rinex.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Grammar for RINEX 3.x navigation files.
 * <p><strong>Why:</strong> Mixed navigation files interleave constellations whose records differ in
 * line count and parameter meaning; the grammar branches on the leading system letter of each record
 * before choosing a parameter table.</p>
 * <p><strong>Role:</strong> {@link RinexVariant#V3_NAV} implementation of {@link RinexGrammar}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode G, E, J, C and I records (7 orbit lines) and R and S records (3 orbit lines, 4 for
 *       GLONASS from version 3.05).</li>
 *   <li>Skip records of unknown constellations with one warning per letter.</li>
 *   <li>Interpret {@code IONOSPHERIC CORR} and {@code TIME SYSTEM CORR} header records.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Version3NavGrammar implements RinexGrammar {
  private static final Logger log = LoggerFactory.getLogger(Version3NavGrammar.class);

  static final int ORBIT_INDENT = 4;

  static final RecordLayout RECORD_START = RecordLayout.of(
      "v3 navigation record",
      FieldSpec.text("satellite", 0, 3),
      FieldSpec.integer("year", 4, 4),
      FieldSpec.integer("month", 9, 2),
      FieldSpec.integer("day", 12, 2),
      FieldSpec.integer("hour", 15, 2),
      FieldSpec.integer("minute", 18, 2),
      FieldSpec.real("second", 21, 2),
      FieldSpec.real("clockBias", 23, 19),
      FieldSpec.real("clockDrift", 42, 19),
      FieldSpec.real("clockDriftRate", 61, 19));

  private static final RecordLayout IONOSPHERIC_CORR = RecordLayout.of(
      "IONOSPHERIC CORR",
      FieldSpec.text("type", 0, 4),
      FieldSpec.real("c0", 5, 12),
      FieldSpec.real("c1", 17, 12),
      FieldSpec.real("c2", 29, 12),
      FieldSpec.real("c3", 41, 12));

  private static final RecordLayout TIME_SYSTEM_CORR = RecordLayout.of(
      "TIME SYSTEM CORR",
      FieldSpec.text("type", 0, 4),
      FieldSpec.real("a0", 5, 17),
      FieldSpec.real("a1", 22, 16),
      FieldSpec.integer("t", 38, 7),
      FieldSpec.integer("w", 45, 5),
      FieldSpec.text("source", 51, 5));

  @Override
  public RinexVariant variant() {
    return RinexVariant.V3_NAV;
  }

  @Override
  public HeaderMetadata parseHeader(HeaderBlock block) throws RinexDecodeException {
    return HeaderParser.parse(block, Version3NavGrammar::handleHeaderRecord);
  }

  private static boolean handleHeaderRecord(
      HeaderLine line, ListIterator<HeaderLine> following, HeaderMetadata.Builder builder)
      throws RinexDecodeException {
    switch (line.label()) {
      case "IONOSPHERIC CORR" -> {
        DecodedRecord rec = IONOSPHERIC_CORR.decode(line.contentLine());
        builder.addIonosphericCorrection(new IonosphericCorrection(rec.text("type"), List.of(
            rec.realOrNaN("c0"), rec.realOrNaN("c1"), rec.realOrNaN("c2"), rec.realOrNaN("c3"))));
        return true;
      }
      case "TIME SYSTEM CORR" -> {
        DecodedRecord rec = TIME_SYSTEM_CORR.decode(line.contentLine());
        builder.addTimeSystemCorrection(new TimeSystemCorrection(
            rec.text("type"), rec.realOrNaN("a0"), rec.realOrNaN("a1"),
            rec.integer("t").orElse(0), rec.integer("w").orElse(0), rec.text("source")));
        return true;
      }
      default -> {
        return false;
      }
    }
  }

  @Override
  public void parseBody(LineCursor cursor, HeaderMetadata header, DecodeContext context, RecordSink sink)
      throws IOException, RinexDecodeException {
    Line line;
    while ((line = cursor.next()) != null) {
      if (line.isBlank()) {
        continue;
      }
      if (line.charAt(0) == ' ') {
        context.warn(WarningKind.SKIPPED_LINE, line.number(),
            "Expected navigation record, skipped '" + Logs.truncate(line.text(), 80) + "'");
        continue;
      }
      Optional<SatelliteId> satellite =
          GrammarSupport.satellite(line, 0, header.defaultConstellation(), context);
      if (satellite.isEmpty()) {
        int skipped = OrbitLines.skip(cursor, ORBIT_INDENT);
        log.debug("Skipped record of unknown constellation at line {} ({} continuation lines)",
            line.number(), skipped);
        continue;
      }
      NavMessageLayout layout = NavLayouts.forConstellation(satellite.get().constellation(), header.version());
      DecodedRecord start = RECORD_START.decode(line);
      Instant epoch = GrammarSupport.epochTime(start, RECORD_START);
      List<Double> orbit = OrbitLines.read(
          cursor, line, satellite.get() + " navigation record", layout, ORBIT_INDENT);
      if (!context.options().acceptsConstellation(satellite.get().constellation())) {
        continue;
      }
      sink.acceptNavRecord(new NavRecord(
          satellite.get(), epoch,
          start.realOrNaN("clockBias"), start.realOrNaN("clockDrift"), start.realOrNaN("clockDriftRate"),
          layout.clockNames(), layout.orbitNames(), orbit, line.number()));
    }
  }
}
