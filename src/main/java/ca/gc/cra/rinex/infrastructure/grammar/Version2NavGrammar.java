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

/**
 * <strong>What:</strong> Grammar for RINEX 2.x navigation files.
 * <p><strong>Why:</strong> Version 2 navigation files hold one constellation each, named by the
 * file-type letter: {@code N} (GPS, 7 orbit lines), {@code G} (GLONASS, 3) and {@code H} (SBAS, 3).</p>
 * <p><strong>Role:</strong> {@link RinexVariant#V2_NAV} implementation of {@link RinexGrammar}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Version2NavGrammar implements RinexGrammar {
  static final int ORBIT_INDENT = 3;

  static final RecordLayout RECORD_START = RecordLayout.of(
      "v2 navigation record",
      FieldSpec.integer("prn", 0, 2),
      FieldSpec.integer("year", 3, 2),
      FieldSpec.integer("month", 6, 2),
      FieldSpec.integer("day", 9, 2),
      FieldSpec.integer("hour", 12, 2),
      FieldSpec.integer("minute", 15, 2),
      FieldSpec.real("second", 17, 5),
      FieldSpec.real("clockBias", 22, 19),
      FieldSpec.real("clockDrift", 41, 19),
      FieldSpec.real("clockDriftRate", 60, 19));

  private static final RecordLayout ION = RecordLayout.of(
      "ION ALPHA / ION BETA",
      FieldSpec.real("c0", 2, 12),
      FieldSpec.real("c1", 14, 12),
      FieldSpec.real("c2", 26, 12),
      FieldSpec.real("c3", 38, 12));

  private static final RecordLayout DELTA_UTC = RecordLayout.of(
      "DELTA-UTC: A0,A1,T,W",
      FieldSpec.real("a0", 3, 19),
      FieldSpec.real("a1", 22, 19),
      FieldSpec.integer("t", 41, 9),
      FieldSpec.integer("w", 50, 9));

  @Override
  public RinexVariant variant() {
    return RinexVariant.V2_NAV;
  }

  @Override
  public HeaderMetadata parseHeader(HeaderBlock block) throws RinexDecodeException {
    return HeaderParser.parse(block, Version2NavGrammar::handleHeaderRecord);
  }

  private static boolean handleHeaderRecord(
      HeaderLine line, ListIterator<HeaderLine> following, HeaderMetadata.Builder builder)
      throws RinexDecodeException {
    switch (line.label()) {
      case "ION ALPHA", "ION BETA" -> {
        DecodedRecord rec = ION.decode(line.contentLine());
        String type = line.label().endsWith("ALPHA") ? "GPSA" : "GPSB";
        builder.addIonosphericCorrection(new IonosphericCorrection(type, List.of(
            rec.realOrNaN("c0"), rec.realOrNaN("c1"), rec.realOrNaN("c2"), rec.realOrNaN("c3"))));
        return true;
      }
      case "DELTA-UTC: A0,A1,T,W" -> {
        DecodedRecord rec = DELTA_UTC.decode(line.contentLine());
        builder.addTimeSystemCorrection(new TimeSystemCorrection(
            "GPUT", rec.realOrNaN("a0"), rec.realOrNaN("a1"),
            rec.integer("t").orElse(0), rec.integer("w").orElse(0), ""));
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
    NavMessageLayout layout = NavLayouts.forConstellation(header.defaultConstellation(), header.version());
    Line line;
    while ((line = cursor.next()) != null) {
      if (line.isBlank()) {
        continue;
      }
      if (line.isBlank(0, 2)) {
        context.warn(WarningKind.SKIPPED_LINE, line.number(),
            "Expected navigation record, skipped '" + Logs.truncate(line.text(), 80) + "'");
        continue;
      }
      DecodedRecord start = RECORD_START.decode(line);
      SatelliteId satellite = new SatelliteId(header.defaultConstellation(), start.requireInt("prn"));
      Instant epoch = GrammarSupport.epochTime(start, RECORD_START);
      List<Double> orbit = OrbitLines.read(
          cursor, line, satellite + " navigation record", layout, ORBIT_INDENT);
      if (!context.options().acceptsConstellation(satellite.constellation())) {
        continue;
      }
      sink.acceptNavRecord(new NavRecord(
          satellite, epoch,
          start.realOrNaN("clockBias"), start.realOrNaN("clockDrift"), start.realOrNaN("clockDriftRate"),
          layout.clockNames(), layout.orbitNames(), orbit, line.number()));
    }
  }
}
