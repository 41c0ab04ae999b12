package ca.gc.cra.rinex.infrastructure.grammar;

import static ca.gc.cra.rinex.testutil.RinexFixtures.context;
import static ca.gc.cra.rinex.testutil.RinexFixtures.endOfHeader;
import static ca.gc.cra.rinex.testutil.RinexFixtures.lines;
import static ca.gc.cra.rinex.testutil.RinexFixtures.read;
import static ca.gc.cra.rinex.testutil.RinexFixtures.run;
import static ca.gc.cra.rinex.testutil.RinexFixtures.slot;
import static ca.gc.cra.rinex.testutil.RinexFixtures.v2Epoch;
import static ca.gc.cra.rinex.testutil.RinexFixtures.v2SatelliteContinuation;
import static ca.gc.cra.rinex.testutil.RinexFixtures.v2Types;
import static ca.gc.cra.rinex.testutil.RinexFixtures.versionLine;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.error.MalformedHeaderException;
import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import ca.gc.cra.rinex.domain.error.TruncatedRecordException;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.domain.gnss.EpochFlag;
import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.record.ObsEpoch;
import ca.gc.cra.rinex.domain.record.ObsSatelliteRecord;
import ca.gc.cra.rinex.domain.record.ObservationValue;
import ca.gc.cra.rinex.domain.text.Line;
import ca.gc.cra.rinex.testutil.RecordingSink;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class Version2ObsGrammarTest {
  private static final SatelliteId G05 = new SatelliteId(Constellation.GPS, 5);
  private static final SatelliteId R10 = new SatelliteId(Constellation.GLONASS, 10);

  private final Version2ObsGrammar grammar = new Version2ObsGrammar();

  @Test
  void decodesSampleFileAndSkipsEventRecords() throws Exception {
    RecordingSink sink = new RecordingSink();
    HeaderMetadata header = run(grammar, read("sample-v2.obs"), context(DecodeOptions.all()), sink);

    assertEquals(List.of("C1", "L1", "L2", "P2", "S1", "S2"),
        header.observationTypes().typesFor(Constellation.GPS).orElseThrow());
    assertEquals(3, sink.epochs().size());
    assertEquals(List.of(
            Instant.parse("2018-01-01T00:00:00Z"),
            Instant.parse("2018-01-01T00:00:30Z"),
            Instant.parse("2018-01-01T00:01:00Z")),
        sink.epochs().stream().map(ObsEpoch::time).toList());

    ObsEpoch first = sink.epochs().get(0);
    assertEquals(EpochFlag.OK, first.flag());
    assertEquals(0.000123456, first.receiverClockOffset().getAsDouble(), 1e-12);
    assertEquals(List.of(G05, R10), first.satellites().stream().map(ObsSatelliteRecord::satellite).toList());

    ObsSatelliteRecord g05 = first.satellites().get(0);
    ObservationValue c1 = g05.observation("C1").orElseThrow();
    assertEquals(20000001.234, c1.value(), 1e-6);
    assertFalse(c1.lossOfLock().isPresent());
    assertEquals(7, c1.signalStrength().getAsInt());
    assertEquals(1, g05.observation("L1").orElseThrow().lossOfLock().getAsInt());
    assertEquals(45.0, g05.observation("S1").orElseThrow().value());
    assertTrue(g05.observation("S2").isEmpty());

    ObsSatelliteRecord r10 = first.satellites().get(1);
    assertEquals(40.25, r10.observation("S1").orElseThrow().value());
    assertTrue(r10.observation("L2").isEmpty());
  }

  @Test
  void readsSatelliteListContinuationLines() throws Exception {
    StringBuilder sats = new StringBuilder();
    for (int prn = 1; prn <= 12; prn++) {
      sats.append(String.format("G%02d", prn));
    }
    List<String> text = new ArrayList<>(List.of(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        v2Types("C1"),
        endOfHeader(),
        v2Epoch(18, 1, 1, 0, 0, 0.0, 0, 13, sats.toString()),
        v2SatelliteContinuation("G13")));
    for (int prn = 1; prn <= 13; prn++) {
      text.add(slot(20000000.0 + prn));
    }
    RecordingSink sink = new RecordingSink();

    run(grammar, lines(text.toArray(String[]::new)), context(DecodeOptions.all()), sink);

    List<ObsSatelliteRecord> records = sink.epochs().get(0).satellites();
    assertEquals(13, records.size());
    assertEquals(new SatelliteId(Constellation.GPS, 13), records.get(12).satellite());
    assertEquals(20000013.0, records.get(12).observation("C1").orElseThrow().value());
  }

  @Test
  void blankSystemLetterUsesFileSystem() throws Exception {
    RecordingSink sink = new RecordingSink();
    run(grammar, lines(
        versionLine(2.11, "OBSERVATION DATA", "R"),
        v2Types("C1"),
        endOfHeader(),
        v2Epoch(18, 1, 1, 0, 0, 0.0, 0, 1, "  3"),
        slot(19000000.0)), context(DecodeOptions.all()), sink);

    assertEquals(new SatelliteId(Constellation.GLONASS, 3), sink.epochs().get(0).satellites().get(0).satellite());
  }

  @Test
  void missingSatelliteLinesAreTruncation() {
    String text = lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        v2Types("C1"),
        endOfHeader(),
        v2Epoch(18, 1, 1, 0, 0, 0.0, 0, 2, "G01G02"),
        slot(20000000.0));

    TruncatedRecordException ex = assertThrows(TruncatedRecordException.class,
        () -> run(grammar, text, context(DecodeOptions.all()), new RecordingSink()));
    assertEquals(4, ex.lineNumber());
  }

  @Test
  void cycleSlipEpochIsConsumedButNotEmitted() throws Exception {
    RecordingSink sink = new RecordingSink();
    run(grammar, lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        v2Types("C1"),
        endOfHeader(),
        v2Epoch(18, 1, 1, 0, 0, 0.0, 6, 1, "G01"),
        slot(1.0),
        v2Epoch(18, 1, 1, 0, 0, 30.0, 0, 1, "G01"),
        slot(20000000.0)), context(DecodeOptions.all()), sink);

    assertEquals(1, sink.epochs().size());
    assertEquals(Instant.parse("2018-01-01T00:00:30Z"), sink.epochs().get(0).time());
  }

  @Test
  void strayLinesAreSkippedWithWarning() throws Exception {
    DecodeContext context = context(DecodeOptions.all());
    RecordingSink sink = new RecordingSink();
    run(grammar, lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        v2Types("C1"),
        endOfHeader(),
        "garbage between epochs",
        v2Epoch(18, 1, 1, 0, 0, 0.0, 0, 1, "G01"),
        slot(20000000.0),
        slot(20000001.0),
        v2Epoch(18, 1, 1, 0, 0, 30.0, 0, 1, "G01"),
        slot(20000002.0)), context, sink);

    assertEquals(2, sink.epochs().size());
    assertEquals(2, context.warnings().size());
    assertEquals(WarningKind.SKIPPED_LINE, context.warnings().get(0).kind());
    assertEquals(4, context.warnings().get(0).lineNumber());
    assertEquals(7, context.warnings().get(1).lineNumber());
  }

  @Test
  void epochShapeAcceptsEventEpochsWithBlankDate() {
    assertTrue(Version2ObsGrammar.looksLikeEpoch(new Line(1, v2Epoch(18, 1, 1, 0, 0, 0.0, 0, 1, "G01"))));
    assertTrue(Version2ObsGrammar.looksLikeEpoch(new Line(2, " ".repeat(28) + "4  2")));
    assertFalse(Version2ObsGrammar.looksLikeEpoch(new Line(3, slot(20000000.0))));
  }

  @Test
  void invalidEpochFlagIsMalformed() {
    String text = lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        v2Types("C1"),
        endOfHeader(),
        v2Epoch(18, 1, 1, 0, 0, 0.0, 8, 1, "G01"),
        slot(1.0));

    MalformedNumericFieldException ex = assertThrows(MalformedNumericFieldException.class,
        () -> run(grammar, text, context(DecodeOptions.all()), new RecordingSink()));
    assertEquals(29, ex.startColumn());
  }

  @Test
  void filtersMeasurementsConstellationsAndTime() throws Exception {
    DecodeOptions options = DecodeOptions.all()
        .withMeasurements(List.of("C"))
        .withConstellations(Set.of(Constellation.GPS))
        .withTimeLimits(Instant.parse("2018-01-01T00:00:30Z"), null);
    RecordingSink sink = new RecordingSink();

    run(grammar, read("sample-v2.obs"), context(options), sink);

    assertEquals(2, sink.epochs().size());
    for (ObsEpoch epoch : sink.epochs()) {
      for (ObsSatelliteRecord record : epoch.satellites()) {
        assertEquals(Constellation.GPS, record.satellite().constellation());
        assertEquals(Set.of("C1"), record.observations().keySet());
      }
    }
  }

  @Test
  void headerWithoutObservationTypesIsMalformed() {
    String text = lines(versionLine(2.11, "OBSERVATION DATA", "G"), endOfHeader());
    assertThrows(MalformedHeaderException.class,
        () -> run(grammar, text, context(DecodeOptions.all()), new RecordingSink()));
  }
}
