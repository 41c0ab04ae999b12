package ca.gc.cra.rinex.domain.header;

import static ca.gc.cra.rinex.testutil.RinexFixtures.endOfHeader;
import static ca.gc.cra.rinex.testutil.RinexFixtures.header;
import static ca.gc.cra.rinex.testutil.RinexFixtures.lines;
import static ca.gc.cra.rinex.testutil.RinexFixtures.versionLine;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.domain.error.MalformedHeaderException;
import ca.gc.cra.rinex.domain.error.MissingVersionHeaderException;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.error.UnsupportedVersionException;
import ca.gc.cra.rinex.domain.text.LineCursor;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.util.List;
import java.util.ListIterator;
import org.junit.jupiter.api.Test;

class HeaderParserTest {

  private static HeaderBlock block(String text) throws IOException, RinexDecodeException {
    try (LineCursor cursor = new LineCursor(new StringReader(text))) {
      return HeaderParser.readBlock(cursor);
    }
  }

  @Test
  void readBlockCapturesVersionTypeAndSystem() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(2.11, "OBSERVATION DATA", "M (MIXED)"),
        header("ALGO", "MARKER NAME"),
        endOfHeader(),
        " 18  1  1  0  0  0.0000000  0  0"));

    assertEquals(2.11, block.version(), 1e-9);
    assertEquals(2, block.majorVersion());
    assertEquals('O', block.fileTypeCode());
    assertEquals('M', block.systemCode());
    assertEquals(FileType.OBS, block.fileType().orElseThrow());
    assertEquals(2, block.lines().size());
    assertEquals(1, block.versionLineNumber());
    assertEquals(3, block.endLineNumber());
  }

  @Test
  void missingVersionRecordFails() {
    String text = lines(header("ALGO", "MARKER NAME"), endOfHeader());
    MissingVersionHeaderException ex = assertThrows(MissingVersionHeaderException.class, () -> block(text));
    assertEquals(2, ex.lineNumber());
  }

  @Test
  void emptyInputIsMissingVersion() {
    assertThrows(MissingVersionHeaderException.class, () -> block(""));
  }

  @Test
  void unterminatedHeaderIsMalformed() {
    String text = lines(versionLine(3.04, "OBSERVATION DATA", "G"), header("ALGO", "MARKER NAME"));
    assertThrows(MalformedHeaderException.class, () -> block(text));
  }

  @Test
  void commentMentioningEndOfHeaderDoesNotEndTheBlock() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(3.04, "OBSERVATION DATA", "G"),
        header("types follow END OF HEADER check", "COMMENT"),
        header("G    1 C1C", "SYS / # / OBS TYPES"),
        endOfHeader()));

    assertTrue(block.lines().stream().anyMatch(line -> line.label().equals("SYS / # / OBS TYPES")));
    assertEquals(4, block.endLineNumber());
  }

  @Test
  void misalignedTerminatorWithoutLabelStillEndsTheBlock() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(3.04, "OBSERVATION DATA", "G"),
        header("ALGO", "MARKER NAME"),
        "                                          END OF HEADER"));

    assertEquals(3, block.endLineNumber());
  }

  @Test
  void parseDispatchesOnLabelsAndKeepsUnknownOnes() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(3.04, "OBSERVATION DATA", "G"),
        header("  2018     1     1     0     0    0.0000000     GPS", "TIME OF FIRST OBS"),
        header("vendor note", "VENDOR EXTENSION"),
        header("    18", "LEAP SECONDS"),
        header("  1111111.0000 -2222222.0000  3333333.0000", "APPROX POSITION XYZ"),
        header("    15.000", "INTERVAL"),
        header("comment text", "COMMENT"),
        header("  GOLD", "MARKER NAME"),
        header("     1", "RCV CLOCK OFFS APPL"),
        header("second note", "VENDOR EXTENSION"),
        endOfHeader()));

    HeaderMetadata header = HeaderParser.parse(block, HeaderRecordHandler.NONE);

    assertEquals(FileType.OBS, header.fileType());
    assertEquals(18, header.leapSeconds().getAsInt());
    assertEquals(15.0, header.interval().getAsDouble());
    assertEquals("GOLD", header.markerName().orElseThrow());
    assertEquals(1, header.receiverClockOffsetApplied().getAsInt());
    assertEquals(List.of(1111111.0, -2222222.0, 3333333.0), header.approxPosition().orElseThrow().asList());
    assertEquals(Instant.parse("2018-01-01T00:00:00Z"), header.timeOfFirstObs().orElseThrow());
    assertEquals("GPS", header.timeSystem());
    assertEquals(List.of("vendor note", "second note"), header.passthrough().get("VENDOR EXTENSION"));
    assertFalse(header.passthrough().containsKey("COMMENT"));
  }

  @Test
  void handlerClaimsRecordsBeforePassThrough() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        header("     2    C1    L1", "# / TYPES OF OBSERV"),
        endOfHeader()));

    HeaderMetadata header = HeaderParser.parse(block, (line, following, builder) -> {
      builder.observationTypes(ObservationTypeTable.global(List.of("C1", "L1")));
      return true;
    });

    assertTrue(header.passthrough().isEmpty());
    assertEquals(List.of("C1", "L1"), header.observationTypes().typesFor(header.defaultConstellation()).orElseThrow());
  }

  @Test
  void unknownFileTypeIsUnsupported() throws Exception {
    HeaderBlock block = block(lines(versionLine(2.11, "X: STRANGE", "G"), endOfHeader()));

    UnsupportedVersionException ex = assertThrows(UnsupportedVersionException.class,
        () -> HeaderParser.parse(block, HeaderRecordHandler.NONE));
    assertEquals('X', ex.fileType());
  }

  @Test
  void codeListFollowsContinuationRecordsWithTheSameLabel() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        header("    11    C1    L1    L2    P2    S1    S2    C2    D1    D2", "# / TYPES OF OBSERV"),
        header("          C5    L5", "# / TYPES OF OBSERV"),
        header("ALGO", "MARKER NAME"),
        endOfHeader()));
    ListIterator<HeaderLine> it = block.lines().listIterator(1);
    HeaderLine first = it.next();

    List<String> codes = HeaderParser.readCodeList(first, it, 11, 6);

    assertEquals(List.of("C1", "L1", "L2", "P2", "S1", "S2", "C2", "D1", "D2", "C5", "L5"), codes);
    assertEquals("MARKER NAME", it.next().label());
  }

  @Test
  void codeListStopsAtAForeignLabel() throws Exception {
    HeaderBlock block = block(lines(
        versionLine(2.11, "OBSERVATION DATA", "G"),
        header("     4    C1    L1", "# / TYPES OF OBSERV"),
        header("ALGO", "MARKER NAME"),
        endOfHeader()));
    ListIterator<HeaderLine> it = block.lines().listIterator(1);

    List<String> codes = HeaderParser.readCodeList(it.next(), it, 4, 6);

    assertEquals(List.of("C1", "L1"), codes);
    assertEquals("MARKER NAME", it.next().label());
  }
}
