package ca.gc.cra.rinex.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import org.junit.jupiter.api.Test;

class FortranNumbersTest {

  @Test
  void decodesFortranDoubleExponent() throws Exception {
    assertEquals(1.5e-3, FortranNumbers.decodeReal(" 1.500000000000D-03", 7, 0, 19).getAsDouble(), 1e-18);
    assertEquals(-0.5, FortranNumbers.decodeReal("  -.5", 7, 0, 5).getAsDouble());
    assertEquals(12.0, FortranNumbers.decodeReal("1.2d1", 7, 0, 5).getAsDouble());
  }

  @Test
  void blankFieldIsAbsentNotZero() throws Exception {
    assertFalse(FortranNumbers.decodeReal("              ", 3, 0, 14).isPresent());
    assertFalse(FortranNumbers.decodeInt("", 3, 0, 1).isPresent());
  }

  @Test
  void malformedRealReportsLineAndColumns() {
    Line line = new Line(12, "abc  1.2.3   ");
    MalformedNumericFieldException ex = assertThrows(MalformedNumericFieldException.class,
        () -> FortranNumbers.decodeReal(line, 3, 8));

    assertEquals(12, ex.lineNumber());
    assertEquals(4, ex.startColumn());
    assertEquals(11, ex.endColumn());
    assertEquals("  1.2.3 ", ex.fieldText());
  }

  @Test
  void integerRejectsEmbeddedSpaces() {
    assertThrows(MalformedNumericFieldException.class, () -> FortranNumbers.decodeInt(" 4 2", 1, 0, 4));
  }

  @Test
  void integerOverflowIsMalformed() {
    MalformedNumericFieldException ex = assertThrows(MalformedNumericFieldException.class,
        () -> FortranNumbers.decodeInt("99999999999", 1, 0, 11));
    assertTrue(ex.getMessage().contains("out of range"));
  }

  @Test
  void requireRealRejectsBlank() {
    Line line = new Line(4, "      ");
    assertThrows(MalformedNumericFieldException.class, () -> FortranNumbers.requireReal(line, 0, 6));
  }

  @Test
  void sliceBeyondLineEndIsBlank() throws Exception {
    Line shortLine = new Line(1, "  42");
    assertEquals(42, FortranNumbers.requireInt(shortLine, 0, 6));
    assertFalse(FortranNumbers.decodeReal(shortLine, 10, 14).isPresent());
  }
}
