package ca.gc.cra.rinex.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortTextIsUnchanged() {
    assertEquals("G01  20000000.000", Logs.truncate("G01  20000000.000", 80));
  }

  @Test
  void longTextIsCutWithSuffix() {
    assertEquals("abc... (truncated, 6 chars)", Logs.truncate("abcdef", 3));
  }

  @Test
  void controlCharactersAreMasked() {
    assertEquals("a?b?", Logs.truncate("a\u0000b\r", 10));
  }

  @Test
  void nullAndInvalidLimit() {
    assertEquals("<null>", Logs.truncate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
