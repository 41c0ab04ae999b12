package ca.gc.cra.rinex.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.StringReader;
import org.junit.jupiter.api.Test;

class LineCursorTest {

  @Test
  void peekDoesNotConsume() throws Exception {
    try (LineCursor cursor = new LineCursor(new StringReader("first\nsecond\n"))) {
      Line peeked = cursor.peek();
      assertSame(peeked, cursor.peek());
      assertSame(peeked, cursor.next());
      assertEquals(1, peeked.number());

      Line second = cursor.next();
      assertEquals("second", second.text());
      assertEquals(2, second.number());
      assertNull(cursor.peek());
      assertNull(cursor.next());
      assertEquals(2, cursor.lineNumber());
    }
  }

  @Test
  void lineSlicingIsTolerantOfShortLines() {
    Line line = new Line(1, "abc");
    assertEquals("bc", line.slice(1, 10));
    assertEquals("", line.slice(5, 2));
    assertEquals(' ', line.charAt(7));
  }
}
