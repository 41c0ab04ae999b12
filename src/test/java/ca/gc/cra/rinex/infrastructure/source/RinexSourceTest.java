package ca.gc.cra.rinex.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RinexSourceTest {

  @Test
  void fileSourceReportsNameAndPath(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("site0010.18o");
    Files.write(file, new byte[] {'a', (byte) 0xE9});
    FileRinexSource source = new FileRinexSource(file);

    assertEquals("site0010.18o", source.name());
    assertEquals(Optional.of(file), source.path());
    try (InputStream in = source.open()) {
      assertArrayEquals(new byte[] {'a', (byte) 0xE9}, in.readAllBytes());
    }
  }

  @Test
  void missingFileFailsOnOpen(@TempDir Path dir) {
    FileRinexSource source = new FileRinexSource(dir.resolve("absent.obs"));

    assertThrows(NoSuchFileException.class, source::open);
  }

  @Test
  void inMemorySourceOpensIndependentStreams() throws IOException {
    InMemoryRinexSource source = InMemoryRinexSource.ofText("mem", "caf\u00e9");

    try (InputStream first = source.open(); InputStream second = source.open()) {
      assertArrayEquals(new byte[] {'c', 'a', 'f', (byte) 0xE9}, first.readAllBytes());
      assertEquals('c', second.read());
    }
    assertTrue(source.path().isEmpty());
  }

  @Test
  void inMemorySourceCopiesContent() throws IOException {
    byte[] bytes = {'x'};
    InMemoryRinexSource source = new InMemoryRinexSource("copy", bytes);
    bytes[0] = 'y';

    try (InputStream in = source.open()) {
      assertEquals('x', in.read());
    }
  }
}
