package ca.gc.cra.rinex.infrastructure.source;

import ca.gc.cra.rinex.application.port.RinexSource;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Byte source holding already-decompressed content in memory, as handed over by a decompression
 * collaborator.
 *
 * @since 0.1.0
 */
public final class InMemoryRinexSource implements RinexSource {
  private final String name;
  private final byte[] content;

  public InMemoryRinexSource(String name, byte[] content) {
    this.name = Objects.requireNonNull(name, "name");
    this.content = Objects.requireNonNull(content, "content").clone();
  }

  /**
   * Wraps text content.
   *
   * @param name source name
   * @param text RINEX text
   * @return source
   */
  public static InMemoryRinexSource ofText(String name, String text) {
    return new InMemoryRinexSource(name, text.getBytes(StandardCharsets.ISO_8859_1));
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public InputStream open() {
    return new ByteArrayInputStream(content);
  }
}
