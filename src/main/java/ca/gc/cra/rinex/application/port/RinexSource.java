package ca.gc.cra.rinex.application.port;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Port supplying the decompressed bytes of one RINEX file.
 * <p><strong>Why:</strong> Decompression of {@code .Z}, {@code .gz} and Hatanaka inputs belongs to external
 * collaborators; the decoder only needs an opaque synchronous byte stream.</p>
 * <p><strong>Role:</strong> Implemented by {@code FileRinexSource} and {@code InMemoryRinexSource}.</p>
 * <p><strong>Thread-safety:</strong> Each {@link #open()} call must return an independent stream.</p>
 *
 * @since 0.1.0
 */
public interface RinexSource {
  /**
   * Returns a short name used in logs, warnings and the MDC.
   *
   * @return source name
   */
  String name();

  /**
   * Opens a fresh stream positioned at the first byte of the file.
   *
   * @return stream owned by the caller
   * @throws IOException when the source cannot be opened
   */
  InputStream open() throws IOException;

  /**
   * Returns the filesystem path when the source is backed by one.
   *
   * @return path, or empty for in-memory sources
   */
  default Optional<Path> path() {
    return Optional.empty();
  }
}
