package ca.gc.cra.rinex.infrastructure.source;

import ca.gc.cra.rinex.application.port.RinexSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Byte source backed by an uncompressed file on disk.
 *
 * @since 0.1.0
 */
public final class FileRinexSource implements RinexSource {
  private final Path path;

  public FileRinexSource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public String name() {
    return String.valueOf(path.getFileName());
  }

  @Override
  public InputStream open() throws IOException {
    return Files.newInputStream(path);
  }

  @Override
  public Optional<Path> path() {
    return Optional.of(path);
  }

  @Override
  public String toString() {
    return "FileRinexSource[" + path + "]";
  }
}
