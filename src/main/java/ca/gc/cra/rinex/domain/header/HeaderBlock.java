package ca.gc.cra.rinex.domain.header;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw header records read up to {@code END OF HEADER}, plus the fields of the version record that
 * gate dispatch.
 *
 * @param lines header records in file order, excluding the terminator
 * @param version declared format version
 * @param fileTypeCode file-type letter (column 21)
 * @param systemCode satellite-system letter (column 41), blank when absent
 * @param versionLineNumber line of the version record
 * @param endLineNumber line of the {@code END OF HEADER} record
 * @since 0.1.0
 */
public record HeaderBlock(
    List<HeaderLine> lines,
    double version,
    char fileTypeCode,
    char systemCode,
    int versionLineNumber,
    int endLineNumber) {

  public HeaderBlock {
    lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
  }

  public Optional<FileType> fileType() {
    return FileType.fromCode(fileTypeCode);
  }

  public int majorVersion() {
    return (int) Math.floor(version);
  }
}
