package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.domain.error.UnsupportedVersionException;
import ca.gc.cra.rinex.domain.header.FileType;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.ObservationTypeTable;
import ca.gc.cra.rinex.domain.header.RinexVariant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Selects the grammar for a file from its declared version and type.
 * <p><strong>Why:</strong> Unsupported versions must fail loudly instead of falling back to a guessed
 * grammar.</p>
 * <p><strong>Role:</strong> Application service consulted once per file, after the header block is
 * read and again once the header is interpreted.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share across workers.</p>
 *
 * @since 0.1.0
 */
public final class GrammarDispatcher {
  private final Map<RinexVariant, RinexGrammar> grammars;

  /**
   * Creates a dispatcher over the given grammars.
   *
   * @param grammars one grammar per supported variant
   * @throws IllegalArgumentException when two grammars claim the same variant
   */
  public GrammarDispatcher(Collection<? extends RinexGrammar> grammars) {
    Objects.requireNonNull(grammars, "grammars");
    Map<RinexVariant, RinexGrammar> byVariant = new EnumMap<>(RinexVariant.class);
    for (RinexGrammar grammar : grammars) {
      if (byVariant.put(grammar.variant(), grammar) != null) {
        throw new IllegalArgumentException("duplicate grammar for " + grammar.variant());
      }
    }
    this.grammars = byVariant;
  }

  /**
   * Picks the grammar for a raw header block.
   *
   * @param block header block with the decoded version record
   * @return grammar that will interpret the rest of the header and the body
   * @throws UnsupportedVersionException when no grammar matches the declared version and type
   */
  public RinexGrammar select(HeaderBlock block) throws UnsupportedVersionException {
    Objects.requireNonNull(block, "block");
    return lookup(block.majorVersion(), block.fileType())
        .orElseThrow(() -> new UnsupportedVersionException(
            block.version(), block.fileTypeCode(), block.versionLineNumber()));
  }

  /**
   * Resolves the grammar and observation-type table for interpreted header metadata.
   *
   * @param header interpreted header
   * @return selection
   * @throws UnsupportedVersionException when no grammar matches the declared version and type
   */
  public GrammarSelection resolve(HeaderMetadata header) throws UnsupportedVersionException {
    Objects.requireNonNull(header, "header");
    RinexGrammar grammar = lookup(header.majorVersion(), Optional.of(header.fileType()))
        .orElseThrow(() -> new UnsupportedVersionException(header.version(), header.fileTypeCode(), 0));
    ObservationTypeTable types = header.fileType() == FileType.OBS
        ? header.observationTypes()
        : ObservationTypeTable.empty();
    return new GrammarSelection(grammar.variant(), grammar, types);
  }

  private Optional<RinexGrammar> lookup(int majorVersion, Optional<FileType> fileType) {
    return fileType
        .flatMap(type -> RinexVariant.of(majorVersion, type))
        .map(grammars::get);
  }
}
