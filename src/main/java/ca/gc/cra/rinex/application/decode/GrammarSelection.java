package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.domain.header.ObservationTypeTable;
import ca.gc.cra.rinex.domain.header.RinexVariant;
import java.util.Objects;

/**
 * Result of dispatching on header metadata.
 *
 * @param variant selected format variant
 * @param grammar grammar decoding the body
 * @param observationTypes resolved observation-type table; empty for navigation files
 * @since 0.1.0
 */
public record GrammarSelection(RinexVariant variant, RinexGrammar grammar, ObservationTypeTable observationTypes) {
  public GrammarSelection {
    Objects.requireNonNull(variant, "variant");
    Objects.requireNonNull(grammar, "grammar");
    Objects.requireNonNull(observationTypes, "observationTypes");
  }
}
