/**
 * The four format grammars ({@link ca.gc.cra.rinex.infrastructure.grammar.Version2ObsGrammar},
 * {@link ca.gc.cra.rinex.infrastructure.grammar.Version3ObsGrammar},
 * {@link ca.gc.cra.rinex.infrastructure.grammar.Version2NavGrammar},
 * {@link ca.gc.cra.rinex.infrastructure.grammar.Version3NavGrammar}) with their column tables and
 * ephemeris parameter tables.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.infrastructure.grammar;
