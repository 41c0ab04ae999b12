/**
 * Parsed body records emitted by the grammars: observation epochs with their satellite records and
 * navigation ephemeris records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.record;
