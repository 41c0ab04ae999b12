/**
 * Header block reading and interpretation: version record, shared labeled records, observation-type
 * tables and navigation correction records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.header;
