/**
 * GNSS vocabulary shared by every layer: constellations, satellite identifiers and epoch flags.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.gnss;
