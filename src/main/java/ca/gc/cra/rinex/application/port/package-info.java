/**
 * Ports between the decode use cases and their collaborators: grammars, record sinks, byte sources
 * and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.application.port;
