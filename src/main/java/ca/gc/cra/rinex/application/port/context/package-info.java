/**
 * Per-file decode context: selection filters and the warning accumulator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.application.port.context;
