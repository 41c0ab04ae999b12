/**
 * Decode use cases: grammar dispatch, single-file decode, record assembly and batch decode.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.application.decode;
