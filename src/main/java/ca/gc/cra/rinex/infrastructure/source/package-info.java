/**
 * {@link ca.gc.cra.rinex.application.port.RinexSource} adapters for files and in-memory content.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.infrastructure.source;
