/**
 * Fatal decode failures. Every type here aborts the decode of one file; recoverable conditions are
 * reported as {@link ca.gc.cra.rinex.domain.dataset.DecodeWarning} values instead.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.error;
