/**
 * Fixed-column text primitives: numbered lines, the line cursor, the Fortran numeric decoder and the
 * declarative record layouts consumed by the header parser and the grammars.
 * <p><strong>Concurrency:</strong> Layouts and the numeric decoder are stateless; cursors are single-owner.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.text;
