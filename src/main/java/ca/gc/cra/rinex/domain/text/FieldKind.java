package ca.gc.cra.rinex.domain.text;

/**
 * Interpretation applied to one fixed-column field.
 *
 * @since 0.1.0
 */
public enum FieldKind {
  /** Fortran real ({@code F}, {@code E} or {@code D} edit descriptor). */
  REAL,
  /** Fortran integer ({@code I} edit descriptor). */
  INTEGER,
  /** Character data ({@code A} edit descriptor), kept verbatim. */
  TEXT
}
