package ca.gc.cra.rinex.domain.dataset;

/**
 * Categories of recoverable decode conditions.
 *
 * @since 0.1.0
 */
public enum WarningKind {
  /** A satellite's constellation has no observation-type list; its record is kept with no fields. */
  UNKNOWN_CONSTELLATION_OBSERVATION_SET,
  /** A (time, satellite) pair appeared again; the later record replaced the earlier one. */
  DUPLICATE_RECORD,
  /** A satellite identifier carries a constellation letter this decoder does not know; the record is skipped. */
  UNKNOWN_CONSTELLATION,
  /** An epoch is earlier than the one before it in file order. */
  NON_MONOTONIC_EPOCH,
  /** A line that should start a record could not be interpreted and was skipped. */
  SKIPPED_LINE
}
