package ca.gc.cra.rinex.domain.gnss;

import java.util.Optional;

/**
 * Epoch flag carried on observation epoch lines.
 *
 * @since 0.1.0
 */
public enum EpochFlag {
  /** Normal epoch. */
  OK(0),
  /** Power failure occurred between the previous and this epoch; data still follow. */
  POWER_FAILURE(1),
  /** Start of antenna movement; special records follow. */
  ANTENNA_MOVING(2),
  /** New site occupation; special records follow. */
  NEW_SITE(3),
  /** Header records follow. */
  HEADER_FOLLOWS(4),
  /** External event; special records follow. */
  EXTERNAL_EVENT(5),
  /** Cycle-slip records follow, laid out like observation records. */
  CYCLE_SLIP(6);

  private final int code;

  EpochFlag(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Returns whether the epoch carries observation records.
   *
   * @return {@code true} for flags 0 and 1
   */
  public boolean carriesObservations() {
    return this == OK || this == POWER_FAILURE;
  }

  /**
   * Returns whether the satellite-count field announces special (header-style) records instead of
   * satellites.
   *
   * @return {@code true} for flags 2 to 5
   */
  public boolean announcesSpecialRecords() {
    return code >= 2 && code <= 5;
  }

  public static Optional<EpochFlag> fromCode(int code) {
    for (EpochFlag flag : values()) {
      if (flag.code == code) {
        return Optional.of(flag);
      }
    }
    return Optional.empty();
  }
}
