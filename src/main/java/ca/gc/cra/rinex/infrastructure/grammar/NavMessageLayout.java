package ca.gc.cra.rinex.infrastructure.grammar;

import java.util.List;
import java.util.Objects;

/**
 * Parameter table of one broadcast message type.
 *
 * @param clockNames names of the three values on the record's first line
 * @param orbitNames names of the orbit-line values, four per line, in order
 * @param orbitLines number of orbit lines following the first line
 */
record NavMessageLayout(List<String> clockNames, List<String> orbitNames, int orbitLines) {
  static final int VALUES_PER_LINE = 4;

  NavMessageLayout {
    clockNames = List.copyOf(Objects.requireNonNull(clockNames, "clockNames"));
    orbitNames = List.copyOf(Objects.requireNonNull(orbitNames, "orbitNames"));
    if (orbitNames.size() > orbitLines * VALUES_PER_LINE) {
      throw new IllegalArgumentException(orbitNames.size() + " names do not fit " + orbitLines + " lines");
    }
  }

  /**
   * Returns how many values line {@code index} (0-based among orbit lines) carries.
   *
   * @param index orbit line index
   * @return 0..4
   */
  int valuesOnLine(int index) {
    return Math.max(0, Math.min(VALUES_PER_LINE, orbitNames.size() - index * VALUES_PER_LINE));
  }
}
