package ca.gc.cra.rinex.domain.record;

import java.util.OptionalInt;

/**
 * One decoded observation with its quality indicators.
 *
 * @param value measured value (pseudorange in meters, phase in cycles, ...)
 * @param lossOfLock loss-of-lock indicator, empty when the column is blank
 * @param signalStrength signal-strength indicator, empty when the column is blank
 * @since 0.1.0
 */
public record ObservationValue(double value, OptionalInt lossOfLock, OptionalInt signalStrength) {
  public ObservationValue {
    lossOfLock = lossOfLock == null ? OptionalInt.empty() : lossOfLock;
    signalStrength = signalStrength == null ? OptionalInt.empty() : signalStrength;
  }

  /**
   * Creates a value without indicators.
   *
   * @param value measured value
   * @return observation
   */
  public static ObservationValue of(double value) {
    return new ObservationValue(value, OptionalInt.empty(), OptionalInt.empty());
  }
}
