package ca.gc.cra.rinex.domain.record;

import ca.gc.cra.rinex.domain.gnss.EpochFlag;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One observation epoch: timestamp, flag, optional receiver clock offset and its satellite records.
 *
 * @param time epoch timestamp in the file's time system
 * @param flag epoch flag
 * @param receiverClockOffset receiver clock offset in seconds, empty when not written
 * @param satellites satellite records in file order
 * @param lineNumber line of the epoch record
 * @since 0.1.0
 */
public record ObsEpoch(
    Instant time,
    EpochFlag flag,
    OptionalDouble receiverClockOffset,
    List<ObsSatelliteRecord> satellites,
    int lineNumber) {

  public ObsEpoch {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(flag, "flag");
    receiverClockOffset = receiverClockOffset == null ? OptionalDouble.empty() : receiverClockOffset;
    satellites = List.copyOf(Objects.requireNonNull(satellites, "satellites"));
  }
}
