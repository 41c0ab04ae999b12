package ca.gc.cra.rinex.domain.record;

import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One broadcast ephemeris record.
 *
 * <p>The three clock terms come from the record's first line; {@link #orbitNames()} and
 * {@link #orbitValues()} hold the broadcast orbit parameters in the order the constellation's message
 * defines them. Blank parameters are {@link Double#NaN}.</p>
 *
 * @param satellite satellite identifier
 * @param epoch time of clock (epoch of applicability)
 * @param clockBias SV clock bias (seconds)
 * @param clockDrift SV clock drift (seconds per second), or the relative frequency bias for GLONASS
 * @param clockDriftRate SV clock drift rate, or the message frame time for GLONASS and SBAS
 * @param clockNames names of the three clock terms
 * @param orbitNames parameter names of the orbit lines
 * @param orbitValues parameter values aligned with {@code orbitNames}
 * @param lineNumber line of the record start
 * @since 0.1.0
 */
public record NavRecord(
    SatelliteId satellite,
    Instant epoch,
    double clockBias,
    double clockDrift,
    double clockDriftRate,
    List<String> clockNames,
    List<String> orbitNames,
    List<Double> orbitValues,
    int lineNumber) {

  public NavRecord {
    Objects.requireNonNull(satellite, "satellite");
    Objects.requireNonNull(epoch, "epoch");
    clockNames = List.copyOf(Objects.requireNonNull(clockNames, "clockNames"));
    orbitNames = List.copyOf(Objects.requireNonNull(orbitNames, "orbitNames"));
    orbitValues = List.copyOf(Objects.requireNonNull(orbitValues, "orbitValues"));
    if (clockNames.size() != 3) {
      throw new IllegalArgumentException("expected 3 clock names, got " + clockNames.size());
    }
    if (orbitNames.size() != orbitValues.size()) {
      throw new IllegalArgumentException(
          "orbit names/values mismatch: " + orbitNames.size() + " vs " + orbitValues.size());
    }
  }

  /**
   * Returns every parameter of the record, clock terms first.
   *
   * @return parameter name to value in message order
   */
  public Map<String, Double> parameters() {
    Map<String, Double> all = new LinkedHashMap<>();
    all.put(clockNames.get(0), clockBias);
    all.put(clockNames.get(1), clockDrift);
    all.put(clockNames.get(2), clockDriftRate);
    for (int i = 0; i < orbitNames.size(); i++) {
      all.put(orbitNames.get(i), orbitValues.get(i));
    }
    return all;
  }
}
