package ca.gc.cra.rinex.domain.record;

import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Observations of one satellite at one epoch.
 *
 * <p>Observation codes without a value in the file are absent from {@link #observations()}; they are
 * never reported as zero.</p>
 *
 * @param satellite satellite identifier
 * @param observations observation code to value, in declared order
 * @since 0.1.0
 */
public record ObsSatelliteRecord(SatelliteId satellite, Map<String, ObservationValue> observations) {
  public ObsSatelliteRecord {
    Objects.requireNonNull(satellite, "satellite");
    observations = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(observations, "observations")));
  }

  public Optional<ObservationValue> observation(String code) {
    return Optional.ofNullable(observations.get(code));
  }
}
