package ca.gc.cra.rinex.application.port.context;

import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Selection filters applied while decoding.
 *
 * @param constellations constellations to keep; empty keeps all
 * @param measurements observation-code prefixes to keep (e.g. {@code "C1"}, {@code "L"}); empty keeps all
 * @param timeStart inclusive lower time bound
 * @param timeEnd inclusive upper time bound; the scan stops after it
 * @param interval minimum spacing between kept observation epochs
 * @param includeIndicators whether loss-of-lock and signal-strength indicators are kept
 * @since 0.1.0
 */
public record DecodeOptions(
    Set<Constellation> constellations,
    List<String> measurements,
    Optional<Instant> timeStart,
    Optional<Instant> timeEnd,
    Optional<Duration> interval,
    boolean includeIndicators) {

  public DecodeOptions {
    constellations = constellations == null || constellations.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(constellations));
    measurements = measurements == null ? List.of() : List.copyOf(measurements);
    timeStart = timeStart == null ? Optional.empty() : timeStart;
    timeEnd = timeEnd == null ? Optional.empty() : timeEnd;
    interval = interval == null ? Optional.empty() : interval;
    if (timeStart.isPresent() && timeEnd.isPresent() && timeEnd.get().isBefore(timeStart.get())) {
      throw new IllegalArgumentException("timeEnd must not precede timeStart");
    }
    interval.ifPresent(value -> {
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException("interval must be positive (was " + value + ")");
      }
    });
  }

  /**
   * Options that keep everything.
   *
   * @return unfiltered options with indicators
   */
  public static DecodeOptions all() {
    return new DecodeOptions(Set.of(), List.of(), Optional.empty(), Optional.empty(), Optional.empty(), true);
  }

  public boolean acceptsConstellation(Constellation constellation) {
    return constellations.isEmpty() || constellations.contains(Objects.requireNonNull(constellation));
  }

  /**
   * Tests an observation code against the measurement prefixes.
   *
   * @param code observation code such as {@code C1C}
   * @return {@code true} when no prefixes are configured or one matches
   */
  public boolean acceptsMeasurement(String code) {
    if (measurements.isEmpty()) {
      return true;
    }
    for (String prefix : measurements) {
      if (code.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  public DecodeOptions withConstellations(Set<Constellation> value) {
    return new DecodeOptions(value, measurements, timeStart, timeEnd, interval, includeIndicators);
  }

  public DecodeOptions withMeasurements(List<String> value) {
    return new DecodeOptions(constellations, value, timeStart, timeEnd, interval, includeIndicators);
  }

  public DecodeOptions withTimeLimits(Instant start, Instant end) {
    return new DecodeOptions(
        constellations, measurements, Optional.ofNullable(start), Optional.ofNullable(end), interval,
        includeIndicators);
  }

  public DecodeOptions withInterval(Duration value) {
    return new DecodeOptions(
        constellations, measurements, timeStart, timeEnd, Optional.ofNullable(value), includeIndicators);
  }

  public DecodeOptions withIncludeIndicators(boolean value) {
    return new DecodeOptions(constellations, measurements, timeStart, timeEnd, interval, value);
  }
}
