package ca.gc.cra.rinex.config;

import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.validation.Numbers;
import ca.gc.cra.rinex.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Operator-facing decoder configuration.
 * <p><strong>Why:</strong> Converts loosely typed YAML or CLI-style key/value pairs into validated selection
 * filters, pool sizing and metrics settings.</p>
 * <p><strong>Role:</strong> Configuration value object consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Recognised keys: {@code constellations}, {@code measurements}, {@code timeStart}, {@code timeEnd},
 * {@code interval} (seconds), {@code includeIndicators}, {@code workers}, {@code metricsExporter}
 * ({@code otlp} or {@code none}) and {@code verbose}.</p>
 *
 * @param constellations constellations to keep; empty keeps all
 * @param measurements observation-code prefixes to keep; empty keeps all
 * @param timeStart inclusive lower epoch bound
 * @param timeEnd inclusive upper epoch bound
 * @param interval minimum spacing between kept observation epochs
 * @param includeIndicators whether loss-of-lock and signal-strength indicators are retained
 * @param workers batch decode pool size, 1 to {@value #MAX_WORKERS}
 * @param metricsExporter {@code otlp} or {@code none}; empty defers to the OpenTelemetry environment
 * @param verbose raise logging to DEBUG at startup
 * @since 0.1.0
 */
public record DecoderConfig(
    Set<Constellation> constellations,
    List<String> measurements,
    Optional<Instant> timeStart,
    Optional<Instant> timeEnd,
    Optional<Duration> interval,
    boolean includeIndicators,
    int workers,
    Optional<String> metricsExporter,
    boolean verbose) {

  /** Section of the YAML document holding decoder settings. */
  public static final String YAML_SECTION = "decode";
  static final int DEFAULT_WORKERS = 4;
  static final int MAX_WORKERS = 64;

  public DecoderConfig {
    constellations = constellations == null || constellations.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(constellations));
    measurements = measurements == null ? List.of() : List.copyOf(measurements);
    timeStart = timeStart == null ? Optional.empty() : timeStart;
    timeEnd = timeEnd == null ? Optional.empty() : timeEnd;
    interval = interval == null ? Optional.empty() : interval;
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    metricsExporter = metricsExporter == null
        ? Optional.empty()
        : metricsExporter.map(DecoderConfig::normalizeExporter);
    if (timeStart.isPresent() && timeEnd.isPresent() && timeEnd.get().isBefore(timeStart.get())) {
      throw new IllegalArgumentException("timeEnd must not precede timeStart");
    }
  }

  /**
   * Returns the defaults: no filters, indicators kept and {@value #DEFAULT_WORKERS} workers. The metrics
   * exporter is left to the OpenTelemetry environment, which itself defaults to {@code none}.
   *
   * @return default configuration
   */
  public static DecoderConfig defaults() {
    return new DecoderConfig(
        Set.of(), List.of(), Optional.empty(), Optional.empty(), Optional.empty(),
        true, DEFAULT_WORKERS, Optional.empty(), false);
  }

  /**
   * Builds configuration from flattened key/value pairs, falling back to {@link #defaults()} per key.
   *
   * @param options raw settings; {@code null} is treated as empty
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or violates a bound
   */
  public static DecoderConfig fromMap(Map<String, String> options) {
    Map<String, String> map = options == null ? Map.of() : options;
    DecoderConfig defaults = defaults();

    Set<Constellation> constellations = parseConstellations(firstNonBlank(map, "constellations", "use"));
    List<String> measurements = Strings.splitList("measurements", firstNonBlank(map, "measurements", "meas"));
    Optional<Instant> start = optionalString(firstNonBlank(map, "timeStart", "tlim.start"))
        .map(value -> parseInstant("timeStart", value));
    Optional<Instant> end = optionalString(firstNonBlank(map, "timeEnd", "tlim.end"))
        .map(value -> parseInstant("timeEnd", value));
    Optional<Duration> interval = optionalString(map.get("interval"))
        .map(value -> secondsToDuration(Numbers.parsePositive("interval", value)));
    boolean indicators = parseBoolean(firstNonBlank(map, "includeIndicators", "useIndicators"),
        defaults.includeIndicators());
    int workers = optionalString(map.get("workers"))
        .map(value -> Numbers.parseIntInRange("workers", value, 1, MAX_WORKERS))
        .orElse(defaults.workers());
    Optional<String> exporter = optionalString(firstNonBlank(map, "metricsExporter", "metrics.exporter"));
    boolean verbose = parseBoolean(map.get("verbose"), defaults.verbose());

    return new DecoderConfig(
        constellations, measurements, start, end, interval, indicators, workers, exporter, verbose);
  }

  /**
   * Loads the {@value #YAML_SECTION} section of a YAML file.
   *
   * @param path YAML location
   * @return parsed configuration, or {@link #defaults()} when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML or a value is invalid
   */
  public static DecoderConfig fromYaml(Path path) throws IOException {
    return YamlConfigLoader.load(path, YAML_SECTION)
        .map(DecoderConfig::fromMap)
        .orElseGet(DecoderConfig::defaults);
  }

  /**
   * Projects the selection settings onto decode options.
   *
   * @return options for {@link ca.gc.cra.rinex.application.decode.RinexDecoder}
   */
  public DecodeOptions toDecodeOptions() {
    return new DecodeOptions(constellations, measurements, timeStart, timeEnd, interval, includeIndicators);
  }

  private static Set<Constellation> parseConstellations(String value) {
    List<String> tokens = Strings.splitList("constellations", value);
    if (tokens.isEmpty()) {
      return Set.of();
    }
    Set<Constellation> result = EnumSet.noneOf(Constellation.class);
    for (String token : tokens) {
      result.add(parseConstellation(token));
    }
    return result;
  }

  private static Constellation parseConstellation(String token) {
    if (token.length() == 1) {
      return Constellation.fromCode(token.charAt(0))
          .orElseThrow(() -> new IllegalArgumentException("Unknown constellation letter: " + token));
    }
    try {
      return Constellation.valueOf(token.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown constellation: " + token, ex);
    }
  }

  private static Instant parseInstant(String name, String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ignored) {
      try {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(name + " must be an ISO-8601 timestamp (was '" + value + "')", ex);
      }
    }
  }

  private static Duration secondsToDuration(double seconds) {
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  private static String normalizeExporter(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + value + "')");
    }
    return normalized;
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String value = map.get(key);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "DecoderConfig{constellations=" + constellations
        + ", measurements=" + measurements
        + ", timeStart=" + timeStart.map(Object::toString).orElse("-")
        + ", timeEnd=" + timeEnd.map(Object::toString).orElse("-")
        + ", interval=" + interval.map(Object::toString).orElse("-")
        + ", includeIndicators=" + includeIndicators
        + ", workers=" + workers
        + ", metricsExporter=" + metricsExporter.orElse("-")
        + ", verbose=" + verbose + '}';
  }
}
