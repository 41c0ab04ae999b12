package ca.gc.cra.rinex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DecoderConfigTest {

  @Test
  void defaultsKeepEverything() {
    DecoderConfig config = DecoderConfig.defaults();

    assertTrue(config.constellations().isEmpty());
    assertTrue(config.measurements().isEmpty());
    assertTrue(config.includeIndicators());
    assertEquals(DecoderConfig.DEFAULT_WORKERS, config.workers());
    assertTrue(config.metricsExporter().isEmpty());
    assertFalse(config.verbose());
    assertEquals(DecodeOptions.all(), config.toDecodeOptions());
  }

  @Test
  void emptyMapGivesDefaults() {
    assertEquals(DecoderConfig.defaults(), DecoderConfig.fromMap(Map.of()));
    assertEquals(DecoderConfig.defaults(), DecoderConfig.fromMap(null));
  }

  @Test
  void parsesAllRecognisedKeys() {
    Map<String, String> raw = new HashMap<>();
    raw.put("constellations", "G, galileo");
    raw.put("measurements", "C1 L1");
    raw.put("timeStart", "2018-01-01T00:00:00Z");
    raw.put("timeEnd", "2018-01-01T06:00:00");
    raw.put("interval", "30");
    raw.put("includeIndicators", "false");
    raw.put("workers", "8");
    raw.put("metricsExporter", " OTLP ");
    raw.put("verbose", "true");

    DecoderConfig config = DecoderConfig.fromMap(raw);

    assertEquals(Set.of(Constellation.GPS, Constellation.GALILEO), config.constellations());
    assertEquals(List.of("C1", "L1"), config.measurements());
    assertEquals(Optional.of(Instant.parse("2018-01-01T00:00:00Z")), config.timeStart());
    assertEquals(Optional.of(Instant.parse("2018-01-01T06:00:00Z")), config.timeEnd());
    assertEquals(Optional.of(Duration.ofSeconds(30)), config.interval());
    assertFalse(config.includeIndicators());
    assertEquals(8, config.workers());
    assertEquals(Optional.of("otlp"), config.metricsExporter());
    assertTrue(config.verbose());

    DecodeOptions options = config.toDecodeOptions();
    assertTrue(options.acceptsConstellation(Constellation.GALILEO));
    assertFalse(options.acceptsConstellation(Constellation.GLONASS));
    assertFalse(options.includeIndicators());
  }

  @Test
  void acceptsShortAliases() {
    DecoderConfig config = DecoderConfig.fromMap(Map.of(
        "use", "R", "meas", "S", "tlim.start", "2018-01-01T01:00:00Z", "useIndicators", "false"));

    assertEquals(Set.of(Constellation.GLONASS), config.constellations());
    assertEquals(List.of("S"), config.measurements());
    assertTrue(config.timeStart().isPresent());
    assertFalse(config.includeIndicators());
  }

  @Test
  void fractionalIntervalKeepsSubSecondPrecision() {
    DecoderConfig config = DecoderConfig.fromMap(Map.of("interval", "0.5"));

    assertEquals(Optional.of(Duration.ofMillis(500)), config.interval());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("workers", "0")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("workers", "65")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("workers", "many")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("interval", "-30")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("constellations", "X")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("constellations", "MARS")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("timeStart", "yesterday")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of("metricsExporter", "zipkin")));
    assertThrows(IllegalArgumentException.class, () -> DecoderConfig.fromMap(Map.of(
        "timeStart", "2018-01-02T00:00:00Z", "timeEnd", "2018-01-01T00:00:00Z")));
  }

  @Test
  void loadsDecodeSectionFromYaml(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("rinex.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  workers: 2",
        "decode:",
        "  constellations: [G, E]",
        "  tlim:",
        "    start: 2018-01-01T00:00:00Z",
        "  metrics:",
        "    exporter: none",
        ""));

    DecoderConfig config = DecoderConfig.fromYaml(file);

    assertEquals(2, config.workers());
    assertEquals(Set.of(Constellation.GPS, Constellation.GALILEO), config.constellations());
    assertEquals(Optional.of(Instant.parse("2018-01-01T00:00:00Z")), config.timeStart());
    assertEquals(Optional.of("none"), config.metricsExporter());
  }

  @Test
  void missingYamlFileGivesDefaults(@TempDir Path dir) throws IOException {
    assertEquals(DecoderConfig.defaults(), DecoderConfig.fromYaml(dir.resolve("absent.yaml")));
  }

  @Test
  void toStringListsSettings() {
    String text = DecoderConfig.defaults().toString();

    assertTrue(text.contains("workers=4"));
    assertTrue(text.contains("metricsExporter=-"));
  }
}
