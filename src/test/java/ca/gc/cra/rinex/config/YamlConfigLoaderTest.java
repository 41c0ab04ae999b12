package ca.gc.cra.rinex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  private static Map<String, String> load(String yaml) {
    return YamlConfigLoader.load(new StringReader(yaml), "decode");
  }

  @Test
  void sectionOverridesCommon() {
    Map<String, String> settings = load(String.join("\n",
        "common:",
        "  workers: 2",
        "  verbose: true",
        "Decode:",
        "  workers: 6",
        "other:",
        "  workers: 9"));

    assertEquals(Map.of("workers", "6", "verbose", "true"), settings);
  }

  @Test
  void flattensNestedMapsAndJoinsLists() {
    Map<String, String> settings = load(String.join("\n",
        "decode:",
        "  tlim:",
        "    start: '2018-01-01T00:00:00Z'",
        "  measurements: [C1, L1]",
        "  interval:"));

    assertEquals("2018-01-01T00:00:00Z", settings.get("tlim.start"));
    assertEquals("C1,L1", settings.get("measurements"));
    assertEquals("", settings.get("interval"));
  }

  @Test
  void unquotedTimestampsBecomeIsoInstants() {
    Map<String, String> settings = load("decode:\n  timeStart: 2018-01-01T00:00:00Z\n");

    assertEquals("2018-01-01T00:00:00Z", settings.get("timeStart"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(load("").isEmpty());
  }

  @Test
  void rejectsUnsupportedShapes() {
    assertThrows(IllegalArgumentException.class, () -> load("- just\n- a list\n"));
    assertThrows(IllegalArgumentException.class, () -> load("decode: 5\n"));
    assertThrows(IllegalArgumentException.class, () -> load("decode:\n  use: [[G]]\n"));
    assertThrows(IllegalArgumentException.class, () -> load("decode: [unclosed\n"));
  }

  @Test
  void refusesArbitraryTypeTags() {
    assertThrows(IllegalArgumentException.class,
        () -> load("decode: !!javax.script.ScriptEngineManager [!!java.net.URLClassLoader [[]]]\n"));
  }

  @Test
  void missingFileIsEmpty(@TempDir Path dir) throws Exception {
    assertTrue(YamlConfigLoader.load(dir.resolve("none.yaml"), "decode").isEmpty());
  }
}
