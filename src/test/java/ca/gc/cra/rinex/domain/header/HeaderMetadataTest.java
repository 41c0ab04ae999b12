package ca.gc.cra.rinex.domain.header;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HeaderMetadataTest {

  @Test
  void versionTwoNavigationFileTypeNamesTheSystem() {
    assertEquals(Constellation.GLONASS,
        HeaderMetadata.builder(2.11, 'G', FileType.NAV, ' ').build().defaultConstellation());
    assertEquals(Constellation.SBAS,
        HeaderMetadata.builder(2.11, 'H', FileType.NAV, ' ').build().defaultConstellation());
    assertEquals(Constellation.GPS,
        HeaderMetadata.builder(2.11, 'N', FileType.NAV, ' ').build().defaultConstellation());
  }

  @Test
  void timeSystemFallsBackToConstellation() {
    assertEquals("GAL", HeaderMetadata.builder(3.04, 'O', FileType.OBS, 'E').build().timeSystem());
    assertEquals("GPS", HeaderMetadata.builder(3.04, 'O', FileType.OBS, 'M').build().timeSystem());
    assertEquals("UTC", HeaderMetadata.builder(3.04, 'O', FileType.OBS, 'G')
        .declaredTimeSystem(" UTC").build().timeSystem());
  }

  @Test
  void firstApproximatePositionWins() {
    HeaderMetadata header = HeaderMetadata.builder(3.04, 'O', FileType.OBS, 'G')
        .approxPosition(new Position(1, 2, 3))
        .approxPosition(new Position(4, 5, 6))
        .build();
    assertEquals(List.of(1.0, 2.0, 3.0), header.approxPosition().orElseThrow().asList());
  }

  @Test
  void perConstellationTypesAccumulate() {
    HeaderMetadata header = HeaderMetadata.builder(3.04, 'O', FileType.OBS, 'M')
        .constellationObservationTypes(Constellation.GALILEO, List.of("C1C"))
        .constellationObservationTypes(Constellation.GPS, List.of("C1C", "L1C"))
        .build();

    ObservationTypeTable table = header.observationTypes();
    assertFalse(table.isGlobal());
    assertEquals(List.of("C1C", "L1C"), table.typesFor(Constellation.GPS).orElseThrow());
    assertTrue(table.typesFor(Constellation.GLONASS).isEmpty());
    assertEquals(List.of('G', 'E'), List.copyOf(table.asMap().keySet()));
  }

  @Test
  void globalTableAnswersForEveryConstellation() {
    ObservationTypeTable table = ObservationTypeTable.global(List.of("C1", "L1"));
    assertEquals(List.of("C1", "L1"), table.typesFor(Constellation.GLONASS).orElseThrow());
    assertEquals(Map.of('*', List.of("C1", "L1")), table.asMap());

    Map<Constellation, List<String>> per = new EnumMap<>(Constellation.class);
    per.put(Constellation.GPS, List.of("C1C"));
    assertEquals(ObservationTypeTable.perConstellation(per), ObservationTypeTable.perConstellation(Map.of(
        Constellation.GPS, List.of("C1C"))));
    assertTrue(ObservationTypeTable.empty().isEmpty());
  }
}
