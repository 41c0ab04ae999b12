package ca.gc.cra.rinex.domain.gnss;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SatelliteIdTest {

  @Test
  void parsesLetterAndNumber() {
    assertEquals(new SatelliteId(Constellation.GPS, 1), SatelliteId.parse("G01"));
    assertEquals(new SatelliteId(Constellation.GLONASS, 5), SatelliteId.parse("R 5"));
    assertEquals(new SatelliteId(Constellation.BEIDOU, 12), SatelliteId.parse(" c12"));
  }

  @Test
  void formatsWithTwoDigitNumber() {
    assertEquals("E05", new SatelliteId(Constellation.GALILEO, 5).toString());
    assertEquals("S120", new SatelliteId(Constellation.SBAS, 120).toString());
  }

  @Test
  void rejectsUnknownLetterAndBadNumbers() {
    assertThrows(IllegalArgumentException.class, () -> SatelliteId.parse("X01"));
    assertThrows(IllegalArgumentException.class, () -> SatelliteId.parse("Gxx"));
    assertThrows(IllegalArgumentException.class, () -> new SatelliteId(Constellation.GPS, 1000));
  }

  @Test
  void constellationLookupIsCaseInsensitive() {
    assertEquals(Constellation.QZSS, Constellation.fromCode('j').orElseThrow());
    assertTrue(Constellation.fromCode('M').isEmpty());
  }
}
