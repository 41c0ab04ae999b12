package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.util.ArrayList;
import java.util.List;

/**
 * Broadcast ephemeris parameter tables per constellation.
 *
 * <p>Orbit values are named in message order; the last orbit line may carry fewer than four. Spare
 * words keep a {@code spare} name so positions stay aligned with the format tables.</p>
 */
final class NavLayouts {
  private static final List<String> CLOCK = List.of("SVclockBias", "SVclockDrift", "SVclockDriftRate");
  private static final List<String> STATE_VECTOR_CLOCK =
      List.of("SVclockBias", "SVrelFreqBias", "MessageFrameTime");

  private static final List<String> KEPLER = List.of(
      "Crs", "DeltaN", "M0",
      "Cuc", "Eccentricity", "Cus", "sqrtA",
      "Toe", "Cic", "Omega0", "Cis",
      "Io", "Crc", "omega", "OmegaDot",
      "IDOT");

  static final NavMessageLayout GPS = kepler("IODE",
      "CodesL2", "GPSWeek", "L2Pflag",
      "SVacc", "health", "TGD", "IODC",
      "TransTime", "FitIntvl");

  static final NavMessageLayout QZSS = GPS;

  static final NavMessageLayout GALILEO = kepler("IODnav",
      "DataSrc", "GALWeek", "spare0",
      "SISA", "health", "BGDe5a", "BGDe5b",
      "TransTime");

  static final NavMessageLayout BEIDOU = kepler("AODE",
      "spare0", "BDTWeek", "spare1",
      "SVacc", "SatH1", "TGD1", "TGD2",
      "TransTime", "AODC");

  static final NavMessageLayout IRNSS = kepler("IODEC",
      "spare0", "IRNWeek", "spare1",
      "URA", "health", "TGD", "spare2",
      "TransTime");

  static final NavMessageLayout GLONASS = new NavMessageLayout(STATE_VECTOR_CLOCK, List.of(
      "X", "dX", "dX2", "health",
      "Y", "dY", "dY2", "FreqNum",
      "Z", "dZ", "dZ2", "AgeOpInfo"), 3);

  static final NavMessageLayout GLONASS_305 = new NavMessageLayout(STATE_VECTOR_CLOCK, List.of(
      "X", "dX", "dX2", "health",
      "Y", "dY", "dY2", "FreqNum",
      "Z", "dZ", "dZ2", "AgeOpInfo",
      "StatusFlags", "DelayL1L2", "URAI", "HealthFlags"), 4);

  static final NavMessageLayout SBAS = new NavMessageLayout(STATE_VECTOR_CLOCK, List.of(
      "X", "dX", "dX2", "health",
      "Y", "dY", "dY2", "URA",
      "Z", "dZ", "dZ2", "IODN"), 3);

  /** First version whose GLONASS records carry a fourth orbit line. */
  static final double GLONASS_EXTENDED_VERSION = 3.05;

  private NavLayouts() {
    // Utility
  }

  /**
   * Selects the table for a constellation and file version.
   *
   * @param constellation satellite constellation
   * @param version declared file version
   * @return parameter table
   */
  static NavMessageLayout forConstellation(Constellation constellation, double version) {
    return switch (constellation) {
      case GPS -> GPS;
      case QZSS -> QZSS;
      case GALILEO -> GALILEO;
      case BEIDOU -> BEIDOU;
      case IRNSS -> IRNSS;
      case GLONASS -> version >= GLONASS_EXTENDED_VERSION - 1e-9 ? GLONASS_305 : GLONASS;
      case SBAS -> SBAS;
    };
  }

  private static NavMessageLayout kepler(String issueOfData, String... tail) {
    List<String> names = new ArrayList<>(1 + KEPLER.size() + tail.length);
    names.add(issueOfData);
    names.addAll(KEPLER);
    names.addAll(List.of(tail));
    return new NavMessageLayout(CLOCK, names, 7);
  }
}
