package ca.gc.cra.rinex.domain.header;

import java.util.List;

/**
 * Approximate marker position in ECEF coordinates (meters).
 *
 * @param x X coordinate
 * @param y Y coordinate
 * @param z Z coordinate
 * @since 0.1.0
 */
public record Position(double x, double y, double z) {
  public List<Double> asList() {
    return List.of(x, y, z);
  }
}
