package ca.gc.cra.rinex.domain.header;

import java.util.List;
import java.util.Objects;

/**
 * Broadcast ionospheric model coefficients from a navigation header.
 *
 * <p>Version 2 {@code ION ALPHA}/{@code ION BETA} records are reported as types {@code GPSA} and
 * {@code GPSB}; version 3 uses the type written in {@code IONOSPHERIC CORR}.</p>
 *
 * @param type correction type, e.g. {@code GPSA}, {@code GAL}, {@code BDSB}
 * @param coefficients coefficients in file order; blank coefficients are {@code NaN}
 * @since 0.1.0
 */
public record IonosphericCorrection(String type, List<Double> coefficients) {
  public IonosphericCorrection {
    type = Objects.requireNonNull(type, "type").trim();
    coefficients = List.copyOf(Objects.requireNonNull(coefficients, "coefficients"));
  }
}
