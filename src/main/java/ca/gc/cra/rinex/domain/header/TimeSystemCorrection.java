package ca.gc.cra.rinex.domain.header;

import java.util.Objects;

/**
 * Time-system correction from a navigation header.
 *
 * <p>Version 2 {@code DELTA-UTC: A0,A1,T,W} is reported as type {@code GPUT}.</p>
 *
 * @param type correction type, e.g. {@code GPUT}, {@code GAGP}
 * @param a0 constant term (seconds)
 * @param a1 linear term (seconds per second)
 * @param referenceTime reference time of week (seconds)
 * @param referenceWeek reference week number
 * @param source provider of the correction, blank in version 2
 * @since 0.1.0
 */
public record TimeSystemCorrection(
    String type, double a0, double a1, int referenceTime, int referenceWeek, String source) {
  public TimeSystemCorrection {
    type = Objects.requireNonNull(type, "type").trim();
    source = source == null ? "" : source.trim();
  }
}
