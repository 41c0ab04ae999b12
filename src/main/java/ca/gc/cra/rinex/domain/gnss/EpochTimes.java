package ca.gc.cra.rinex.domain.gnss;

import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Builds epoch timestamps from decoded calendar fields.
 *
 * <p>Timestamps are calendar readings in the file's time system, represented on the UTC time line
 * without leap-second or system-offset correction; the time system itself is kept as a dataset
 * attribute.</p>
 *
 * @since 0.1.0
 */
public final class EpochTimes {
  /** Two-digit years below this value belong to the 21st century. */
  public static final int TWO_DIGIT_YEAR_PIVOT = 80;

  private EpochTimes() {
    // Utility
  }

  /**
   * Expands a two-digit year: values below {@value #TWO_DIGIT_YEAR_PIVOT} map to {@code 2000 + yy},
   * the rest to {@code 1900 + yy}. Four-digit years pass through unchanged.
   *
   * @param year year as written in the file
   * @return four-digit year
   */
  public static int expandTwoDigitYear(int year) {
    if (year >= 100) {
      return year;
    }
    return year < TWO_DIGIT_YEAR_PIVOT ? 2000 + year : 1900 + year;
  }

  /**
   * Combines calendar fields into an instant.
   *
   * @param year four-digit year
   * @param month month 1..12
   * @param day day of month
   * @param hour hour 0..23
   * @param minute minute 0..59
   * @param seconds seconds including fraction; {@code 60.0} rolls over into the next minute
   * @param lineNumber source line used for diagnostics
   * @param startColumn 0-based first column of the date fields, for diagnostics
   * @param endColumn 0-based column just past the date fields, for diagnostics
   * @param raw raw date text for diagnostics
   * @return instant on the UTC time line
   * @throws MalformedNumericFieldException when the fields do not form a valid date
   */
  public static Instant toInstant(
      int year, int month, int day, int hour, int minute, double seconds,
      int lineNumber, int startColumn, int endColumn, String raw)
      throws MalformedNumericFieldException {
    if (seconds < 0 || seconds > 61) {
      throw new MalformedNumericFieldException(
          lineNumber, startColumn + 1, endColumn, raw, "Invalid epoch seconds");
    }
    try {
      long nanos = Math.round(seconds * 1_000_000_000d);
      return LocalDateTime.of(year, month, day, hour, minute)
          .plusNanos(nanos)
          .toInstant(ZoneOffset.UTC);
    } catch (DateTimeException ex) {
      throw new MalformedNumericFieldException(
          lineNumber, startColumn + 1, endColumn, raw, "Invalid epoch date");
    }
  }
}
