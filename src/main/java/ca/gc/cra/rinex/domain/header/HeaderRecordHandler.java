package ca.gc.cra.rinex.domain.header;

import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import java.util.ListIterator;

/**
 * Version-specific interpretation of header records that the shared parser does not own.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HeaderRecordHandler {
  /** Handler that claims no records. */
  HeaderRecordHandler NONE = (line, following, builder) -> false;

  /**
   * Offers one record to the handler.
   *
   * @param line current record
   * @param following iterator positioned after {@code line}; handlers consume continuation records from it
   * @param builder metadata under construction
   * @return {@code true} when the record was interpreted, {@code false} to pass it through
   * @throws RinexDecodeException when the record is corrupt
   */
  boolean handle(HeaderLine line, ListIterator<HeaderLine> following, HeaderMetadata.Builder builder)
      throws RinexDecodeException;
}
