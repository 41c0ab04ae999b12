package ca.gc.cra.rinex.application.port;

import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.RinexVariant;
import ca.gc.cra.rinex.domain.text.LineCursor;
import java.io.IOException;

/**
 * <strong>What:</strong> Capability shared by the four format variants.
 * <p><strong>Why:</strong> The dispatcher selects one variant per file; everything version-specific lives
 * behind this interface so no shared code branches on version.</p>
 * <p><strong>Role:</strong> Implemented by {@code Version2ObsGrammar}, {@code Version3ObsGrammar},
 * {@code Version2NavGrammar} and {@code Version3NavGrammar}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless; per-file state lives in the cursor,
 * the context and the sink.</p>
 *
 * @since 0.1.0
 */
public interface RinexGrammar {
  /**
   * Returns the variant this grammar decodes.
   *
   * @return variant
   */
  RinexVariant variant();

  /**
   * Interprets the header block, including the version-specific records.
   *
   * @param block raw header block read up to {@code END OF HEADER}
   * @return immutable metadata
   * @throws RinexDecodeException when a header record is malformed
   */
  HeaderMetadata parseHeader(HeaderBlock block) throws RinexDecodeException;

  /**
   * Decodes the body that follows the header, emitting records to the sink.
   *
   * @param cursor cursor positioned on the first body line
   * @param header metadata returned by {@link #parseHeader(HeaderBlock)}
   * @param context per-file filters and warning accumulator
   * @param sink record receiver
   * @throws IOException when the source fails
   * @throws RinexDecodeException on malformed or truncated records
   */
  void parseBody(LineCursor cursor, HeaderMetadata header, DecodeContext context, RecordSink sink)
      throws IOException, RinexDecodeException;
}
