package ca.gc.cra.rinex.infrastructure.grammar;

import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import ca.gc.cra.rinex.domain.record.ObservationValue;
import ca.gc.cra.rinex.domain.text.FortranNumbers;
import ca.gc.cra.rinex.domain.text.Line;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Decoder for observation slots: {@code F14.3} value, loss-of-lock digit, signal-strength digit.
 */
final class ObservationSlots {
  static final int SLOT_WIDTH = 16;
  static final int VALUE_WIDTH = 14;

  private ObservationSlots() {
    // Utility
  }

  /**
   * Decodes consecutive slots of one line into {@code out}.
   *
   * <p>Blank values stay absent even when indicator columns are filled; codes rejected by the
   * measurement filter are not decoded.</p>
   *
   * @param line source line
   * @param column 0-based column of the first slot
   * @param types observation codes in declared order
   * @param from index into {@code types} of the first slot on this line
   * @param to index into {@code types} just past the last slot on this line
   * @param options selection filters
   * @param out receives decoded values keyed by code
   * @throws MalformedNumericFieldException when a slot holds non-numeric text
   */
  static void decode(
      Line line,
      int column,
      List<String> types,
      int from,
      int to,
      DecodeOptions options,
      Map<String, ObservationValue> out)
      throws MalformedNumericFieldException {
    for (int k = from; k < to; k++) {
      String code = types.get(k);
      if (!options.acceptsMeasurement(code)) {
        continue;
      }
      int start = column + (k - from) * SLOT_WIDTH;
      OptionalDouble value = FortranNumbers.decodeReal(line, start, VALUE_WIDTH);
      if (value.isEmpty()) {
        continue;
      }
      if (options.includeIndicators()) {
        OptionalInt lli = FortranNumbers.decodeInt(line, start + VALUE_WIDTH, 1);
        OptionalInt ssi = FortranNumbers.decodeInt(line, start + VALUE_WIDTH + 1, 1);
        out.put(code, new ObservationValue(value.getAsDouble(), lli, ssi));
      } else {
        out.put(code, ObservationValue.of(value.getAsDouble()));
      }
    }
  }
}
