package ca.gc.cra.rinex.application.port;

import ca.gc.cra.rinex.domain.record.NavRecord;
import ca.gc.cra.rinex.domain.record.ObsEpoch;

/**
 * Receives the records a grammar produces, in file order.
 *
 * @since 0.1.0
 */
public interface RecordSink {
  /**
   * Accepts one observation epoch that passed the selection filters.
   *
   * @param epoch decoded epoch
   */
  void acceptEpoch(ObsEpoch epoch);

  /**
   * Accepts one navigation record that passed the selection filters.
   *
   * @param record decoded ephemeris record
   */
  void acceptNavRecord(NavRecord record);
}
