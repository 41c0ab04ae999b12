package ca.gc.cra.rinex.domain.dataset;

import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Immutable labeled array produced by one decode.
 * <p><strong>Why:</strong> Consumers (export, plotting, analysis) address values by coordinate
 * (time, satellite, field) and never see raw line state.</p>
 * <p><strong>Role:</strong> Output of the record assembler; axes are
 * {@code time x satellite x observation code} for observation files and
 * {@code time x satellite x ephemeris parameter} for navigation files.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report absent cells as empty optionals ({@code NaN} in the raw arrays), never as zero.</li>
 *   <li>Carry header metadata as attributes together with the accumulated warnings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 * <p><strong>Performance:</strong> Values live in flat {@code double[]} arrays indexed
 * {@code (t * satellites + s) * fields + f}.</p>
 *
 * @since 0.1.0
 */
public final class RinexDataset {
  private final DatasetKind kind;
  private final HeaderMetadata header;
  private final List<Instant> times;
  private final List<SatelliteId> satellites;
  private final List<String> fields;
  private final double[] values;
  private final double[] lossOfLock;
  private final double[] signalStrength;
  private final Map<String, Object> attributes;
  private final List<DecodeWarning> warnings;
  private final Map<Instant, Integer> timeIndex = new HashMap<>();
  private final Map<SatelliteId, Integer> satelliteIndex = new HashMap<>();
  private final Map<String, Integer> fieldIndex = new HashMap<>();

  RinexDataset(
      DatasetKind kind,
      HeaderMetadata header,
      List<Instant> times,
      List<SatelliteId> satellites,
      List<String> fields,
      double[] values,
      double[] lossOfLock,
      double[] signalStrength,
      Map<String, Object> attributes,
      List<DecodeWarning> warnings) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.header = Objects.requireNonNull(header, "header");
    this.times = List.copyOf(times);
    this.satellites = List.copyOf(satellites);
    this.fields = List.copyOf(fields);
    this.values = Objects.requireNonNull(values, "values");
    this.lossOfLock = lossOfLock;
    this.signalStrength = signalStrength;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.warnings = List.copyOf(warnings);
    for (int i = 0; i < this.times.size(); i++) {
      timeIndex.put(this.times.get(i), i);
    }
    for (int i = 0; i < this.satellites.size(); i++) {
      satelliteIndex.put(this.satellites.get(i), i);
    }
    for (int i = 0; i < this.fields.size(); i++) {
      fieldIndex.put(this.fields.get(i), i);
    }
  }

  public DatasetKind kind() {
    return kind;
  }

  public HeaderMetadata header() {
    return header;
  }

  /**
   * Returns the time axis in chronological order.
   *
   * @return distinct epoch timestamps
   */
  public List<Instant> times() {
    return times;
  }

  /**
   * Returns the satellite axis in first-seen order.
   *
   * @return distinct satellites
   */
  public List<SatelliteId> satellites() {
    return satellites;
  }

  /**
   * Returns the field axis: observation codes for OBS, parameter names for NAV.
   *
   * @return distinct field names
   */
  public List<String> fields() {
    return fields;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  public Optional<Object> attribute(String name) {
    return Optional.ofNullable(attributes.get(name));
  }

  public List<DecodeWarning> warnings() {
    return warnings;
  }

  /**
   * Returns whether loss-of-lock and signal-strength arrays are present.
   *
   * @return {@code true} for observation datasets decoded with indicators
   */
  public boolean hasIndicators() {
    return lossOfLock != null;
  }

  /**
   * Looks up one value by coordinate.
   *
   * @param time epoch timestamp
   * @param satellite satellite identifier
   * @param field observation code or parameter name
   * @return value, or empty when the coordinate is unknown or the cell is absent
   */
  public OptionalDouble value(Instant time, SatelliteId satellite, String field) {
    int offset = offsetOf(time, satellite, field);
    if (offset < 0 || Double.isNaN(values[offset])) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(values[offset]);
  }

  public OptionalInt lossOfLock(Instant time, SatelliteId satellite, String field) {
    return indicator(lossOfLock, time, satellite, field);
  }

  public OptionalInt signalStrength(Instant time, SatelliteId satellite, String field) {
    return indicator(signalStrength, time, satellite, field);
  }

  /**
   * Returns the raw value at array indices.
   *
   * @param t time index
   * @param s satellite index
   * @param f field index
   * @return value or {@code NaN} when absent
   * @throws IndexOutOfBoundsException when an index falls outside its axis
   */
  public double valueAt(int t, int s, int f) {
    checkAxis("time", t, times.size());
    checkAxis("satellite", s, satellites.size());
    checkAxis("field", f, fields.size());
    return values[offset(t, s, f)];
  }

  private static void checkAxis(String axis, int index, int size) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException(axis + " index " + index + " outside axis of size " + size);
    }
  }

  /**
   * Copies one field into a {@code [time][satellite]} matrix.
   *
   * @param field observation code or parameter name
   * @return matrix with {@code NaN} for absent cells
   * @throws IllegalArgumentException when the field is not on the axis
   */
  public double[][] slice(String field) {
    Integer f = fieldIndex.get(field);
    if (f == null) {
      throw new IllegalArgumentException("unknown field " + field);
    }
    double[][] out = new double[times.size()][satellites.size()];
    for (int t = 0; t < times.size(); t++) {
      for (int s = 0; s < satellites.size(); s++) {
        out[t][s] = values[offset(t, s, f)];
      }
    }
    return out;
  }

  /**
   * Counts the cells that hold a value.
   *
   * @return number of non-absent values
   */
  public long presentValueCount() {
    long count = 0;
    for (double value : values) {
      if (!Double.isNaN(value)) {
        count++;
      }
    }
    return count;
  }

  private OptionalInt indicator(double[] array, Instant time, SatelliteId satellite, String field) {
    if (array == null) {
      return OptionalInt.empty();
    }
    int offset = offsetOf(time, satellite, field);
    if (offset < 0 || Double.isNaN(array[offset])) {
      return OptionalInt.empty();
    }
    return OptionalInt.of((int) array[offset]);
  }

  private int offsetOf(Instant time, SatelliteId satellite, String field) {
    Integer t = timeIndex.get(time);
    Integer s = satelliteIndex.get(satellite);
    Integer f = fieldIndex.get(field);
    if (t == null || s == null || f == null) {
      return -1;
    }
    return offset(t, s, f);
  }

  private int offset(int t, int s, int f) {
    return (t * satellites.size() + s) * fields.size() + f;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RinexDataset that)) {
      return false;
    }
    return kind == that.kind
        && times.equals(that.times)
        && satellites.equals(that.satellites)
        && fields.equals(that.fields)
        && Arrays.equals(values, that.values)
        && Arrays.equals(lossOfLock, that.lossOfLock)
        && Arrays.equals(signalStrength, that.signalStrength)
        && attributes.equals(that.attributes)
        && warnings.equals(that.warnings);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(kind, times, satellites, fields, attributes, warnings);
    result = 31 * result + Arrays.hashCode(values);
    result = 31 * result + Arrays.hashCode(lossOfLock);
    return 31 * result + Arrays.hashCode(signalStrength);
  }

  @Override
  public String toString() {
    return "RinexDataset{" + kind.label()
        + ", times=" + times.size()
        + ", satellites=" + satellites.size()
        + ", fields=" + fields
        + ", warnings=" + warnings.size()
        + '}';
  }
}
