package ca.gc.cra.rinex.domain.dataset;

import ca.gc.cra.rinex.domain.gnss.SatelliteId;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.record.ObservationValue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Growable index tables plus a sparse cell store that finalize into a
 * {@link RinexDataset}.
 * <p><strong>Why:</strong> The time and satellite axes are only known once the whole body has been
 * read; cells are keyed by integer offsets into the index tables until then.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Allocate time, satellite and field indices on first sight.</li>
 *   <li>Replace a whole cell when the same (time, satellite) pair is stored again.</li>
 *   <li>Sort the time axis chronologically on {@link #build}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one builder belongs to one decode.</p>
 *
 * @since 0.1.0
 */
public final class DatasetBuilder {
  private final DatasetKind kind;
  private final List<Instant> times = new ArrayList<>();
  private final Map<Instant, Integer> timeIndex = new HashMap<>();
  private final List<SatelliteId> satellites = new ArrayList<>();
  private final Map<SatelliteId, Integer> satelliteIndex = new HashMap<>();
  private final List<String> fields = new ArrayList<>();
  private final Map<String, Integer> fieldIndex = new HashMap<>();
  private final Map<Long, Map<Integer, ObservationValue>> cells = new HashMap<>();

  public DatasetBuilder(DatasetKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DatasetKind kind() {
    return kind;
  }

  /**
   * Registers a field name, keeping first-registration order on the field axis.
   *
   * @param name observation code or parameter name
   * @return field index
   */
  public int declareField(String name) {
    Objects.requireNonNull(name, "name");
    Integer existing = fieldIndex.get(name);
    if (existing != null) {
      return existing;
    }
    int index = fields.size();
    fields.add(name);
    fieldIndex.put(name, index);
    return index;
  }

  /**
   * Registers a timestamp on the time axis, even when no satellite record follows.
   *
   * @param time epoch timestamp
   * @return time index in insertion order
   */
  public int addTime(Instant time) {
    Objects.requireNonNull(time, "time");
    Integer existing = timeIndex.get(time);
    if (existing != null) {
      return existing;
    }
    int index = times.size();
    times.add(time);
    timeIndex.put(time, index);
    return index;
  }

  /**
   * Stores one satellite's values at one time.
   *
   * <p>A second store for the same pair replaces the earlier cell entirely: fields the later record
   * does not carry become absent.</p>
   *
   * @param time epoch timestamp
   * @param satellite satellite identifier
   * @param values field name to value; may be empty
   * @return {@code true} when an earlier cell was replaced
   */
  public boolean put(Instant time, SatelliteId satellite, Map<String, ObservationValue> values) {
    Objects.requireNonNull(satellite, "satellite");
    Objects.requireNonNull(values, "values");
    int t = addTime(time);
    int s = satelliteIndex.computeIfAbsent(satellite, key -> {
      satellites.add(key);
      return satellites.size() - 1;
    });
    Map<Integer, ObservationValue> cell = new LinkedHashMap<>();
    values.forEach((name, value) -> cell.put(declareField(name), value));
    return cells.put(cellKey(t, s), cell) != null;
  }

  public boolean contains(Instant time, SatelliteId satellite) {
    Integer t = timeIndex.get(time);
    Integer s = satelliteIndex.get(satellite);
    return t != null && s != null && cells.containsKey(cellKey(t, s));
  }

  public int timeCount() {
    return times.size();
  }

  public int satelliteCount() {
    return satellites.size();
  }

  public int recordCount() {
    return cells.size();
  }

  /**
   * Returns the time axis in chronological order.
   *
   * @return sorted copy of the registered timestamps
   */
  public List<Instant> sortedTimes() {
    List<Instant> sorted = new ArrayList<>(times);
    sorted.sort(Comparator.naturalOrder());
    return sorted;
  }

  /**
   * Finalizes the dataset.
   *
   * @param header header metadata of the file
   * @param attributes dataset attributes
   * @param warnings accumulated warnings
   * @param includeIndicators whether to materialize loss-of-lock and signal-strength arrays
   * @return immutable dataset
   * @throws IllegalStateException when the dense array would exceed the addressable size
   */
  public RinexDataset build(
      HeaderMetadata header,
      Map<String, Object> attributes,
      List<DecodeWarning> warnings,
      boolean includeIndicators) {
    int timeCount = times.size();
    int satCount = satellites.size();
    int fieldCount = fields.size();
    long size = (long) timeCount * satCount * fieldCount;
    if (size > Integer.MAX_VALUE - 8) {
      throw new IllegalStateException("dataset too large: " + timeCount + "x" + satCount + "x" + fieldCount);
    }
    List<Instant> sorted = sortedTimes();
    int[] remap = new int[timeCount];
    for (int i = 0; i < timeCount; i++) {
      remap[timeIndex.get(sorted.get(i))] = i;
    }

    boolean indicators = includeIndicators && kind == DatasetKind.OBS;
    double[] values = nanArray((int) size);
    double[] lossOfLock = indicators ? nanArray((int) size) : null;
    double[] signalStrength = indicators ? nanArray((int) size) : null;
    for (Map.Entry<Long, Map<Integer, ObservationValue>> entry : cells.entrySet()) {
      long key = entry.getKey();
      int t = remap[(int) (key >>> 32)];
      int s = (int) key;
      for (Map.Entry<Integer, ObservationValue> field : entry.getValue().entrySet()) {
        int offset = (t * satCount + s) * fieldCount + field.getKey();
        ObservationValue value = field.getValue();
        values[offset] = value.value();
        if (indicators) {
          value.lossOfLock().ifPresent(v -> lossOfLock[offset] = v);
          value.signalStrength().ifPresent(v -> signalStrength[offset] = v);
        }
      }
    }
    return new RinexDataset(
        kind, header, sorted, satellites, fields,
        values, lossOfLock, signalStrength, attributes, warnings);
  }

  private static long cellKey(int timeIndex, int satelliteIndex) {
    return ((long) timeIndex << 32) | (satelliteIndex & 0xFFFFFFFFL);
  }

  private static double[] nanArray(int size) {
    double[] array = new double[size];
    Arrays.fill(array, Double.NaN);
    return array;
  }
}
