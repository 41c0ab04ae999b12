package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.application.port.RecordSink;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.domain.dataset.DatasetBuilder;
import ca.gc.cra.rinex.domain.dataset.DatasetKind;
import ca.gc.cra.rinex.domain.dataset.RinexDataset;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import ca.gc.cra.rinex.domain.gnss.Constellation;
import ca.gc.cra.rinex.domain.header.FileType;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.IonosphericCorrection;
import ca.gc.cra.rinex.domain.header.TimeSystemCorrection;
import ca.gc.cra.rinex.domain.record.NavRecord;
import ca.gc.cra.rinex.domain.record.ObsEpoch;
import ca.gc.cra.rinex.domain.record.ObsSatelliteRecord;
import ca.gc.cra.rinex.domain.record.ObservationValue;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Record sink that folds grammar output into a {@link RinexDataset}.
 * <p><strong>Why:</strong> Keeps axis allocation, duplicate handling and attribute derivation out of
 * the grammars.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register every admitted epoch on the time axis, even when it lists no satellites.</li>
 *   <li>Report a repeated (time, satellite) pair as {@link WarningKind#DUPLICATE_RECORD}; the later
 *       record replaces the earlier one entirely.</li>
 *   <li>Report observation epochs earlier than their predecessor as {@link WarningKind#NON_MONOTONIC_EPOCH}.</li>
 *   <li>Derive dataset attributes from the header on {@link #finish()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one assembler belongs to one decode.</p>
 *
 * @since 0.1.0
 */
public final class DatasetAssembler implements RecordSink {
  private final HeaderMetadata header;
  private final DecodeContext context;
  private final Optional<Path> path;
  private final DatasetBuilder builder;
  private final List<Double> receiverClockOffsets = new ArrayList<>();
  private Instant lastEpoch;
  private int epochCount;

  /**
   * Creates an assembler for one file.
   *
   * @param header interpreted header
   * @param context per-file context receiving warnings
   * @param path source path reported in the {@code filename} attribute, when known
   */
  public DatasetAssembler(HeaderMetadata header, DecodeContext context, Optional<Path> path) {
    this.header = Objects.requireNonNull(header, "header");
    this.context = Objects.requireNonNull(context, "context");
    this.path = Objects.requireNonNull(path, "path");
    this.builder = new DatasetBuilder(header.fileType() == FileType.OBS ? DatasetKind.OBS : DatasetKind.NAV);
    if (header.fileType() == FileType.OBS) {
      header.observationTypes().asMap().forEach((system, codes) -> {
        boolean wanted = Constellation.fromCode(system)
            .map(context.options()::acceptsConstellation)
            .orElse(true);
        if (wanted) {
          codes.stream().filter(context.options()::acceptsMeasurement).forEach(builder::declareField);
        }
      });
    }
  }

  @Override
  public void acceptEpoch(ObsEpoch epoch) {
    Objects.requireNonNull(epoch, "epoch");
    Instant time = epoch.time();
    if (lastEpoch != null && time.isBefore(lastEpoch)) {
      context.warn(WarningKind.NON_MONOTONIC_EPOCH, epoch.lineNumber(),
          "Epoch " + time + " precedes previous epoch " + lastEpoch);
    }
    lastEpoch = time;
    epochCount++;
    builder.addTime(time);
    epoch.receiverClockOffset().ifPresent(receiverClockOffsets::add);
    for (ObsSatelliteRecord record : epoch.satellites()) {
      if (builder.put(time, record.satellite(), record.observations())) {
        context.warn(WarningKind.DUPLICATE_RECORD, epoch.lineNumber(),
            "Duplicate record for " + record.satellite() + " at " + time + "; later record kept");
      }
    }
  }

  @Override
  public void acceptNavRecord(NavRecord record) {
    Objects.requireNonNull(record, "record");
    epochCount++;
    Map<String, ObservationValue> values = new LinkedHashMap<>();
    record.parameters().forEach((name, value) -> {
      builder.declareField(name);
      if (!Double.isNaN(value)) {
        values.put(name, ObservationValue.of(value));
      }
    });
    if (builder.put(record.epoch(), record.satellite(), values)) {
      context.warn(WarningKind.DUPLICATE_RECORD, record.lineNumber(),
          "Duplicate record for " + record.satellite() + " at " + record.epoch() + "; later record kept");
    }
  }

  /**
   * Returns the number of epochs (OBS) or records (NAV) accepted so far.
   *
   * @return accepted count
   */
  public int acceptedCount() {
    return epochCount;
  }

  public int recordCount() {
    return builder.recordCount();
  }

  /**
   * Finalizes the dataset.
   *
   * @return immutable dataset carrying attributes and warnings
   */
  public RinexDataset finish() {
    return builder.build(header, attributes(), context.warnings(), context.options().includeIndicators());
  }

  private Map<String, Object> attributes() {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("version", header.version());
    attrs.put("rinextype", builder.kind().label());
    path.ifPresent(p -> attrs.put("filename", String.valueOf(p.getFileName())));
    attrs.put("time_system", header.timeSystem());
    if (builder.kind() == DatasetKind.OBS) {
      attrs.put("interval", header.interval().isPresent()
          ? header.interval().getAsDouble()
          : medianSpacingSeconds(builder.sortedTimes()));
    }
    header.approxPosition().ifPresent(position -> attrs.put("position", position.asList()));
    if (!receiverClockOffsets.isEmpty()) {
      attrs.put("time_offset", List.copyOf(receiverClockOffsets));
    }
    header.receiverClockOffsetApplied().ifPresent(v -> attrs.put("receiver_clock_offset_applied", v));
    header.leapSeconds().ifPresent(v -> attrs.put("leap_seconds", v));
    header.markerName().ifPresent(v -> attrs.put("marker_name", v));
    for (IonosphericCorrection corr : header.ionosphericCorrections()) {
      attrs.put("ionospheric_corr_" + corr.type(), corr.coefficients());
    }
    for (TimeSystemCorrection corr : header.timeSystemCorrections()) {
      attrs.put("time_system_corr_" + corr.type(), List.of(
          corr.a0(), corr.a1(), (double) corr.referenceTime(), (double) corr.referenceWeek()));
    }
    header.passthrough().forEach(attrs::putIfAbsent);
    return attrs;
  }

  /**
   * Median spacing of a sorted time axis, robust against data gaps.
   *
   * @param times chronologically sorted timestamps
   * @return median spacing in seconds, or {@code NaN} with fewer than two timestamps
   */
  static double medianSpacingSeconds(List<Instant> times) {
    if (times.size() < 2) {
      return Double.NaN;
    }
    double[] gaps = new double[times.size() - 1];
    for (int i = 1; i < times.size(); i++) {
      gaps[i - 1] = Duration.between(times.get(i - 1), times.get(i)).toNanos() / 1e9;
    }
    Arrays.sort(gaps);
    int mid = gaps.length / 2;
    return gaps.length % 2 == 1 ? gaps[mid] : (gaps[mid - 1] + gaps[mid]) / 2.0;
  }
}
