package ca.gc.cra.rinex.domain.header;

import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Immutable header metadata of one RINEX file.
 * <p><strong>Why:</strong> Version and file type gate every later parsing decision; observation-type
 * lists fix how satellite records are indexed. Producing the metadata once, before the body is read,
 * keeps those decisions stable for the whole file.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link HeaderParser} and attached to the dataset
 * as attributes.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the {@link Builder} is not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class HeaderMetadata {
  private final double version;
  private final char fileTypeCode;
  private final FileType fileType;
  private final char systemCode;
  private final ObservationTypeTable observationTypes;
  private final OptionalInt leapSeconds;
  private final Position approxPosition;
  private final String declaredTimeSystem;
  private final OptionalDouble interval;
  private final Instant timeOfFirstObs;
  private final String markerName;
  private final OptionalInt receiverClockOffsetApplied;
  private final List<IonosphericCorrection> ionosphericCorrections;
  private final List<TimeSystemCorrection> timeSystemCorrections;
  private final Map<String, List<String>> passthrough;

  private HeaderMetadata(Builder builder) {
    this.version = builder.version;
    this.fileTypeCode = builder.fileTypeCode;
    this.fileType = builder.fileType;
    this.systemCode = builder.systemCode;
    this.observationTypes = builder.constellationTypes.isEmpty()
        ? builder.observationTypes
        : ObservationTypeTable.perConstellation(builder.constellationTypes);
    this.leapSeconds = builder.leapSeconds;
    this.approxPosition = builder.approxPosition;
    this.declaredTimeSystem = builder.declaredTimeSystem;
    this.interval = builder.interval;
    this.timeOfFirstObs = builder.timeOfFirstObs;
    this.markerName = builder.markerName;
    this.receiverClockOffsetApplied = builder.receiverClockOffsetApplied;
    this.ionosphericCorrections = List.copyOf(builder.ionosphericCorrections);
    this.timeSystemCorrections = List.copyOf(builder.timeSystemCorrections);
    Map<String, List<String>> copy = new LinkedHashMap<>();
    builder.passthrough.forEach((label, values) -> copy.put(label, List.copyOf(values)));
    this.passthrough = Collections.unmodifiableMap(copy);
  }

  /**
   * Starts a builder seeded with the fields of the version record.
   *
   * @param version declared version
   * @param fileTypeCode file-type letter
   * @param fileType resolved file family
   * @param systemCode satellite-system letter, blank when absent
   * @return builder
   */
  public static Builder builder(double version, char fileTypeCode, FileType fileType, char systemCode) {
    return new Builder(version, fileTypeCode, fileType, systemCode);
  }

  public double version() {
    return version;
  }

  public int majorVersion() {
    return (int) Math.floor(version);
  }

  public char fileTypeCode() {
    return fileTypeCode;
  }

  public FileType fileType() {
    return fileType;
  }

  public char systemCode() {
    return systemCode;
  }

  public ObservationTypeTable observationTypes() {
    return observationTypes;
  }

  public OptionalInt leapSeconds() {
    return leapSeconds;
  }

  public Optional<Position> approxPosition() {
    return Optional.ofNullable(approxPosition);
  }

  public OptionalDouble interval() {
    return interval;
  }

  public Optional<Instant> timeOfFirstObs() {
    return Optional.ofNullable(timeOfFirstObs);
  }

  public Optional<String> markerName() {
    return Optional.ofNullable(markerName);
  }

  public OptionalInt receiverClockOffsetApplied() {
    return receiverClockOffsetApplied;
  }

  public List<IonosphericCorrection> ionosphericCorrections() {
    return ionosphericCorrections;
  }

  public List<TimeSystemCorrection> timeSystemCorrections() {
    return timeSystemCorrections;
  }

  /**
   * Returns header records whose labels this decoder does not interpret, keyed by label, with the
   * trimmed content of every occurrence in file order.
   *
   * @return unmodifiable pass-through records
   */
  public Map<String, List<String>> passthrough() {
    return passthrough;
  }

  /**
   * Returns the time system of the epoch timestamps.
   *
   * <p>The value written in {@code TIME OF FIRST OBS} wins; otherwise it follows from the satellite
   * system of the file, with mixed or blank systems defaulting to {@code GPS}.</p>
   *
   * @return three-letter time system identifier
   */
  public String timeSystem() {
    if (declaredTimeSystem != null && !declaredTimeSystem.isBlank()) {
      return declaredTimeSystem;
    }
    return defaultConstellation().timeSystem();
  }

  /**
   * Returns the constellation assumed for satellite identifiers without a system letter.
   *
   * <p>Version 2 navigation files name their system through the file-type letter ({@code G} for
   * GLONASS, {@code H} for SBAS); everything else uses the system letter, defaulting to GPS.</p>
   *
   * @return default constellation
   */
  public Constellation defaultConstellation() {
    if (majorVersion() == 2 && fileType == FileType.NAV) {
      switch (Character.toUpperCase(fileTypeCode)) {
        case 'G':
          return Constellation.GLONASS;
        case 'H':
          return Constellation.SBAS;
        default:
          return Constellation.GPS;
      }
    }
    return Constellation.fromCode(systemCode).orElse(Constellation.GPS);
  }

  @Override
  public String toString() {
    return "HeaderMetadata{version=" + version
        + ", type=" + fileTypeCode
        + ", system=" + systemCode
        + ", observationTypes=" + observationTypes
        + ", timeSystem=" + timeSystem()
        + '}';
  }

  /**
   * Mutable accumulator used while header records are interpreted.
   */
  public static final class Builder {
    private final double version;
    private final char fileTypeCode;
    private final FileType fileType;
    private final char systemCode;
    private ObservationTypeTable observationTypes = ObservationTypeTable.empty();
    private OptionalInt leapSeconds = OptionalInt.empty();
    private Position approxPosition;
    private String declaredTimeSystem;
    private OptionalDouble interval = OptionalDouble.empty();
    private Instant timeOfFirstObs;
    private String markerName;
    private OptionalInt receiverClockOffsetApplied = OptionalInt.empty();
    private final Map<Constellation, List<String>> constellationTypes = new EnumMap<>(Constellation.class);
    private final List<IonosphericCorrection> ionosphericCorrections = new ArrayList<>();
    private final List<TimeSystemCorrection> timeSystemCorrections = new ArrayList<>();
    private final Map<String, List<String>> passthrough = new LinkedHashMap<>();

    private Builder(double version, char fileTypeCode, FileType fileType, char systemCode) {
      this.version = version;
      this.fileTypeCode = fileTypeCode;
      this.fileType = Objects.requireNonNull(fileType, "fileType");
      this.systemCode = systemCode;
    }

    public double version() {
      return version;
    }

    public Builder observationTypes(ObservationTypeTable table) {
      this.observationTypes = Objects.requireNonNull(table, "table");
      return this;
    }

    /**
     * Declares the observation codes of one constellation; takes precedence over a global list.
     *
     * @param constellation constellation the codes apply to
     * @param codes ordered observation codes
     * @return this builder
     */
    public Builder constellationObservationTypes(Constellation constellation, List<String> codes) {
      constellationTypes.put(
          Objects.requireNonNull(constellation, "constellation"), List.copyOf(codes));
      return this;
    }

    public Builder leapSeconds(int seconds) {
      this.leapSeconds = OptionalInt.of(seconds);
      return this;
    }

    /**
     * Records the approximate position; only the first occurrence is kept.
     *
     * @param position marker position
     * @return this builder
     */
    public Builder approxPosition(Position position) {
      if (this.approxPosition == null) {
        this.approxPosition = position;
      }
      return this;
    }

    public Builder declaredTimeSystem(String timeSystem) {
      this.declaredTimeSystem = timeSystem == null ? null : timeSystem.trim();
      return this;
    }

    public Builder interval(double seconds) {
      this.interval = OptionalDouble.of(seconds);
      return this;
    }

    public Builder timeOfFirstObs(Instant time) {
      this.timeOfFirstObs = time;
      return this;
    }

    public Builder markerName(String name) {
      this.markerName = name == null || name.isBlank() ? null : name.trim();
      return this;
    }

    public Builder receiverClockOffsetApplied(int applied) {
      this.receiverClockOffsetApplied = OptionalInt.of(applied);
      return this;
    }

    public Builder addIonosphericCorrection(IonosphericCorrection correction) {
      ionosphericCorrections.add(Objects.requireNonNull(correction, "correction"));
      return this;
    }

    public Builder addTimeSystemCorrection(TimeSystemCorrection correction) {
      timeSystemCorrections.add(Objects.requireNonNull(correction, "correction"));
      return this;
    }

    public Builder passthrough(String label, String content) {
      passthrough.computeIfAbsent(label, ignored -> new ArrayList<>()).add(content.trim());
      return this;
    }

    public HeaderMetadata build() {
      return new HeaderMetadata(this);
    }
  }
}
