package ca.gc.cra.rinex.application.port.context;

import ca.gc.cra.rinex.application.port.MetricsPort;
import ca.gc.cra.rinex.domain.dataset.DecodeWarning;
import ca.gc.cra.rinex.domain.dataset.WarningKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-file decode state shared by the grammar and the assembler.
 * <p><strong>Why:</strong> Grammars need the selection filters and a place to report recoverable
 * conditions; keeping both here leaves the grammars themselves stateless.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accumulate {@link DecodeWarning} values and log each one at WARN.</li>
 *   <li>Decide whether an epoch is admitted by the time bounds and interval decimation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one context belongs to one decode.</p>
 * <p><strong>Observability:</strong> Increments {@code decode.warnings} per warning.</p>
 *
 * @since 0.1.0
 */
public final class DecodeContext {
  private static final Logger log = LoggerFactory.getLogger(DecodeContext.class);

  /** Outcome of {@link #admit(Instant)}. */
  public enum Admission {
    /** Decode the epoch and hand it to the sink. */
    ADMIT,
    /** Consume the epoch's lines and drop it. */
    SKIP,
    /** The epoch is past the end bound; stop scanning. */
    STOP
  }

  private final String sourceName;
  private final DecodeOptions options;
  private final MetricsPort metrics;
  private final List<DecodeWarning> warnings = new ArrayList<>();
  private final Set<String> reportedOnce = new HashSet<>();
  private Instant intervalReference;

  public DecodeContext(String sourceName, DecodeOptions options, MetricsPort metrics) {
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public String sourceName() {
    return sourceName;
  }

  public DecodeOptions options() {
    return options;
  }

  /**
   * Records a recoverable condition.
   *
   * @param kind warning category
   * @param lineNumber source line, or {@code 0}
   * @param message description
   */
  public void warn(WarningKind kind, int lineNumber, String message) {
    DecodeWarning warning = new DecodeWarning(kind, lineNumber, message);
    warnings.add(warning);
    metrics.increment("decode.warnings");
    log.warn("{} line {}: {} ({})", sourceName, lineNumber, message, kind);
  }

  /**
   * Records a recoverable condition once per key for this file.
   *
   * @param kind warning category
   * @param key de-duplication key, e.g. a constellation letter
   * @param lineNumber line of the first occurrence
   * @param message description
   * @return {@code true} when the warning was recorded, {@code false} when it was already reported
   */
  public boolean warnOnce(WarningKind kind, String key, int lineNumber, String message) {
    if (!reportedOnce.add(kind + "/" + key)) {
      return false;
    }
    warn(kind, lineNumber, message);
    return true;
  }

  public List<DecodeWarning> warnings() {
    return List.copyOf(warnings);
  }

  /**
   * Applies the time bounds and the interval decimation to an epoch.
   *
   * <p>With an interval configured, the first admitted epoch sets the reference; a later epoch is
   * admitted only when at least one interval has elapsed, and the reference then advances by one
   * interval.</p>
   *
   * @param time epoch timestamp
   * @return admission decision
   */
  public Admission admit(Instant time) {
    Objects.requireNonNull(time, "time");
    if (options.timeStart().isPresent() && time.isBefore(options.timeStart().get())) {
      return Admission.SKIP;
    }
    if (options.timeEnd().isPresent() && time.isAfter(options.timeEnd().get())) {
      return Admission.STOP;
    }
    if (options.interval().isPresent()) {
      Duration interval = options.interval().get();
      if (intervalReference == null) {
        intervalReference = time;
      } else if (Duration.between(intervalReference, time).compareTo(interval) < 0) {
        return Admission.SKIP;
      } else {
        intervalReference = intervalReference.plus(interval);
      }
    }
    return Admission.ADMIT;
  }
}
