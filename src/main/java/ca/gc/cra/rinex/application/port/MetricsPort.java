package ca.gc.cra.rinex.application.port;

/**
 * <strong>What:</strong> Port abstracting decoder metrics emission.
 * <p><strong>Why:</strong> Lets the decode use cases count files, epochs and warnings without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} discards everything.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from batch workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code decode.files},
 * {@code decode.failures}, {@code decode.epochs}, {@code decode.records}, {@code decode.warnings},
 * {@code decode.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (count, nanoseconds, ...)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
