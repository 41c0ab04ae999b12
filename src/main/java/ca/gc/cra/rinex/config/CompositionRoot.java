package ca.gc.cra.rinex.config;

import ca.gc.cra.rinex.application.decode.BatchDecodeUseCase;
import ca.gc.cra.rinex.application.decode.GrammarDispatcher;
import ca.gc.cra.rinex.application.decode.RinexDecoder;
import ca.gc.cra.rinex.application.port.MetricsPort;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.infrastructure.grammar.Version2NavGrammar;
import ca.gc.cra.rinex.infrastructure.grammar.Version2ObsGrammar;
import ca.gc.cra.rinex.infrastructure.grammar.Version3NavGrammar;
import ca.gc.cra.rinex.infrastructure.grammar.Version3ObsGrammar;
import ca.gc.cra.rinex.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rinex.logging.LoggingConfigurator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires decoder use cases to the concrete grammars and metrics adapter.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so callers only supply a {@link DecoderConfig}.</p>
 * <p><strong>Role:</strong> Composition root for the decode pipeline (header dispatch, grammar, dataset
 * assembly).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the RINEX 2/3 observation and navigation grammars.</li>
 *   <li>Create the metrics adapter from the configured exporter.</li>
 *   <li>Build single-file and batch decode use cases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread; the decoders it returns are thread-safe.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 * @see RinexDecoder
 * @see BatchDecodeUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final DecoderConfig config;
  private final MetricsPort metrics;
  private final GrammarDispatcher dispatcher;

  /**
   * Creates the root and its metrics adapter.
   *
   * @param config decoder configuration
   */
  public CompositionRoot(DecoderConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(
        Objects.requireNonNull(config, "config").metricsExporter().orElse(null)));
  }

  /**
   * Creates the root with a caller-supplied metrics port.
   *
   * @param config decoder configuration
   * @param metrics metrics sink
   */
  public CompositionRoot(DecoderConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.dispatcher = new GrammarDispatcher(grammars());
    log.debug("Decoder wired with {}", config);
  }

  /**
   * Returns one instance of every supported grammar.
   *
   * @return RINEX 2 and 3 observation and navigation grammars
   */
  public static List<RinexGrammar> grammars() {
    return List.of(
        new Version2ObsGrammar(),
        new Version3ObsGrammar(),
        new Version2NavGrammar(),
        new Version3NavGrammar());
  }

  public DecoderConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public GrammarDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Builds a decoder applying the configured selection filters.
   *
   * @return decoder bound to this root's dispatcher and metrics
   */
  public RinexDecoder decoder() {
    return new RinexDecoder(dispatcher, config.toDecodeOptions(), metrics);
  }

  /**
   * Builds a batch use case sized by {@link DecoderConfig#workers()}.
   *
   * @return batch decode use case
   */
  public BatchDecodeUseCase batchDecodeUseCase() {
    return new BatchDecodeUseCase(decoder(), config.workers());
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
