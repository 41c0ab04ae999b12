package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.application.port.MetricsPort;
import ca.gc.cra.rinex.application.port.RinexGrammar;
import ca.gc.cra.rinex.application.port.RinexSource;
import ca.gc.cra.rinex.application.port.context.DecodeContext;
import ca.gc.cra.rinex.application.port.context.DecodeOptions;
import ca.gc.cra.rinex.domain.dataset.RinexDataset;
import ca.gc.cra.rinex.domain.error.RinexDecodeException;
import ca.gc.cra.rinex.domain.header.HeaderBlock;
import ca.gc.cra.rinex.domain.header.HeaderMetadata;
import ca.gc.cra.rinex.domain.header.HeaderParser;
import ca.gc.cra.rinex.domain.text.LineCursor;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Decodes one RINEX file into a {@link RinexDataset}.
 * <p><strong>Why:</strong> Ties the single streaming pass together: header block, dispatch, header
 * interpretation, body grammar, assembly.</p>
 * <p><strong>Role:</strong> Application use case; {@link BatchDecodeUseCase} runs one call per file on
 * worker threads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the grammar through {@link GrammarDispatcher}; unsupported versions abort the file.</li>
 *   <li>Give every decode its own cursor, context and assembler.</li>
 *   <li>Abandon the file as a unit on the first fatal error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; no state is shared between decodes.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@value #MDC_FILE_KEY} for the duration of a decode;
 * emits {@code decode.files}, {@code decode.failures}, {@code decode.epochs}, {@code decode.records}
 * and {@code decode.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class RinexDecoder {
  private static final Logger log = LoggerFactory.getLogger(RinexDecoder.class);

  /** MDC key carrying the name of the file being decoded. */
  public static final String MDC_FILE_KEY = "rinex.file";

  /** Byte-to-column mapping stays one-to-one for any 8-bit input. */
  static final Charset CHARSET = StandardCharsets.ISO_8859_1;

  private final GrammarDispatcher dispatcher;
  private final DecodeOptions options;
  private final MetricsPort metrics;

  /**
   * Creates a decoder.
   *
   * @param dispatcher grammar dispatcher
   * @param options selection filters applied to every file
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} when metrics are disabled
   */
  public RinexDecoder(GrammarDispatcher dispatcher, DecodeOptions options, MetricsPort metrics) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.options = Objects.requireNonNull(options, "options");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public DecodeOptions options() {
    return options;
  }

  /**
   * Decodes a file from a byte source.
   *
   * @param source decompressed RINEX bytes
   * @return dataset
   * @throws IOException when the source fails
   * @throws RinexDecodeException when the file is malformed or unsupported
   */
  public RinexDataset decode(RinexSource source) throws IOException, RinexDecodeException {
    Objects.requireNonNull(source, "source");
    try (InputStream in = source.open()) {
      return decode(new InputStreamReader(in, CHARSET), source.name(), source.path());
    }
  }

  /**
   * Decodes an uncompressed file on disk.
   *
   * @param path file path
   * @return dataset with a {@code filename} attribute
   * @throws IOException when the file cannot be read
   * @throws RinexDecodeException when the file is malformed or unsupported
   */
  public RinexDataset decode(Path path) throws IOException, RinexDecodeException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = new InputStreamReader(Files.newInputStream(path), CHARSET)) {
      return decode(reader, String.valueOf(path.getFileName()), Optional.of(path));
    }
  }

  /**
   * Decodes already-decoded text.
   *
   * @param reader character source; closed by this call
   * @param name name used in logs and warnings
   * @return dataset
   * @throws IOException when the reader fails
   * @throws RinexDecodeException when the file is malformed or unsupported
   */
  public RinexDataset decode(Reader reader, String name) throws IOException, RinexDecodeException {
    return decode(reader, name, Optional.empty());
  }

  private RinexDataset decode(Reader reader, String name, Optional<Path> path)
      throws IOException, RinexDecodeException {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(name, "name");
    String previousFile = MDC.get(MDC_FILE_KEY);
    MDC.put(MDC_FILE_KEY, name);
    long start = System.nanoTime();
    metrics.increment("decode.files");
    try (LineCursor cursor = new LineCursor(reader)) {
      HeaderBlock block = HeaderParser.readBlock(cursor);
      RinexGrammar grammar = dispatcher.select(block);
      HeaderMetadata header = grammar.parseHeader(block);
      GrammarSelection selection = dispatcher.resolve(header);
      log.debug("Selected {} for {} (version {}, {} pass-through header labels)",
          selection.variant(), name, header.version(), header.passthrough().size());

      DecodeContext context = new DecodeContext(name, options, metrics);
      DatasetAssembler assembler = new DatasetAssembler(header, context, path);
      selection.grammar().parseBody(cursor, header, context, assembler);
      RinexDataset dataset = assembler.finish();

      long elapsed = System.nanoTime() - start;
      metrics.observe("decode.epochs", assembler.acceptedCount());
      metrics.observe("decode.records", assembler.recordCount());
      log.info("Decoded {} as {}: {} epochs, {} satellites, {} warnings in {} ms",
          name, selection.variant(), dataset.times().size(), dataset.satellites().size(),
          dataset.warnings().size(), TimeUnit.NANOSECONDS.toMillis(elapsed));
      return dataset;
    } catch (RinexDecodeException | IOException | RuntimeException ex) {
      metrics.increment("decode.failures");
      log.error("Failed to decode {}: {}", name, ex.getMessage());
      throw ex;
    } finally {
      metrics.observe("decode.latencyNanos", System.nanoTime() - start);
      if (previousFile == null) {
        MDC.remove(MDC_FILE_KEY);
      } else {
        MDC.put(MDC_FILE_KEY, previousFile);
      }
    }
  }
}
