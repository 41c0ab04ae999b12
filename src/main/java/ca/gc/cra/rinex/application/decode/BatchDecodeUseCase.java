package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.application.port.RinexSource;
import ca.gc.cra.rinex.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes independent files in parallel, one worker per file.
 * <p><strong>Why:</strong> Decoding one file is strictly sequential; throughput comes from running
 * whole files side by side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Give every file its own decode (cursor, header, builder); nothing is shared across files.</li>
 *   <li>Turn a fatal error into a {@link DecodeOutcome.Failure} for that file only.</li>
 *   <li>Return outcomes in the order of the input sources.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call owns a private worker pool; concurrent calls are safe.</p>
 *
 * @since 0.1.0
 */
public final class BatchDecodeUseCase {
  private static final Logger log = LoggerFactory.getLogger(BatchDecodeUseCase.class);

  private final RinexDecoder decoder;
  private final int workers;

  /**
   * Creates the use case.
   *
   * @param decoder decoder shared by all workers
   * @param workers maximum number of files decoded at once; must be positive
   */
  public BatchDecodeUseCase(RinexDecoder decoder, int workers) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Decodes every source.
   *
   * @param sources files to decode
   * @return one outcome per source, in input order
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  public List<DecodeOutcome> decodeAll(List<? extends RinexSource> sources) throws InterruptedException {
    Objects.requireNonNull(sources, "sources");
    if (sources.isEmpty()) {
      return List.of();
    }
    ExecutorService pool = ExecutorFactories.newDecodePool(
        Math.min(workers, sources.size()), "rinex-decode",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      List<Future<DecodeOutcome>> futures = new ArrayList<>(sources.size());
      for (RinexSource source : sources) {
        futures.add(pool.submit(() -> decodeOne(source)));
      }
      List<DecodeOutcome> outcomes = new ArrayList<>(futures.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(futures.get(i), sources.get(i)));
      }
      long failures = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
      log.info("Batch decode finished: {} files, {} failed", outcomes.size(), failures);
      return List.copyOf(outcomes);
    } finally {
      pool.shutdownNow();
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Decode workers did not stop within 5 seconds");
      }
    }
  }

  private DecodeOutcome decodeOne(RinexSource source) {
    try {
      return new DecodeOutcome.Success(source.name(), decoder.decode(source));
    } catch (Exception ex) {
      return new DecodeOutcome.Failure(source.name(), ex);
    }
  }

  private static DecodeOutcome await(Future<DecodeOutcome> future, RinexSource source)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      Exception failure = cause instanceof Exception exception ? exception : ex;
      return new DecodeOutcome.Failure(source.name(), failure);
    }
  }
}
