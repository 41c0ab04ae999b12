package ca.gc.cra.rinex.application.decode;

import ca.gc.cra.rinex.domain.dataset.RinexDataset;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-file result of a batch decode: either a dataset or the failure that abandoned the file.
 *
 * @since 0.1.0
 */
public sealed interface DecodeOutcome permits DecodeOutcome.Success, DecodeOutcome.Failure {
  /**
   * Returns the name of the decoded source.
   *
   * @return source name
   */
  String sourceName();

  default boolean isSuccess() {
    return this instanceof Success;
  }

  default Optional<RinexDataset> dataset() {
    return this instanceof Success success ? Optional.of(success.value()) : Optional.empty();
  }

  default Optional<Exception> failure() {
    return this instanceof Failure failed ? Optional.of(failed.cause()) : Optional.empty();
  }

  /**
   * Successful decode.
   *
   * @param sourceName source name
   * @param value decoded dataset
   */
  record Success(String sourceName, RinexDataset value) implements DecodeOutcome {
    public Success {
      Objects.requireNonNull(sourceName, "sourceName");
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Failed decode; the file was abandoned as a unit.
   *
   * @param sourceName source name
   * @param cause fatal decode or I/O error
   */
  record Failure(String sourceName, Exception cause) implements DecodeOutcome {
    public Failure {
      Objects.requireNonNull(sourceName, "sourceName");
      Objects.requireNonNull(cause, "cause");
    }
  }
}
