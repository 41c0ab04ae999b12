package ca.gc.cra.rinex.domain.dataset;

import java.util.Objects;

/**
 * Recoverable condition met while decoding; attached to the dataset.
 *
 * @param kind warning category
 * @param lineNumber 1-based source line, or {@code 0} when not tied to one line
 * @param message human-readable description
 * @since 0.1.0
 */
public record DecodeWarning(WarningKind kind, int lineNumber, String message) {
  public DecodeWarning {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return kind + "@" + lineNumber + ": " + message;
  }
}
