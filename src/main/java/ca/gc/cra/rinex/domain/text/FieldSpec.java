package ca.gc.cra.rinex.domain.text;

import java.util.Objects;

/**
 * Descriptor of one field in a fixed-column record.
 *
 * @param name field name used to look the value up after decoding
 * @param start 0-based first column
 * @param width number of columns
 * @param kind interpretation of the field text
 * @since 0.1.0
 */
public record FieldSpec(String name, int start, int width, FieldKind kind) {
  public FieldSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (start < 0 || width <= 0) {
      throw new IllegalArgumentException("invalid column range for " + name + ": " + start + "+" + width);
    }
  }

  public static FieldSpec real(String name, int start, int width) {
    return new FieldSpec(name, start, width, FieldKind.REAL);
  }

  public static FieldSpec integer(String name, int start, int width) {
    return new FieldSpec(name, start, width, FieldKind.INTEGER);
  }

  public static FieldSpec text(String name, int start, int width) {
    return new FieldSpec(name, start, width, FieldKind.TEXT);
  }
}
