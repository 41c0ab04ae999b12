package ca.gc.cra.rinex.domain.text;

import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Field values produced by {@link RecordLayout#decode(Line)}.
 *
 * <p>Numeric fields are stored as boxed optionals keyed by field name; text fields keep the raw
 * slice. Look-ups of names that the layout does not declare fail fast.</p>
 *
 * @since 0.1.0
 */
public final class DecodedRecord {
  private final Line line;
  private final RecordLayout layout;
  private final Map<String, Object> values;

  DecodedRecord(Line line, RecordLayout layout, Map<String, Object> values) {
    this.line = line;
    this.layout = layout;
    this.values = values;
  }

  /**
   * Returns the line this record was decoded from.
   *
   * @return source line
   */
  public Line line() {
    return line;
  }

  public OptionalDouble real(String name) {
    return (OptionalDouble) lookup(name, FieldKind.REAL);
  }

  public OptionalInt integer(String name) {
    return (OptionalInt) lookup(name, FieldKind.INTEGER);
  }

  public String text(String name) {
    return (String) lookup(name, FieldKind.TEXT);
  }

  /**
   * Returns a real field, or {@link Double#NaN} when blank.
   *
   * @param name field name
   * @return value or NaN
   */
  public double realOrNaN(String name) {
    return real(name).orElse(Double.NaN);
  }

  /**
   * Returns an integer field that must be present.
   *
   * @param name field name
   * @return decoded value
   * @throws MalformedNumericFieldException when the field is blank
   */
  public int requireInt(String name) throws MalformedNumericFieldException {
    OptionalInt value = integer(name);
    if (value.isPresent()) {
      return value.getAsInt();
    }
    FieldSpec spec = layout.field(name);
    throw FortranNumbers.malformed(
        line.slice(spec.start(), spec.width()), line.number(), spec.start(), spec.width(),
        "Missing required integer field");
  }

  /**
   * Returns a real field that must be present.
   *
   * @param name field name
   * @return decoded value
   * @throws MalformedNumericFieldException when the field is blank
   */
  public double requireReal(String name) throws MalformedNumericFieldException {
    OptionalDouble value = real(name);
    if (value.isPresent()) {
      return value.getAsDouble();
    }
    FieldSpec spec = layout.field(name);
    throw FortranNumbers.malformed(
        line.slice(spec.start(), spec.width()), line.number(), spec.start(), spec.width(),
        "Missing required numeric field");
  }

  private Object lookup(String name, FieldKind expected) {
    FieldSpec spec = layout.field(Objects.requireNonNull(name, "name"));
    if (spec.kind() != expected) {
      throw new IllegalArgumentException("field " + name + " is " + spec.kind() + ", not " + expected);
    }
    return values.get(name);
  }
}
