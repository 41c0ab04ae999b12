package ca.gc.cra.rinex.domain.text;

import ca.gc.cra.rinex.domain.error.MalformedNumericFieldException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Declarative table of fixed-column fields for one record type.
 * <p><strong>Why:</strong> Keeps version and constellation quirks in data (column tables) instead of in
 * scattered substring arithmetic; one generic decoder consumes every table.</p>
 * <p><strong>Role:</strong> Domain support type used by the header parser and the epoch grammars.</p>
 * <p><strong>Thread-safety:</strong> Immutable; layouts are shared constants.</p>
 *
 * @since 0.1.0
 */
public final class RecordLayout {
  private final String name;
  private final List<FieldSpec> fields;
  private final Map<String, FieldSpec> byName;

  private RecordLayout(String name, List<FieldSpec> fields) {
    this.name = Objects.requireNonNull(name, "name");
    this.fields = List.copyOf(fields);
    Map<String, FieldSpec> index = new HashMap<>();
    for (FieldSpec spec : this.fields) {
      if (index.put(spec.name(), spec) != null) {
        throw new IllegalArgumentException("duplicate field " + spec.name() + " in layout " + name);
      }
    }
    this.byName = Map.copyOf(index);
  }

  /**
   * Creates a layout from field descriptors.
   *
   * @param name layout name used in diagnostics
   * @param fields ordered field descriptors
   * @return immutable layout
   */
  public static RecordLayout of(String name, FieldSpec... fields) {
    return new RecordLayout(name, Arrays.asList(fields));
  }

  public String name() {
    return name;
  }

  public List<FieldSpec> fields() {
    return fields;
  }

  /**
   * Returns the descriptor for a field name.
   *
   * @param fieldName declared field name
   * @return descriptor
   * @throws IllegalArgumentException when the layout does not declare the field
   */
  public FieldSpec field(String fieldName) {
    FieldSpec spec = byName.get(fieldName);
    if (spec == null) {
      throw new IllegalArgumentException("layout " + name + " has no field " + fieldName);
    }
    return spec;
  }

  /**
   * Decodes every declared field of a line.
   *
   * @param line source line
   * @return decoded values
   * @throws MalformedNumericFieldException when a numeric field holds non-numeric text
   */
  public DecodedRecord decode(Line line) throws MalformedNumericFieldException {
    Objects.requireNonNull(line, "line");
    Map<String, Object> values = new LinkedHashMap<>();
    for (FieldSpec spec : fields) {
      Object value = switch (spec.kind()) {
        case REAL -> FortranNumbers.decodeReal(line, spec.start(), spec.width());
        case INTEGER -> FortranNumbers.decodeInt(line, spec.start(), spec.width());
        case TEXT -> line.slice(spec.start(), spec.width());
      };
      values.put(spec.name(), value);
    }
    return new DecodedRecord(line, this, values);
  }
}
