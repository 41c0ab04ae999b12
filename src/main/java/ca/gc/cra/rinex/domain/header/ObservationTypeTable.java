package ca.gc.cra.rinex.domain.header;

import ca.gc.cra.rinex.domain.gnss.Constellation;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Observation-type lists declared in an observation header.
 *
 * <p>Version 2 declares one list for every constellation ({@code # / TYPES OF OBSERV}); version 3
 * declares one list per constellation ({@code SYS / # / OBS TYPES}). Lookups always go through
 * {@link #typesFor(Constellation)} so grammars never need to know which form applies.</p>
 *
 * @since 0.1.0
 */
public final class ObservationTypeTable {
  private static final ObservationTypeTable EMPTY = new ObservationTypeTable(List.of(), Map.of());

  private final List<String> global;
  private final Map<Constellation, List<String>> perConstellation;

  private ObservationTypeTable(List<String> global, Map<Constellation, List<String>> perConstellation) {
    this.global = global;
    this.perConstellation = perConstellation;
  }

  public static ObservationTypeTable empty() {
    return EMPTY;
  }

  /**
   * Creates a table that applies one list to every constellation.
   *
   * @param types ordered observation codes
   * @return table
   */
  public static ObservationTypeTable global(List<String> types) {
    return new ObservationTypeTable(List.copyOf(Objects.requireNonNull(types, "types")), Map.of());
  }

  /**
   * Creates a table with one list per constellation.
   *
   * @param types ordered observation codes keyed by constellation
   * @return table
   */
  public static ObservationTypeTable perConstellation(Map<Constellation, List<String>> types) {
    Objects.requireNonNull(types, "types");
    Map<Constellation, List<String>> copy = new EnumMap<>(Constellation.class);
    types.forEach((constellation, list) -> copy.put(constellation, List.copyOf(list)));
    return new ObservationTypeTable(List.of(), Collections.unmodifiableMap(copy));
  }

  /**
   * Resolves the list that applies to a constellation.
   *
   * @param constellation satellite constellation
   * @return ordered codes, or empty when the header declares none for it
   */
  public Optional<List<String>> typesFor(Constellation constellation) {
    if (!global.isEmpty()) {
      return Optional.of(global);
    }
    return Optional.ofNullable(perConstellation.get(constellation));
  }

  public boolean isGlobal() {
    return !global.isEmpty();
  }

  public boolean isEmpty() {
    return global.isEmpty() && perConstellation.isEmpty();
  }

  /**
   * Returns the declared lists keyed by constellation letter; a global list is reported under
   * {@code '*'}.
   *
   * @return ordered view of every declared list
   */
  public Map<Character, List<String>> asMap() {
    Map<Character, List<String>> view = new LinkedHashMap<>();
    if (!global.isEmpty()) {
      view.put('*', global);
    }
    perConstellation.forEach((constellation, list) -> view.put(constellation.code(), list));
    return Collections.unmodifiableMap(view);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ObservationTypeTable that)) {
      return false;
    }
    return global.equals(that.global) && perConstellation.equals(that.perConstellation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(global, perConstellation);
  }

  @Override
  public String toString() {
    return "ObservationTypeTable" + asMap();
  }
}
