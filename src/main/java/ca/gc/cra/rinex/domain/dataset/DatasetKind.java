package ca.gc.cra.rinex.domain.dataset;

/**
 * Shape of a decoded dataset.
 *
 * @since 0.1.0
 */
public enum DatasetKind {
  /** time x satellite x observation code. */
  OBS("obs"),
  /** time x satellite x ephemeris parameter. */
  NAV("nav");

  private final String label;

  DatasetKind(String label) {
    this.label = label;
  }

  /**
   * Returns the value stored in the {@code rinextype} attribute.
   *
   * @return lower-case kind label
   */
  public String label() {
    return label;
  }
}
