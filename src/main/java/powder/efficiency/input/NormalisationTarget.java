package powder.efficiency.input;

/**
 * What the raw scan is divided by before calibration constants are derived.
 */
public enum NormalisationTarget {

  NONE("None"),
  MONITOR("Monitor"),
  /**
   * Summed counts inside the regions of interest at each scan point (sequential method only)
   */
  ROI("ROI");

  private final String name;

  NormalisationTarget(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

}
