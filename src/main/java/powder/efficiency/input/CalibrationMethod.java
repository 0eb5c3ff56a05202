package powder.efficiency.input;

/**
 * Policy used to reduce the distribution of response ratios of a pixel to one factor.
 */
public enum CalibrationMethod {

  MEDIAN("Median"),
  MEAN("Mean"),
  /**
   * Robust center of the ratio distribution, delegated to a
   * {@link powder.efficiency.utils.RobustCenterEstimator}. Only available for 1-D reduction.
   */
  MOST_LIKELY_MEAN("MostLikelyMean");

  private final String name;

  CalibrationMethod(String name) {
    this.name = name;
  }

  /**
   * Find the policy matching the given display name (case-insensitive)
   *
   * @param name Name such as "Median"
   * @return matching policy
   * @throws IllegalArgumentException if no policy has the given name
   */
  public static CalibrationMethod fromName(String name) {
    for (CalibrationMethod method : values()) {
      if (method.name.equalsIgnoreCase(name.trim())) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown calibration method: " + name);
  }

  public String getName() {
    return name;
  }

}
