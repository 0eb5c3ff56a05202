package powder.efficiency.output;

/**
 * Final efficiency constants: one value per pixel with its uncertainty and a validity flag set
 * by the mask criterion. Constants of a tube detector are stored tube after tube and can be
 * addressed by (tube, pixel in tube).
 */
public class CalibrationTable {

  private final double[] values;
  private final double[] uncertainties;
  private final boolean[] valid;
  private final int pixelsPerTube;

  /**
   * @param values Constants, all positive and finite
   * @param uncertainties Uncertainty of each constant
   * @param valid False for constants outside the mask criterion
   * @param pixelsPerTube Pixels per tube for a tube detector; the total count for a
   * one-dimensional detector
   */
  public CalibrationTable(double[] values, double[] uncertainties, boolean[] valid,
      int pixelsPerTube) {
    if (values.length != uncertainties.length || values.length != valid.length) {
      throw new IllegalArgumentException("Values, uncertainties and flags differ in length");
    }
    if (pixelsPerTube < 1 || values.length % pixelsPerTube != 0) {
      throw new IllegalArgumentException(
          values.length + " constants cannot be split into tubes of " + pixelsPerTube);
    }
    this.values = values.clone();
    this.uncertainties = uncertainties.clone();
    this.valid = valid.clone();
    this.pixelsPerTube = pixelsPerTube;
  }

  public int size() {
    return values.length;
  }

  public int getNumberOfTubes() {
    return values.length / pixelsPerTube;
  }

  public int getPixelsPerTube() {
    return pixelsPerTube;
  }

  public double getValue(int index) {
    return values[index];
  }

  public double getValue(int tube, int pixel) {
    return values[tube * pixelsPerTube + pixel];
  }

  public double getUncertainty(int index) {
    return uncertainties[index];
  }

  public double getUncertainty(int tube, int pixel) {
    return uncertainties[tube * pixelsPerTube + pixel];
  }

  public boolean isValid(int index) {
    return valid[index];
  }

  public boolean isValid(int tube, int pixel) {
    return valid[tube * pixelsPerTube + pixel];
  }

  public double[] getValues() {
    return values.clone();
  }

  public double[] getUncertainties() {
    return uncertainties.clone();
  }

  /**
   * @return 1 for valid constants and 0 for masked ones
   */
  public double[] getValidityFlags() {
    double[] flags = new double[valid.length];
    for (int i = 0; i < valid.length; ++i) {
      flags[i] = valid[i] ? 1. : 0.;
    }
    return flags;
  }

  public int countValid() {
    int count = 0;
    for (boolean isValid : valid) {
      if (isValid) {
        ++count;
      }
    }
    return count;
  }

}
