package powder.efficiency.experiment;

import java.util.Arrays;

/**
 * Summed response of all tubes of a tube detector on a common angular grid: one row per pixel
 * height in the tube, one column per angular bin. Bins no data fell into hold zero.
 */
public class ReferenceSurface {

  private final double[] binAngles;
  private final double[][] intensities;
  private final double[][] variances;

  /**
   * @param binAngles Angle of each bin, ascending
   * @param intensities Mean counts [pixel in tube][bin]
   * @param variances Variance of the mean counts [pixel in tube][bin]
   */
  public ReferenceSurface(double[] binAngles, double[][] intensities, double[][] variances) {
    for (int p = 0; p < intensities.length; ++p) {
      if (intensities[p].length != binAngles.length || variances[p].length != binAngles.length) {
        throw new IllegalArgumentException("Row " + p + " does not have " + binAngles.length
            + " bins");
      }
    }
    this.binAngles = binAngles.clone();
    this.intensities = deepCopy(intensities);
    this.variances = deepCopy(variances);
  }

  private static double[][] deepCopy(double[][] data) {
    double[][] out = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      out[i] = data[i].clone();
    }
    return out;
  }

  public int getNumberOfRows() {
    return intensities.length;
  }

  public int getNumberOfBins() {
    return binAngles.length;
  }

  public double getBinAngle(int bin) {
    return binAngles[bin];
  }

  public double getIntensity(int row, int bin) {
    return intensities[row][bin];
  }

  public double getVariance(int row, int bin) {
    return variances[row][bin];
  }

  /**
   * @param from First bin (inclusive)
   * @param to Last bin (exclusive)
   * @return angles of the bins in [from, to)
   */
  public double[] getBinAngles(int from, int to) {
    return Arrays.copyOfRange(binAngles, from, to);
  }

  /**
   * @param row Pixel height in the tube
   * @param from First bin (inclusive)
   * @param to Last bin (exclusive)
   * @return intensities of the row in bins [from, to)
   */
  public double[] getIntensities(int row, int from, int to) {
    return Arrays.copyOfRange(intensities[row], from, to);
  }

}
