package powder.efficiency.input;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Response of a single pixel across all scan points: samples of (angle, intensity, variance),
 * sorted by angle on construction. Instances are immutable; the cropping and scaling operations
 * all return new curves.
 */
public class PixelResponseCurve {

  private final double[] angles;
  private final double[] intensities;
  private final double[] variances;

  /**
   * Build a curve from unsorted samples. Arrays are copied and sorted together by angle
   * (stable, so repeated angles keep their scan order).
   *
   * @param angles Scattering angle of each sample (degrees)
   * @param intensities Counts (or normalised counts) of each sample
   * @param variances Variance of each intensity
   */
  public PixelResponseCurve(double[] angles, double[] intensities, double[] variances) {
    if (angles.length != intensities.length || angles.length != variances.length) {
      throw new IllegalArgumentException("Angle, intensity and variance lengths differ: "
          + angles.length + ", " + intensities.length + ", " + variances.length);
    }
    Integer[] order = IntStream.range(0, angles.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble(i -> angles[i]));
    this.angles = new double[angles.length];
    this.intensities = new double[angles.length];
    this.variances = new double[angles.length];
    for (int i = 0; i < order.length; ++i) {
      this.angles[i] = angles[order[i]];
      this.intensities[i] = intensities[order[i]];
      this.variances[i] = variances[order[i]];
    }
  }

  public int size() {
    return angles.length;
  }

  public double getAngle(int index) {
    return angles[index];
  }

  public double getIntensity(int index) {
    return intensities[index];
  }

  public double getVariance(int index) {
    return variances[index];
  }

  public double[] getAngles() {
    return angles.clone();
  }

  public double[] getIntensities() {
    return intensities.clone();
  }

  public double[] getVariances() {
    return variances.clone();
  }

  /**
   * @return number of samples with non-zero intensity
   */
  public int countNonZero() {
    int count = 0;
    for (double intensity : intensities) {
      if (intensity != 0.) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Sub-curve of the samples with index in [from, to)
   *
   * @param from First sample kept
   * @param to One past the last sample kept
   * @return new curve
   */
  public PixelResponseCurve slice(int from, int to) {
    if (from < 0 || to > size() || from > to) {
      throw new IndexOutOfBoundsException(
          "Cannot take samples [" + from + ", " + to + ") of a curve of size " + size());
    }
    return new PixelResponseCurve(
        Arrays.copyOfRange(angles, from, to),
        Arrays.copyOfRange(intensities, from, to),
        Arrays.copyOfRange(variances, from, to));
  }

  /**
   * @param count Number of samples to drop from the low-angle end
   * @return new curve without the first samples
   */
  public PixelResponseCurve cropLeading(int count) {
    return slice(Math.min(count, size()), size());
  }

  /**
   * @param count Number of samples to drop from the high-angle end
   * @return new curve without the last samples
   */
  public PixelResponseCurve cropTrailing(int count) {
    return slice(0, Math.max(0, size() - count));
  }

  /**
   * @param count Number of samples to keep from the high-angle end
   * @return new curve holding only the last samples
   */
  public PixelResponseCurve tail(int count) {
    return slice(Math.max(0, size() - count), size());
  }

  /**
   * Scale the intensities by a factor; variances scale by its square
   *
   * @param factor Multiplicative factor
   * @return scaled curve
   */
  public PixelResponseCurve scaled(double factor) {
    double[] scaledIntensities = new double[size()];
    double[] scaledVariances = new double[size()];
    for (int i = 0; i < size(); ++i) {
      scaledIntensities[i] = intensities[i] * factor;
      scaledVariances[i] = variances[i] * factor * factor;
    }
    return new PixelResponseCurve(angles, scaledIntensities, scaledVariances);
  }

  /**
   * Same intensities and variances placed on different angles, e.g. the angles of the reference
   * when both are known to share the binning
   *
   * @param newAngles Angles to use, same length as this curve
   * @return curve on the new angles
   */
  public PixelResponseCurve withAngles(double[] newAngles) {
    if (newAngles.length != size()) {
      throw new IllegalArgumentException(
          "Expected " + size() + " angles, got " + newAngles.length);
    }
    return new PixelResponseCurve(newAngles, intensities, variances);
  }

  @Override
  public String toString() {
    if (size() == 0) {
      return "PixelResponseCurve{empty}";
    }
    return "PixelResponseCurve{" + size() + " samples, " + angles[0] + " to "
        + angles[size() - 1] + " deg}";
  }
}
