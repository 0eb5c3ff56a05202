package powder.efficiency.experiment;

import java.util.Arrays;
import powder.efficiency.input.PixelResponseCurve;

/**
 * Sliding combined response of the pixels calibrated so far. After each pixel the reference
 * covers the angles of that pixel minus its first bin offset, so it always overlaps the next
 * pixel; its length stays fixed at (scan points - bin offset).
 * Only the sequential builder owns and mutates an instance.
 */
class ReferenceCurve {

  private double[] angles;
  private double[] intensities;
  private double[] variances;

  /**
   * Start the reference from the first pixel of the range
   *
   * @param firstPixel Response of the first pixel, sorted by angle
   * @param binOffset Number of low-angle samples that do not overlap the next pixel
   */
  ReferenceCurve(PixelResponseCurve firstPixel, int binOffset) {
    set(firstPixel.cropLeading(binOffset));
  }

  private void set(PixelResponseCurve curve) {
    angles = curve.getAngles();
    intensities = curve.getIntensities();
    variances = curve.getVariances();
  }

  int size() {
    return angles.length;
  }

  double[] getAngles() {
    return angles.clone();
  }

  double getIntensity(int index) {
    return intensities[index];
  }

  double getVariance(int index) {
    return variances[index];
  }

  double[] getIntensities() {
    return intensities.clone();
  }

  /**
   * Element-wise ratio of the reference to a curve on the same grid; a zero divisor gives a
   * non-finite or NaN entry, which the statistics treat as missing
   *
   * @param cropped Pixel response aligned to the reference angles
   * @return reference / cropped
   */
  double[] ratioTo(PixelResponseCurve cropped) {
    double[] ratios = new double[size()];
    for (int i = 0; i < ratios.length; ++i) {
      ratios[i] = intensities[i] / cropped.getIntensity(i);
    }
    return ratios;
  }

  /**
   * Replace the reference values by the given curve, keeping the reference angles
   *
   * @param cropped Pixel response aligned to the reference angles
   */
  void replaceWith(PixelResponseCurve cropped) {
    intensities = cropped.getIntensities();
    variances = cropped.getVariances();
  }

  /**
   * Inverse-variance weighted mean of the reference and a curve on the same grid. Where both
   * variances are zero the plain mean is taken; where only one is positive, that side is kept.
   *
   * @param cropped Scaled pixel response aligned to the reference angles
   */
  void weightedMeanWith(PixelResponseCurve cropped) {
    for (int i = 0; i < size(); ++i) {
      double y1 = intensities[i];
      double v1 = variances[i];
      double y2 = cropped.getIntensity(i);
      double v2 = cropped.getVariance(i);
      if (v1 > 0. && v2 > 0.) {
        double w1 = 1. / v1;
        double w2 = 1. / v2;
        intensities[i] = (y1 * w1 + y2 * w2) / (w1 + w2);
        variances[i] = 1. / (w1 + w2);
      } else if (v1 > 0.) {
        intensities[i] = y1;
        variances[i] = v1;
      } else if (v2 > 0.) {
        intensities[i] = y2;
        variances[i] = v2;
      } else {
        intensities[i] = (y1 + y2) / 2.;
        variances[i] = 0.;
      }
    }
  }

  /**
   * Move the reference window up by one pixel: append the samples of the pixel beyond the
   * current reference, then drop the same number from the low-angle end
   *
   * @param tail High-angle samples of the current pixel
   * @param binOffset Number of samples to drop
   */
  void advance(PixelResponseCurve tail, int binOffset) {
    int n = size() + tail.size();
    double[] newAngles = Arrays.copyOf(angles, n);
    double[] newIntensities = Arrays.copyOf(intensities, n);
    double[] newVariances = Arrays.copyOf(variances, n);
    for (int i = 0; i < tail.size(); ++i) {
      newAngles[size() + i] = tail.getAngle(i);
      newIntensities[size() + i] = tail.getIntensity(i);
      newVariances[size() + i] = tail.getVariance(i);
    }
    set(new PixelResponseCurve(newAngles, newIntensities, newVariances).cropLeading(binOffset));
  }

  /**
   * @return snapshot of the current reference as an immutable curve
   */
  PixelResponseCurve toCurve() {
    return new PixelResponseCurve(angles, intensities, variances);
  }

}
