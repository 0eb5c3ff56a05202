package powder.efficiency.experiment;

import powder.efficiency.input.PixelResponseCurve;

/**
 * Fixed-size buffer the combined response of all corrected pixels is written into, one block
 * of samples per pixel.
 */
class ResponseBuffer {

  private final double[] angles;
  private final double[] intensities;
  private final double[] variances;

  ResponseBuffer(int size) {
    angles = new double[size];
    intensities = new double[size];
    variances = new double[size];
  }

  int size() {
    return angles.length;
  }

  void set(int index, double angle, double intensity, double variance) {
    angles[index] = angle;
    intensities[index] = intensity;
    variances[index] = variance;
  }

  PixelResponseCurve toCurve() {
    return new PixelResponseCurve(angles, intensities, variances);
  }

}
