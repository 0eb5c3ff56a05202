package powder.efficiency.utils;

/**
 * Resamples a curve onto a new set of abscissae.
 */
public interface SplineResampler {

  /**
   * @param x Sampled abscissae, strictly increasing
   * @param y Sampled values
   * @param targetX Abscissae to resample onto
   * @return values at each of targetX
   */
  double[] resample(double[] x, double[] y, double[] targetX);

}
