package powder.efficiency.utils;

/**
 * Natural cubic spline resampling backed by {@link NumericUtils#interpolate}.
 */
public class CubicSplineResampler implements SplineResampler {

  @Override
  public double[] resample(double[] x, double[] y, double[] targetX) {
    return NumericUtils.interpolate(x, y, targetX);
  }

}
