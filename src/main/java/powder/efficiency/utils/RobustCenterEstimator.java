package powder.efficiency.utils;

/**
 * Estimator of the central tendency of a sample that is insensitive to outliers. Used for the
 * most-likely-mean calibration policy.
 */
public interface RobustCenterEstimator {

  /**
   * Estimate the center of a non-empty sample of finite values
   *
   * @param sample Values to estimate the center of; never empty
   * @return estimated center
   */
  double estimate(double[] sample);

}
