package powder.efficiency.utils;

/**
 * Most-likely-mean estimator: returns the sample member whose summed square-root distance to
 * all other members is smallest. Ties are resolved in favor of the earliest member.
 */
public class MinimumDistanceEstimator implements RobustCenterEstimator {

  @Override
  public double estimate(double[] sample) {
    if (sample.length == 0) {
      throw new IllegalArgumentException("Cannot estimate the center of an empty sample");
    }
    double bestDistance = Double.POSITIVE_INFINITY;
    double best = sample[0];
    for (double candidate : sample) {
      double distance = 0.;
      for (double other : sample) {
        distance += Math.sqrt(Math.abs(candidate - other));
      }
      if (distance < bestDistance) {
        bestDistance = distance;
        best = candidate;
      }
    }
    return best;
  }

}
