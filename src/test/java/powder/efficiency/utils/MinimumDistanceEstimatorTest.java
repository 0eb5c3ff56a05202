package powder.efficiency.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class MinimumDistanceEstimatorTest {

  @Test
  public void estimate_ignoresOutlier() {
    RobustCenterEstimator estimator = new MinimumDistanceEstimator();
    double center = estimator.estimate(new double[]{0.9, 1.0, 1.1, 50.});
    assertEquals(1.0, center, 0.);
  }

  @Test
  public void estimate_returnsSampleMember() {
    RobustCenterEstimator estimator = new MinimumDistanceEstimator();
    assertEquals(2., estimator.estimate(new double[]{1., 2., 3.}), 0.);
  }

  @Test
  public void estimate_singleValue() {
    assertEquals(4.2, new MinimumDistanceEstimator().estimate(new double[]{4.2}), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void estimate_emptySampleThrows() {
    new MinimumDistanceEstimator().estimate(new double[]{});
  }

}
