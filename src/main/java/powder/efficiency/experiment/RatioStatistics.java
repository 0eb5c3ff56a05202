package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import powder.efficiency.input.CalibrationMethod;
import powder.efficiency.utils.MaskedArray;
import powder.efficiency.utils.MinimumDistanceEstimator;
import powder.efficiency.utils.NumericUtils;
import powder.efficiency.utils.RobustCenterEstimator;

/**
 * Reduces the ratios between a reference response and a pixel response to a relative
 * calibration factor. Zero and non-finite ratios carry no information and are left out, as are
 * ratios inside excluded index ranges; if nothing is left the factor is 1.
 */
public class RatioStatistics {

  public static final double NEUTRAL_FACTOR = 1.;

  private final CalibrationMethod method;
  private final RobustCenterEstimator robustCenter;

  public RatioStatistics(CalibrationMethod method) {
    this(method, new MinimumDistanceEstimator());
  }

  /**
   * @param method Reduction policy
   * @param robustCenter Estimator used for {@link CalibrationMethod#MOST_LIKELY_MEAN}
   */
  public RatioStatistics(CalibrationMethod method, RobustCenterEstimator robustCenter) {
    this.method = method;
    this.robustCenter = robustCenter;
  }

  public CalibrationMethod getMethod() {
    return method;
  }

  /**
   * Reduce a ratio array to one factor
   *
   * @param ratios Pixel-aligned ratios; zeros mean no data
   * @return factor, or {@link #NEUTRAL_FACTOR} if no usable ratio remains
   */
  public double reduce(double[] ratios) {
    return reduce(ratios, Collections.emptyList());
  }

  /**
   * Reduce a ratio array to one factor, ignoring ratios in the excluded ranges
   *
   * @param ratios Pixel-aligned ratios; zeros mean no data
   * @param excluded Index ranges [from, to) left out of the statistics
   * @return factor, or {@link #NEUTRAL_FACTOR} if no usable ratio remains
   */
  public double reduce(double[] ratios, List<Pair<Integer, Integer>> excluded) {
    MaskedArray masked = MaskedArray.of(ratios);
    masked.maskRanges(excluded);
    double[] sample = masked.compressed();
    if (sample.length == 0) {
      return NEUTRAL_FACTOR;
    }
    switch (method) {
      case MEAN:
        return NumericUtils.mean(sample);
      case MOST_LIKELY_MEAN:
        return robustCenter.estimate(sample);
      case MEDIAN:
      default:
        return NumericUtils.median(sample);
    }
  }

  /**
   * Reduce each row of a ratio matrix (pixel in tube x scan point) along the scan-point axis.
   * Only median and mean are defined for this shape.
   *
   * @param ratios Ratio image; zeros mean no data
   * @param excluded Column ranges [from, to) left out of the statistics
   * @return one factor per row
   * @throws IllegalArgumentException for the most-likely-mean policy
   */
  public double[] reduceRows(double[][] ratios, List<Pair<Integer, Integer>> excluded) {
    if (method == CalibrationMethod.MOST_LIKELY_MEAN) {
      throw new IllegalArgumentException(
          method.getName() + " is not supported for ratio matrices");
    }
    double[] factors = new double[ratios.length];
    for (int row = 0; row < ratios.length; ++row) {
      factors[row] = reduce(ratios[row], excluded);
    }
    return factors;
  }

  /**
   * Translate angular ranges to index ranges of a sorted angle array. Each range [lower, upper]
   * becomes the [from, to) run of indices whose angle lies inside it; ranges that miss the
   * array entirely are dropped.
   *
   * @param angles Sorted angles the ratios are defined on
   * @param angularRanges (lower, upper) angle pairs
   * @return index ranges, in the order of the angular ranges
   */
  public static List<Pair<Integer, Integer>> toIndexRanges(double[] angles,
      List<Pair<Double, Double>> angularRanges) {
    List<Pair<Integer, Integer>> indexRanges = new ArrayList<>();
    for (Pair<Double, Double> range : angularRanges) {
      int from = 0;
      while (from < angles.length && angles[from] < range.getFirst()) {
        ++from;
      }
      int to = from;
      while (to < angles.length && angles[to] <= range.getSecond()) {
        ++to;
      }
      if (to > from) {
        indexRanges.add(new Pair<>(from, to));
      }
    }
    return indexRanges;
  }

  /**
   * Move index ranges to a view of the array that starts at the given offset, clipping them to
   * [0, length)
   *
   * @param ranges Ranges on the full array
   * @param offset Index of the full array where the view starts
   * @param length Length of the view
   * @return ranges on the view; empty ones are dropped
   */
  static List<Pair<Integer, Integer>> shiftRanges(List<Pair<Integer, Integer>> ranges,
      int offset, int length) {
    List<Pair<Integer, Integer>> shifted = new ArrayList<>();
    for (Pair<Integer, Integer> range : ranges) {
      int from = Math.max(0, range.getFirst() - offset);
      int to = Math.min(length, range.getSecond() - offset);
      if (to > from) {
        shifted.add(new Pair<>(from, to));
      }
    }
    return shifted;
  }

}
