package powder.efficiency.experiment;

import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import powder.efficiency.input.DetectorScan;
import powder.efficiency.input.NormalisationTarget;
import powder.efficiency.input.ScanFrame;

/**
 * Prepares raw scan data before any constants are derived: normalisation to monitor or to
 * region-of-interest counts, removal of special values, and application of previously derived
 * constants.
 */
public class ScanNormalizer {

  private static final Logger logger = Logger.getLogger(ScanNormalizer.class);

  /**
   * Normalise a one-dimensional detector scan. Afterwards NaN and infinite values (and their
   * variances) are replaced by zero.
   *
   * @param scan Raw scan
   * @param target What to normalise to
   * @param regionsOfInterest Angular regions summed for {@link NormalisationTarget#ROI}
   * @param binOffset Number of pixels the detector moves per scan point
   * @return normalised scan
   * @throws IllegalArgumentException if the scan has no monitor counts for monitor
   * normalisation, or the regions are not seen by the detector at every scan point
   */
  public DetectorScan normalise(DetectorScan scan, NormalisationTarget target,
      List<Pair<Double, Double>> regionsOfInterest, int binOffset) {
    double[][] y = scan.getIntensities();
    double[][] v = scan.getVariances();
    switch (target) {
      case MONITOR:
        if (!scan.hasMonitor()) {
          throw new IllegalArgumentException(
              "Scan " + scan.getName() + " has no monitor counts to normalise to");
        }
        divideByCounts(y, v, scan.getMonitor());
        break;
      case ROI:
        validateRegions(scan, regionsOfInterest);
        double[] roiCounts = roiCounts(scan, regionsOfInterest, binOffset);
        divideByCounts(y, v, roiCounts);
        break;
      case NONE:
      default:
        break;
    }
    for (int p = 0; p < y.length; ++p) {
      replaceSpecialValues(y[p], v[p]);
    }
    return scan.withData(y, v);
  }

  /**
   * Normalise one scan file of a tube detector. Only monitor normalisation is defined here.
   *
   * @param frame Raw scan file
   * @param target What to normalise to
   * @return normalised frame
   * @throws IllegalArgumentException for ROI normalisation, or missing monitor counts
   */
  public ScanFrame normalise(ScanFrame frame, NormalisationTarget target) {
    if (target == NormalisationTarget.ROI) {
      throw new IllegalArgumentException("ROI normalisation is not defined for tube detectors");
    }
    double[][][] y = frame.getIntensities();
    double[][][] v = frame.getVariances();
    if (target == NormalisationTarget.MONITOR) {
      if (!frame.hasMonitor()) {
        throw new IllegalArgumentException(
            "Scan file " + frame.getName() + " has no monitor counts to normalise to");
      }
      double[] monitor = frame.getMonitor();
      for (int t = 0; t < y.length; ++t) {
        divideByCounts(y[t], v[t], monitor);
      }
    }
    for (int t = 0; t < y.length; ++t) {
      for (int p = 0; p < y[t].length; ++p) {
        replaceSpecialValues(y[t][p], v[t][p]);
      }
    }
    return frame.withData(y, v);
  }

  /**
   * Multiply previously derived constants into a scan, one constant per pixel
   *
   * @param scan Scan to correct
   * @param constants One constant per pixel
   * @return corrected scan
   * @throws IllegalArgumentException if the number of constants does not match the pixels
   */
  public static DetectorScan applyConstants(DetectorScan scan, double[] constants) {
    if (constants.length != scan.getNumberOfPixels()) {
      throw new IllegalArgumentException("Got " + constants.length + " constants for "
          + scan.getNumberOfPixels() + " pixels");
    }
    double[][] y = scan.getIntensities();
    double[][] v = scan.getVariances();
    for (int p = 0; p < y.length; ++p) {
      scale(y[p], v[p], constants[p]);
    }
    return scan.withData(y, v);
  }

  /**
   * Multiply constants into a scan file of a tube detector
   *
   * @param frame Scan file to correct
   * @param constants One constant per tube pixel, indexed tube * pixelsPerTube + pixel
   * @return corrected frame
   * @throws IllegalArgumentException if the number of constants does not match the pixels
   */
  public static ScanFrame applyConstants(ScanFrame frame, double[] constants) {
    int pixelsPerTube = frame.getPixelsPerTube();
    if (constants.length != frame.getNumberOfTubes() * pixelsPerTube) {
      throw new IllegalArgumentException("Got " + constants.length + " constants for "
          + frame.getNumberOfTubes() + "x" + pixelsPerTube + " pixels");
    }
    double[][][] y = frame.getIntensities();
    double[][][] v = frame.getVariances();
    for (int t = 0; t < y.length; ++t) {
      for (int p = 0; p < pixelsPerTube; ++p) {
        scale(y[t][p], v[t][p], constants[t * pixelsPerTube + p]);
      }
    }
    return frame.withData(y, v);
  }

  private static void scale(double[] y, double[] v, double factor) {
    for (int s = 0; s < y.length; ++s) {
      y[s] *= factor;
      v[s] *= factor * factor;
    }
  }

  /**
   * Divide every row by per-scan-point counts whose variance equals the counts
   */
  private static void divideByCounts(double[][] y, double[][] v, double[] counts) {
    for (int p = 0; p < y.length; ++p) {
      for (int s = 0; s < counts.length; ++s) {
        double c = counts[s];
        double value = y[p][s] / c;
        v[p][s] = v[p][s] / (c * c) + value * value / c;
        y[p][s] = value;
      }
    }
  }

  private static void replaceSpecialValues(double[] y, double[] v) {
    for (int s = 0; s < y.length; ++s) {
      if (!Double.isFinite(y[s]) || !Double.isFinite(v[s])) {
        y[s] = 0.;
        v[s] = 0.;
      }
    }
  }

  /**
   * The regions must lie inside the part of the angular range every scan point covers:
   * above the angle of the first pixel at the last scan point, below that of the last pixel at
   * the first scan point
   */
  static void validateRegions(DetectorScan scan, List<Pair<Double, Double>> regionsOfInterest) {
    double lowest = Double.POSITIVE_INFINITY;
    double highest = Double.NEGATIVE_INFINITY;
    for (Pair<Double, Double> roi : regionsOfInterest) {
      lowest = Math.min(lowest, roi.getFirst());
      highest = Math.max(highest, roi.getSecond());
    }
    double lowerBound = scan.getAngle(0, scan.getScanPoints() - 1);
    double upperBound = scan.getAngle(scan.getNumberOfPixels() - 1, 0);
    if (lowest < lowerBound || highest > upperBound) {
      throw new IllegalArgumentException("Invalid ROI. The region must be fully contained "
          + "within the detector at any scan point; for this scan it can be within "
          + lowerBound + " and " + upperBound + " degrees");
    }
  }

  /**
   * Sum the counts of the pixels inside the regions at each scan point. The detector moves by
   * binOffset pixels per scan point, so the pixel window moves down by as much.
   */
  static double[] roiCounts(DetectorScan scan, List<Pair<Double, Double>> regionsOfInterest,
      int binOffset) {
    int pixels = scan.getNumberOfPixels();
    int[] firstCells = new int[regionsOfInterest.size()];
    int[] lastCells = new int[regionsOfInterest.size()];
    for (int r = 0; r < regionsOfInterest.size(); ++r) {
      Pair<Double, Double> roi = regionsOfInterest.get(r);
      int first = 0;
      while (first < pixels && !(scan.getAngle(first, 0) > roi.getFirst())) {
        ++first;
      }
      int last = 0;
      while (last < pixels && scan.getAngle(last, 0) < roi.getSecond()) {
        ++last;
      }
      firstCells[r] = first;
      lastCells[r] = last;
      logger.info("Region " + roi + " spans pixels [" + first + ", " + last + ")");
    }
    double[][] y = scan.getIntensities();
    double[] counts = new double[scan.getScanPoints()];
    for (int s = 0; s < counts.length; ++s) {
      double sum = 0.;
      for (int r = 0; r < firstCells.length; ++r) {
        int from = Math.max(0, firstCells[r] - binOffset * s);
        int to = Math.min(pixels, lastCells[r] - binOffset * s);
        for (int p = from; p < to; ++p) {
          sum += y[p][s];
        }
      }
      counts[s] = sum;
    }
    return counts;
  }

}
