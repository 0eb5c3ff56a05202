package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.PixelResponseCurve;
import powder.efficiency.input.ScanFrame;
import powder.efficiency.input.TubeScanSet;
import powder.efficiency.utils.MaskedArray;

/**
 * Derives per-pixel efficiency constants of a tube detector from a set of overlapping scan
 * files. Each iteration applies the constants derived so far, sums all files into a global
 * reference, and compares every tube with the window of the reference it covered. The residual
 * correction of each pixel is the row-wise reduction of the ratio image and is multiplied into
 * the cumulative constants.
 *
 * Tubes are expected in descending angular order: the last tube sees the lowest angles, and
 * each tube starts one standard scan above the next one.
 */
public class GlobalReferenceSolver {

  private static final Logger logger = Logger.getLogger(GlobalReferenceSolver.class);

  private final RatioStatistics statistics;
  private final OverlappingFrameSummer summer;
  private final List<Pair<Double, Double>> excludedRanges;
  private final int numberOfIterations;
  private final double chiSquaredThreshold;
  private final int pixelsToTrim;
  private final int maximumAutoIterations;
  private final double smallNumberFloor;
  private final boolean parallelTubes;
  private final boolean outputResponse;

  private List<Double> chiSquaredHistory;

  /**
   * @param statistics Row-wise reduction of ratio images
   * @param summer Builds the global reference from corrected scan files
   * @param options Iteration, trimming and output settings of the run
   */
  public GlobalReferenceSolver(RatioStatistics statistics, OverlappingFrameSummer summer,
      CalibrationOptions options) {
    this.statistics = statistics;
    this.summer = summer;
    excludedRanges = new ArrayList<>(options.getExcludedRanges());
    numberOfIterations = options.getNumberOfIterations();
    chiSquaredThreshold = options.getChiSquaredThreshold();
    pixelsToTrim = options.getPixelsToTrim();
    maximumAutoIterations = options.getMaximumAutoIterations();
    smallNumberFloor = options.getSmallNumberFloor();
    parallelTubes = options.isParallelTubes();
    outputResponse = options.isOutputResponse();
    chiSquaredHistory = new ArrayList<>();
  }

  /**
   * Run the iterations. Constants are written to the context indexed
   * tube * pixelsPerTube + pixel.
   *
   * @param scans Prepared scan files, each holding exactly one standard scan
   * @param context Run state receiving constants, live mask and response
   * @throws IllegalStateException if the reference does not cover every tube window
   */
  public void solve(TubeScanSet scans, RunContext context) {
    List<ScanFrame> frames = scans.getFrames();
    int tubes = scans.getNumberOfTubes();
    int pixelsPerTube = scans.getPixelsPerTube();
    int scansPerFile = scans.getScansPerFile();
    int scanPoints = scans.getScanPoints();
    logger.info("Number of scan steps is: " + scanPoints);
    chiSquaredHistory = new ArrayList<>();

    markLivePixels(frames, tubes, pixelsPerTube, scanPoints, context);

    int iteration = 0;
    double chiSquared = Double.POSITIVE_INFINITY;
    while (iteration < numberOfIterations
        || (numberOfIterations == CalibrationOptions.AUTO_ITERATIONS
        && chiSquared > chiSquaredThreshold)) {
      if (numberOfIterations == CalibrationOptions.AUTO_ITERATIONS
          && iteration >= maximumAutoIterations) {
        context.warn("Chi2/NdoF=" + chiSquared + " still above " + chiSquaredThreshold
            + " after " + iteration + " iterations; stopping");
        break;
      }
      logger.info("Starting iteration #" + iteration);

      List<ScanFrame> corrected = applyConstants(frames, context.getConstants());
      ReferenceSurface reference = summer.sum(corrected, scans.getScanStep());
      int binsNeeded = (tubes - 1) * scansPerFile + scanPoints;
      if (reference.getNumberOfBins() < binsNeeded) {
        throw new IllegalStateException("Global reference has " + reference.getNumberOfBins()
            + " bins but the tube windows need " + binsNeeded);
      }

      double[][] current = new double[tubes][];
      if (parallelTubes) {
        IntStream.range(0, tubes).parallel().forEach(tube ->
            current[tube] = tubeFactors(corrected, reference, tube, tubes, scansPerFile));
      } else {
        for (int tube = tubes - 1; tube >= 0; --tube) {
          current[tube] = tubeFactors(corrected, reference, tube, tubes, scansPerFile);
        }
      }

      for (int tube = 0; tube < tubes; ++tube) {
        double[] factors = MaskedArray.replaceSpecialValues(current[tube], 1.);
        for (int pixel = 0; pixel < pixelsPerTube; ++pixel) {
          int index = tube * pixelsPerTube + pixel;
          context.setEmittedFactor(index, current[tube][pixel]);
          if (factors[pixel] < smallNumberFloor) {
            factors[pixel] = 1.;
          }
          current[tube][pixel] = factors[pixel];
          context.setConstant(index, context.getConstants()[index] * factors[pixel]);
        }
      }

      chiSquared = chiSquaredPerDegreeOfFreedom(current, pixelsToTrim);
      chiSquaredHistory.add(chiSquared);
      logger.info("Iteration " + iteration + ": Chi2/NdoF=" + chiSquared
          + " (termination criterion: < " + chiSquaredThreshold + ")");
      ++iteration;
    }

    if (outputResponse) {
      context.setResponseSurface(
          summer.sum(applyConstants(frames, context.getConstants()), scans.getScanStep()));
    }
  }

  /**
   * @return chi-squared per degree of freedom after each iteration that was run
   */
  public List<Double> getChiSquaredHistory() {
    return Collections.unmodifiableList(chiSquaredHistory);
  }

  public int getIterationsRun() {
    return chiSquaredHistory.size();
  }

  private static List<ScanFrame> applyConstants(List<ScanFrame> frames, double[] constants) {
    List<ScanFrame> corrected = new ArrayList<>();
    for (ScanFrame frame : frames) {
      corrected.add(ScanNormalizer.applyConstants(frame, constants));
    }
    return corrected;
  }

  private static void markLivePixels(List<ScanFrame> frames, int tubes, int pixelsPerTube,
      int scanPoints, RunContext context) {
    for (int tube = 0; tube < tubes; ++tube) {
      for (int pixel = 0; pixel < pixelsPerTube; ++pixel) {
        int nonZero = 0;
        for (ScanFrame frame : frames) {
          for (int s = 0; s < frame.getScanPoints(); ++s) {
            if (frame.getIntensity(tube, pixel, s) != 0.) {
              ++nonZero;
            }
          }
        }
        context.setLive(tube * pixelsPerTube + pixel, nonZero > scanPoints / 5.);
      }
    }
  }

  /**
   * Stack the response of every pixel of a tube over all scan files, sorted by angle
   */
  static PixelResponseCurve[] stackTube(List<ScanFrame> frames, int tube) {
    int pixelsPerTube = frames.get(0).getPixelsPerTube();
    int scansPerFile = frames.get(0).getScanPoints();
    int length = scansPerFile * frames.size();
    PixelResponseCurve[] stacked = new PixelResponseCurve[pixelsPerTube];
    for (int pixel = 0; pixel < pixelsPerTube; ++pixel) {
      double[] angles = new double[length];
      double[] intensities = new double[length];
      double[] variances = new double[length];
      for (int f = 0; f < frames.size(); ++f) {
        ScanFrame frame = frames.get(f);
        for (int s = 0; s < scansPerFile; ++s) {
          int index = f * scansPerFile + s;
          angles[index] = frame.getAngle(tube, pixel, s);
          intensities[index] = frame.getIntensity(tube, pixel, s);
          variances[index] = frame.getVariance(tube, pixel, s);
        }
      }
      stacked[pixel] = new PixelResponseCurve(angles, intensities, variances);
    }
    return stacked;
  }

  /**
   * Ratio of the tube's window of the reference to the tube's own data, reduced per pixel.
   * The first tube drops its last standard scan and the last tube its first one, as those
   * columns fall outside the part of the reference the other tubes also cover.
   */
  private double[] tubeFactors(List<ScanFrame> frames, ReferenceSurface reference, int tube,
      int tubes, int scansPerFile) {
    PixelResponseCurve[] stacked = stackTube(frames, tube);
    int scanPoints = stacked[0].size();
    int itube = tubes - tube - 1;
    int from = itube * scansPerFile;
    int to = from + scanPoints;

    List<Pair<Integer, Integer>> excluded =
        RatioStatistics.toIndexRanges(reference.getBinAngles(from, to), excludedRanges);

    int firstColumn = 0;
    int lastColumn = scanPoints;
    if (tube == 0) {
      lastColumn = scanPoints - scansPerFile;
    } else if (tube == tubes - 1) {
      firstColumn = scansPerFile;
    }

    double[][] ratios = new double[stacked.length][lastColumn - firstColumn];
    for (int pixel = 0; pixel < stacked.length; ++pixel) {
      for (int j = firstColumn; j < lastColumn; ++j) {
        ratios[pixel][j - firstColumn] =
            reference.getIntensity(pixel, from + j) / stacked[pixel].getIntensity(j);
      }
    }
    double[] factors = statistics.reduceRows(ratios,
        RatioStatistics.shiftRanges(excluded, firstColumn, lastColumn - firstColumn));
    logger.debug("Derived residual factors for tube #" + tube);
    return factors;
  }

  /**
   * Sum of squared deviations from 1 of the residual factors, over the pixels not trimmed off
   * either end of each tube, per degree of freedom
   *
   * @param current Residual factors [tube][pixel in tube]
   * @param trim Pixels left out at each end of a tube
   * @return chi-squared per degree of freedom
   */
  static double chiSquaredPerDegreeOfFreedom(double[][] current, int trim) {
    int pixelsPerTube = current[0].length;
    double chiSquared = 0.;
    for (double[] tube : current) {
      for (int pixel = trim; pixel < pixelsPerTube - trim; ++pixel) {
        double diff = tube[pixel] - 1.;
        chiSquared += diff * diff;
      }
    }
    int degreesOfFreedom = (pixelsPerTube - 2 * trim) * current.length;
    return chiSquared / degreesOfFreedom;
  }

}
