package powder.efficiency.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.util.Pair;
import powder.efficiency.experiment.DerivationMethod;

/**
 * Options for a single calibration run. Set the values first, then pass the object to an
 * experiment; {@link #validate(int)} is checked before any data is touched.
 * Defaults for the global-method tuning values come from {@link Configuration}.
 */
public class CalibrationOptions {

  /**
   * Value of {@link #getLastPixel()} meaning "up to the last pixel of the detector"
   */
  public static final int LAST_DETECTOR_PIXEL = -1;

  /**
   * Value of {@link #getNumberOfIterations()} meaning "iterate until chi-squared converges"
   */
  public static final int AUTO_ITERATIONS = 0;

  static final int MAXIMUM_ITERATIONS = 10;

  private CalibrationMethod method;
  private DerivationMethod derivationMethod;
  private boolean interpolateOverlappingAngles;
  private NormalisationTarget normaliseTo;
  private List<Pair<Double, Double>> regionsOfInterest;
  private List<Pair<Double, Double>> excludedRanges;
  private int firstPixel;
  private int lastPixel;
  private int numberOfIterations;
  private Pair<Double, Double> maskCriterion;
  private double[] priorConstants;
  private boolean outputResponse;

  private double chiSquaredThreshold;
  private int pixelsToTrim;
  private int maximumAutoIterations;
  private double smallNumberFloor;
  private boolean parallelTubes;

  /**
   * Create options populated with defaults from the current {@link Configuration}
   */
  public CalibrationOptions() {
    this(Configuration.getInstance());
  }

  /**
   * Create options populated with defaults from the given configuration
   *
   * @param config Configuration to take tuning defaults from
   */
  public CalibrationOptions(Configuration config) {
    method = config.getDefaultMethod();
    derivationMethod = DerivationMethod.SEQUENTIAL_1D;
    interpolateOverlappingAngles = false;
    normaliseTo = NormalisationTarget.NONE;
    regionsOfInterest = new ArrayList<>();
    regionsOfInterest.add(new Pair<>(0., 100.));
    excludedRanges = new ArrayList<>();
    firstPixel = 0;
    lastPixel = LAST_DETECTOR_PIXEL;
    numberOfIterations = 1;
    maskCriterion = null;
    priorConstants = null;
    outputResponse = false;

    chiSquaredThreshold = config.getChiSquaredThreshold();
    pixelsToTrim = config.getPixelsToTrim();
    maximumAutoIterations = config.getMaximumAutoIterations();
    smallNumberFloor = config.getSmallNumberFloor();
    parallelTubes = config.isParallelTubes();
  }

  /**
   * Check the options for combinations that cannot be run, given the number of scan files that
   * will be supplied. Does not look at any scan data.
   *
   * @param numberOfScanFiles Number of scan files in the calibration input
   * @return map from option name to description of the problem; empty if the options are valid
   */
  public Map<String, String> validate(int numberOfScanFiles) {
    Map<String, String> issues = new LinkedHashMap<>();

    if (method == null) {
      issues.put("CalibrationMethod", "A calibration method must be set");
    }
    if (derivationMethod == null) {
      issues.put("DerivationMethod", "A derivation method must be set");
      return issues;
    }

    if (derivationMethod == DerivationMethod.GLOBAL_2D) {
      if (interpolateOverlappingAngles) {
        issues.put("InterpolateOverlappingAngles",
            "Interpolation option is not supported for global method");
      }
      if (normaliseTo == NormalisationTarget.ROI) {
        issues.put("NormaliseTo", "ROI normalisation is not supported for global method");
      }
      if (method == CalibrationMethod.MOST_LIKELY_MEAN || method == CalibrationMethod.MEAN) {
        issues.put("CalibrationMethod",
            method.getName() + " is not supported for global reference method");
      }
      if (numberOfScanFiles < 2) {
        issues.put("CalibrationRun",
            "At least two overlapping scan files needed for the global method");
      }
      if (pixelsToTrim < 0) {
        issues.put("PixelsToTrim", "Number of pixels to trim cannot be negative");
      }
      if (maximumAutoIterations < 1) {
        issues.put("MaximumAutoIterations", "Iteration cap must be at least 1");
      }
    }

    if (derivationMethod == DerivationMethod.SEQUENTIAL_1D) {
      if (numberOfIterations != 1) {
        issues.put("NumberOfIterations",
            "NumberOfIterations is not supported for sequential method");
      }
      if (numberOfScanFiles < 1) {
        issues.put("CalibrationRun", "A detector scan is needed for the sequential method");
      }
      if (firstPixel < 0) {
        issues.put("PixelRange", "First pixel index cannot be negative");
      } else if (lastPixel != LAST_DETECTOR_PIXEL && lastPixel < firstPixel) {
        issues.put("PixelRange", "Last pixel index must not precede the first");
      }
    }

    if (numberOfIterations < 0 || numberOfIterations > MAXIMUM_ITERATIONS) {
      issues.put("NumberOfIterations",
          "Number of iterations must be between 0 and " + MAXIMUM_ITERATIONS);
    }

    if (normaliseTo == NormalisationTarget.ROI
        && (regionsOfInterest.isEmpty() || !orderedPairs(regionsOfInterest))) {
      issues.put("ROI", "Regions of interest must be non-empty ordered pairs");
    }
    if (!orderedPairs(excludedRanges)) {
      issues.put("ExcludedRange", "Excluded ranges must be ordered pairs");
    }
    if (maskCriterion != null && !(maskCriterion.getFirst() < maskCriterion.getSecond())) {
      issues.put("MaskCriterion", "Mask criterion must be an ordered pair");
    }

    return issues;
  }

  /**
   * Throw if {@link #validate(int)} reports any issues
   *
   * @param numberOfScanFiles Number of scan files in the calibration input
   * @throws CalibrationConfigurationException listing every issue found
   */
  public void checkValid(int numberOfScanFiles) {
    Map<String, String> issues = validate(numberOfScanFiles);
    if (!issues.isEmpty()) {
      throw new CalibrationConfigurationException(issues);
    }
  }

  private static boolean orderedPairs(List<Pair<Double, Double>> ranges) {
    for (Pair<Double, Double> range : ranges) {
      if (!(range.getFirst() < range.getSecond())) {
        return false;
      }
    }
    return true;
  }

  public CalibrationMethod getMethod() {
    return method;
  }

  public void setMethod(CalibrationMethod method) {
    this.method = method;
  }

  public DerivationMethod getDerivationMethod() {
    return derivationMethod;
  }

  public void setDerivationMethod(DerivationMethod derivationMethod) {
    this.derivationMethod = derivationMethod;
  }

  public boolean isInterpolateOverlappingAngles() {
    return interpolateOverlappingAngles;
  }

  /**
   * Choose whether the overlapping part of each pixel is resampled onto the reference angles
   * with a spline before ratios are taken (sequential method only)
   *
   * @param interpolate True to interpolate
   */
  public void setInterpolateOverlappingAngles(boolean interpolate) {
    this.interpolateOverlappingAngles = interpolate;
  }

  public NormalisationTarget getNormaliseTo() {
    return normaliseTo;
  }

  public void setNormaliseTo(NormalisationTarget normaliseTo) {
    this.normaliseTo = normaliseTo;
  }

  public List<Pair<Double, Double>> getRegionsOfInterest() {
    return Collections.unmodifiableList(regionsOfInterest);
  }

  /**
   * Set the scattering angle regions whose counts the scan is normalised to when
   * {@link NormalisationTarget#ROI} is selected
   *
   * @param regionsOfInterest (lower, upper) pairs in degrees
   */
  public void setRegionsOfInterest(List<Pair<Double, Double>> regionsOfInterest) {
    this.regionsOfInterest = new ArrayList<>(regionsOfInterest);
  }

  public List<Pair<Double, Double>> getExcludedRanges() {
    return Collections.unmodifiableList(excludedRanges);
  }

  /**
   * Set the scattering angle regions left out of the ratio statistics, e.g. the beam stop
   *
   * @param excludedRanges (lower, upper) pairs in degrees
   */
  public void setExcludedRanges(List<Pair<Double, Double>> excludedRanges) {
    this.excludedRanges = new ArrayList<>(excludedRanges);
  }

  public int getFirstPixel() {
    return firstPixel;
  }

  public int getLastPixel() {
    return lastPixel;
  }

  /**
   * Select the (0-based, inclusive) pixel range the sequential method derives constants for;
   * pixels outside keep a constant of 1
   *
   * @param firstPixel First pixel to calibrate
   * @param lastPixel Last pixel to calibrate, or {@link #LAST_DETECTOR_PIXEL}
   */
  public void setPixelRange(int firstPixel, int lastPixel) {
    this.firstPixel = firstPixel;
    this.lastPixel = lastPixel;
  }

  public int getNumberOfIterations() {
    return numberOfIterations;
  }

  /**
   * Number of iterations of the global method; {@link #AUTO_ITERATIONS} iterates until the
   * chi-squared criterion is met
   *
   * @param numberOfIterations Iteration count between 0 and 10
   */
  public void setNumberOfIterations(int numberOfIterations) {
    this.numberOfIterations = numberOfIterations;
  }

  public Pair<Double, Double> getMaskCriterion() {
    return maskCriterion;
  }

  /**
   * Constants outside [low, high] are flagged invalid in the output table
   *
   * @param low Lowest valid constant
   * @param high Highest valid constant
   */
  public void setMaskCriterion(double low, double high) {
    this.maskCriterion = new Pair<>(low, high);
  }

  public void clearMaskCriterion() {
    this.maskCriterion = null;
  }

  public double[] getPriorConstants() {
    return priorConstants;
  }

  /**
   * Previously derived constants, one per pixel (or per tube pixel), multiplied into the data
   * before derivation
   *
   * @param priorConstants Constants to apply, or null for none
   */
  public void setPriorConstants(double[] priorConstants) {
    this.priorConstants = priorConstants == null ? null : priorConstants.clone();
  }

  public boolean isOutputResponse() {
    return outputResponse;
  }

  /**
   * Choose whether the combined response of all corrected pixels is produced as well
   *
   * @param outputResponse True to build the combined response
   */
  public void setOutputResponse(boolean outputResponse) {
    this.outputResponse = outputResponse;
  }

  public double getChiSquaredThreshold() {
    return chiSquaredThreshold;
  }

  public void setChiSquaredThreshold(double chiSquaredThreshold) {
    this.chiSquaredThreshold = chiSquaredThreshold;
  }

  public int getPixelsToTrim() {
    return pixelsToTrim;
  }

  public void setPixelsToTrim(int pixelsToTrim) {
    this.pixelsToTrim = pixelsToTrim;
  }

  public int getMaximumAutoIterations() {
    return maximumAutoIterations;
  }

  public void setMaximumAutoIterations(int maximumAutoIterations) {
    this.maximumAutoIterations = maximumAutoIterations;
  }

  public double getSmallNumberFloor() {
    return smallNumberFloor;
  }

  public void setSmallNumberFloor(double smallNumberFloor) {
    this.smallNumberFloor = smallNumberFloor;
  }

  public boolean isParallelTubes() {
    return parallelTubes;
  }

  public void setParallelTubes(boolean parallelTubes) {
    this.parallelTubes = parallelTubes;
  }

}
