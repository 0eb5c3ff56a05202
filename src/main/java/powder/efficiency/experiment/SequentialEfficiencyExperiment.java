package powder.efficiency.experiment;

import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeriesCollection;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.DetectorScan;
import powder.efficiency.input.PixelResponseCurve;
import powder.efficiency.input.ScanDataset;
import powder.efficiency.utils.CubicSplineResampler;
import powder.efficiency.utils.MinimumDistanceEstimator;
import powder.efficiency.utils.RobustCenterEstimator;
import powder.efficiency.utils.SplineResampler;

/**
 * Efficiency constants of a one-dimensional detector from a single (possibly merged) detector
 * scan. The scan is optionally normalised and corrected by prior constants, then the pixels in
 * the selected range are calibrated one after the other against a sliding reference curve
 * (see {@link SequentialReferenceBuilder}). The relative constants are finally divided by the
 * median of the live pixels.
 *
 * Produces two plots: the constants against pixel index, and the combined response of the
 * corrected pixels when it was requested.
 */
public class SequentialEfficiencyExperiment extends EfficiencyExperiment {

  private static final Logger logger = Logger.getLogger(SequentialEfficiencyExperiment.class);

  private RobustCenterEstimator robustCenter;
  private SplineResampler resampler;
  private int firstPixel;
  private int lastPixel;

  public SequentialEfficiencyExperiment() {
    super();
    robustCenter = new MinimumDistanceEstimator();
    resampler = new CubicSplineResampler();
  }

  @Override
  protected void backend(ScanDataset dataset) {
    DetectorScan scan = (DetectorScan) dataset;
    int pixels = scan.getNumberOfPixels();
    context = new RunContext(pixels);
    logger.info("Number of scan steps is: " + scan.getScanPoints());
    logger.info("Number of detector pixels is: " + pixels);

    firstPixel = options.getFirstPixel();
    lastPixel = options.getLastPixel();
    if (lastPixel == CalibrationOptions.LAST_DETECTOR_PIXEL) {
      lastPixel = pixels - 1;
    } else if (lastPixel >= pixels) {
      context.warn("Last pixel number provided is larger than total number of pixels. "
          + "Taking the last existing pixel.");
      lastPixel = pixels - 1;
    }
    if (firstPixel > lastPixel) {
      throw new IllegalArgumentException("First pixel " + firstPixel
          + " is beyond the last pixel of the detector (" + (pixels - 1) + ")");
    }

    int binOffset = SequentialReferenceBuilder.binOffset(scan);
    fireStateChange("Normalising scan data...");
    scan = new ScanNormalizer().normalise(scan, options.getNormaliseTo(),
        options.getRegionsOfInterest(), binOffset);
    if (options.getPriorConstants() != null) {
      scan = ScanNormalizer.applyConstants(scan, options.getPriorConstants());
    }

    fireStateChange("Computing relative calibration factors for pixels #" + firstPixel
        + " to #" + lastPixel + "...");
    RatioStatistics statistics = new RatioStatistics(options.getMethod(), robustCenter);
    SequentialReferenceBuilder builder = new SequentialReferenceBuilder(statistics, resampler,
        options.isInterpolateOverlappingAngles(), options.getExcludedRanges());
    builder.derive(scan, firstPixel, lastPixel, options.isOutputResponse(), context);

    fireStateChange("Performing absolute normalisation...");
    normalisation = new AbsoluteNormalizer().normalise(context);
    table = new OutputAssembler().assemble(context, options.getMaskCriterion(), pixels);

    XYSeriesCollection constants = new XYSeriesCollection();
    constants.addSeries(constantsSeries(scan.getName() + " constants", table.getValues()));
    xySeriesData.add(constants);
    if (context.getResponse() != null) {
      XYSeriesCollection response = new XYSeriesCollection();
      response.addSeries(responseSeries(scan.getName() + " combined response",
          context.getResponse()));
      xySeriesData.add(response);
    }
  }

  @Override
  public DerivationMethod getDerivationMethod() {
    return DerivationMethod.SEQUENTIAL_1D;
  }

  @Override
  public boolean hasEnoughData(ScanDataset dataset) {
    return dataset instanceof DetectorScan;
  }

  /**
   * @return the first pixel calibrated in the last run
   */
  public int getFirstPixel() {
    return firstPixel;
  }

  /**
   * @return the last pixel calibrated in the last run, after clamping to the detector
   */
  public int getLastPixel() {
    return lastPixel;
  }

  /**
   * @return combined response of the corrected pixels, or null if it was not requested
   */
  public PixelResponseCurve getResponse() {
    return context == null ? null : context.getResponse();
  }

  /**
   * Set the estimator used for the most-likely-mean policy
   *
   * @param robustCenter Estimator to use
   */
  public void setRobustCenterEstimator(RobustCenterEstimator robustCenter) {
    this.robustCenter = robustCenter;
  }

  /**
   * Set the interpolation used when overlapping angles are resampled
   *
   * @param resampler Resampler to use
   */
  public void setSplineResampler(SplineResampler resampler) {
    this.resampler = resampler;
  }

}
