package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import powder.efficiency.input.CalibrationConfigurationException;
import powder.efficiency.input.ScanDataset;
import powder.efficiency.input.ScanFrame;
import powder.efficiency.input.TubeScanSet;
import powder.efficiency.utils.MinimumDistanceEstimator;

/**
 * Efficiency constants of a tube detector from a set of overlapping scan files. Each file is
 * cut to one standard scan, optionally normalised to monitor and corrected by prior constants;
 * the constants are then iterated against a global reference rebuilt from all files each time
 * (see {@link GlobalReferenceSolver}), and finally divided by the median of the live pixels.
 *
 * Produces two plots: the constants against pixel index (tube after tube), and the
 * chi-squared per degree of freedom of each iteration.
 */
public class GlobalEfficiencyExperiment extends EfficiencyExperiment {

  private static final Logger logger = Logger.getLogger(GlobalEfficiencyExperiment.class);

  private OverlappingFrameSummer summer;
  private List<Double> chiSquaredHistory;

  public GlobalEfficiencyExperiment() {
    super();
    summer = new AngularBinSummer();
    chiSquaredHistory = new ArrayList<>();
  }

  @Override
  protected void backend(ScanDataset dataset) {
    TubeScanSet scans = (TubeScanSet) dataset;
    int tubes = scans.getNumberOfTubes();
    int pixelsPerTube = scans.getPixelsPerTube();
    int scansPerFile = scans.getScansPerFile();
    if (pixelsPerTube - 2 * options.getPixelsToTrim() <= 0) {
      throw new CalibrationConfigurationException(Collections.singletonMap("PixelsToTrim",
          "Trimming " + options.getPixelsToTrim() + " pixels from each end leaves none of the "
              + pixelsPerTube + " pixels in a tube"));
    }
    context = new RunContext(tubes * pixelsPerTube);
    logger.info("Number of tubes is: " + tubes + ", pixels per tube: " + pixelsPerTube);

    fireStateChange("Pre-processing scan files...");
    ScanNormalizer normalizer = new ScanNormalizer();
    List<ScanFrame> prepared = new ArrayList<>();
    for (ScanFrame frame : scans.getFrames()) {
      if (frame.getScanPoints() < scansPerFile) {
        throw new IllegalArgumentException("Scan file " + frame.getName() + " has "
            + frame.getScanPoints() + " scan points, fewer than " + scansPerFile);
      }
      if (frame.getScanPoints() > scansPerFile) {
        context.warn("Scan file " + frame.getName() + " has " + frame.getScanPoints()
            + " scan points instead of " + scansPerFile);
        frame = frame.truncated(scansPerFile);
      }
      frame = normalizer.normalise(frame, options.getNormaliseTo());
      if (options.getPriorConstants() != null) {
        frame = ScanNormalizer.applyConstants(frame, options.getPriorConstants());
      }
      prepared.add(frame);
    }
    TubeScanSet preparedScans =
        new TubeScanSet(scans.getName(), prepared, scansPerFile, scans.getScanStep());

    fireStateChange("Iterating global reference...");
    RatioStatistics statistics =
        new RatioStatistics(options.getMethod(), new MinimumDistanceEstimator());
    GlobalReferenceSolver solver = new GlobalReferenceSolver(statistics, summer, options);
    solver.solve(preparedScans, context);
    chiSquaredHistory = new ArrayList<>(solver.getChiSquaredHistory());
    logger.info("Global reference converged after " + solver.getIterationsRun()
        + " iterations");

    fireStateChange("Performing absolute normalisation...");
    normalisation = new AbsoluteNormalizer().normalise(context);
    table = new OutputAssembler().assemble(context, options.getMaskCriterion(), pixelsPerTube);

    XYSeriesCollection constants = new XYSeriesCollection();
    constants.addSeries(constantsSeries(scans.getName() + " constants", table.getValues()));
    xySeriesData.add(constants);
    XYSeries chiSquared = new XYSeries("Chi2/NdoF");
    for (int i = 0; i < chiSquaredHistory.size(); ++i) {
      chiSquared.add(i, chiSquaredHistory.get(i));
    }
    xySeriesData.add(new XYSeriesCollection(chiSquared));
  }

  @Override
  public DerivationMethod getDerivationMethod() {
    return DerivationMethod.GLOBAL_2D;
  }

  @Override
  public boolean hasEnoughData(ScanDataset dataset) {
    return dataset instanceof TubeScanSet && dataset.getNumberOfScanFiles() > 0;
  }

  /**
   * @return chi-squared per degree of freedom after each iteration of the last run
   */
  public List<Double> getChiSquaredHistory() {
    return Collections.unmodifiableList(chiSquaredHistory);
  }

  /**
   * @return number of iterations the last run performed
   */
  public int getIterationsRun() {
    return chiSquaredHistory.size();
  }

  /**
   * @return corrected response of all files summed on the reference grid, or null if it was
   * not requested
   */
  public ReferenceSurface getResponseSurface() {
    return context == null ? null : context.getResponseSurface();
  }

  /**
   * Set the strategy that sums overlapping scan files into the global reference
   *
   * @param summer Summer to use
   */
  public void setFrameSummer(OverlappingFrameSummer summer) {
    this.summer = summer;
  }

}
