package powder.efficiency;

import java.awt.Font;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.log4j.Logger;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.XYSeriesCollection;
import powder.efficiency.experiment.EfficiencyExperiment;
import powder.efficiency.experiment.GlobalEfficiencyExperiment;
import powder.efficiency.experiment.SequentialEfficiencyExperiment;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.DetectorScan;
import powder.efficiency.input.ScanDataset;
import powder.efficiency.input.TubeScanSet;
import powder.efficiency.output.CalResult;

/**
 * EfficiencyCalibrator runs a calibration end to end for external programs: it creates the
 * experiment matching the options, runs it on the scan data and packs the constants, diagnostics
 * and (optionally) plots into a {@link CalResult}.
 */
public class EfficiencyCalibrator {

  private static final Logger logger = Logger.getLogger(EfficiencyCalibrator.class);

  static final int IMAGE_WIDTH = 1280;
  static final int IMAGE_HEIGHT = 960;

  private final boolean renderPlots;

  public EfficiencyCalibrator() {
    this(true);
  }

  /**
   * @param renderPlots False to leave the image map of results empty
   */
  public EfficiencyCalibrator(boolean renderPlots) {
    this.renderPlots = renderPlots;
  }

  /**
   * Run the calibration selected by the options' derivation method
   *
   * @param dataset Scan data of the kind the derivation method needs
   * @param options Validated before the data is used
   * @return constants and diagnostics
   * @throws IOException if the plots cannot be encoded
   */
  public CalResult run(ScanDataset dataset, CalibrationOptions options) throws IOException {
    EfficiencyExperiment experiment = options.getDerivationMethod().createExperiment();
    experiment.setOptions(options);
    experiment.runExperimentOnData(dataset);
    if (experiment instanceof GlobalEfficiencyExperiment) {
      return getDataGlobal((GlobalEfficiencyExperiment) experiment);
    }
    return getDataSequential((SequentialEfficiencyExperiment) experiment);
  }

  /**
   * Calibrate a one-dimensional detector
   *
   * @param scan Detector scan
   * @param options Options; their derivation method must be sequential
   * @return constants and diagnostics
   * @throws IOException if the plots cannot be encoded
   */
  public CalResult runSequential(DetectorScan scan, CalibrationOptions options)
      throws IOException {
    SequentialEfficiencyExperiment experiment = new SequentialEfficiencyExperiment();
    experiment.setOptions(options);
    experiment.runExperimentOnData(scan);
    return getDataSequential(experiment);
  }

  /**
   * Calibrate a tube detector
   *
   * @param scans Overlapping scan files
   * @param options Options; their derivation method must be global
   * @return constants and diagnostics
   * @throws IOException if the plots cannot be encoded
   */
  public CalResult runGlobal(TubeScanSet scans, CalibrationOptions options) throws IOException {
    GlobalEfficiencyExperiment experiment = new GlobalEfficiencyExperiment();
    experiment.setOptions(options);
    experiment.runExperimentOnData(scans);
    return getDataGlobal(experiment);
  }

  private CalResult getDataSequential(SequentialEfficiencyExperiment experiment)
      throws IOException {
    byte[][] images = renderCharts(experiment.getData(),
        new String[]{"Calibration constants", "Combined response"},
        new String[]{"Pixel #", "Scattering angle (degrees)"},
        new String[]{"Calibration constant", "Intensity"});
    return CalResult.buildSequentialData(experiment.getTable(), experiment.getEmittedFactors(),
        experiment.getNormalisationConstant(), experiment.getResponse(), images);
  }

  private CalResult getDataGlobal(GlobalEfficiencyExperiment experiment) throws IOException {
    byte[][] images = renderCharts(experiment.getData(),
        new String[]{"Calibration constants", "Convergence"},
        new String[]{"Pixel # (tube after tube)", "Iteration"},
        new String[]{"Calibration constant", "Chi2/NdoF"});
    return CalResult.buildGlobalData(experiment.getTable(), experiment.getEmittedFactors(),
        experiment.getNormalisationConstant(), experiment.getChiSquaredHistory(), images);
  }

  private byte[][] renderCharts(List<XYSeriesCollection> data, String[] titles,
      String[] xAxisTitles, String[] yAxisTitles) throws IOException {
    if (!renderPlots) {
      return new byte[][]{};
    }
    List<byte[]> pngByteArrays = new ArrayList<>();
    for (int i = 0; i < data.size() && i < titles.length; ++i) {
      JFreeChart chart = ChartFactory.createXYLineChart(titles[i], "", "", data.get(i));
      NumberAxis xAxis = new NumberAxis(xAxisTitles[i]);
      Font bold = xAxis.getLabelFont();
      bold = bold.deriveFont(Font.BOLD, bold.getSize() + 2);
      xAxis.setLabelFont(bold);
      NumberAxis yAxis = new NumberAxis(yAxisTitles[i]);
      yAxis.setAutoRangeIncludesZero(false);
      yAxis.setLabelFont(bold);
      XYPlot xyPlot = chart.getXYPlot();
      xyPlot.setDomainAxis(xAxis);
      xyPlot.setRangeAxis(yAxis);

      BufferedImage image = chart.createBufferedImage(IMAGE_WIDTH, IMAGE_HEIGHT);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      pngByteArrays.add(out.toByteArray());
    }
    logger.debug("Rendered " + pngByteArrays.size() + " plots");
    return pngByteArrays.toArray(new byte[][]{});
  }

}
