package powder.efficiency.output;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import powder.efficiency.input.PixelResponseCurve;

/**
 * Easy interface by which external programs can get at the results of an efficiency
 * calibration. CalResult contains two maps: one from string descriptors to plots stored as PNG
 * byte arrays, and one from string descriptors to the numbers derived by the calibration, given
 * as arrays of doubles.
 */
public class CalResult {

  /**
   * Get data from a one-dimensional detector calibration
   *
   * @param table final constants
   * @param emittedFactors factors as derived for each pixel, before any replacement
   * @param normalisation constant the relative factors were divided by
   * @param response combined response of all corrected pixels, or null
   * @param images plots converted to png-format images as byte arrays (may be empty)
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildSequentialData(CalibrationTable table, double[] emittedFactors,
      double normalisation, PixelResponseCurve response, byte[][] images) {
    CalResult out = buildTableData(table, emittedFactors, normalisation, images);
    if (response != null) {
      out.numerMap.put("Response_angles", response.getAngles());
      out.numerMap.put("Response_intensities", response.getIntensities());
      out.numerMap.put("Response_variances", response.getVariances());
    }
    return out;
  }

  /**
   * Get data from a tube detector calibration
   *
   * @param table final constants, tube after tube
   * @param emittedFactors residual factors of the last iteration, before any replacement
   * @param normalisation constant the relative factors were divided by
   * @param chiSquaredHistory chi-squared per degree of freedom after each iteration
   * @param images plots converted to png-format images as byte arrays (may be empty)
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildGlobalData(CalibrationTable table, double[] emittedFactors,
      double normalisation, List<Double> chiSquaredHistory, byte[][] images) {
    CalResult out = buildTableData(table, emittedFactors, normalisation, images);
    double[] chiSquared = new double[chiSquaredHistory.size()];
    for (int i = 0; i < chiSquared.length; ++i) {
      chiSquared[i] = chiSquaredHistory.get(i);
    }
    out.numerMap.put("Chi_squared_per_degree_of_freedom", chiSquared);
    out.numerMap.put("Iterations", new double[]{chiSquared.length});
    out.numerMap.put("Tube_shape",
        new double[]{table.getNumberOfTubes(), table.getPixelsPerTube()});
    return out;
  }

  private static CalResult buildTableData(CalibrationTable table, double[] emittedFactors,
      double normalisation, byte[][] images) {
    CalResult out = new CalResult();
    out.numerMap.put("Calibration_constants", table.getValues());
    out.numerMap.put("Uncertainties", table.getUncertainties());
    out.numerMap.put("Valid", table.getValidityFlags());
    out.numerMap.put("Emitted_factors", emittedFactors);
    out.numerMap.put("Absolute_normalisation", new double[]{normalisation});
    if (images.length > 0) {
      out.imageMap.put("Constants_plot", images[0]);
    }
    if (images.length > 1) {
      out.imageMap.put("Response_plot", images[1]);
    }
    return out;
  }

  Map<String, double[]> numerMap;
  Map<String, byte[]> imageMap;

  private CalResult() {
    numerMap = new HashMap<>();
    imageMap = new HashMap<>();
  }

  /**
   * Get the map of plots produced by the calibration
   *
   * @return Map from plot names to PNG images as byte arrays
   */
  public Map<String, byte[]> getImageMap() {
    return imageMap;
  }

  /**
   * Get the map of numbers produced by the calibration
   *
   * @return Map from value names to arrays of values
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

}
