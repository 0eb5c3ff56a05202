package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.PixelResponseCurve;
import powder.efficiency.input.ScanDataset;
import powder.efficiency.output.CalibrationTable;
import powder.efficiency.utils.NumericUtils;

/**
 * This class defines the template for each way of deriving detector efficiency constants.
 * Concrete extensions define the backend for the calculation; the data they produce can be
 * plotted or handed to external programs.
 *
 * Experiments work in a manner similar to builder patterns: set up the
 * {@link CalibrationOptions} first, then call {@link #runExperimentOnData(ScanDataset)} with the
 * scan data. The options are validated before the data is looked at; any problem with them
 * stops the run with a {@link powder.efficiency.input.CalibrationConfigurationException}.
 *
 * Results (table, warnings, plots) are only populated once the experiment has been run.
 */
public abstract class EfficiencyExperiment {

  private final EventListenerList eventHelper;
  CalibrationOptions options;
  List<XYSeriesCollection> xySeriesData;
  /**
   * Names of the scan data sent into the experiment
   */
  List<String> dataNames;
  RunContext context;
  CalibrationTable table;
  double normalisation;
  private String status;

  /**
   * Initialize all fields common to experiment objects, with options taken from the current
   * configuration
   */
  EfficiencyExperiment() {
    options = new CalibrationOptions();
    options.setDerivationMethod(getDerivationMethod());
    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    status = "";
    normalisation = Double.NaN;
    eventHelper = new EventListenerList();
  }

  /**
   * Build a plottable series of constants against pixel index
   *
   * @param name Series name
   * @param values Constants in pixel order
   * @return series of (pixel, constant)
   */
  static XYSeries constantsSeries(String name, double[] values) {
    XYSeries series = new XYSeries(name);
    for (int i = 0; i < values.length; ++i) {
      series.add(i, values[i]);
    }
    return series;
  }

  /**
   * Build a plottable series of a response curve against scattering angle
   *
   * @param name Series name
   * @param curve Response to plot
   * @return series of (angle, intensity)
   */
  static XYSeries responseSeries(String name, PixelResponseCurve curve) {
    XYSeries series = new XYSeries(name);
    for (int i = 0; i < curve.size(); ++i) {
      series.add(curve.getAngle(i), curve.getIntensity(i));
    }
    return series;
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Runs the calculations specific to a derivation method on data already known to be of the
   * right kind, with options already validated.
   *
   * @param dataset Scan data to process
   */
  protected abstract void backend(final ScanDataset dataset);

  /**
   * @return the derivation method this experiment implements
   */
  public abstract DerivationMethod getDerivationMethod();

  /**
   * Used to check if the input is the kind of scan data this experiment works on
   *
   * @param dataset Data to be fed into the calculation
   * @return True if the calculation can be run on it
   */
  public abstract boolean hasEnoughData(final ScanDataset dataset);

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this experiment, populated in the backend function of an
   * implementing class. Each entry is the data of a separate chart.
   *
   * @return Plottable data
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * @return names of the scan data the experiment was run on
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  public CalibrationOptions getOptions() {
    return options;
  }

  /**
   * Replace the options of this experiment
   *
   * @param options Options to run with; their derivation method must match this experiment
   */
  public void setOptions(CalibrationOptions options) {
    if (options.getDerivationMethod() != getDerivationMethod()) {
      throw new IllegalArgumentException("Options are for " + options.getDerivationMethod()
          + " but this experiment implements " + getDerivationMethod().getName());
    }
    this.options = options;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the run
   */
  public String getStatus() {
    return status;
  }

  /**
   * @return the final constants table of the last run
   */
  public CalibrationTable getTable() {
    return table;
  }

  /**
   * @return the constant the relative factors were divided by, NaN if there was no live pixel
   */
  public double getNormalisationConstant() {
    return normalisation;
  }

  /**
   * @return factors as derived, including pathological ones that were replaced in the table
   */
  public double[] getEmittedFactors() {
    return context == null ? new double[]{} : context.getEmittedFactors();
  }

  /**
   * @return warnings raised during the last run
   */
  public List<String> getWarnings() {
    return context == null ? Collections.emptyList() : context.getWarnings();
  }

  /**
   * Produce human-readable lines summarizing the result
   *
   * @return summary lines
   */
  String[] getDataStrings() {
    if (table == null) {
      return new String[]{""};
    }
    return new String[]{
        "Constants derived: " + table.size(),
        "Valid constants: " + table.countValid(),
        "Absolute normalisation: " + NumericUtils.DECIMAL_FORMAT.get().format(normalisation),
        "Warnings: " + getWarnings().size()
    };
  }

  /**
   * Summary of the result, one entry per line
   *
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Driver to do data processing on input data (calls a concrete backend method which is
   * different for each derivation method). The options are checked here, before the data is
   * looked at.
   *
   * @param dataset Scan data to be processed
   * @throws powder.efficiency.input.CalibrationConfigurationException if the options are invalid
   * @throws IllegalArgumentException if the data is missing or of the wrong kind
   */
  public void runExperimentOnData(final ScanDataset dataset) {

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();
    context = null;
    table = null;
    normalisation = Double.NaN;

    fireStateChange("Beginning loading data...");

    if (dataset == null) {
      throw new IllegalArgumentException("No scan data given to " + getDerivationMethod().getName());
    }
    options.checkValid(dataset.getNumberOfScanFiles());
    if (!hasEnoughData(dataset)) {
      throw new IllegalArgumentException("Scan data " + dataset.getName()
          + " cannot be used with " + getDerivationMethod().getName());
    }

    dataNames.add(dataset.getName());

    fireStateChange("Beginning calculations...");

    backend(dataset);

    fireStateChange("Calculations done!");
  }

}
