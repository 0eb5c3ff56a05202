package powder.efficiency.input;

/**
 * Detector scan data handed to a calibration experiment by the data loader.
 */
public interface ScanDataset {

  /**
   * @return name identifying the data (e.g., run numbers), used in reports and logs
   */
  String getName();

  /**
   * @return number of scan files the data was loaded from
   */
  int getNumberOfScanFiles();

}
