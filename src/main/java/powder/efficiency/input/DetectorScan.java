package powder.efficiency.input;

/**
 * Detector scan of a one-dimensional pixel array (one row of pixels along the scattering angle),
 * as used by the sequential method. Data is held as pixel x scan-point matrices of scattering
 * angle, intensity and variance, plus optional monitor counts per scan point.
 * Several scan files merged into one scan are represented by a single object.
 */
public class DetectorScan implements ScanDataset {

  private final String name;
  private final double[][] angles;
  private final double[][] intensities;
  private final double[][] variances;
  private final double[] monitor;
  private final double pixelSize;
  private final double scanStep;
  private final int numberOfScanFiles;

  /**
   * Create a scan from a single scan file
   *
   * @param name Name of the scan (e.g., run number)
   * @param angles Scattering angle of each pixel at each scan point [pixel][scan point]
   * @param intensities Counts of each pixel at each scan point [pixel][scan point]
   * @param variances Variance of the counts [pixel][scan point]
   * @param monitor Monitor counts per scan point, or null if not recorded
   * @param pixelSize Angular size of one pixel (degrees)
   * @param scanStep Angular step between two consecutive scan points (degrees)
   */
  public DetectorScan(String name, double[][] angles, double[][] intensities,
      double[][] variances, double[] monitor, double pixelSize, double scanStep) {
    this(name, angles, intensities, variances, monitor, pixelSize, scanStep, 1);
  }

  /**
   * Create a scan merged from one or more scan files
   *
   * @param name Name of the scan (e.g., run numbers)
   * @param angles Scattering angle of each pixel at each scan point [pixel][scan point]
   * @param intensities Counts of each pixel at each scan point [pixel][scan point]
   * @param variances Variance of the counts [pixel][scan point]
   * @param monitor Monitor counts per scan point, or null if not recorded
   * @param pixelSize Angular size of one pixel (degrees)
   * @param scanStep Angular step between two consecutive scan points (degrees)
   * @param numberOfScanFiles Number of files merged into this scan
   */
  public DetectorScan(String name, double[][] angles, double[][] intensities,
      double[][] variances, double[] monitor, double pixelSize, double scanStep,
      int numberOfScanFiles) {
    if (angles.length == 0) {
      throw new IllegalArgumentException("Detector scan " + name + " has no pixels");
    }
    if (!(pixelSize > 0.) || !(scanStep > 0.)) {
      throw new IllegalArgumentException("Pixel size and scan step must be positive, got "
          + pixelSize + " and " + scanStep);
    }
    int scanPoints = angles[0].length;
    checkShape("intensities", intensities, angles.length, scanPoints);
    checkShape("variances", variances, angles.length, scanPoints);
    checkShape("angles", angles, angles.length, scanPoints);
    if (monitor != null && monitor.length != scanPoints) {
      throw new IllegalArgumentException("Monitor has " + monitor.length
          + " entries but the scan has " + scanPoints + " points");
    }
    this.name = name;
    this.angles = deepCopy(angles);
    this.intensities = deepCopy(intensities);
    this.variances = deepCopy(variances);
    this.monitor = monitor == null ? null : monitor.clone();
    this.pixelSize = pixelSize;
    this.scanStep = scanStep;
    this.numberOfScanFiles = numberOfScanFiles;
  }

  private static void checkShape(String label, double[][] data, int rows, int columns) {
    if (data.length != rows) {
      throw new IllegalArgumentException(
          "Expected " + rows + " pixels of " + label + ", got " + data.length);
    }
    for (int i = 0; i < rows; ++i) {
      if (data[i].length != columns) {
        throw new IllegalArgumentException("Pixel " + i + " has " + data[i].length + " "
            + label + " but the scan has " + columns + " points");
      }
    }
  }

  static double[][] deepCopy(double[][] data) {
    double[][] out = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      out[i] = data[i].clone();
    }
    return out;
  }

  /**
   * Copy of this scan with the same geometry but different data, e.g. after normalisation
   *
   * @param newIntensities Replacement intensities [pixel][scan point]
   * @param newVariances Replacement variances [pixel][scan point]
   * @return new scan
   */
  public DetectorScan withData(double[][] newIntensities, double[][] newVariances) {
    return new DetectorScan(name, angles, newIntensities, newVariances, monitor, pixelSize,
        scanStep, numberOfScanFiles);
  }

  /**
   * Get the response of one pixel over the whole scan, sorted by angle
   *
   * @param pixel Pixel index (0-based)
   * @return the pixel's response curve
   */
  public PixelResponseCurve getPixelCurve(int pixel) {
    return new PixelResponseCurve(angles[pixel], intensities[pixel], variances[pixel]);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public int getNumberOfScanFiles() {
    return numberOfScanFiles;
  }

  public int getNumberOfPixels() {
    return angles.length;
  }

  public int getScanPoints() {
    return angles[0].length;
  }

  public double getAngle(int pixel, int scanPoint) {
    return angles[pixel][scanPoint];
  }

  public double[][] getIntensities() {
    return deepCopy(intensities);
  }

  public double[][] getVariances() {
    return deepCopy(variances);
  }

  public boolean hasMonitor() {
    return monitor != null;
  }

  public double[] getMonitor() {
    return monitor == null ? null : monitor.clone();
  }

  public double getPixelSize() {
    return pixelSize;
  }

  public double getScanStep() {
    return scanStep;
  }

}
