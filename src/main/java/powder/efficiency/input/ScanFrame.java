package powder.efficiency.input;

import java.util.Arrays;

/**
 * All data from one scan file of a two-dimensional (tube) detector: scattering angle, counts
 * and variance for every pixel of every tube at every scan point, indexed
 * [tube][pixel in tube][scan point].
 */
public class ScanFrame {

  private final String name;
  private final double[][][] angles;
  private final double[][][] intensities;
  private final double[][][] variances;
  private final double[] monitor;

  /**
   * @param name Name of the scan file (e.g., run number)
   * @param angles Scattering angles [tube][pixel][scan point]
   * @param intensities Counts [tube][pixel][scan point]
   * @param variances Variances of the counts [tube][pixel][scan point]
   * @param monitor Monitor counts per scan point, or null if not recorded
   */
  public ScanFrame(String name, double[][][] angles, double[][][] intensities,
      double[][][] variances, double[] monitor) {
    if (angles.length == 0 || angles[0].length == 0) {
      throw new IllegalArgumentException("Scan frame " + name + " has no pixels");
    }
    int tubes = angles.length;
    int pixels = angles[0].length;
    int scanPoints = angles[0][0].length;
    checkShape(name, "angles", angles, tubes, pixels, scanPoints);
    checkShape(name, "intensities", intensities, tubes, pixels, scanPoints);
    checkShape(name, "variances", variances, tubes, pixels, scanPoints);
    if (monitor != null && monitor.length != scanPoints) {
      throw new IllegalArgumentException("Monitor of " + name + " has " + monitor.length
          + " entries but the frame has " + scanPoints + " scan points");
    }
    this.name = name;
    this.angles = deepCopy(angles);
    this.intensities = deepCopy(intensities);
    this.variances = deepCopy(variances);
    this.monitor = monitor == null ? null : monitor.clone();
  }

  private static void checkShape(String name, String label, double[][][] data, int tubes,
      int pixels, int scanPoints) {
    if (data.length != tubes) {
      throw new IllegalArgumentException(name + ": expected " + tubes + " tubes of " + label);
    }
    for (double[][] tube : data) {
      if (tube.length != pixels) {
        throw new IllegalArgumentException(name + ": expected " + pixels + " pixels of " + label);
      }
      for (double[] pixel : tube) {
        if (pixel.length != scanPoints) {
          throw new IllegalArgumentException(
              name + ": expected " + scanPoints + " scan points of " + label);
        }
      }
    }
  }

  private static double[][][] deepCopy(double[][][] data) {
    double[][][] out = new double[data.length][][];
    for (int i = 0; i < data.length; ++i) {
      out[i] = DetectorScan.deepCopy(data[i]);
    }
    return out;
  }

  /**
   * Frame with the same angles but different data
   *
   * @param newIntensities Replacement counts [tube][pixel][scan point]
   * @param newVariances Replacement variances [tube][pixel][scan point]
   * @return new frame
   */
  public ScanFrame withData(double[][][] newIntensities, double[][][] newVariances) {
    return new ScanFrame(name, angles, newIntensities, newVariances, monitor);
  }

  /**
   * Frame holding only the first scan points, used when a file recorded more points than a
   * standard scan
   *
   * @param scanPoints Number of scan points to keep
   * @return truncated frame
   */
  public ScanFrame truncated(int scanPoints) {
    double[][][] newAngles = new double[getNumberOfTubes()][getPixelsPerTube()][];
    double[][][] newIntensities = new double[getNumberOfTubes()][getPixelsPerTube()][];
    double[][][] newVariances = new double[getNumberOfTubes()][getPixelsPerTube()][];
    for (int t = 0; t < getNumberOfTubes(); ++t) {
      for (int p = 0; p < getPixelsPerTube(); ++p) {
        newAngles[t][p] = Arrays.copyOf(angles[t][p], scanPoints);
        newIntensities[t][p] = Arrays.copyOf(intensities[t][p], scanPoints);
        newVariances[t][p] = Arrays.copyOf(variances[t][p], scanPoints);
      }
    }
    double[] newMonitor = monitor == null ? null : Arrays.copyOf(monitor, scanPoints);
    return new ScanFrame(name, newAngles, newIntensities, newVariances, newMonitor);
  }

  public String getName() {
    return name;
  }

  public int getNumberOfTubes() {
    return angles.length;
  }

  public int getPixelsPerTube() {
    return angles[0].length;
  }

  public int getScanPoints() {
    return angles[0][0].length;
  }

  public double getAngle(int tube, int pixel, int scanPoint) {
    return angles[tube][pixel][scanPoint];
  }

  public double getIntensity(int tube, int pixel, int scanPoint) {
    return intensities[tube][pixel][scanPoint];
  }

  public double getVariance(int tube, int pixel, int scanPoint) {
    return variances[tube][pixel][scanPoint];
  }

  public double[][][] getIntensities() {
    return deepCopy(intensities);
  }

  public double[][][] getVariances() {
    return deepCopy(variances);
  }

  public boolean hasMonitor() {
    return monitor != null;
  }

  public double[] getMonitor() {
    return monitor == null ? null : monitor.clone();
  }

}
