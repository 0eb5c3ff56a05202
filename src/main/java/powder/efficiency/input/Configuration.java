package powder.efficiency.input;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding defaults for the calibration runs that users have asked to tune
 * without changing code. These include the termination threshold and trimmed pixel band of the
 * automatic iteration mode of the global method, the safety cap on automatic iterations, the
 * small-number floor below which per-iteration factors are discarded, whether tubes are
 * processed in parallel, and the default calibration policy.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "efficiency-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double chiSquaredThreshold = 1.0;
  private int pixelsToTrim = 28;
  private int maximumAutoIterations = 10;
  private double smallNumberFloor = 1E-5;
  private boolean parallelTubes = true;
  private CalibrationMethod defaultMethod = CalibrationMethod.MEDIAN;

  private Configuration(URL configLocation) {
    if (configLocation == null) {
      logger.error("No configuration file found, using built-in defaults");
      return;
    }
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      chiSquaredThreshold =
          config.getDouble("GlobalReference.ChiSquaredThreshold", chiSquaredThreshold);
      pixelsToTrim = config.getInt("GlobalReference.PixelsToTrim", pixelsToTrim);
      maximumAutoIterations =
          config.getInt("GlobalReference.MaximumAutoIterations", maximumAutoIterations);
      smallNumberFloor = config.getDouble("GlobalReference.SmallNumberFloor", smallNumberFloor);
      parallelTubes = config.getBoolean("GlobalReference.ParallelTubes", parallelTubes);

      String methodParam = config.getString("Statistics.DefaultMethod");
      if (methodParam != null) {
        try {
          defaultMethod = CalibrationMethod.fromName(methodParam);
        } catch (IllegalArgumentException e) {
          logger.warn("Unknown calibration method in config file: " + methodParam, e);
        }
      }

      loadedConfigPath = configLocation.toString();
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Read a configuration without touching the shared instance
   *
   * @param configLocation File to read, or null for built-in defaults
   * @return new configuration
   */
  static Configuration load(URL configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists. A file named
   * {@value #DEFAULT_CONFIG_PATH} in the working directory takes precedence over the one
   * embedded in the jar.
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    File local = new File(System.getProperty("user.dir"), DEFAULT_CONFIG_PATH);
    if (local.exists()) {
      return getInstance(local.getPath());
    }
    if (instance == null) {
      instance = new Configuration(
          Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH));
    }
    return instance;
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   *
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      URL url = null;
      try {
        url = new File(configLocation).getCanonicalFile().toURI().toURL();
      } catch (IOException e) {
        logger.error("Could not resolve config location " + configLocation, e);
      }
      instance = new Configuration(url);
    }
    return instance;
  }

  /**
   * Chi-squared per degree of freedom below which automatic iterations stop.
   * The property is defined from GlobalReference.ChiSquaredThreshold
   *
   * @return termination threshold
   */
  public double getChiSquaredThreshold() {
    return chiSquaredThreshold;
  }

  /**
   * Number of pixels at each end of a tube left out of the chi-squared calculation.
   * The property is defined from GlobalReference.PixelsToTrim
   *
   * @return pixels trimmed per tube end
   */
  public int getPixelsToTrim() {
    return pixelsToTrim;
  }

  /**
   * Safety cap on the number of automatic iterations.
   * The property is defined from GlobalReference.MaximumAutoIterations
   *
   * @return maximum number of iterations when the iteration count is automatic
   */
  public int getMaximumAutoIterations() {
    return maximumAutoIterations;
  }

  /**
   * Per-iteration factors smaller than this are treated as carrying no information.
   *
   * @return small-number floor
   */
  public double getSmallNumberFloor() {
    return smallNumberFloor;
  }

  public boolean isParallelTubes() {
    return parallelTubes;
  }

  public CalibrationMethod getDefaultMethod() {
    return defaultMethod;
  }

  /**
   * @return location of the configuration that was read in
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

}
