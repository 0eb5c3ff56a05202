package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;
import powder.efficiency.input.PixelResponseCurve;

/**
 * State owned by one calibration run: the constants table being derived, the live-pixel mask,
 * the factors as they were emitted, and the warnings raised along the way. Each run gets its
 * own context; nothing here is shared between runs.
 */
public class RunContext {

  private static final Logger logger = Logger.getLogger(RunContext.class);

  private final double[] constants;
  private final double[] uncertainties;
  private final double[] emittedFactors;
  private final boolean[] livePixels;
  private final List<String> warnings;
  private PixelResponseCurve response;
  private ReferenceSurface responseSurface;

  /**
   * @param numberOfPixels Size of the constants table; every entry starts at 1
   */
  RunContext(int numberOfPixels) {
    constants = new double[numberOfPixels];
    Arrays.fill(constants, 1.);
    uncertainties = new double[numberOfPixels];
    emittedFactors = new double[numberOfPixels];
    Arrays.fill(emittedFactors, 1.);
    livePixels = new boolean[numberOfPixels];
    warnings = new ArrayList<>();
  }

  /**
   * Log a recovered problem and keep it to be handed back with the result
   *
   * @param message Description, including the pixel or tube concerned
   */
  synchronized void warn(String message) {
    logger.warn(message);
    warnings.add(message);
  }

  int size() {
    return constants.length;
  }

  double[] getConstants() {
    return constants;
  }

  double[] getUncertainties() {
    return uncertainties;
  }

  boolean[] getLivePixels() {
    return livePixels;
  }

  void setConstant(int index, double value) {
    constants[index] = value;
  }

  void setEmittedFactor(int index, double factor) {
    emittedFactors[index] = factor;
  }

  void setLive(int index, boolean live) {
    livePixels[index] = live;
  }

  boolean isLive(int index) {
    return livePixels[index];
  }

  /**
   * @return factors exactly as derived, including any zero or non-finite ones
   */
  public double[] getEmittedFactors() {
    return emittedFactors.clone();
  }

  void setResponse(PixelResponseCurve response) {
    this.response = response;
  }

  void setResponseSurface(ReferenceSurface responseSurface) {
    this.responseSurface = responseSurface;
  }

  /**
   * @return combined response of a one-dimensional detector, or null if not built
   */
  public PixelResponseCurve getResponse() {
    return response;
  }

  /**
   * @return summed corrected response of a tube detector, or null if not built
   */
  public ReferenceSurface getResponseSurface() {
    return responseSurface;
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(new ArrayList<>(warnings));
  }

}
