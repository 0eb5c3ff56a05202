package powder.efficiency.experiment;

import org.apache.log4j.Logger;
import powder.efficiency.utils.NumericUtils;

/**
 * Turns relative constants into absolute ones by dividing by the median constant of the live
 * pixels. Pixels that are not live get exactly 1 with no uncertainty.
 */
public class AbsoluteNormalizer {

  private static final Logger logger = Logger.getLogger(AbsoluteNormalizer.class);

  /**
   * Normalise the constants of the context in place
   *
   * @param context Run state holding constants, uncertainties and live mask
   * @return the normalisation constant, or NaN if there were no live pixels
   */
  public double normalise(RunContext context) {
    double[] constants = context.getConstants();
    double[] uncertainties = context.getUncertainties();
    boolean[] live = context.getLivePixels();

    int liveCount = 0;
    for (boolean isLive : live) {
      if (isLive) {
        ++liveCount;
      }
    }
    double[] liveConstants = new double[liveCount];
    int index = 0;
    for (int i = 0; i < constants.length; ++i) {
      if (live[i]) {
        liveConstants[index++] = constants[i];
      }
    }

    if (liveCount == 0) {
      context.warn("No live pixels; absolute normalisation skipped and all constants set to 1");
      for (int i = 0; i < constants.length; ++i) {
        constants[i] = 1.;
        uncertainties[i] = 0.;
      }
      return Double.NaN;
    }

    double norm = NumericUtils.median(liveConstants);
    logger.info("Absolute normalisation constant is: " + norm);
    for (int i = 0; i < constants.length; ++i) {
      if (!live[i]) {
        constants[i] = 1.;
        uncertainties[i] = 0.;
        continue;
      }
      constants[i] /= norm;
      uncertainties[i] /= Math.abs(norm);
      if (!Double.isFinite(constants[i]) || constants[i] <= 0.) {
        context.warn("Constant " + constants[i] + " of pixel #" + i
            + " is not positive after normalisation; set to 1");
        constants[i] = 1.;
        uncertainties[i] = 0.;
      }
    }
    return norm;
  }

}
