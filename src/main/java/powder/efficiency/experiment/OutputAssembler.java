package powder.efficiency.experiment;

import org.apache.commons.math3.util.Pair;
import powder.efficiency.output.CalibrationTable;

/**
 * Builds the final constants table from a normalised run, flagging constants outside the mask
 * criterion as invalid. Flagged constants are kept in the table.
 */
public class OutputAssembler {

  /**
   * @param context Run state after absolute normalisation
   * @param maskCriterion (low, high) range of valid constants, or null to accept all
   * @param pixelsPerTube Row length of the table
   * @return the constants table
   * @throws IllegalStateException if a constant is not positive and finite
   */
  public CalibrationTable assemble(RunContext context, Pair<Double, Double> maskCriterion,
      int pixelsPerTube) {
    double[] constants = context.getConstants();
    boolean[] valid = new boolean[constants.length];
    for (int i = 0; i < constants.length; ++i) {
      double value = constants[i];
      if (!Double.isFinite(value) || value <= 0.) {
        throw new IllegalStateException("Constant of pixel #" + i + " is " + value);
      }
      valid[i] = maskCriterion == null
          || (value >= maskCriterion.getFirst() && value <= maskCriterion.getSecond());
    }
    return new CalibrationTable(constants, context.getUncertainties(), valid, pixelsPerTube);
  }

}
