package powder.efficiency.utils;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.util.Pair;

/**
 * Array of doubles paired with a mask of entries that carry no information. An entry is masked
 * when it is zero, not finite, or was explicitly masked (e.g., it falls inside an excluded
 * angular range). All reductions operate on the unmasked entries only.
 */
public class MaskedArray {

  private final double[] values;
  private final boolean[] masked;

  private MaskedArray(double[] values) {
    this.values = values.clone();
    masked = new boolean[values.length];
    for (int i = 0; i < values.length; ++i) {
      masked[i] = !isInformative(values[i]);
    }
  }

  /**
   * Wrap data, masking zero and non-finite entries
   *
   * @param values Data to wrap (copied)
   * @return masked array over a copy of the data
   */
  public static MaskedArray of(double[] values) {
    return new MaskedArray(values);
  }

  /**
   * True if the value can contribute to statistics: it is finite and non-zero.
   *
   * @param value Value to check
   * @return false for zero, NaN and infinities
   */
  public static boolean isInformative(double value) {
    return value != 0. && Double.isFinite(value);
  }

  /**
   * Copy of the data with every NaN or infinite entry replaced by the given value
   *
   * @param data Data to clean
   * @param replacement Value put in place of non-finite entries
   * @return cleaned copy
   */
  public static double[] replaceSpecialValues(double[] data, double replacement) {
    double[] out = data.clone();
    for (int i = 0; i < out.length; ++i) {
      if (!Double.isFinite(out[i])) {
        out[i] = replacement;
      }
    }
    return out;
  }

  /**
   * Mask entries in the index range [from, to); indices outside the array are ignored.
   *
   * @param from First index to mask (inclusive)
   * @param to Last index to mask (exclusive)
   */
  public void maskRange(int from, int to) {
    int lower = Math.max(0, from);
    int upper = Math.min(values.length, to);
    for (int i = lower; i < upper; ++i) {
      masked[i] = true;
    }
  }

  /**
   * Mask each of a list of index ranges, given as [from, to) pairs
   *
   * @param ranges Ranges to mask
   */
  public void maskRanges(List<Pair<Integer, Integer>> ranges) {
    for (Pair<Integer, Integer> range : ranges) {
      maskRange(range.getFirst(), range.getSecond());
    }
  }

  public boolean isMasked(int index) {
    return masked[index];
  }

  public int size() {
    return values.length;
  }

  /**
   * @return number of entries still available to statistics
   */
  public int countUnmasked() {
    int count = 0;
    for (boolean isMasked : masked) {
      if (!isMasked) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Get the unmasked entries in their original order
   *
   * @return new array holding only the informative entries
   */
  public double[] compressed() {
    double[] out = new double[countUnmasked()];
    int index = 0;
    for (int i = 0; i < values.length; ++i) {
      if (!masked[i]) {
        out[index++] = values[i];
      }
    }
    return out;
  }

  @Override
  public String toString() {
    return "MaskedArray{unmasked=" + Arrays.toString(compressed()) + "}";
  }
}
