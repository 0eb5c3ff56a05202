package powder.efficiency.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Class containing math functions used by the calibration: spline interpolation of sampled
 * curves and order statistics over plain arrays.
 */
public class NumericUtils {

  private static final double RATIO_TOLERANCE = 1E-9;

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Numerical Recipes cubic spline (spline.c), natural boundary conditions.
   * Expects arrays with +1 offset: x[1,...,n], etc.
   *
   * @param x abscissae, strictly increasing
   * @param y ordinates
   * @param n number of points
   * @param y2 output second derivatives
   */
  private static void spline(double[] x, double[] y, int n, double[] y2) {

    double[] u = new double[n + 1];
    y2[1] = u[1] = 0.0;

    for (int i = 2; i <= n - 1; i++) {
      double sig = (x[i] - x[i - 1]) / (x[i + 1] - x[i - 1]);
      double p = sig * y2[i - 1] + 2.0;
      y2[i] = (sig - 1.0) / p;
      u[i] = (y[i + 1] - y[i]) / (x[i + 1] - x[i]) - (y[i] - y[i - 1]) / (x[i] - x[i - 1]);
      u[i] = (6.0 * u[i] / (x[i + 1] - x[i - 1]) - sig * u[i - 1]) / p;
    }
    y2[n] = 0.0;
    for (int k = n - 1; k >= 1; k--) {
      y2[k] = y2[k] * y2[k + 1] + u[k];
    }
  }

  /**
   * Evaluate the spline produced by {@link #spline} at a single point (splint.c).
   * Points outside the sampled range are extrapolated from the outermost segment.
   */
  private static double splint(double[] xa, double[] ya, double[] y2a, int n, double x) {

    int klo = 1;
    int khi = n;
    while (khi - klo > 1) {
      int k = (khi + klo) >> 1;
      if (xa[k] > x) {
        khi = k;
      } else {
        klo = k;
      }
    }
    double h = xa[khi] - xa[klo];
    if (h == 0.0) {
      throw new IllegalArgumentException("Repeated abscissa " + xa[klo] + " in spline input");
    }

    double a = (xa[khi] - x) / h;
    double b = (x - xa[klo]) / h;
    return a * ya[klo] + b * ya[khi]
        + ((a * a * a - a) * y2a[klo] + (b * b * b - b) * y2a[khi]) * (h * h) / 6.0;
  }

  /**
   * Interpolate using a cubic spline.
   *
   * Interpolate measured Y[X] to the Y[Z]<br>
   * We know Y[X] = Y at values of X <br>
   * We want Y[Z] = Y interpolated to values of Z<br>
   *
   * With fewer than three points the spline degenerates and linear interpolation is used.
   *
   * @param X Measured X series, strictly increasing
   * @param Y Measured Y series
   * @param Z Desired X coordinates to interpolate
   * @return interpolated array of Y values corresponding to input Z
   */
  public static double[] interpolate(double[] X, double[] Y, double[] Z) {

    if (X.length != Y.length) {
      throw new IllegalArgumentException(
          "Abscissa and ordinate lengths differ: " + X.length + " vs. " + Y.length);
    }

    double[] interpolatedValues = new double[Z.length];
    int n = X.length;

    if (n == 0) {
      return interpolatedValues;
    }
    if (n == 1) {
      Arrays.fill(interpolatedValues, Y[0]);
      return interpolatedValues;
    }

    double[] tmpY = new double[n + 1];
    double[] tmpX = new double[n + 1];

    // Create offset (+1) arrays to use with Num Recipes interpolation
    for (int i = 0; i < n; i++) {
      tmpY[i + 1] = Y[i];
      tmpX[i + 1] = X[i];
    }
    double[] y2 = new double[n + 1];
    if (n > 2) {
      spline(tmpX, tmpY, n, y2);
    }

    for (int i = 0; i < Z.length; i++) {
      interpolatedValues[i] = splint(tmpX, tmpY, y2, n, Z[i]);
    }
    return interpolatedValues;
  }

  /**
   * Median of the given values. Even-sized samples give the mean of the two central values.
   *
   * @param values Data to get the median of
   * @return median, or NaN for an empty array
   */
  public static double median(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double[] sorted = new DescriptiveStatistics(values).getSortedValues();
    int upper = values.length / 2;
    if (values.length % 2 == 1) {
      return sorted[upper];
    }
    return (sorted[upper - 1] + sorted[upper]) / 2.;
  }

  /**
   * Arithmetic mean of the given values.
   *
   * @param values Data to average
   * @return mean, or NaN for an empty array
   */
  public static double mean(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    return new DescriptiveStatistics(values).getMean();
  }

  /**
   * Round a ratio of two positive quantities up to the next integer, e.g. the number of pixel
   * bins covered by one scan step. Quotients within floating-point noise of an integer are
   * taken as that integer.
   *
   * @param numerator Dividend (scan step)
   * @param denominator Divisor (pixel angular size)
   * @return ceiling of the quotient
   */
  public static int ceilRatio(double numerator, double denominator) {
    return (int) Math.ceil(numerator / denominator - RATIO_TOLERANCE);
  }

  /**
   * Sets decimalformat object so that infinity can be printed in text reports
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
