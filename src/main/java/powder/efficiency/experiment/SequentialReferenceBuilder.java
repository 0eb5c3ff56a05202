package powder.efficiency.experiment;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;
import powder.efficiency.input.DetectorScan;
import powder.efficiency.input.PixelResponseCurve;
import powder.efficiency.utils.NumericUtils;
import powder.efficiency.utils.SplineResampler;

/**
 * Derives relative efficiency constants of a one-dimensional detector pixel by pixel.
 * The first pixel of the range seeds a reference curve; each following pixel is compared to the
 * reference over the angles they share, its factor is derived from the ratio, and its scaled
 * response is merged into the reference, which then slides up by one pixel.
 *
 * The builder writes into the {@link RunContext} it is given: one constant per pixel (pixels
 * outside the range keep 1), the live-pixel mask and, if requested, the combined response of all
 * corrected pixels.
 */
public class SequentialReferenceBuilder {

  private static final Logger logger = Logger.getLogger(SequentialReferenceBuilder.class);

  /**
   * Largest tolerated difference between the bin offset and the actual step-to-pixel ratio
   * before data is better interpolated
   */
  static final double NON_INTEGER_STEP_TOLERANCE = 0.1;

  private final RatioStatistics statistics;
  private final SplineResampler resampler;
  private final boolean interpolate;
  private final List<Pair<Double, Double>> excludedRanges;

  /**
   * @param statistics Reduction of ratio curves to factors
   * @param resampler Interpolation used when overlapping angles do not coincide
   * @param interpolate True to resample each live pixel onto the reference angles
   * @param excludedRanges Angular ranges left out of the ratio statistics
   */
  public SequentialReferenceBuilder(RatioStatistics statistics, SplineResampler resampler,
      boolean interpolate, List<Pair<Double, Double>> excludedRanges) {
    this.statistics = statistics;
    this.resampler = resampler;
    this.interpolate = interpolate;
    this.excludedRanges = new ArrayList<>(excludedRanges);
  }

  /**
   * Number of reference samples a pixel does not share with the next one
   *
   * @param scan Scan to get the pixel size and scan step from
   * @return ceiling of scan step over pixel size
   */
  public static int binOffset(DetectorScan scan) {
    return NumericUtils.ceilRatio(scan.getScanStep(), scan.getPixelSize());
  }

  /**
   * Derive constants for pixels [firstPixel, lastPixel] of the scan
   *
   * @param scan Normalised scan
   * @param firstPixel First pixel of the range (0-based)
   * @param lastPixel Last pixel of the range (inclusive); must be inside the detector
   * @param outputResponse True to build the combined response
   * @param context Run state receiving the constants, live mask and response
   * @throws IllegalStateException if a cropped pixel does not line up with the reference
   */
  public void derive(DetectorScan scan, int firstPixel, int lastPixel, boolean outputResponse,
      RunContext context) {
    int scanPoints = scan.getScanPoints();
    int binOffset = binOffset(scan);
    double stepInPixels = scan.getScanStep() / scan.getPixelSize();
    logger.info("Bin offset is: " + binOffset);
    if (Math.abs(binOffset - stepInPixels) > NON_INTEGER_STEP_TOLERANCE && !interpolate) {
      context.warn("Scan step is not an integer multiple of the pixel size: "
          + NumericUtils.DECIMAL_FORMAT.get().format(stepInPixels)
          + ". Consider interpolating overlapping angles.");
    }
    if (binOffset >= scanPoints) {
      throw new IllegalArgumentException("Bin offset " + binOffset
          + " leaves no overlap in a scan of " + scanPoints + " points");
    }

    ResponseBuffer response = null;
    if (outputResponse) {
      response = new ResponseBuffer((lastPixel - firstPixel) * binOffset + scanPoints);
    }

    ReferenceCurve reference = null;
    for (int pixel = firstPixel; pixel <= lastPixel; ++pixel) {
      PixelResponseCurve curve = scan.getPixelCurve(pixel);
      context.setLive(pixel, curve.countNonZero() > scanPoints / 5.);

      if (pixel == firstPixel) {
        reference = new ReferenceCurve(curve, binOffset);
        context.setConstant(pixel, 1.);
        context.setEmittedFactor(pixel, 1.);
      } else {
        extend(reference, curve, pixel, binOffset, context);
      }

      if (response != null) {
        writeResponse(response, reference, curve, pixel - firstPixel,
            pixel == lastPixel, binOffset, scanPoints);
      }
    }

    if (response != null) {
      context.setResponse(response.toCurve());
    }
  }

  private void extend(ReferenceCurve reference, PixelResponseCurve curve, int pixel,
      int binOffset, RunContext context) {
    PixelResponseCurve cropped = curve.cropTrailing(binOffset);
    if (cropped.size() != reference.size()) {
      throw new IllegalStateException("Unequal number of bins in the reference ("
          + reference.size() + ") and the cropped pixel #" + pixel + " (" + cropped.size() + ")");
    }

    double[] referenceAngles = reference.getAngles();
    if (interpolate && context.isLive(pixel)) {
      double[] resampled = resampler.resample(
          cropped.getAngles(), cropped.getIntensities(), referenceAngles);
      cropped = new PixelResponseCurve(referenceAngles, resampled, cropped.getVariances());
    } else {
      cropped = cropped.withAngles(referenceAngles);
    }

    double[] ratios = reference.ratioTo(cropped);
    double factor = statistics.reduce(ratios,
        RatioStatistics.toIndexRanges(referenceAngles, excludedRanges));
    context.setEmittedFactor(pixel, factor);

    if (Double.isFinite(factor) && factor != 0.) {
      logger.debug("Factor derived for detector pixel #" + pixel + " is " + factor);
      context.setConstant(pixel, factor);
    } else {
      context.warn("Factor is " + factor + " for pixel #" + pixel);
      context.setLive(pixel, false);
    }

    PixelResponseCurve tail = curve.tail(binOffset);
    if (factor == 0.) {
      reference.replaceWith(cropped);
    } else if (Double.isFinite(factor)) {
      tail = tail.scaled(factor);
      reference.weightedMeanWith(cropped.scaled(factor));
    }
    reference.advance(tail, binOffset);
  }

  /**
   * Each pixel contributes the first binOffset samples of the reference at its own offset; the
   * last pixel contributes the rest of the reference and its own raw high-angle samples.
   */
  private static void writeResponse(ResponseBuffer response, ReferenceCurve reference,
      PixelResponseCurve curve, int position, boolean last, int binOffset, int scanPoints) {
    int end = binOffset;
    if (last) {
      end = scanPoints - binOffset;
      for (int s = 0; s < binOffset; ++s) {
        int index = response.size() - binOffset + s;
        response.set(index, curve.getAngle(end + s), curve.getIntensity(end + s),
            curve.getVariance(end + s));
      }
    }
    double[] angles = reference.getAngles();
    for (int s = 0; s < end; ++s) {
      response.set(position * binOffset + s, angles[s], reference.getIntensity(s),
          reference.getVariance(s));
    }
  }

}
