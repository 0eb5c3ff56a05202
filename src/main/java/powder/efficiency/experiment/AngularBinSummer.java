package powder.efficiency.experiment;

import java.util.List;
import powder.efficiency.input.ScanFrame;

/**
 * Sums tube data into angular bins one scan step wide, starting at the lowest angle seen.
 * Each pixel height keeps its own row. A bin holds the mean of all counts that fell into it, so
 * bins covered by several tubes are not overweighted.
 */
public class AngularBinSummer implements OverlappingFrameSummer {

  @Override
  public ReferenceSurface sum(List<ScanFrame> frames, double scanStep) {
    if (frames.isEmpty()) {
      throw new IllegalArgumentException("No scan files to sum");
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (ScanFrame frame : frames) {
      for (int t = 0; t < frame.getNumberOfTubes(); ++t) {
        for (int p = 0; p < frame.getPixelsPerTube(); ++p) {
          for (int s = 0; s < frame.getScanPoints(); ++s) {
            double angle = frame.getAngle(t, p, s);
            min = Math.min(min, angle);
            max = Math.max(max, angle);
          }
        }
      }
    }

    int rows = frames.get(0).getPixelsPerTube();
    int bins = (int) Math.round((max - min) / scanStep) + 1;
    double[][] sums = new double[rows][bins];
    double[][] variances = new double[rows][bins];
    int[][] counts = new int[rows][bins];
    for (ScanFrame frame : frames) {
      for (int t = 0; t < frame.getNumberOfTubes(); ++t) {
        for (int p = 0; p < rows; ++p) {
          for (int s = 0; s < frame.getScanPoints(); ++s) {
            int bin = (int) Math.round((frame.getAngle(t, p, s) - min) / scanStep);
            sums[p][bin] += frame.getIntensity(t, p, s);
            variances[p][bin] += frame.getVariance(t, p, s);
            ++counts[p][bin];
          }
        }
      }
    }

    double[] binAngles = new double[bins];
    for (int b = 0; b < bins; ++b) {
      binAngles[b] = min + b * scanStep;
    }
    for (int p = 0; p < rows; ++p) {
      for (int b = 0; b < bins; ++b) {
        int n = counts[p][b];
        if (n > 0) {
          sums[p][b] /= n;
          variances[p][b] /= (double) n * n;
        }
      }
    }
    return new ReferenceSurface(binAngles, sums, variances);
  }

}
