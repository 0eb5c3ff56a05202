package powder.efficiency.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import powder.efficiency.input.DetectorScan;
import powder.efficiency.input.NormalisationTarget;
import powder.efficiency.input.ScanFrame;
import powder.efficiency.test.TestUtils;

public class ScanNormalizerTest {

  private static final List<Pair<Double, Double>> NO_REGIONS = Collections.emptyList();

  @Test
  public void normalise_monitorPropagatesVariance() {
    double[] monitor = new double[5];
    Arrays.fill(monitor, 2.);
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1., 3.}, 5, monitor);
    DetectorScan normalised =
        new ScanNormalizer().normalise(scan, NormalisationTarget.MONITOR, NO_REGIONS, 1);
    assertEquals(100., normalised.getIntensities()[0][0], 1E-12);
    assertEquals(200. / 4. + 100. * 100. / 2., normalised.getVariances()[0][0], 1E-9);
    assertEquals(3. * TestUtils.pattern(3.), normalised.getIntensities()[1][2], 1E-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void normalise_monitorMissing() {
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1.}, 5);
    new ScanNormalizer().normalise(scan, NormalisationTarget.MONITOR, NO_REGIONS, 1);
  }

  @Test
  public void normalise_replacesSpecialValuesWithZero() {
    double[][] angles = {{0., 1., 2.}};
    double[][] counts = {{1., Double.NaN, 3.}};
    double[][] variances = {{1., 1., Double.POSITIVE_INFINITY}};
    DetectorScan scan = new DetectorScan("special", angles, counts, variances, null, 1., 1.);
    DetectorScan normalised =
        new ScanNormalizer().normalise(scan, NormalisationTarget.NONE, NO_REGIONS, 1);
    assertEquals(1., normalised.getIntensities()[0][0], 0.);
    assertEquals(0., normalised.getIntensities()[0][1], 0.);
    assertEquals(0., normalised.getVariances()[0][1], 0.);
    assertEquals(0., normalised.getIntensities()[0][2], 0.);
    assertEquals(0., normalised.getVariances()[0][2], 0.);
  }

  @Test
  public void normalise_zeroMonitorCountsBecomeZero() {
    double[] monitor = {1., 0., 1.};
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1.}, 3, monitor);
    DetectorScan normalised =
        new ScanNormalizer().normalise(scan, NormalisationTarget.MONITOR, NO_REGIONS, 1);
    assertEquals(0., normalised.getIntensities()[0][1], 0.);
    assertEquals(0., normalised.getVariances()[0][1], 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void validateRegions_rejectsRegionOutsideCommonRange() {
    DetectorScan scan = TestUtils.sequentialScan(new double[30], 5);
    ScanNormalizer.validateRegions(scan, Collections.singletonList(new Pair<>(0., 20.)));
  }

  @Test
  public void validateRegions_acceptsRegionInsideCommonRange() {
    DetectorScan scan = TestUtils.sequentialScan(new double[30], 5);
    ScanNormalizer.validateRegions(scan, Collections.singletonList(new Pair<>(10., 20.)));
  }

  @Test
  public void roiCounts_followsRegionAcrossScanPoints() {
    double[] efficiencies = new double[30];
    Arrays.fill(efficiencies, 1.);
    DetectorScan scan = TestUtils.sequentialScan(efficiencies, 5);
    double expected = 0.;
    for (int angle = 11; angle < 20; ++angle) {
      expected += TestUtils.pattern(angle);
    }
    double[] counts = ScanNormalizer.roiCounts(
        scan, Collections.singletonList(new Pair<>(10., 20.)), 1);
    assertEquals(5, counts.length);
    for (double count : counts) {
      assertEquals(expected, count, 1E-9);
    }
  }

  @Test
  public void normalise_roiGivesUniformScale() {
    double[] efficiencies = new double[30];
    Arrays.fill(efficiencies, 1.);
    DetectorScan scan = TestUtils.sequentialScan(efficiencies, 5);
    DetectorScan normalised = new ScanNormalizer().normalise(scan, NormalisationTarget.ROI,
        Collections.singletonList(new Pair<>(10., 20.)), 1);
    double ratio = scan.getIntensities()[3][0] / normalised.getIntensities()[3][0];
    assertEquals(ratio, scan.getIntensities()[7][4] / normalised.getIntensities()[7][4], 1E-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void normalise_frameRejectsRoi() {
    ScanFrame frame = TestUtils.tubeScanSet(new double[][]{{1.}}, 2, 1, 1.).getFrames().get(0);
    new ScanNormalizer().normalise(frame, NormalisationTarget.ROI);
  }

  @Test
  public void applyConstants_scalesFramePixels() {
    ScanFrame frame =
        TestUtils.tubeScanSet(new double[][]{{1., 1.}, {1., 1.}}, 2, 1, 1.).getFrames().get(0);
    ScanFrame corrected = ScanNormalizer.applyConstants(frame, new double[]{1., 1., 1., 3.});
    assertEquals(3. * frame.getIntensity(1, 1, 0), corrected.getIntensity(1, 1, 0), 1E-12);
    assertEquals(9. * frame.getVariance(1, 1, 0), corrected.getVariance(1, 1, 0), 1E-9);
    assertEquals(frame.getIntensity(0, 1, 1), corrected.getIntensity(0, 1, 1), 0.);
  }

  @Test
  public void applyConstants_rejectsWrongLength() {
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1., 1.}, 3);
    try {
      ScanNormalizer.applyConstants(scan, new double[]{1.});
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("2 pixels"));
      return;
    }
    throw new AssertionError("Expected constants of the wrong length to be refused");
  }

}
