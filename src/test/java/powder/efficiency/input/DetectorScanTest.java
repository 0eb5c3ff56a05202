package powder.efficiency.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import powder.efficiency.test.TestUtils;

public class DetectorScanTest {

  @Test
  public void getPixelCurve_followsPixelAcrossScanPoints() {
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1., 2.}, 5);
    assertEquals(2, scan.getNumberOfPixels());
    assertEquals(5, scan.getScanPoints());
    assertEquals(1, scan.getNumberOfScanFiles());
    assertFalse(scan.hasMonitor());
    PixelResponseCurve curve = scan.getPixelCurve(1);
    assertEquals(5, curve.size());
    assertEquals(1., curve.getAngle(0), 0.);
    assertEquals(2. * TestUtils.pattern(5.), curve.getIntensity(4), 1E-10);
  }

  @Test
  public void withData_doesNotShareArrays() {
    DetectorScan scan = TestUtils.sequentialScan(new double[]{1.}, 3);
    double[][] y = scan.getIntensities();
    y[0][0] = -1.;
    assertEquals(TestUtils.pattern(0.), scan.getIntensities()[0][0], 1E-10);
    DetectorScan changed = scan.withData(y, scan.getVariances());
    assertEquals(-1., changed.getIntensities()[0][0], 0.);
    assertEquals(scan.getAngle(0, 2), changed.getAngle(0, 2), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_rejectsRaggedData() {
    double[][] angles = {{0., 1.}, {1., 2.}};
    double[][] counts = {{1., 1.}, {1.}};
    new DetectorScan("ragged", angles, counts, counts, null, 1., 1.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_rejectsMonitorOfWrongLength() {
    double[][] data = {{1., 1.}};
    new DetectorScan("monitor", data, data, data, new double[]{1.}, 1., 1.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_rejectsNonPositiveStep() {
    double[][] data = {{1., 1.}};
    new DetectorScan("step", data, data, data, null, 1., 0.);
  }

  @Test
  public void tubeScanSet_describesFiles() {
    TubeScanSet set = TestUtils.tubeScanSet(new double[][]{{1., 1.}, {1., 1.}}, 4, 3, 0.5);
    assertEquals(3, set.getNumberOfScanFiles());
    assertEquals(2, set.getNumberOfTubes());
    assertEquals(2, set.getPixelsPerTube());
    assertEquals(12, set.getScanPoints());
    assertEquals(0.5, set.getScanStep(), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void tubeScanSet_rejectsMismatchedFrames() {
    List<ScanFrame> frames = new ArrayList<>(
        TestUtils.tubeScanSet(new double[][]{{1., 1.}}, 2, 1, 1.).getFrames());
    frames.addAll(TestUtils.tubeScanSet(new double[][]{{1.}}, 2, 1, 1.).getFrames());
    new TubeScanSet("mixed", frames, 2, 1.);
  }

  @Test
  public void scanFrame_truncatedKeepsFirstPoints() {
    ScanFrame frame = TestUtils.tubeScanSet(new double[][]{{1.}}, 3, 1, 1., 2).getFrames().get(0);
    assertEquals(5, frame.getScanPoints());
    ScanFrame truncated = frame.truncated(3);
    assertEquals(3, truncated.getScanPoints());
    assertEquals(frame.getIntensity(0, 0, 2), truncated.getIntensity(0, 0, 2), 0.);
    assertTrue(Arrays.equals(new double[]{0., 1., 2.}, new double[]{
        truncated.getAngle(0, 0, 0), truncated.getAngle(0, 0, 1), truncated.getAngle(0, 0, 2)}));
  }

}
