package powder.efficiency.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import powder.efficiency.input.PixelResponseCurve;

public class CalResultTest {

  private static CalibrationTable table() {
    return new CalibrationTable(new double[]{0.9, 1.1, 1., 1.}, new double[4],
        new boolean[]{true, true, true, false}, 2);
  }

  @Test
  public void buildSequentialData_withResponse() {
    PixelResponseCurve response = new PixelResponseCurve(new double[]{2., 1.},
        new double[]{20., 10.}, new double[]{4., 1.});
    CalResult result = CalResult.buildSequentialData(table(), new double[]{1., 2., 3., 4.}, 1.5,
        response, new byte[][]{{1}, {2}});
    assertArrayEquals(new double[]{0.9, 1.1, 1., 1.},
        result.getNumerMap().get("Calibration_constants"), 0.);
    assertArrayEquals(new double[]{1., 1., 1., 0.}, result.getNumerMap().get("Valid"), 0.);
    assertArrayEquals(new double[]{1.5}, result.getNumerMap().get("Absolute_normalisation"), 0.);
    assertArrayEquals(new double[]{1., 2.}, result.getNumerMap().get("Response_angles"), 0.);
    assertArrayEquals(new double[]{10., 20.},
        result.getNumerMap().get("Response_intensities"), 0.);
    assertEquals(2, result.getImageMap().size());
    assertArrayEquals(new byte[]{2}, result.getImageMap().get("Response_plot"));
  }

  @Test
  public void buildSequentialData_withoutResponseOrImages() {
    CalResult result = CalResult.buildSequentialData(table(), new double[4], 1., null,
        new byte[][]{});
    assertFalse(result.getNumerMap().containsKey("Response_angles"));
    assertTrue(result.getImageMap().isEmpty());
    assertEquals(5, result.getNumerMap().size());
  }

  @Test
  public void buildGlobalData_reportsIterations() {
    CalResult result = CalResult.buildGlobalData(table(), new double[4], 1.,
        Arrays.asList(0.5, 0.1, 0.01), new byte[][]{{1}});
    assertArrayEquals(new double[]{0.5, 0.1, 0.01},
        result.getNumerMap().get("Chi_squared_per_degree_of_freedom"), 0.);
    assertArrayEquals(new double[]{3.}, result.getNumerMap().get("Iterations"), 0.);
    assertArrayEquals(new double[]{2., 2.}, result.getNumerMap().get("Tube_shape"), 0.);
    assertTrue(result.getImageMap().containsKey("Constants_plot"));
  }

}
