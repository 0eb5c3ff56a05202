package powder.efficiency.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AbsoluteNormalizerTest {

  private static RunContext context(double[] constants, boolean[] live) {
    RunContext context = new RunContext(constants.length);
    for (int i = 0; i < constants.length; ++i) {
      context.setConstant(i, constants[i]);
      context.setLive(i, live[i]);
      context.getUncertainties()[i] = 0.1 * constants[i];
    }
    return context;
  }

  @Test
  public void normalise_dividesByMedianOfLivePixels() {
    RunContext context = context(new double[]{1., 2., 4., 100.},
        new boolean[]{true, true, true, false});
    double norm = new AbsoluteNormalizer().normalise(context);
    assertEquals(2., norm, 0.);
    assertArrayEquals(new double[]{0.5, 1., 2., 1.}, context.getConstants(), 1E-15);
    assertEquals(0.05, context.getUncertainties()[0], 1E-15);
    assertEquals(0., context.getUncertainties()[3], 0.);
    assertTrue(context.getWarnings().isEmpty());
  }

  @Test
  public void normalise_noLivePixels() {
    RunContext context = context(new double[]{3., 5.}, new boolean[]{false, false});
    double norm = new AbsoluteNormalizer().normalise(context);
    assertTrue(Double.isNaN(norm));
    assertArrayEquals(new double[]{1., 1.}, context.getConstants(), 0.);
    assertEquals(1, context.getWarnings().size());
  }

  @Test
  public void normalise_replacesNonPositiveConstant() {
    RunContext context = context(new double[]{-1., 2., 2.}, new boolean[]{true, true, true});
    new AbsoluteNormalizer().normalise(context);
    assertArrayEquals(new double[]{1., 1., 1.}, context.getConstants(), 0.);
    assertEquals(1, context.getWarnings().size());
    assertTrue(context.getWarnings().get(0).contains("pixel #0"));
  }

}
