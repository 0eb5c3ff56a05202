package powder.efficiency.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.util.Pair;
import org.junit.Test;
import powder.efficiency.output.CalibrationTable;

public class OutputAssemblerTest {

  private static RunContext context(double... constants) {
    RunContext context = new RunContext(constants.length);
    for (int i = 0; i < constants.length; ++i) {
      context.setConstant(i, constants[i]);
    }
    return context;
  }

  @Test
  public void assemble_flagsConstantsOutsideMask() {
    CalibrationTable table = new OutputAssembler()
        .assemble(context(1., 0.5, 1.5, 1E-5, 2.), new Pair<>(0.5, 1.5), 5);
    assertArrayEquals(new double[]{1., 1., 1., 0., 0.}, table.getValidityFlags(), 0.);
    assertEquals(1E-5, table.getValue(3), 0.);
    assertEquals(3, table.countValid());
  }

  @Test
  public void assemble_withoutMaskAcceptsAll() {
    CalibrationTable table = new OutputAssembler().assemble(context(0.1, 10.), null, 1);
    assertTrue(table.isValid(0));
    assertTrue(table.isValid(1));
    assertEquals(2, table.getNumberOfTubes());
  }

  @Test
  public void assemble_laysOutTubes() {
    CalibrationTable table = new OutputAssembler()
        .assemble(context(1., 2., 3., 4., 5., 6.), new Pair<>(0., 4.5), 3);
    assertEquals(2, table.getNumberOfTubes());
    assertEquals(3, table.getPixelsPerTube());
    assertEquals(5., table.getValue(1, 1), 0.);
    assertFalse(table.isValid(1, 1));
  }

  @Test(expected = IllegalStateException.class)
  public void assemble_rejectsNonFiniteConstant() {
    new OutputAssembler().assemble(context(1., Double.NaN), null, 2);
  }

}
