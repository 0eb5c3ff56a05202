package powder.efficiency.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DerivationMethodTest {

  @Test
  public void createExperiment_matchesMethod() {
    for (DerivationMethod method : DerivationMethod.values()) {
      EfficiencyExperiment experiment = method.createExperiment();
      assertEquals(method, experiment.getDerivationMethod());
      assertEquals(method, experiment.getOptions().getDerivationMethod());
    }
    assertTrue(DerivationMethod.SEQUENTIAL_1D.createExperiment()
        instanceof SequentialEfficiencyExperiment);
    assertTrue(DerivationMethod.GLOBAL_2D.createExperiment()
        instanceof GlobalEfficiencyExperiment);
  }

  @Test
  public void fromName_findsOptionNames() {
    assertEquals(DerivationMethod.SEQUENTIAL_1D,
        DerivationMethod.fromName("SequentialSummedReference1D"));
    assertEquals(DerivationMethod.GLOBAL_2D,
        DerivationMethod.fromName("globalsummedreference2d"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromName_unknown() {
    DerivationMethod.fromName("Sequential");
  }

}
