package powder.efficiency.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import powder.efficiency.input.CalibrationConfigurationException;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.TubeScanSet;
import powder.efficiency.output.CalibrationTable;
import powder.efficiency.test.TestUtils;

public class GlobalEfficiencyExperimentTest {

  private static GlobalEfficiencyExperiment experiment(CalibrationOptions options) {
    GlobalEfficiencyExperiment experiment = new GlobalEfficiencyExperiment();
    experiment.setOptions(options);
    return experiment;
  }

  @Test
  public void runExperimentOnData_producesNormalisedTable() {
    TubeScanSet scans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1.);
    GlobalEfficiencyExperiment experiment =
        experiment(GlobalReferenceSolverTest.options(10));
    experiment.runExperimentOnData(scans);

    CalibrationTable table = experiment.getTable();
    assertEquals(3, table.getNumberOfTubes());
    assertEquals(4, table.getPixelsPerTube());
    double[] sorted = table.getValues();
    Arrays.sort(sorted);
    assertEquals(1., (sorted[5] + sorted[6]) / 2., 1E-12);
    assertFalse(Double.isNaN(experiment.getNormalisationConstant()));
    assertEquals(10, experiment.getIterationsRun());
    assertEquals(2, experiment.getData().size());
    assertEquals(10, experiment.getData().get(1).getSeries(0).getItemCount());
    assertEquals(12, experiment.getEmittedFactors().length);
    assertTrue(experiment.getWarnings().isEmpty());
  }

  @Test
  public void runExperimentOnData_oneFileIsRefused() {
    TubeScanSet scans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 1, 1.);
    try {
      experiment(GlobalReferenceSolverTest.options(1)).runExperimentOnData(scans);
    } catch (CalibrationConfigurationException e) {
      assertTrue(e.getIssues().containsKey("CalibrationRun"));
      return;
    }
    throw new AssertionError("Expected a configuration exception");
  }

  @Test(expected = CalibrationConfigurationException.class)
  public void runExperimentOnData_trimLeavesNoPixels() {
    TubeScanSet scans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1.);
    CalibrationOptions options = GlobalReferenceSolverTest.options(1);
    options.setPixelsToTrim(2);
    experiment(options).runExperimentOnData(scans);
  }

  @Test
  public void runExperimentOnData_longFileIsTruncated() {
    TubeScanSet scans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1., 3);
    GlobalEfficiencyExperiment experiment =
        experiment(GlobalReferenceSolverTest.options(1));
    experiment.runExperimentOnData(scans);
    assertEquals(1, experiment.getWarnings().size());
    assertTrue(experiment.getWarnings().get(0).contains("file1"));
    assertNotNull(experiment.getTable());
  }

  @Test(expected = IllegalArgumentException.class)
  public void runExperimentOnData_shortFileIsRefused() {
    TubeScanSet longScans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1.);
    TubeScanSet scans = new TubeScanSet("short", longScans.getFrames(), 5, 1.);
    experiment(GlobalReferenceSolverTest.options(1)).runExperimentOnData(scans);
  }

  @Test
  public void runExperimentOnData_priorConstantsAreApplied() {
    TubeScanSet scans =
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1.);
    double[] prior = new double[12];
    for (int tube = 0; tube < 3; ++tube) {
      for (int pixel = 0; pixel < 4; ++pixel) {
        prior[tube * 4 + pixel] = 1. / GlobalReferenceSolverTest.EFFICIENCIES[tube][pixel];
      }
    }
    CalibrationOptions options = GlobalReferenceSolverTest.options(1);
    options.setPriorConstants(prior);
    GlobalEfficiencyExperiment experiment = experiment(options);
    experiment.runExperimentOnData(scans);
    for (double value : experiment.getTable().getValues()) {
      assertEquals(1., value, 1E-9);
    }
    assertEquals(0., experiment.getChiSquaredHistory().get(0), 1E-18);
  }

  @Test
  public void hasEnoughData_needsTubeScans() {
    GlobalEfficiencyExperiment experiment = new GlobalEfficiencyExperiment();
    assertFalse(experiment.hasEnoughData(TestUtils.sequentialScan(new double[]{1.}, 4)));
    assertTrue(experiment.hasEnoughData(
        TestUtils.tubeScanSet(GlobalReferenceSolverTest.EFFICIENCIES, 4, 2, 1.)));
  }

}
