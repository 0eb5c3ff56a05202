package powder.efficiency.experiment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import powder.efficiency.input.CalibrationMethod;
import powder.efficiency.input.CalibrationOptions;
import powder.efficiency.input.PixelResponseCurve;
import powder.efficiency.input.TubeScanSet;
import powder.efficiency.test.TestUtils;

public class GlobalReferenceSolverTest {

  static final double[][] EFFICIENCIES = {
      {1.0, 1.05, 1.1, 1.15},
      {1.2, 1.26, 1.32, 1.38},
      {0.8, 0.84, 0.88, 0.92}};

  static CalibrationOptions options(int iterations) {
    CalibrationOptions options = new CalibrationOptions();
    options.setDerivationMethod(DerivationMethod.GLOBAL_2D);
    options.setMethod(CalibrationMethod.MEDIAN);
    options.setNumberOfIterations(iterations);
    options.setPixelsToTrim(1);
    options.setParallelTubes(false);
    return options;
  }

  private static GlobalReferenceSolver solver(CalibrationOptions options) {
    return new GlobalReferenceSolver(new RatioStatistics(options.getMethod()),
        new AngularBinSummer(), options);
  }

  @Test
  public void chiSquaredPerDegreeOfFreedom_skipsTrimmedPixels() {
    double[][] current = {{5., 1.1, 0.9, 5.}, {-3., 1., 1.2, 7.}};
    assertEquals((0.01 + 0.01 + 0. + 0.04) / 4.,
        GlobalReferenceSolver.chiSquaredPerDegreeOfFreedom(current, 1), 1E-15);
  }

  @Test
  public void stackTube_mergesFilesByAngle() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    PixelResponseCurve[] stacked = GlobalReferenceSolver.stackTube(scans.getFrames(), 0);
    assertEquals(4, stacked.length);
    assertEquals(8, stacked[2].size());
    assertEquals(8., stacked[2].getAngle(0), 0.);
    assertEquals(15., stacked[2].getAngle(7), 0.);
    assertEquals(1.1 * (TestUtils.pattern(15.) + 2.), stacked[2].getIntensity(7), 1E-10);
  }

  @Test
  public void solve_runsFixedNumberOfIterations() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    GlobalReferenceSolver solver = solver(options(3));
    RunContext context = new RunContext(12);
    solver.solve(scans, context);
    assertEquals(3, solver.getIterationsRun());
    assertEquals(3, solver.getChiSquaredHistory().size());
    assertTrue(solver.getChiSquaredHistory().get(2) < solver.getChiSquaredHistory().get(0));
    assertNull(context.getResponseSurface());
  }

  @Test
  public void solve_equalisesTubesPixelByPixel() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    RunContext context = new RunContext(12);
    solver(options(10)).solve(scans, context);
    double[] constants = context.getConstants();
    for (int pixel = 0; pixel < 4; ++pixel) {
      double first = constants[pixel] * EFFICIENCIES[0][pixel];
      for (int tube = 1; tube < 3; ++tube) {
        double product = constants[tube * 4 + pixel] * EFFICIENCIES[tube][pixel];
        assertEquals(1., product / first, 1E-3);
      }
    }
    for (boolean live : context.getLivePixels()) {
      assertTrue(live);
    }
  }

  @Test
  public void solve_autoStopsBelowThreshold() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    CalibrationOptions options = options(CalibrationOptions.AUTO_ITERATIONS);
    options.setChiSquaredThreshold(1E-4);
    GlobalReferenceSolver solver = solver(options);
    RunContext context = new RunContext(12);
    solver.solve(scans, context);
    assertEquals(3, solver.getIterationsRun());
    assertTrue(solver.getChiSquaredHistory().get(2) <= 1E-4);
    assertTrue(context.getWarnings().isEmpty());
  }

  @Test
  public void solve_autoStopsAtCap() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    CalibrationOptions options = options(CalibrationOptions.AUTO_ITERATIONS);
    options.setChiSquaredThreshold(1E-30);
    options.setMaximumAutoIterations(4);
    GlobalReferenceSolver solver = solver(options);
    RunContext context = new RunContext(12);
    solver.solve(scans, context);
    assertEquals(4, solver.getIterationsRun());
    assertEquals(1, context.getWarnings().size());
  }

  @Test
  public void solve_parallelMatchesSequential() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    RunContext sequential = new RunContext(12);
    solver(options(2)).solve(scans, sequential);
    CalibrationOptions parallelOptions = options(2);
    parallelOptions.setParallelTubes(true);
    RunContext parallel = new RunContext(12);
    solver(parallelOptions).solve(scans, parallel);
    assertArrayEquals(sequential.getConstants(), parallel.getConstants(), 0.);
  }

  @Test
  public void solve_buildsResponseSurface() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    CalibrationOptions options = options(1);
    options.setOutputResponse(true);
    RunContext context = new RunContext(12);
    solver(options).solve(scans, context);
    ReferenceSurface surface = context.getResponseSurface();
    assertNotNull(surface);
    assertEquals(4, surface.getNumberOfRows());
    assertEquals(16, surface.getNumberOfBins());
  }

  @Test(expected = IllegalStateException.class)
  public void solve_referenceTooNarrow() {
    TubeScanSet scans = TestUtils.tubeScanSet(EFFICIENCIES, 4, 2, 1.);
    CalibrationOptions options = options(1);
    OverlappingFrameSummer narrow = (frames, step) -> new ReferenceSurface(new double[]{0.},
        new double[][]{{1.}, {1.}, {1.}, {1.}}, new double[][]{{1.}, {1.}, {1.}, {1.}});
    new GlobalReferenceSolver(new RatioStatistics(CalibrationMethod.MEDIAN), narrow, options)
        .solve(scans, new RunContext(12));
  }

}
