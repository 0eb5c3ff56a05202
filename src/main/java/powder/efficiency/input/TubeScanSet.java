package powder.efficiency.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Set of overlapping scan files of a tube detector, as used by the global method. Each file is
 * one {@link ScanFrame}; consecutive files are expected to be offset by one standard scan (the
 * angular distance between neighbouring tubes), so that every tube overlaps its neighbours.
 */
public class TubeScanSet implements ScanDataset {

  private final String name;
  private final List<ScanFrame> frames;
  private final int scansPerFile;
  private final double scanStep;

  /**
   * @param name Name of the set (e.g., first and last run numbers)
   * @param frames One frame per scan file, in scan order
   * @param scansPerFile Number of scan points in a standard scan file
   * @param scanStep Angular step between two consecutive scan points (degrees)
   */
  public TubeScanSet(String name, List<ScanFrame> frames, int scansPerFile, double scanStep) {
    if (scansPerFile < 1) {
      throw new IllegalArgumentException("Scans per file must be positive, got " + scansPerFile);
    }
    if (!(scanStep > 0.)) {
      throw new IllegalArgumentException("Scan step must be positive, got " + scanStep);
    }
    if (!frames.isEmpty()) {
      ScanFrame first = frames.get(0);
      for (ScanFrame frame : frames) {
        if (frame.getNumberOfTubes() != first.getNumberOfTubes()
            || frame.getPixelsPerTube() != first.getPixelsPerTube()) {
          throw new IllegalArgumentException("Scan file " + frame.getName() + " has "
              + frame.getNumberOfTubes() + "x" + frame.getPixelsPerTube() + " pixels, expected "
              + first.getNumberOfTubes() + "x" + first.getPixelsPerTube());
        }
      }
    }
    this.name = name;
    this.frames = new ArrayList<>(frames);
    this.scansPerFile = scansPerFile;
    this.scanStep = scanStep;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public int getNumberOfScanFiles() {
    return frames.size();
  }

  public List<ScanFrame> getFrames() {
    return Collections.unmodifiableList(frames);
  }

  public int getNumberOfTubes() {
    return frames.isEmpty() ? 0 : frames.get(0).getNumberOfTubes();
  }

  public int getPixelsPerTube() {
    return frames.isEmpty() ? 0 : frames.get(0).getPixelsPerTube();
  }

  public int getScansPerFile() {
    return scansPerFile;
  }

  /**
   * @return total number of scan points a tube sees over all files
   */
  public int getScanPoints() {
    return scansPerFile * frames.size();
  }

  public double getScanStep() {
    return scanStep;
  }

}
