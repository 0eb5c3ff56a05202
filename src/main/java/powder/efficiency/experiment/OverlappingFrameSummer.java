package powder.efficiency.experiment;

import java.util.List;
import powder.efficiency.input.ScanFrame;

/**
 * Combines overlapping scan files of a tube detector into one reference on a common angular
 * grid.
 */
public interface OverlappingFrameSummer {

  /**
   * @param frames Scan files, all of the same shape
   * @param scanStep Angular step between scan points (degrees)
   * @return summed response, one row per pixel height in the tube
   */
  ReferenceSurface sum(List<ScanFrame> frames, double scanStep);

}
