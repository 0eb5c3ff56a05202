package powder.efficiency.input;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a calibration run is configured with an invalid combination of options. All
 * problems found are collected so they can be reported together, keyed by option name.
 */
public class CalibrationConfigurationException extends RuntimeException {

  private final Map<String, String> issues;

  public CalibrationConfigurationException(Map<String, String> issues) {
    super(describe(issues));
    this.issues = Collections.unmodifiableMap(new LinkedHashMap<>(issues));
  }

  private static String describe(Map<String, String> issues) {
    StringBuilder sb = new StringBuilder("Invalid calibration configuration:");
    for (Map.Entry<String, String> issue : issues.entrySet()) {
      sb.append("\n  ").append(issue.getKey()).append(": ").append(issue.getValue());
    }
    return sb.toString();
  }

  /**
   * @return map from option name to description of the problem with it
   */
  public Map<String, String> getIssues() {
    return issues;
  }
}
