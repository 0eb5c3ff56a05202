package powder.efficiency.experiment;

/**
 * Enumerated type defining each way of deriving efficiency constants, and creating the
 * associated experiment.
 */
public enum DerivationMethod {

  /**
   * One-dimensional detector: a reference curve is grown pixel by pixel
   */
  SEQUENTIAL_1D("SequentialSummedReference1D") {
    @Override
    public EfficiencyExperiment createExperiment() {
      return new SequentialEfficiencyExperiment();
    }
  },
  /**
   * Tube detector: a global reference is rebuilt from all scan files each iteration
   */
  GLOBAL_2D("GlobalSummedReference2D") {
    @Override
    public EfficiencyExperiment createExperiment() {
      return new GlobalEfficiencyExperiment();
    }
  };

  private final String name;

  DerivationMethod(String name) {
    this.name = name;
  }

  /**
   * Look up a method by its option name, ignoring case
   *
   * @param name Name such as "SequentialSummedReference1D"
   * @return matching method
   * @throws IllegalArgumentException if no method has that name
   */
  public static DerivationMethod fromName(String name) {
    for (DerivationMethod method : values()) {
      if (method.name.equalsIgnoreCase(name)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown derivation method: " + name);
  }

  public abstract EfficiencyExperiment createExperiment();

  public String getName() {
    return name;
  }

}
