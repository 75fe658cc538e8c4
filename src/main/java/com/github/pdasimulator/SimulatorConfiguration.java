package com.github.pdasimulator;

/**
 * This class encapsulates all the configuration parameters for the simulator. Use the
 * {@code SimulatorConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. stepDelayMillis only paces the automatic step loop for observers, it has no bearing on the
 * verdict. Zero is fine for headless runs.<br>
 * 2. maxSteps puts a ceiling on the number of moves in a run. If this is not set (0), runs are
 * unbounded and an automaton with an epsilon self-loop will never halt.<br>
 */
public final class SimulatorConfiguration {
  private final RunMode runMode;
  private final long stepDelayMillis;
  private final long maxSteps;

  public RunMode getRunMode() {
    return runMode;
  }

  public long getStepDelayMillis() {
    return stepDelayMillis;
  }

  public long getMaxSteps() {
    return maxSteps;
  }

  public final static class SimulatorConfigurationBuilder {
    private RunMode runMode;
    private long stepDelayMillis;
    private long maxSteps;

    public static SimulatorConfigurationBuilder newBuilder() {
      return new SimulatorConfigurationBuilder();
    }

    public SimulatorConfigurationBuilder runMode(final RunMode runMode) {
      this.runMode = runMode;
      return this;
    }

    public SimulatorConfigurationBuilder stepDelayMillis(long stepDelayMillis) {
      this.stepDelayMillis = stepDelayMillis;
      return this;
    }

    public SimulatorConfigurationBuilder maxSteps(long maxSteps) {
      this.maxSteps = maxSteps;
      return this;
    }

    public SimulatorConfiguration build() throws PdaSimulatorException {
      final SimulatorConfiguration config =
          new SimulatorConfiguration(runMode, stepDelayMillis, maxSteps);
      config.validate();
      return config;
    }

    private SimulatorConfigurationBuilder() {}
  }

  private void validate() throws PdaSimulatorException {
    StringBuilder messages = new StringBuilder();
    if (runMode == null) {
      messages.append("RunMode cannot be null. ");
    }
    if (stepDelayMillis < 0L) {
      messages.append("stepDelayMillis cannot be negative. ");
    }
    if (maxSteps < 0L) {
      messages.append("maxSteps cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new PdaSimulatorException(PdaSimulatorException.Code.INVALID_SIMULATOR_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "SimulatorConfiguration [runMode=" + runMode + ", stepDelayMillis=" + stepDelayMillis
        + ", maxSteps=" + maxSteps + "]";
  }

  private SimulatorConfiguration(final RunMode runMode, final long stepDelayMillis,
      final long maxSteps) {
    this.runMode = runMode;
    this.stepDelayMillis = stepDelayMillis;
    this.maxSteps = maxSteps;
  }

}
