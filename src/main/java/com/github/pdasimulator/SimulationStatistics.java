package com.github.pdasimulator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Holder of statistics for a simulator across its runs, plus a bounded trace of the configurations
 * visited by the current run.
 */
public final class SimulationStatistics {
  final static int maxTraceLength = 100;

  private final String simulatorId;
  private final long startTstampMillis = System.currentTimeMillis();
  private int runsStarted;
  private int runsAccepted;
  private int runsRejected;
  private int runsStopped;
  private String currentRunId;
  private int stepsInRun;
  private int movesInRun;
  // bounded at maxTraceLength, oldest entries get dropped
  private final Deque<Configuration> boundedTrace = new ArrayDeque<>();

  SimulationStatistics(final String simulatorId) {
    this.simulatorId = simulatorId;
  }

  synchronized void runStarted(final String runId) {
    runsStarted++;
    currentRunId = runId;
    stepsInRun = 0;
    movesInRun = 0;
    boundedTrace.clear();
  }

  synchronized void runReset() {
    stepsInRun = 0;
    movesInRun = 0;
    boundedTrace.clear();
  }

  synchronized void stepped(final StepOutcome outcome) {
    stepsInRun++;
    switch (outcome.getKind()) {
      case MOVED:
        movesInRun++;
        break;
      case ACCEPTED:
        runsAccepted++;
        break;
      case REJECTED:
        runsRejected++;
        break;
      default:
        break;
    }
  }

  synchronized void runStopped() {
    runsStopped++;
  }

  synchronized void record(final Configuration configuration) {
    if (boundedTrace.size() >= maxTraceLength) {
      boundedTrace.pollFirst();
    }
    boundedTrace.addLast(configuration);
  }

  public String getSimulatorId() {
    return simulatorId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public synchronized int getRunsStarted() {
    return runsStarted;
  }

  public synchronized int getRunsAccepted() {
    return runsAccepted;
  }

  public synchronized int getRunsRejected() {
    return runsRejected;
  }

  public synchronized int getRunsStopped() {
    return runsStopped;
  }

  public synchronized String getCurrentRunId() {
    return currentRunId;
  }

  public synchronized int getStepsInRun() {
    return stepsInRun;
  }

  public synchronized int getMovesInRun() {
    return movesInRun;
  }

  /**
   * Configurations of the current run, oldest first: the initial one followed by one per move.
   */
  public synchronized List<Configuration> getConfigurationTrace() {
    return Collections.unmodifiableList(new ArrayList<>(boundedTrace));
  }

  @Override
  public synchronized String toString() {
    return "SimulationStatistics [simulatorId=" + simulatorId + ", startTstampMillis="
        + startTstampMillis + ", runsStarted=" + runsStarted + ", runsAccepted=" + runsAccepted
        + ", runsRejected=" + runsRejected + ", runsStopped=" + runsStopped + ", currentRunId="
        + currentRunId + ", stepsInRun=" + stepsInRun + ", movesInRun=" + movesInRun + "]";
  }

}
