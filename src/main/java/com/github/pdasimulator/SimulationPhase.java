package com.github.pdasimulator;

/**
 * Lifecycle phase of a simulator. STOPPED is a cancellation, not a verdict.
 */
public enum SimulationPhase {
  NOT_STARTED,
  RUNNING,
  // halted with an accept or reject verdict
  FINISHED,
  // cancelled externally while running
  STOPPED;
}
