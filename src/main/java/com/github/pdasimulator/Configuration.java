package com.github.pdasimulator;

import java.util.List;

/**
 * Snapshot of (current state, input position, stack contents) at some instant of a run. The stack
 * is ordered bottom-to-top.
 */
public final class Configuration {
  private final String stateId;
  private final String stateName;
  private final int inputIndex;
  private final List<String> stack;

  Configuration(final State state, final int inputIndex, final List<String> stack) {
    this.stateId = state.getId();
    this.stateName = state.getName();
    this.inputIndex = inputIndex;
    this.stack = stack;
  }

  public String getStateId() {
    return stateId;
  }

  public String getStateName() {
    return stateName;
  }

  public int getInputIndex() {
    return inputIndex;
  }

  public List<String> getStack() {
    return stack;
  }

  @Override
  public String toString() {
    return "(" + stateName + ", " + inputIndex + ", " + stack + ")";
  }
}
