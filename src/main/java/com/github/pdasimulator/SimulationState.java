package com.github.pdasimulator;

import java.util.List;

/**
 * Mutable cursor over a {@link PushdownAutomaton} for the duration of one run. Only the owning
 * {@link StepExecutor} mutates it, everybody else gets to read.
 *
 * Invariants:<br>
 * 1. currentInputIndex never decreases within a run and stays within [0, word length]<br>
 * 2. once finished, it stays finished until the next {@link #initialize(State, List)}<br>
 * 3. currentSymbol is word[currentInputIndex], or epsilon at the end of the word<br>
 */
public final class SimulationState {
  private State currentState;
  private int currentInputIndex;
  private String currentSymbol = Symbols.EPSILON;
  private boolean started;
  private boolean finished;
  private List<String> word;

  void initialize(final State startState, final List<String> word) {
    this.word = word;
    this.currentState = startState;
    this.currentInputIndex = 0;
    this.currentSymbol = symbolAt(0);
    this.finished = false;
    this.started = false;
  }

  void markStarted() {
    started = true;
  }

  void markFinished() {
    finished = true;
  }

  void moveTo(final State nextState) {
    currentState = nextState;
  }

  void advanceInput() {
    if (currentInputIndex < word.size()) {
      currentInputIndex++;
    }
    currentSymbol = symbolAt(currentInputIndex);
  }

  SimulationState copy() {
    final SimulationState copy = new SimulationState();
    copy.currentState = currentState;
    copy.currentInputIndex = currentInputIndex;
    copy.currentSymbol = currentSymbol;
    copy.started = started;
    copy.finished = finished;
    copy.word = word;
    return copy;
  }

  private String symbolAt(final int index) {
    return index < word.size() ? word.get(index) : Symbols.EPSILON;
  }

  public State getCurrentState() {
    return currentState;
  }

  public int getCurrentInputIndex() {
    return currentInputIndex;
  }

  public String getCurrentSymbol() {
    return currentSymbol;
  }

  public boolean isStarted() {
    return started;
  }

  public boolean isFinished() {
    return finished;
  }

  public boolean isInputConsumed() {
    return word != null && currentInputIndex == word.size();
  }

  @Override
  public String toString() {
    return "SimulationState [currentState=" + (currentState == null ? null : currentState.getName())
        + ", currentInputIndex=" + currentInputIndex + ", currentSymbol=" + currentSymbol
        + ", started=" + started + ", finished=" + finished + "]";
  }
}
