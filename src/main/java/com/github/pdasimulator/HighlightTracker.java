package com.github.pdasimulator;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observer-side presentation state, keyed by entity id and derived purely from the event stream.
 * A rendering layer can query this instead of keeping flags on states, transitions and operations.
 *
 * States and transitions stay highlighted once visited, operations stay marked once fired. All of
 * it is cleared when a run starts, stops or is reset.
 */
public final class HighlightTracker implements SimulationListener {
  private final Set<String> highlightedStates = ConcurrentHashMap.newKeySet();
  private final Set<String> highlightedTransitions = ConcurrentHashMap.newKeySet();
  private final Set<String> correctOperations = ConcurrentHashMap.newKeySet();
  private volatile String activeStateId;
  private volatile StepOutcome verdict;

  @Override
  public void onEvent(final SimulationEvent event) {
    switch (event.getKind()) {
      case RUN_STARTED:
      case RUN_STOPPED:
      case RUN_RESET:
        clear();
        break;
      case STATE_ACTIVATED:
        activeStateId = event.getStateId();
        highlightedStates.add(event.getStateId());
        break;
      case TRANSITION_FIRED:
        highlightedTransitions.add(event.getTransitionId());
        correctOperations.add(event.getOperationId());
        break;
      case STEP_COMPLETED:
        if (event.getOutcome().isTerminal()) {
          verdict = event.getOutcome();
        }
        break;
      default:
        break;
    }
  }

  public boolean isHighlighted(final State state) {
    return highlightedStates.contains(state.getId());
  }

  public boolean isHighlighted(final Transition transition) {
    return highlightedTransitions.contains(transition.getId());
  }

  public boolean isCorrect(final Operation operation) {
    return correctOperations.contains(operation.getId());
  }

  public boolean isActive(final State state) {
    return state.getId().equals(activeStateId);
  }

  public Set<String> getHighlightedStateIds() {
    return Collections.unmodifiableSet(highlightedStates);
  }

  public Set<String> getHighlightedTransitionIds() {
    return Collections.unmodifiableSet(highlightedTransitions);
  }

  /**
   * Terminal outcome of the last run, null while running or after a clear.
   */
  public StepOutcome getVerdict() {
    return verdict;
  }

  private void clear() {
    highlightedStates.clear();
    highlightedTransitions.clear();
    correctOperations.clear();
    activeStateId = null;
    verdict = null;
  }
}
