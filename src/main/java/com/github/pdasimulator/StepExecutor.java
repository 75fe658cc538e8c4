package com.github.pdasimulator;

import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies one simulation step at a time to a {@link SimulationState} and its
 * {@link PushdownStack}.
 *
 * A step activates the current state, asks the {@link TransitionSelector} for the operation to
 * fire, applies its stack effect, advances the input when the operation consumes a symbol and
 * moves to the destination state. When nothing fires, the termination policy decides between
 * acceptance (by final state, then by empty stack) and rejection, and the run is finished. There is
 * no distinction between a stuck configuration and a rejection.
 *
 * Timing free: pacing and cancellation belong to the driver.
 */
public final class StepExecutor {
  private static final Logger logger = LogManager.getLogger(StepExecutor.class.getSimpleName());

  private final String simulatorId;
  private final PushdownAutomaton automaton;
  private final TransitionSelector selector;
  private final SimulationState simulationState;
  private final PushdownStack stack;
  private final SimulationListener listener;
  // 0 means no ceiling
  private final long maxSteps;

  private String runId;
  private long moves;

  StepExecutor(final String simulatorId, final PushdownAutomaton automaton,
      final SimulationState simulationState, final PushdownStack stack,
      final SimulationListener listener, final long maxSteps) {
    this.simulatorId = simulatorId;
    this.automaton = automaton;
    this.selector = new TransitionSelector(automaton);
    this.simulationState = simulationState;
    this.stack = stack;
    this.listener = listener;
    this.maxSteps = maxSteps;
  }

  /**
   * Resets the stack to just the bottom marker and points the cursor at the start state and the
   * first input symbol. The run is left not started.
   */
  void initialize(final String runId) {
    this.runId = runId;
    this.moves = 0L;
    stack.reset();
    stack.push(Symbols.BOTTOM_MARKER);

    final Optional<State> flaggedStart = automaton.findStartState();
    final State startState;
    if (flaggedStart.isPresent()) {
      startState = flaggedStart.get();
    } else {
      // malformed definition, fall back to the first declared state
      startState = automaton.getStates().get(0);
      logWarning("No state is flagged as start, falling back to first declared state "
          + startState.getName());
    }
    simulationState.initialize(startState, automaton.getWordSymbols());
    logInfo(String.format("Simulation initialized. Start state: %s, Word: %s",
        startState.getName(), automaton.getWord()));
  }

  /**
   * Perform one step. Returns empty without touching anything if the run was not started or is
   * already finished.
   */
  Optional<StepOutcome> step() {
    if (!simulationState.isStarted() || simulationState.isFinished()) {
      return Optional.empty();
    }
    final State currentState = simulationState.getCurrentState();
    logDebug(String.format("Current state: %s, input symbol: %s, stack: %s",
        currentState.getName(), simulationState.getCurrentSymbol(), stack));

    emit(SimulationEvent.stateActivated(runId, currentState));

    final List<TransitionMatch> candidates =
        selector.candidates(currentState, simulationState.getCurrentSymbol(), stack);
    // the ceiling only cuts off moves, a halting configuration still gets its verdict
    if (!candidates.isEmpty() && maxSteps > 0L && moves >= maxSteps) {
      logWarning("Step limit of " + maxSteps + " reached, halting run");
      return Optional.of(halt(StepOutcome.rejected(StepOutcome.REASON_STEP_LIMIT)));
    }

    for (final TransitionMatch match : candidates) {
      final Transition transition = match.getTransition();
      final Operation operation = match.getOperation();
      if (!applyStackEffect(operation, stack)) {
        logWarning(String.format("Cannot pop %s, top of stack is %s. Skipping %s",
            operation.getStackPopSymbol(), stack.peek().orElse("empty"), operation));
        continue;
      }
      logDebug("Transition found: " + match + ", stack after: " + stack);
      if (operation.consumesInput()) {
        simulationState.advanceInput();
      }
      simulationState.moveTo(transition.getToState());
      moves++;

      final StepOutcome outcome = StepOutcome.moved(transition, operation);
      emit(SimulationEvent.transitionFired(runId, transition, operation));
      emit(SimulationEvent.stateActivated(runId, transition.getToState()));
      emit(SimulationEvent.stepCompleted(runId, outcome));
      return Optional.of(outcome);
    }

    return Optional.of(halt(evaluateTermination()));
  }

  /**
   * Acceptance by final state takes priority over acceptance by empty stack; either one suffices.
   */
  private StepOutcome evaluateTermination() {
    final boolean inputConsumed = simulationState.isInputConsumed();
    if (inputConsumed && simulationState.getCurrentState().isAccepting()) {
      return StepOutcome.accepted(StepOutcome.REASON_FINAL_STATE);
    }
    if (inputConsumed && (stack.isEmpty() || (stack.size() == 1
        && Symbols.BOTTOM_MARKER.equals(stack.peek().orElse(null))))) {
      return StepOutcome.accepted(StepOutcome.REASON_EMPTY_STACK);
    }
    return StepOutcome.rejected(StepOutcome.REASON_NO_TRANSITION);
  }

  private StepOutcome halt(final StepOutcome outcome) {
    simulationState.markFinished();
    if (outcome.isAccepted()) {
      logInfo("Accepted: " + outcome.getReason());
    } else {
      logInfo("Rejected: " + outcome.getReason());
    }
    emit(SimulationEvent.stepCompleted(runId, outcome));
    emit(outcome.isAccepted() ? SimulationEvent.runAccepted(runId, outcome.getReason())
        : SimulationEvent.runRejected(runId, outcome.getReason()));
    return outcome;
  }

  /**
   * Pops then pushes. The pop is re-checked against the stack top (a bottom-marker pop accepts any
   * top); on mismatch nothing is applied and false is returned. Pushed symbols go on left to right
   * and the bottom marker is only pushed when the stack does not already hold one.
   */
  static boolean applyStackEffect(final Operation operation, final PushdownStack stack) {
    final String popSymbol = operation.getStackPopSymbol();
    if (!Symbols.isEpsilon(popSymbol)) {
      final Optional<String> top = stack.peek();
      if (!top.isPresent()
          || !(top.get().equals(popSymbol) || Symbols.BOTTOM_MARKER.equals(popSymbol))) {
        return false;
      }
      stack.pop();
    }
    for (final String symbol : operation.pushSymbols()) {
      if (Symbols.BOTTOM_MARKER.equals(symbol)) {
        if (!stack.contains(Symbols.BOTTOM_MARKER)) {
          stack.push(symbol);
        }
      } else {
        stack.push(symbol);
      }
    }
    return true;
  }

  long getMoves() {
    return moves;
  }

  private void emit(final SimulationEvent event) {
    if (listener != null) {
      listener.onEvent(event);
    }
  }

  private void logWarning(final String message) {
    logger.warn(new StringBuilder().append("[s:").append(simulatorId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[s:").append(simulatorId).append("][r:").append(runId)
        .append("] ").append(message).toString());
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[s:").append(simulatorId).append("][r:")
          .append(runId).append("] ").append(message).toString());
    }
  }
}
