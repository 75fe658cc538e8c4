package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the transition/operation to fire for a configuration.
 *
 * The policy is deterministic first-match: transitions leaving the current state are scanned in
 * declared order and, within each, operations in declared order. There is no branching and no
 * backtracking, the first operation whose guard holds wins.
 */
public final class TransitionSelector {
  private final PushdownAutomaton automaton;

  public TransitionSelector(final PushdownAutomaton automaton) {
    this.automaton = automaton;
  }

  /**
   * The first matching (transition, operation), or empty when nothing matches.
   */
  public Optional<TransitionMatch> select(final State currentState, final String currentSymbol,
      final PushdownStack stack) {
    for (final Transition transition : automaton.transitionsFrom(currentState)) {
      for (final Operation operation : transition.getOperations()) {
        if (matches(operation, currentSymbol, stack)) {
          return Optional.of(new TransitionMatch(transition, operation));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Every matching (transition, operation) in scan order; the head of this list is what
   * {@link #select(State, String, PushdownStack)} returns.
   */
  public List<TransitionMatch> candidates(final State currentState, final String currentSymbol,
      final PushdownStack stack) {
    final List<TransitionMatch> candidates = new ArrayList<>();
    for (final Transition transition : automaton.transitionsFrom(currentState)) {
      for (final Operation operation : transition.getOperations()) {
        if (matches(operation, currentSymbol, stack)) {
          candidates.add(new TransitionMatch(transition, operation));
        }
      }
    }
    return candidates;
  }

  /**
   * Guard predicate: the input symbol matches (or the operation consumes nothing) and the stack
   * top matches (or the operation pops nothing).
   */
  public static boolean matches(final Operation operation, final String inputSymbol,
      final PushdownStack stack) {
    final boolean inputMatch = Symbols.isEpsilon(operation.getInputTopSymbol())
        || operation.getInputTopSymbol().equals(inputSymbol);
    final Optional<String> top = stack.peek();
    final boolean stackMatch = Symbols.isEpsilon(operation.getStackPopSymbol())
        || (top.isPresent() && operation.getStackPopSymbol().equals(top.get()));
    return inputMatch && stackMatch;
  }
}
