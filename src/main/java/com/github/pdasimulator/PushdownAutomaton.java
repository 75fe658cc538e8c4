package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.pdasimulator.PdaSimulatorException.Code;

/**
 * Immutable definition of a pushdown automaton together with the input word to run it on. Use the
 * {@code PushdownAutomatonBuilder} to build it.
 *
 * Declaration order matters: transitions are scanned in the order they were added and, when no
 * state is flagged as start, the first declared state is used.
 */
public final class PushdownAutomaton {
  private final List<State> states;
  private final List<Transition> transitions;
  private final String word;
  private final List<String> wordSymbols;

  public List<State> getStates() {
    return states;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public String getWord() {
    return word;
  }

  /**
   * The word split into its individual input symbols.
   */
  public List<String> getWordSymbols() {
    return wordSymbols;
  }

  public int getWordLength() {
    return wordSymbols.size();
  }

  /**
   * Transitions leaving the given state, in declared order.
   */
  public List<Transition> transitionsFrom(final State state) {
    final List<Transition> outgoing = new ArrayList<>();
    for (final Transition transition : transitions) {
      if (transition.getFromState().equals(state)) {
        outgoing.add(transition);
      }
    }
    return outgoing;
  }

  /**
   * The first state flagged as start, if any.
   */
  public Optional<State> findStartState() {
    for (final State state : states) {
      if (state.isStart()) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  /**
   * Same states and transitions, different input word.
   */
  public PushdownAutomaton withWord(final String word) {
    return new PushdownAutomaton(states, transitions, word);
  }

  public final static class PushdownAutomatonBuilder {
    private final List<State> states = new ArrayList<>();
    private final List<Transition> transitions = new ArrayList<>();
    private String word = "";

    public static PushdownAutomatonBuilder newBuilder() {
      return new PushdownAutomatonBuilder();
    }

    public PushdownAutomatonBuilder state(final State state) {
      this.states.add(state);
      return this;
    }

    public PushdownAutomatonBuilder states(final State... states) {
      for (State state : states) {
        this.states.add(state);
      }
      return this;
    }

    public PushdownAutomatonBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public PushdownAutomatonBuilder word(final String word) {
      this.word = word;
      return this;
    }

    public PushdownAutomaton build() throws PdaSimulatorException {
      validate(states, transitions);
      return new PushdownAutomaton(states, transitions, word);
    }

    private PushdownAutomatonBuilder() {}
  }

  private static void validate(final List<State> states, final List<Transition> transitions)
      throws PdaSimulatorException {
    if (states.isEmpty()) {
      throw new PdaSimulatorException(Code.INVALID_AUTOMATON);
    }
    final Set<State> known = new HashSet<>();
    for (final State state : states) {
      if (state == null) {
        throw new PdaSimulatorException(Code.INVALID_STATE);
      }
      known.add(state);
    }
    for (final Transition transition : transitions) {
      if (transition == null) {
        throw new PdaSimulatorException(Code.ILLEGAL_TRANSITION, "Null transition is invalid");
      }
      if (!known.contains(transition.getFromState()) || !known.contains(transition.getToState())) {
        throw new PdaSimulatorException(Code.ILLEGAL_TRANSITION,
            "Transition " + transition.getFromState().getName() + "->"
                + transition.getToState().getName() + " references an unknown state");
      }
    }
  }

  @Override
  public String toString() {
    return "PushdownAutomaton [states=" + states.size() + ", transitions=" + transitions.size()
        + ", word=" + word + "]";
  }

  private PushdownAutomaton(final List<State> states, final List<Transition> transitions,
      final String word) {
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.word = word == null ? "" : word;
    this.wordSymbols = Collections.unmodifiableList(Symbols.split(this.word));
  }
}
