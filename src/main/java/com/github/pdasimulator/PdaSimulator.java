package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A deterministic pushdown automaton simulator. Given a {@link PushdownAutomaton} and its input
 * word, it walks the automaton one step at a time, committing to the first transition (in
 * declared order) whose guard matches, until the run is accepted, rejected or stopped.
 *
 * Notes for users:<br>
 * 1. this simulator instance is thread-safe, but it drives one run at a time. Create as many
 * simulators as there are concurrent runs<br>
 *
 * 2. lifecycle: NOT_STARTED -> RUNNING -> FINISHED, with STOPPED reachable from RUNNING via
 * {@link #stop()}. {@link #start()} may be called again from FINISHED or STOPPED, it implicitly
 * resets. {@link #reset()} is valid from any phase<br>
 *
 * 3. there is no backtracking and no exploration of alternative branches, so this is not a general
 * non-deterministic PDA acceptor<br>
 *
 * 4. nothing in an automaton run raises an exception. Rejections and stuck configurations are
 * reported as {@link StepOutcome}s and observation events. Exceptions are reserved for lock
 * timeouts and interrupts<br>
 *
 * 5. an automaton that loops on epsilon moves forever will never halt unless
 * {@link SimulatorConfiguration#getMaxSteps()} is set<br>
 *
 * 6. this is a skeleton interface, it exists purely as a header file for easier demonstration of
 * the simulator's functionality<br>
 */
public interface PdaSimulator {

  ///// Run lifecycle API /////
  /**
   * Initialize a new run and enter RUNNING. Depending on the {@link RunMode}, the step loop is then
   * driven manually, on the caller thread (this call returns once the run has halted) or on a
   * daemon thread.
   *
   * Returns false iff a run is already in progress.
   */
  boolean start() throws PdaSimulatorException;

  /**
   * Cancel the current run. The stack is cleared and the phase becomes STOPPED. An automatic step
   * loop honors this before its next step.
   *
   * Returns false iff no run is in progress.
   */
  boolean stop() throws PdaSimulatorException;

  /**
   * Re-initialize the simulation state and the stack and go back to NOT_STARTED.
   */
  boolean reset() throws PdaSimulatorException;

  /**
   * Perform exactly one step of the current run. Returns empty if no run is in progress.
   */
  Optional<StepOutcome> step() throws PdaSimulatorException;

  /**
   * Block until the current run has halted or the timeout expired. Returns true iff the run is no
   * longer RUNNING.
   */
  boolean awaitCompletion(final long timeoutMillis) throws PdaSimulatorException;


  ///// Observation API /////
  /**
   * Report the current lifecycle phase.
   */
  SimulationPhase getPhase();

  /**
   * Read a copy of the simulation cursor: current state, input position and flags.
   */
  SimulationState readSimulationState() throws PdaSimulatorException;

  /**
   * Read the stack contents ordered bottom-to-top.
   */
  List<String> readStack() throws PdaSimulatorException;

  /**
   * The accept/reject outcome of the current run, once it has finished.
   */
  Optional<StepOutcome> getVerdict();

  void addListener(final SimulationListener listener);

  void removeListener(final SimulationListener listener);


  ///// Non-run specific functions /////
  /**
   * Reports the id of this simulator instance.
   */
  String getId();

  PushdownAutomaton getAutomaton();

  /**
   * Returns the config that this simulator is wired with.
   */
  SimulatorConfiguration getConfiguration();

  /**
   * Report statistics for this simulator.
   */
  SimulationStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build simulators.
   */
  public final static class PdaSimulatorBuilder {
    private SimulatorConfiguration config;
    private PushdownAutomaton automaton;
    private final List<SimulationListener> listeners = new ArrayList<>();

    public static PdaSimulatorBuilder newBuilder() {
      return new PdaSimulatorBuilder();
    }

    public PdaSimulatorBuilder config(final SimulatorConfiguration config) {
      this.config = config;
      return this;
    }

    public PdaSimulatorBuilder automaton(final PushdownAutomaton automaton) {
      this.automaton = automaton;
      return this;
    }

    public PdaSimulatorBuilder listener(final SimulationListener listener) {
      this.listeners.add(listener);
      return this;
    }

    public PdaSimulator build() throws PdaSimulatorException {
      return new PdaSimulatorImpl(config, automaton, listeners);
    }

    private PdaSimulatorBuilder() {}
  }

}
