package com.github.pdasimulator;

/**
 * Observation event emitted by the simulator to its {@link SimulationListener}s. Entities are
 * referenced by their stable ids so that observers can keep their own presentation state keyed by
 * id without the core ever carrying it.
 */
public final class SimulationEvent {
  private final Kind kind;
  private final String runId;
  private final String stateId;
  private final String transitionId;
  private final String operationId;
  private final StepOutcome outcome;
  private final String reason;

  static SimulationEvent runStarted(final String runId) {
    return new SimulationEvent(Kind.RUN_STARTED, runId, null, null, null, null, null);
  }

  static SimulationEvent stateActivated(final String runId, final State state) {
    return new SimulationEvent(Kind.STATE_ACTIVATED, runId, state.getId(), null, null, null, null);
  }

  static SimulationEvent transitionFired(final String runId, final Transition transition,
      final Operation operation) {
    return new SimulationEvent(Kind.TRANSITION_FIRED, runId, null, transition.getId(),
        operation.getId(), null, null);
  }

  static SimulationEvent stepCompleted(final String runId, final StepOutcome outcome) {
    return new SimulationEvent(Kind.STEP_COMPLETED, runId, null, null, null, outcome, null);
  }

  static SimulationEvent runAccepted(final String runId, final String reason) {
    return new SimulationEvent(Kind.RUN_ACCEPTED, runId, null, null, null, null, reason);
  }

  static SimulationEvent runRejected(final String runId, final String reason) {
    return new SimulationEvent(Kind.RUN_REJECTED, runId, null, null, null, null, reason);
  }

  static SimulationEvent runStopped(final String runId) {
    return new SimulationEvent(Kind.RUN_STOPPED, runId, null, null, null, null, null);
  }

  static SimulationEvent runReset(final String runId) {
    return new SimulationEvent(Kind.RUN_RESET, runId, null, null, null, null, null);
  }

  public Kind getKind() {
    return kind;
  }

  public String getRunId() {
    return runId;
  }

  public String getStateId() {
    return stateId;
  }

  public String getTransitionId() {
    return transitionId;
  }

  public String getOperationId() {
    return operationId;
  }

  public StepOutcome getOutcome() {
    return outcome;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return "SimulationEvent [kind=" + kind + ", runId=" + runId + ", stateId=" + stateId
        + ", transitionId=" + transitionId + ", operationId=" + operationId + ", outcome="
        + outcome + ", reason=" + reason + "]";
  }

  public static enum Kind {
    // a new run was initialized and entered RUNNING
    RUN_STARTED,
    // the current state is being evaluated
    STATE_ACTIVATED,
    // a transition fired with the given operation
    TRANSITION_FIRED,
    // one step finished, carries its outcome
    STEP_COMPLETED,
    // verdicts
    RUN_ACCEPTED, RUN_REJECTED,
    // external cancellation, not a verdict
    RUN_STOPPED,
    // simulation state was re-initialized
    RUN_RESET;
  }

  private SimulationEvent(final Kind kind, final String runId, final String stateId,
      final String transitionId, final String operationId, final StepOutcome outcome,
      final String reason) {
    this.kind = kind;
    this.runId = runId;
    this.stateId = stateId;
    this.transitionId = transitionId;
    this.operationId = operationId;
    this.outcome = outcome;
    this.reason = reason;
  }
}
