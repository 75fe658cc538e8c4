package com.github.pdasimulator;

/**
 * This object encapsulates the result of one simulation step.
 *
 * A step either moves the automaton along a transition ({@link Kind#MOVED}, carrying the fired
 * transition and operation) or halts the run with a verdict ({@link Kind#ACCEPTED} or
 * {@link Kind#REJECTED}, carrying a reason). A halted run with no applicable transition and no
 * acceptance condition is a plain rejection, not an error.
 */
public final class StepOutcome {
  public static final String REASON_FINAL_STATE = "final state";
  public static final String REASON_EMPTY_STACK = "empty stack";
  public static final String REASON_NO_TRANSITION =
      "no applicable transition, or end conditions unmet";
  public static final String REASON_STEP_LIMIT = "step limit reached";

  private final Kind kind;
  private final Transition transition;
  private final Operation operation;
  private final String reason;

  public static StepOutcome moved(final Transition transition, final Operation operation) {
    return new StepOutcome(Kind.MOVED, transition, operation, null);
  }

  public static StepOutcome accepted(final String reason) {
    return new StepOutcome(Kind.ACCEPTED, null, null, reason);
  }

  public static StepOutcome rejected(final String reason) {
    return new StepOutcome(Kind.REJECTED, null, null, reason);
  }

  public Kind getKind() {
    return kind;
  }

  public Transition getTransition() {
    return transition;
  }

  public Operation getOperation() {
    return operation;
  }

  public String getReason() {
    return reason;
  }

  public boolean isTerminal() {
    return kind != Kind.MOVED;
  }

  public boolean isAccepted() {
    return kind == Kind.ACCEPTED;
  }

  @Override
  public String toString() {
    if (kind == Kind.MOVED) {
      return "StepOutcome [kind=" + kind + ", transition=" + transition.getFromState().getName()
          + "->" + transition.getToState().getName() + ", operation=" + operation + "]";
    }
    return "StepOutcome [kind=" + kind + ", reason=" + reason + "]";
  }

  public static enum Kind {
    MOVED, ACCEPTED, REJECTED;
  }

  private StepOutcome(final Kind kind, final Transition transition, final Operation operation,
      final String reason) {
    this.kind = kind;
    this.transition = transition;
    this.operation = operation;
    this.reason = reason;
  }
}
