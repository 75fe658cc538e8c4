package com.github.pdasimulator;

import java.util.Objects;

/**
 * A (transition, operation) couple whose guard holds for the current configuration.
 */
public final class TransitionMatch {
  private final Transition transition;
  private final Operation operation;

  TransitionMatch(final Transition transition, final Operation operation) {
    this.transition = transition;
    this.operation = operation;
  }

  public Transition getTransition() {
    return transition;
  }

  public Operation getOperation() {
    return operation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionMatch)) {
      return false;
    }
    TransitionMatch other = (TransitionMatch) o;
    return Objects.equals(transition, other.transition)
        && Objects.equals(operation, other.operation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(transition, operation);
  }

  @Override
  public String toString() {
    return "TransitionMatch [" + transition.getFromState().getName() + "->"
        + transition.getToState().getName() + ", " + operation + "]";
  }
}
