package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.github.pdasimulator.PdaSimulatorException.Code;

/**
 * A directed edge fromState->toState owning an ordered list of {@link Operation}s. Operations are
 * evaluated in the order they were handed in. A transition without operations can never fire.
 */
public final class Transition {
  private final String id = UUID.randomUUID().toString();
  private final State fromState;
  private final State toState;
  private final List<Operation> operations;

  public Transition(final State fromState, final State toState, final List<Operation> operations)
      throws PdaSimulatorException {
    if (fromState == null || toState == null) {
      throw new PdaSimulatorException(Code.INVALID_STATE);
    }
    if (operations == null || operations.contains(null)) {
      throw new PdaSimulatorException(Code.INVALID_OPERATION,
          "Operations of transition " + fromState.getName() + "->" + toState.getName()
              + " cannot be null");
    }
    this.fromState = fromState;
    this.toState = toState;
    this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
  }

  public Transition(final State fromState, final State toState, final Operation... operations)
      throws PdaSimulatorException {
    this(fromState, toState, operations == null ? null : Arrays.asList(operations));
  }

  public String getId() {
    return id;
  }

  public State getFromState() {
    return fromState;
  }

  public State getToState() {
    return toState;
  }

  public List<Operation> getOperations() {
    return operations;
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", fromState=" + fromState.getName() + ", toState="
        + toState.getName() + ", operations=" + operations + "]";
  }
}
