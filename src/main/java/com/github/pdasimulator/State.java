package com.github.pdasimulator;

import java.util.UUID;

import com.github.pdasimulator.PdaSimulatorException.Code;

/**
 * This object represents immutable metadata about an automaton state. Presentation concerns like
 * highlighting are not kept here, see {@link HighlightTracker}.
 */
public final class State {
  // auto-generated
  private final String id = UUID.randomUUID().toString();

  final static int maxStateNameLength = 20;
  private final String name;
  private final boolean start;
  private final boolean accepting;

  public State(final String name, final boolean start, final boolean accepting)
      throws PdaSimulatorException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxStateNameLength) {
      throw new PdaSimulatorException(Code.INVALID_STATE_NAME);
    }
    this.name = name.trim();
    this.start = start;
    this.accepting = accepting;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isStart() {
    return start;
  }

  public boolean isAccepting() {
    return accepting;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((id == null) ? 0 : id.hashCode());
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (id == null) {
      if (other.id != null) {
        return false;
      }
    } else if (!id.equals(other.id)) {
      return false;
    }
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", name=" + name + ", start=" + start + ", accepting=" + accepting
        + "]";
  }
}
