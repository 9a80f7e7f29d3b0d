package com.github.dfa;

import com.github.dfa.AutomatonException.Code;

/**
 * This object represents an immutable automaton state. States are identified by a non-negative
 * integer and are never declared on their own; they exist because a transition mentions them.
 */
public final class State implements Comparable<State> {
  private final int id;

  private State(final int id) {
    this.id = id;
  }

  public static State of(final int id) throws AutomatonException {
    if (id < 0) {
      throw new AutomatonException(Code.INVALID_STATE,
          "State identifier must be non-negative but was " + id);
    }
    return new State(id);
  }

  public int getId() {
    return id;
  }

  @Override
  public int compareTo(final State other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
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
    return id == other.id;
  }

  @Override
  public String toString() {
    return String.valueOf(id);
  }
}
