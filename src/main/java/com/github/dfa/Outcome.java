package com.github.dfa;

/**
 * This represents how a simulation run ended.
 */
public enum Outcome {
  // input exhausted in a final state
  ACCEPTED,
  // input exhausted in a non-final state
  REJECTED_NOT_FINAL,
  // a symbol outside the alphabet was read, independent of the current state
  REJECTED_UNKNOWN_SYMBOL,
  // the transition table has no edge for the current state and symbol
  REJECTED_NO_TRANSITION;

  public boolean isAccepted() {
    return this == ACCEPTED;
  }
}
