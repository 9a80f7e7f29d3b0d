package com.github.dfa;

/**
 * Classification a test input is expected to receive.
 */
public enum Expectation {
  ACCEPT,
  REJECT;

  public boolean matches(final boolean accepted) {
    return accepted == (this == ACCEPT);
  }
}
