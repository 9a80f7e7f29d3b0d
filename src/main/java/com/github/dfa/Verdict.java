package com.github.dfa;

/**
 * This object encapsulates the result of running one test input through an automaton: the literal
 * input line, what it was expected to do, what it actually did, and whether those agree.
 */
public final class Verdict {
  private final String input;
  private final Expectation expectation;
  private final boolean accepted;

  public Verdict(final String input, final Expectation expectation, final boolean accepted) {
    this.input = input;
    this.expectation = expectation;
    this.accepted = accepted;
  }

  public String getInput() {
    return input;
  }

  public Expectation getExpectation() {
    return expectation;
  }

  public boolean isAccepted() {
    return accepted;
  }

  public boolean isPassed() {
    return expectation.matches(accepted);
  }

  @Override
  public String toString() {
    return "Verdict [input=" + input + ", expectation=" + expectation + ", accepted=" + accepted
        + ", passed=" + isPassed() + "]";
  }
}
