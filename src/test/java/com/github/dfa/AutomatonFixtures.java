package com.github.dfa;

import com.github.dfa.Automaton.AutomatonBuilder;

/**
 * Shared automata for tests.
 */
public final class AutomatonFixtures {

  /**
   * Recognizes every string over {0,1} that contains the substring "01".
   */
  public static final String CONTAINS_ZERO_ONE = String.join("\n",
      "# strings over {0,1} containing 01",
      "alphabet: 0 1",
      "final: 2",
      "0 0 1",
      "0 1 0",
      "1 0 1",
      "1 1 2",
      "2 0 2",
      "2 1 2",
      "");

  public static Automaton containsZeroOne() throws AutomatonException {
    return AutomatonBuilder.newBuilder().symbol("0").symbol("1").finalState(State.of(2))
        .transition(transition(0, "0", 1)).transition(transition(0, "1", 0))
        .transition(transition(1, "0", 1)).transition(transition(1, "1", 2))
        .transition(transition(2, "0", 2)).transition(transition(2, "1", 2)).build();
  }

  public static Transition transition(final int from, final String symbol, final int to)
      throws AutomatonException {
    return new Transition(State.of(from), symbol, State.of(to));
  }

  private AutomatonFixtures() {}
}
