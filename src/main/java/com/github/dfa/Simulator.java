package com.github.dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decides accept/reject for an input against an {@link Automaton}. Every method here is a pure
 * function of its arguments: the automaton is only read, and there is no I/O.
 */
public final class Simulator {

  /**
   * Returns true iff the automaton accepts the given symbol sequence. An empty sequence is accepted
   * iff the start state is final.
   */
  public static boolean accepts(final Automaton automaton, final List<String> symbols) {
    return trace(automaton, symbols).isAccepted();
  }

  /**
   * Same as {@link #accepts(Automaton, List)} with every code point of input read as one symbol.
   */
  public static boolean accepts(final Automaton automaton, final String input) {
    return accepts(automaton, symbolsOf(input));
  }

  /**
   * Walk the transition table over the symbols and report the route taken. Unknown symbols and
   * missing transitions end the walk right away with a reject outcome.
   */
  public static SimulationTrace trace(final Automaton automaton, final List<String> symbols) {
    State currentState = automaton.getStartState();
    final List<State> route = new ArrayList<>(symbols.size() + 1);
    route.add(currentState);
    for (int index = 0; index < symbols.size(); index++) {
      final String symbol = symbols.get(index);
      if (!automaton.inAlphabet(symbol)) {
        return new SimulationTrace(route, Outcome.REJECTED_UNKNOWN_SYMBOL, index);
      }
      final Optional<State> nextState =
          automaton.getTransitionTable().lookup(currentState, symbol);
      if (!nextState.isPresent()) {
        return new SimulationTrace(route, Outcome.REJECTED_NO_TRANSITION, index);
      }
      currentState = nextState.get();
      route.add(currentState);
    }
    return new SimulationTrace(route,
        automaton.isFinal(currentState) ? Outcome.ACCEPTED : Outcome.REJECTED_NOT_FINAL, -1);
  }

  public static SimulationTrace trace(final Automaton automaton, final String input) {
    return trace(automaton, symbolsOf(input));
  }

  /**
   * Split a string into single code point symbols. The empty string yields the empty sequence.
   */
  public static List<String> symbolsOf(final String input) {
    if (input == null || input.isEmpty()) {
      return Collections.emptyList();
    }
    final List<String> symbols = new ArrayList<>(input.length());
    input.codePoints().forEach(codePoint -> symbols.add(new String(Character.toChars(codePoint))));
    return symbols;
  }

  private Simulator() {}
}
