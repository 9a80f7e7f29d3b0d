package com.github.dfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfa.AutomatonException.Code;

/**
 * A deterministic finite automaton.
 *
 * Notes for users:<br>
 * 1. an Automaton is immutable once built and is therefore safe to share across threads; nothing
 * in simulation or verification ever writes to it<br>
 *
 * 2. there is no registry of automata; callers hold on to the instance and pass it explicitly to
 * {@link Simulator} and {@link BatchVerifier}<br>
 *
 * 3. states are not declared, they are discovered from transitions. The start state is the
 * smallest discovered state, which is state 0 for any conventional definition<br>
 *
 * 4. the transition relation is validated to be a partial function at build time: two transitions
 * out of the same state on the same symbol must agree on the destination or the build fails<br>
 */
public final class Automaton {
  private final String automatonId = UUID.randomUUID().toString();

  private final Set<String> alphabet;
  private final Set<State> states;
  private final Set<State> finalStates;
  private final State startState;
  private final TransitionTable transitionTable;

  private Automaton(final Set<String> alphabet, final TreeSet<State> states,
      final Set<State> finalStates, final TransitionTable transitionTable) {
    this.alphabet = Collections.unmodifiableSet(alphabet);
    this.states = Collections.unmodifiableSet(states);
    this.finalStates = Collections.unmodifiableSet(finalStates);
    this.transitionTable = transitionTable;
    this.startState = states.first();
  }

  public String getId() {
    return automatonId;
  }

  public Set<String> getAlphabet() {
    return alphabet;
  }

  /**
   * All states discovered from the transitions, in ascending order.
   */
  public Set<State> getStates() {
    return states;
  }

  public Set<State> getFinalStates() {
    return finalStates;
  }

  public State getStartState() {
    return startState;
  }

  public TransitionTable getTransitionTable() {
    return transitionTable;
  }

  public boolean inAlphabet(final String symbol) {
    return alphabet.contains(symbol);
  }

  public boolean isFinal(final State state) {
    return finalStates.contains(state);
  }

  @Override
  public String toString() {
    return "Automaton [automatonId=" + automatonId + ", states=" + states.size() + ", startState="
        + startState + ", finalStates=" + finalStates + ", alphabet=" + alphabet
        + ", transitions=" + transitionTable.size() + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build automata. All validation happens in
   * {@link #build()}; a failed build never hands out a partially constructed automaton.
   */
  public final static class AutomatonBuilder {
    private static final Logger logger =
        LogManager.getLogger(AutomatonBuilder.class.getSimpleName());

    private final Set<String> alphabet = new LinkedHashSet<>();
    private final Set<State> finalStates = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();

    public static AutomatonBuilder newBuilder() {
      return new AutomatonBuilder();
    }

    public AutomatonBuilder alphabet(final Set<String> alphabet) {
      this.alphabet.addAll(alphabet);
      return this;
    }

    public AutomatonBuilder symbol(final String symbol) {
      this.alphabet.add(symbol);
      return this;
    }

    public AutomatonBuilder finalStates(final Set<State> finalStates) {
      this.finalStates.addAll(finalStates);
      return this;
    }

    public AutomatonBuilder finalState(final State finalState) {
      this.finalStates.add(finalState);
      return this;
    }

    public AutomatonBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public AutomatonBuilder transitions(final List<Transition> transitions) {
      this.transitions.addAll(transitions);
      return this;
    }

    public Automaton build() throws AutomatonException {
      if (alphabet.isEmpty()) {
        throw new AutomatonException(Code.INVALID_ALPHABET, "Alphabet must declare a symbol");
      }
      if (transitions.isEmpty()) {
        throw new AutomatonException(Code.EMPTY_DEFINITION);
      }

      final Map<State, Map<String, State>> rows = new HashMap<>();
      // first line seen for every (fromState, symbol), for conflict messages
      final Map<State, Map<String, Transition>> firstSeen = new HashMap<>();
      final TreeSet<State> states = new TreeSet<>();
      for (final Transition transition : transitions) {
        if (transition == null) {
          throw new AutomatonException(Code.MALFORMED_DEFINITION,
              "Transition list must not contain null entries");
        }
        if (!alphabet.contains(transition.getSymbol())) {
          throw new AutomatonException(Code.UNKNOWN_SYMBOL,
              String.format("Symbol '%s' in %s is not part of the alphabet %s",
                  transition.getSymbol(), transition, alphabet),
              transition.getLineNumber());
        }
        final Map<String, Transition> seen =
            firstSeen.computeIfAbsent(transition.getFromState(), state -> new HashMap<>());
        final Transition previous = seen.get(transition.getSymbol());
        if (previous != null) {
          if (!previous.getToState().equals(transition.getToState())) {
            throw new AutomatonException(Code.CONFLICTING_TRANSITION,
                String.format("%s conflicts with %s declared on line %d", transition, previous,
                    previous.getLineNumber()),
                transition.getLineNumber());
          }
          if (logger.isDebugEnabled()) {
            logger.debug("Dropping duplicate " + transition + " on line "
                + transition.getLineNumber());
          }
          continue;
        }
        seen.put(transition.getSymbol(), transition);
        rows.computeIfAbsent(transition.getFromState(), state -> new HashMap<>())
            .put(transition.getSymbol(), transition.getToState());
        states.add(transition.getFromState());
        states.add(transition.getToState());
      }
      if (states.isEmpty()) {
        throw new AutomatonException(Code.EMPTY_DEFINITION);
      }

      for (final State finalState : finalStates) {
        if (!states.contains(finalState)) {
          throw new AutomatonException(Code.DANGLING_FINAL_STATE,
              "Final state " + finalState + " is not used by any transition");
        }
      }

      final Automaton automaton = new Automaton(new LinkedHashSet<>(alphabet), states,
          new TreeSet<>(finalStates), new TransitionTable(rows));
      logger.info("[a:" + automaton.getId() + "] Successfully built " + automaton);
      return automaton;
    }

    private AutomatonBuilder() {}
  }

}
