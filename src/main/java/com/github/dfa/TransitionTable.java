package com.github.dfa;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Indexed lookup over a validated, deterministic transition relation.
 *
 * K=fromState, V=(K=symbol, V=toState). This table is fully hydrated once at build time and never
 * modified afterwards, so a lookup is a pair of hash lookups regardless of how many transitions the
 * automaton has.
 */
public final class TransitionTable {
  private final Map<State, Map<String, State>> table;
  private final int size;

  TransitionTable(final Map<State, Map<String, State>> transitions) {
    final Map<State, Map<String, State>> copy = new HashMap<>();
    int count = 0;
    for (final Map.Entry<State, Map<String, State>> row : transitions.entrySet()) {
      copy.put(row.getKey(), Collections.unmodifiableMap(new HashMap<>(row.getValue())));
      count += row.getValue().size();
    }
    this.table = Collections.unmodifiableMap(copy);
    this.size = count;
  }

  /**
   * Returns the destination for (fromState, symbol), or empty when the relation has no edge there.
   */
  public Optional<State> lookup(final State fromState, final String symbol) {
    final Map<String, State> row = table.get(fromState);
    if (row == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(row.get(symbol));
  }

  /**
   * Number of distinct transitions.
   */
  public int size() {
    return size;
  }

  @Override
  public String toString() {
    return "TransitionTable [size=" + size + ", table=" + table + "]";
  }
}
