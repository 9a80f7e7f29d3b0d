package com.github.dfa;

import java.util.Objects;

import com.github.dfa.AutomatonException.Code;

/**
 * One edge of the transition relation: fromState --symbol--> toState. The definition line it was
 * read from is kept around purely for error reporting; it takes no part in equality.
 */
public final class Transition {
  private final State fromState;
  private final String symbol;
  private final State toState;
  private final int lineNumber;

  public Transition(final State fromState, final String symbol, final State toState)
      throws AutomatonException {
    this(fromState, symbol, toState, -1);
  }

  public Transition(final State fromState, final String symbol, final State toState,
      final int lineNumber) throws AutomatonException {
    if (fromState == null || toState == null) {
      throw new AutomatonException(Code.INVALID_STATE, "Null state is invalid", lineNumber);
    }
    if (symbol == null || symbol.isEmpty()) {
      throw new AutomatonException(Code.MALFORMED_DEFINITION, "Transition symbol is empty",
          lineNumber);
    }
    this.fromState = fromState;
    this.symbol = symbol;
    this.toState = toState;
    this.lineNumber = lineNumber;
  }

  public State getFromState() {
    return fromState;
  }

  public String getSymbol() {
    return symbol;
  }

  public State getToState() {
    return toState;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, symbol, toState);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) obj;
    return fromState.equals(other.fromState) && symbol.equals(other.symbol)
        && toState.equals(other.toState);
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", symbol=" + symbol + ", toState=" + toState
        + "]";
  }
}
