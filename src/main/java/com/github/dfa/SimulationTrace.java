package com.github.dfa;

import java.util.Collections;
import java.util.List;

/**
 * Route of states visited while simulating one input, along with how the run ended. The route
 * always begins with the start state. When a run is cut short, {@link #getFailedSymbolIndex()}
 * points at the symbol that could not be consumed; otherwise it is -1.
 */
public final class SimulationTrace {
  private final List<State> route;
  private final Outcome outcome;
  private final int failedSymbolIndex;

  SimulationTrace(final List<State> route, final Outcome outcome, final int failedSymbolIndex) {
    this.route = Collections.unmodifiableList(route);
    this.outcome = outcome;
    this.failedSymbolIndex = failedSymbolIndex;
  }

  public List<State> getRoute() {
    return route;
  }

  public State getLastState() {
    return route.get(route.size() - 1);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public int getFailedSymbolIndex() {
    return failedSymbolIndex;
  }

  public boolean isAccepted() {
    return outcome.isAccepted();
  }

  @Override
  public String toString() {
    return "SimulationTrace [route=" + route + ", outcome=" + outcome + ", failedSymbolIndex="
        + failedSymbolIndex + "]";
  }
}
