package com.github.dfa;

import static com.github.dfa.AutomatonFixtures.transition;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import com.github.dfa.Automaton.AutomatonBuilder;

/**
 * Tests to maintain the sanity and correctness of the Simulator.
 */
public class SimulatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testContainsZeroOne() throws AutomatonException {
    final Automaton automaton = AutomatonFixtures.containsZeroOne();
    // 0->1->2
    assertTrue(Simulator.accepts(automaton, "01"));
    // 0->0->1, 1 is not final
    assertFalse(Simulator.accepts(automaton, "10"));
    // start state 0 is not final
    assertFalse(Simulator.accepts(automaton, ""));
    // 0->1->1->2->2
    assertTrue(Simulator.accepts(automaton, "0011"));
    assertFalse(Simulator.accepts(automaton, "1110"));
    assertTrue(Simulator.accepts(automaton, "111000110"));
  }

  @Test
  public void testEmptyInputAcceptedIffStartStateIsFinal() throws AutomatonException {
    final Automaton startIsFinal = AutomatonBuilder.newBuilder().symbol("a")
        .finalState(State.of(0)).transition(transition(0, "a", 1)).build();
    assertTrue(Simulator.accepts(startIsFinal, Collections.emptyList()));
    assertFalse(Simulator.accepts(startIsFinal, "a"));

    final Automaton startIsNotFinal = AutomatonBuilder.newBuilder().symbol("a")
        .finalState(State.of(1)).transition(transition(0, "a", 1)).build();
    assertFalse(Simulator.accepts(startIsNotFinal, Collections.emptyList()));
    assertTrue(Simulator.accepts(startIsNotFinal, "a"));
  }

  @Test
  public void testUnknownSymbolAlwaysRejects() throws AutomatonException {
    final Automaton automaton = AutomatonFixtures.containsZeroOne();
    for (final String input : Arrays.asList("2", "012", "0121", "x01", "01 ", "0\u00011")) {
      assertFalse(input, Simulator.accepts(automaton, input));
    }
    final SimulationTrace trace = Simulator.trace(automaton, "01x1");
    assertEquals(Outcome.REJECTED_UNKNOWN_SYMBOL, trace.getOutcome());
    assertEquals(2, trace.getFailedSymbolIndex());
    // 0->1->2, stopped before x
    assertEquals(Arrays.asList(State.of(0), State.of(1), State.of(2)), trace.getRoute());
  }

  @Test
  public void testMissingTransitionRejects() throws AutomatonException {
    // only "ab" is accepted
    final Automaton automaton = AutomatonBuilder.newBuilder().symbol("a").symbol("b")
        .finalState(State.of(2)).transition(transition(0, "a", 1))
        .transition(transition(1, "b", 2)).build();
    assertTrue(Simulator.accepts(automaton, "ab"));

    final SimulationTrace trace = Simulator.trace(automaton, "abb");
    assertFalse(trace.isAccepted());
    assertEquals(Outcome.REJECTED_NO_TRANSITION, trace.getOutcome());
    assertEquals(2, trace.getFailedSymbolIndex());
    assertEquals(State.of(2), trace.getLastState());

    assertEquals(Outcome.REJECTED_NO_TRANSITION, Simulator.trace(automaton, "b").getOutcome());
  }

  @Test
  public void testTraceRoute() throws AutomatonException {
    final SimulationTrace trace = Simulator.trace(AutomatonFixtures.containsZeroOne(), "0011");
    assertTrue(trace.isAccepted());
    assertEquals(Outcome.ACCEPTED, trace.getOutcome());
    assertEquals(-1, trace.getFailedSymbolIndex());
    assertEquals(Arrays.asList(State.of(0), State.of(1), State.of(1), State.of(2), State.of(2)),
        trace.getRoute());

    final SimulationTrace rejected = Simulator.trace(AutomatonFixtures.containsZeroOne(), "10");
    assertEquals(Outcome.REJECTED_NOT_FINAL, rejected.getOutcome());
    assertEquals(State.of(1), rejected.getLastState());
  }

  @Test
  public void testSimulationIsDeterministic() throws AutomatonException {
    final Automaton automaton = AutomatonFixtures.containsZeroOne();
    final Random random = new Random(42L);
    for (int iter = 0; iter < 200; iter++) {
      final StringBuilder input = new StringBuilder();
      final int length = random.nextInt(12);
      for (int symbol = 0; symbol < length; symbol++) {
        input.append(random.nextBoolean() ? '0' : '1');
      }
      final boolean first = Simulator.accepts(automaton, input.toString());
      assertEquals(input.toString(), first, Simulator.accepts(automaton, input.toString()));
      assertEquals(input.toString(), input.indexOf("01") >= 0, first);
    }
  }

  @Test
  public void testMultiByteSymbols() throws AutomatonException {
    final Automaton automaton = AutomatonBuilder.newBuilder().symbol("α").symbol("😀")
        .finalState(State.of(1)).transition(transition(0, "α", 0))
        .transition(transition(0, "😀", 1)).build();
    final List<String> symbols = Simulator.symbolsOf("αα😀");
    assertEquals(3, symbols.size());
    assertTrue(Simulator.accepts(automaton, symbols));
    assertFalse(Simulator.accepts(automaton, "α"));
  }

  @Test
  public void testSymbolsOf() {
    assertEquals(Collections.emptyList(), Simulator.symbolsOf(""));
    assertEquals(Arrays.asList("0", "1", "1"), Simulator.symbolsOf("011"));
  }

}
