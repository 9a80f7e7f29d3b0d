package com.github.dfa;

import static com.github.dfa.AutomatonFixtures.transition;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import com.github.dfa.Automaton.AutomatonBuilder;
import com.github.dfa.AutomatonException.Code;

/**
 * Tests to maintain the sanity and correctness of Automaton construction.
 */
public class AutomatonTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testBuildDiscoversStates() throws AutomatonException {
    final Automaton automaton = AutomatonFixtures.containsZeroOne();
    assertEquals(3, automaton.getStates().size());
    assertEquals(State.of(0), automaton.getStartState());
    assertEquals(1, automaton.getFinalStates().size());
    assertTrue(automaton.isFinal(State.of(2)));
    assertFalse(automaton.isFinal(State.of(0)));
    assertTrue(automaton.inAlphabet("0"));
    assertFalse(automaton.inAlphabet("2"));
    assertEquals(6, automaton.getTransitionTable().size());
  }

  @Test
  public void testStartStateIsSmallestState() throws AutomatonException {
    final Automaton automaton = AutomatonBuilder.newBuilder().symbol("a").finalState(State.of(4))
        .transition(transition(4, "a", 3)).transition(transition(3, "a", 4)).build();
    assertEquals(State.of(3), automaton.getStartState());
    assertTrue(Simulator.accepts(automaton, "a"));
    assertFalse(Simulator.accepts(automaton, "aa"));
  }

  @Test
  public void testConflictingTransitionsAreRejected() throws AutomatonException {
    final AutomatonBuilder builder = AutomatonBuilder.newBuilder().symbol("0").symbol("1")
        .transition(new Transition(State.of(0), "0", State.of(1), 3))
        .transition(new Transition(State.of(0), "0", State.of(2), 4));
    final AutomatonException problem = assertThrows(AutomatonException.class, builder::build);
    assertEquals(Code.CONFLICTING_TRANSITION, problem.getCode());
    assertEquals(4, problem.getLineNumber());
    assertTrue(problem.getMessage().contains("line 3"));
  }

  @Test
  public void testIdenticalDuplicateTransitionsAreDropped() throws AutomatonException {
    final Automaton automaton = AutomatonBuilder.newBuilder().symbol("0")
        .transition(transition(0, "0", 1)).transition(transition(0, "0", 1))
        .transition(transition(1, "0", 1)).build();
    assertEquals(2, automaton.getTransitionTable().size());
  }

  @Test
  public void testUnknownSymbolIsRejected() throws AutomatonException {
    final AutomatonBuilder builder =
        AutomatonBuilder.newBuilder().symbol("0").transition(transition(0, "1", 1));
    assertEquals(Code.UNKNOWN_SYMBOL,
        assertThrows(AutomatonException.class, builder::build).getCode());
  }

  @Test
  public void testDanglingFinalStateIsRejected() throws AutomatonException {
    final AutomatonBuilder builder = AutomatonBuilder.newBuilder().symbol("0")
        .finalState(State.of(7)).transition(transition(0, "0", 1));
    assertEquals(Code.DANGLING_FINAL_STATE,
        assertThrows(AutomatonException.class, builder::build).getCode());
  }

  @Test
  public void testEmptyDefinitionsAreRejected() throws AutomatonException {
    assertEquals(Code.EMPTY_DEFINITION, assertThrows(AutomatonException.class,
        () -> AutomatonBuilder.newBuilder().symbol("0").build()).getCode());
    assertEquals(Code.INVALID_ALPHABET, assertThrows(AutomatonException.class,
        () -> AutomatonBuilder.newBuilder().transition(transition(0, "0", 0)).build())
            .getCode());
  }

  @Test
  public void testNullTransitionIsRejected() throws AutomatonException {
    final AutomatonBuilder builder = AutomatonBuilder.newBuilder().symbol("0")
        .transition(transition(0, "0", 1)).transition(null);
    assertEquals(Code.MALFORMED_DEFINITION,
        assertThrows(AutomatonException.class, builder::build).getCode());
  }

  @Test
  public void testNegativeStateIsRejected() {
    assertEquals(Code.INVALID_STATE,
        assertThrows(AutomatonException.class, () -> State.of(-1)).getCode());
  }

  @Test
  public void testAutomatonIsImmutable() throws AutomatonException {
    final Automaton automaton = AutomatonFixtures.containsZeroOne();
    assertThrows(UnsupportedOperationException.class, () -> automaton.getAlphabet().add("2"));
    assertThrows(UnsupportedOperationException.class,
        () -> automaton.getFinalStates().add(State.of(0)));
    assertThrows(UnsupportedOperationException.class,
        () -> automaton.getStates().addAll(Arrays.asList(State.of(9))));
  }

  @Test
  public void testEveryAutomatonGetsItsOwnId() throws AutomatonException {
    assertNotEquals(AutomatonFixtures.containsZeroOne().getId(),
        AutomatonFixtures.containsZeroOne().getId());
  }

}
