package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

public class DeterministicAutomatonTest {

  private static final List<String> BINARY = List.of("0", "1");
  private static final List<String> AB = List.of("a", "b");

  /**
   * Words ending in 1.
   */
  static DeterministicAutomaton endsInOne() {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", List.of("q0", "q1"), true, false);
    dfa.addState("q1", List.of("q0", "q1"), false, true);
    return dfa;
  }

  /**
   * Words ending in a, with two redundant states and one unreachable state.
   */
  static DeterministicAutomaton endsInA(String firstName) {
    final var dfa = new DeterministicAutomaton(AB);
    dfa.addState(firstName, List.of("B", "C"), true, false);
    dfa.addState("B", List.of("D", "C"), false, true);
    dfa.addState("C", List.of("B", firstName), false, false);
    dfa.addState("D", List.of("B", "C"), false, true);
    dfa.addState("U", List.of("U", firstName), false, true);
    return dfa;
  }

  @Test
  public void recognition() {
    final var dfa = endsInOne();
    assertTrue(dfa.accepts("011"));
    assertTrue(dfa.accepts(" 1 "));
    assertFalse(dfa.accepts("10"));
    assertFalse(dfa.accepts(""));
    assertEquals(new State("q1", false, true), dfa.run(List.of("0", "1")));
  }

  @Test
  public void acceptedWords() {
    assertEquals(
      List.of(List.of("1"), List.of("0", "1"), List.of("1", "1")),
      endsInOne().acceptedWords(2)
    );
    assertTrue(endsInOne().acceptedWords(0).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> endsInOne().acceptedWords(-1));
  }

  @Test
  public void invalidSymbolIsReportedBeforeMissingStart() {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", List.of("q0", "q0"));

    final var error = assertThrows(InvalidSymbolException.class, () -> dfa.accepts("012"));
    assertEquals("2", error.symbol);
    assertThrows(NoStartStateException.class, () -> dfa.accepts("01"));
  }

  @Test
  public void secondStartStateIsRejected() {
    final var dfa = endsInOne();
    final var error = assertThrows(
      DuplicateStartStateException.class,
      () -> dfa.addState("q2", List.of("q2", "q2"), true, false)
    );
    assertEquals("q0", error.existingStart);
    assertEquals("q2", error.rejectedStart);
    assertFalse(dfa.state("q2").isPresent());
  }

  @Test
  public void targetCountMustMatchAlphabet() {
    final var dfa = new DeterministicAutomaton(BINARY);
    assertThrows(IllegalArgumentException.class, () -> dfa.addState("q0", List.of("q0")));
    assertThrows(IllegalArgumentException.class, () -> new DeterministicAutomaton(List.of("0", "0")));
  }

  @Test
  public void partialAutomatonFailsOnMissingTransition() {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", Arrays.asList("q0", null), true, true);

    assertTrue(dfa.accepts("00"));
    assertThrows(UndefinedTransitionException.class, () -> dfa.accepts("01"));
    assertEquals("-", dfa.targetLabel(dfa.state("q0").orElseThrow(), "1"));
  }

  @Test
  public void minimalAutomatonIsUnchangedByMinimization() {
    final var dfa = endsInOne();
    assertTrue(dfa.accepts("011"));

    final var minimized = dfa.minimize();
    assertSame(dfa, minimized);
    assertEquals(2, dfa.states().size());
    assertEquals(new TreeSet<>(List.of("q0", "q1")), dfa.stateNames());
    assertTrue(dfa.accepts("011"));
  }

  @Test
  public void minimizationMergesEquivalentStates() {
    final var dfa = endsInA("A");
    final var original = dfa.copy();

    dfa.minimize();
    assertEquals(new TreeSet<>(List.of("m0", "m1")), dfa.stateNames());
    assertEquals(new State("m0", true, false), dfa.startState().orElseThrow());
    assertEquals(Set.of(new State("m1", false, true)), dfa.acceptingStates());
    Words.assertSameLanguage(AB, 8, original::accepts, dfa::accepts);
  }

  @Test
  public void minimizedAutomatonHasNoEquivalentStates() {
    final var dfa = endsInA("A").minimized();
    for (SortedSet<String> equivalenceClass : dfa.equivalenceClasses()) {
      assertEquals(1, equivalenceClass.size(), "still mergeable: " + equivalenceClass);
    }

    // Every pair of states is told apart by some short word
    final List<State> states = List.copyOf(dfa.states());
    for (int i = 0; i < states.size(); i++) {
      for (int j = i + 1; j < states.size(); j++) {
        final State p = states.get(i);
        final State q = states.get(j);
        final boolean distinguished = Words
          .upTo(AB, states.size())
          .stream()
          .anyMatch(word -> runFrom(dfa, p, word).accepting() != runFrom(dfa, q, word).accepting());
        assertTrue(distinguished, p + " and " + q + " are equivalent");
      }
    }
  }

  @Test
  public void minimizedLeavesOriginalAlone() {
    final var dfa = endsInA("A");
    final var minimized = dfa.minimized();
    assertEquals(5, dfa.states().size());
    assertEquals(2, minimized.states().size());
  }

  @Test
  public void mergedNamesSkipTakenNames() {
    final var dfa = endsInA("m0");
    dfa.minimize();
    assertEquals(new TreeSet<>(List.of("m1", "m2")), dfa.stateNames());
    assertTrue(dfa.startState().orElseThrow().starting());
  }

  @Test
  public void equivalenceClasses() {
    final var dfa = endsInA("A");
    assertEquals(
      List.of(new TreeSet<>(List.of("A", "C")), new TreeSet<>(List.of("B", "D"))),
      dfa.equivalenceClasses()
    );
    assertEquals(5, dfa.states().size());
  }

  @Test
  public void unreachableStatesArePruned() {
    final var dfa = endsInA("A");
    assertEquals(Set.of(new State("U", false, true)), dfa.removeUnreachableStates());
    assertFalse(dfa.state("U").isPresent());
    assertTrue(dfa.state("A").isPresent());
    assertTrue(dfa.removeUnreachableStates().isEmpty());
  }

  @Test
  public void failedMinimizationLeavesAutomatonUntouched() {
    final var dfa = new DeterministicAutomaton(AB);
    dfa.addState("A", List.of("B", "A"), true, false);
    dfa.addState("B", Arrays.asList("B", null), false, true);
    dfa.addState("C", List.of("C", "C"), false, true);

    assertThrows(UndefinedTransitionException.class, dfa::minimize);
    assertEquals(new TreeSet<>(List.of("A", "B", "C")), dfa.stateNames());
    assertTrue(dfa.accepts("a"));
  }

  @Test
  public void minimizationPreconditions() {
    assertThrows(EmptyAutomatonException.class, () -> new DeterministicAutomaton(BINARY).minimize());

    final var noStart = new DeterministicAutomaton(BINARY);
    noStart.addState("q0", List.of("q0", "q0"));
    assertThrows(NoStartStateException.class, noStart::minimize);
  }

  @Test
  public void copyIsIndependent() {
    final var dfa = endsInOne();
    final var copy = dfa.copy();
    copy.addState("q2", List.of("q2", "q2"));

    assertNotEquals(dfa.states(), copy.states());
    assertEquals(dfa.startState(), copy.startState());
  }

  @Test
  public void dotGraph() {
    final String dot = endsInOne().dotGraph("ends in one");
    assertTrue(dot.startsWith("digraph \"ends in one\" {"));
    assertTrue(dot.contains("\"q1\" [shape = doublecircle];"));
    assertTrue(dot.contains("\"q0\" [shape = circle];"));
    assertTrue(dot.contains("\"_start1\" -> \"q0\" [label = \"\"];"));
    assertTrue(dot.contains("\"q0\" -> \"q1\" [label = \"1\"];"));
  }

  private static State runFrom(DeterministicAutomaton dfa, State from, List<String> word) {
    State current = from;
    for (String symbol : word) {
      current = dfa.transition(current, symbol);
    }
    return current;
  }
}
