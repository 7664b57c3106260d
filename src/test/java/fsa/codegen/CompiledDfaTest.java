package fsa.codegen;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fsa.DeterministicAutomaton;
import fsa.InvalidSymbolException;
import fsa.NoStartStateException;
import fsa.NonDeterministicAutomaton;
import fsa.UndefinedTransitionException;
import fsa.Words;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class CompiledDfaTest {

  private static final List<String> BINARY = List.of("0", "1");

  @Test
  public void agreesWithInterpretedRecognition() throws Exception {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", List.of("q0", "q1"), true, false);
    dfa.addState("q1", List.of("q0", "q1"), false, true);

    final var compiled = CompiledDfa.compile(dfa);
    assertTrue(compiled.accepts("011"));
    assertFalse(compiled.accepts(""));
    Words.assertSameLanguage(BINARY, 8, dfa::accepts, compiled::accepts);
  }

  @Test
  public void compilesSubsetConstruction() throws Exception {
    final var nfa = new NonDeterministicAutomaton(BINARY);
    nfa.addState("q1", List.of(Set.of("q1"), Set.of("q1", "q2")), true, false);
    nfa.addState("q2", List.of(Set.of("q3"), Set.of("q3")));
    nfa.addState("q3", List.of(Set.of(), Set.of()), false, true);
    final var dfa = nfa.toDfa();

    final var compiled = CompiledDfa.compile(dfa);
    assertTrue(compiled.accepts("11"));
    assertFalse(compiled.accepts("00"));
    Words.assertSameLanguage(BINARY, 8, nfa::accepts, compiled::accepts);
  }

  @Test
  public void singleSymbolAlphabet() throws Exception {
    final var dfa = new DeterministicAutomaton(List.of("a"));
    dfa.addState("even", List.of("odd"), true, true);
    dfa.addState("odd", List.of("even"), false, false);

    final var compiled = CompiledDfa.compile(dfa);
    Words.assertSameLanguage(List.of("a"), 6, dfa::accepts, compiled::accepts);
  }

  @Test
  public void ignoresUnreachablePartialStates() throws Exception {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", List.of("q0", "q0"), true, true);
    dfa.addState("dead", Arrays.asList("dead", null));

    final var compiled = CompiledDfa.compile(dfa);
    assertTrue(compiled.accepts("0101"));
  }

  @Test
  public void rejectsOutOfRangeIndices() throws Exception {
    final var dfa = new DeterministicAutomaton(BINARY);
    dfa.addState("q0", List.of("q0", "q0"), true, true);

    final var compiled = CompiledDfa.compile(dfa);
    assertTrue(compiled.accepts(new int[] { 0, 1 }));
    assertFalse(compiled.accepts(new int[] { 0, 2 }));
    assertThrows(InvalidSymbolException.class, () -> compiled.accepts("02"));
  }

  @Test
  public void compilationNeedsStartAndTotalTransitions() {
    final var noStart = new DeterministicAutomaton(BINARY);
    noStart.addState("q0", List.of("q0", "q0"));
    assertThrows(NoStartStateException.class, () -> CompiledDfa.compile(noStart));

    final var partial = new DeterministicAutomaton(BINARY);
    partial.addState("q0", Arrays.asList("q0", null), true, false);
    assertThrows(UndefinedTransitionException.class, () -> CompiledDfa.compile(partial));
  }
}
