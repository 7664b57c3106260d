package fsa.grammar.earley;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import fsa.grammar.Alphabet;
import fsa.grammar.Grammar;
import fsa.grammar.ProductionList;
import org.junit.jupiter.api.Test;

public class EarleyTest {

  private static Earley arithmetic() {
    final var grammar = new Grammar(
      Alphabet.of("E", "T", "P"),
      Alphabet.of("+", "*", "a"),
      "E",
      ProductionList.fromString("E -> T | E+T\nT -> P | T*P\nP -> a")
    );
    return new Earley(grammar);
  }

  @Test
  public void arithmeticExpressions() {
    final var earley = arithmetic();
    assertTrue(earley.recognizes("a*a+a"));
    assertTrue(earley.recognizes("a+a*a"));
    assertTrue(earley.recognizes("a"));
    assertFalse(earley.recognizes("a+*a"));
    assertFalse(earley.recognizes("a+"));
    assertFalse(earley.recognizes(""));
  }

  @Test
  public void epsilonProductions() {
    final var grammar = new Grammar(
      Alphabet.of("S"),
      Alphabet.of("a", "b"),
      "S",
      ProductionList.fromString("S -> aSb |")
    );
    final var earley = new Earley(grammar);
    assertTrue(earley.recognizes(""));
    assertTrue(earley.recognizes("ab"));
    assertTrue(earley.recognizes("aaabbb"));
    assertFalse(earley.recognizes("aab"));
    assertFalse(earley.recognizes("ba"));
  }

  @Test
  public void nullableNonTerminalInTheMiddle() {
    final var grammar = new Grammar(
      Alphabet.of("S", "A", "B"),
      Alphabet.of("a", "b"),
      "S",
      ProductionList.fromString("S -> AAB\nA -> a |\nB -> b")
    );
    final var earley = new Earley(grammar);
    assertTrue(earley.recognizes("b"));
    assertTrue(earley.recognizes("ab"));
    assertTrue(earley.recognizes("aab"));
    assertFalse(earley.recognizes("aaab"));
  }

  @Test
  public void situationsPerPosition() {
    final var processed = arithmetic().process("a");
    assertEquals(2, processed.size());
    assertTrue(processed.get(0).contains(new EarleySituation("E'", "E", 0, 0, 0)));
    assertTrue(processed.get(1).contains(new EarleySituation("P", "a", 0, 1, 1)));
  }

  @Test
  public void grammarIsAugmented() {
    final var earley = arithmetic();
    assertEquals("E'", earley.grammar().startSymbol());
  }

  @Test
  public void situationRendering() {
    assertEquals("E🠖E+⚫T [0, 2]", new EarleySituation("E", "E+T", 0, 2, 2).toString());
  }
}
