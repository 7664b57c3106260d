package fsa.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

public class ProductionListTest {

  @Test
  public void parsesAlternatives() throws Exception {
    assertEquals(
      List.of(new ProductionRule("S", "ab"), new ProductionRule("S", "c")),
      ProductionRule.fromString("S -> a b | c")
    );
    assertEquals(List.of(new ProductionRule("P", "a")), ProductionRule.fromString("P🠖a"));
  }

  @Test
  public void emptyAlternativeIsEpsilonProduction() throws Exception {
    assertEquals(
      List.of(new ProductionRule("S", "aSb"), new ProductionRule("S", "")),
      ProductionRule.fromString("S -> aSb |")
    );
  }

  @Test
  public void malformedRules() {
    assertThrows(MalformedProductionException.class, () -> ProductionRule.fromString("S a"));
    assertThrows(MalformedProductionException.class, () -> ProductionRule.fromString(" -> a"));
    assertThrows(MalformedProductionException.class, () -> ProductionRule.fromString("S -> a -> b"));

    final var error = assertThrows(MalformedProductionException.class, () -> ProductionRule.fromString("  -> a"));
    assertEquals(2, error.getErrorOffset());
  }

  @Test
  public void malformedLinesAreSkipped() {
    final var productions = ProductionList.fromString(String.join(
      "\n",
      "E -> T | E+T",
      "not a production",
      "",
      "-> a",
      "P 🠖 a"
    ));
    assertEquals(3, productions.productions().size());
    assertEquals(
      List.of(new ProductionRule("E", "T"), new ProductionRule("E", "E+T")),
      productions.productionsFor("E")
    );
    assertEquals("E🠖T, E🠖E+T, P🠖a", productions.toString());
  }

  @Test
  public void augmentedGrammar() {
    final var grammar = new Grammar(
      Alphabet.of("S"),
      Alphabet.of("a"),
      "S",
      ProductionList.fromString("S -> aS | a")
    );
    final var augmented = grammar.augmented();

    assertEquals("S'", augmented.startSymbol());
    assertEquals(List.of(new ProductionRule("S'", "S")), augmented.productions().productionsFor("S'"));
    assertTrue(augmented.isNonTerminal("S'"));
    assertFalse(grammar.isNonTerminal("S'"));
    assertEquals(2, grammar.productions().productions().size());
  }

  @Test
  public void startSymbolMustBeNonTerminal() {
    assertThrows(
      IllegalArgumentException.class,
      () -> new Grammar(Alphabet.of("S"), Alphabet.of("a"), "a", new ProductionList())
    );
  }

  @Test
  public void grammarSummary() {
    final var grammar = new Grammar(
      Alphabet.of("S"),
      Alphabet.of("a", "b"),
      "S",
      ProductionList.fromString("S -> ab")
    );
    final String summary = grammar.toString();
    final String[] lines = summary.split("\n");

    assertEquals("+" + "-".repeat(36) + "+", lines[0]);
    assertEquals("| Grammar" + " ".repeat(28) + "|", lines[1]);
    assertEquals("| Terminal symbols:" + " ".repeat(11) + "a, b" + " ".repeat(3) + "|", lines[4]);
    assertTrue(lines[8].startsWith("| S🠖ab "));
  }
}
