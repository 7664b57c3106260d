package fsa.grammar;

import java.util.List;

/**
 * Context-free grammar.
 *
 * <p>Terminals and non-terminals are single characters, except for the fresh
 * start symbol introduced by {@link #augmented()}.
 */
public final class Grammar {

  private final Alphabet nonTerminals;
  private final Alphabet terminals;
  private final String startSymbol;
  private final ProductionList productions;

  public Grammar(Alphabet nonTerminals, Alphabet terminals, String startSymbol, ProductionList productions) {
    if (!nonTerminals.contains(startSymbol)) {
      throw new IllegalArgumentException("start symbol '" + startSymbol + "' is not a non-terminal");
    }
    this.nonTerminals = nonTerminals;
    this.terminals = terminals;
    this.startSymbol = startSymbol;
    this.productions = productions;
  }

  public Alphabet nonTerminals() {
    return nonTerminals;
  }

  public Alphabet terminals() {
    return terminals;
  }

  public String startSymbol() {
    return startSymbol;
  }

  public ProductionList productions() {
    return productions;
  }

  /**
   * Equivalent grammar with a fresh start symbol {@code S'} and the extra
   * production {@code S' -> S}, so the start symbol never appears on a right
   * side. This grammar is not modified.
   *
   * @return augmented copy
   */
  public Grammar augmented() {
    final String newStart = startSymbol + "'";
    final var newNonTerminals = nonTerminals.copy();
    newNonTerminals.add(newStart);
    final var newProductions = productions.copy();
    newProductions.addProductions(List.of(new ProductionRule(newStart, startSymbol)));
    return new Grammar(newNonTerminals, terminals.copy(), newStart, newProductions);
  }

  public boolean isNonTerminal(String symbol) {
    return nonTerminals.contains(symbol);
  }

  public boolean isTerminal(String symbol) {
    return terminals.contains(symbol);
  }

  @Override
  public String toString() {
    final String productionsText = productions.toString();
    final int dashes = Math.max(productionsText.length() + 2, 30 + terminals.toString().length() + 2);
    final String divider = "+" + "-".repeat(dashes) + "+\n";

    final var builder = new StringBuilder();
    builder.append(divider);
    builder.append(row("| Grammar", dashes));
    builder.append(divider);
    builder.append(row(padRight("| Non-terminal symbols: ", 30) + nonTerminals, dashes));
    builder.append(row(padRight("| Terminal symbols: ", 30) + terminals, dashes));
    builder.append(row(padRight("| Starting symbol: ", 30) + startSymbol, dashes));
    builder.append(divider);
    builder.append(row("| Productions", dashes));
    builder.append(row("| " + productionsText, dashes));
    builder.append(divider);
    return builder.toString();
  }

  private static String row(String content, int dashes) {
    return padRight(content, dashes + 1) + "|\n";
  }

  private static String padRight(String str, int width) {
    return str.length() >= width ? str : str + " ".repeat(width - str.length());
  }
}
