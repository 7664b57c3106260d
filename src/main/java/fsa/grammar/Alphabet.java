package fsa.grammar;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable set of grammar symbols, kept sorted for display.
 */
public final class Alphabet {

  private final SortedSet<String> symbols;

  public Alphabet(Collection<String> symbols) {
    this.symbols = new TreeSet<>(symbols);
  }

  public static Alphabet of(String... symbols) {
    final var alphabet = new Alphabet(Collections.emptySet());
    for (String symbol : symbols) {
      alphabet.add(symbol);
    }
    return alphabet;
  }

  public void add(String symbol) {
    symbols.add(symbol);
  }

  public boolean contains(String symbol) {
    return symbols.contains(symbol);
  }

  public SortedSet<String> symbols() {
    return Collections.unmodifiableSortedSet(symbols);
  }

  public Alphabet copy() {
    return new Alphabet(symbols);
  }

  @Override
  public String toString() {
    return String.join(", ", symbols);
  }
}
