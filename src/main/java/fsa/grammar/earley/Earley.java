package fsa.grammar.earley;

import fsa.grammar.Grammar;
import fsa.grammar.ProductionRule;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Earley recognizer for a context-free grammar.
 *
 * <p>The grammar is augmented with a fresh start symbol on construction. A
 * word is derivable when the situation {@code S' -> S⚫} spans the whole word.
 * Every character of the word is one terminal.
 */
public final class Earley {

  private static final Logger LOG = LoggerFactory.getLogger(Earley.class);

  private final Grammar grammar;

  public Earley(Grammar grammar) {
    this.grammar = grammar.augmented();
  }

  /**
   * Augmented grammar used for recognition.
   */
  public Grammar grammar() {
    return grammar;
  }

  /**
   * Check whether a word is derivable from the start symbol.
   *
   * @param word word made of terminal characters
   * @return whether the grammar derives {@code word}
   */
  public boolean recognizes(String word) {
    final List<Set<EarleySituation>> processed = process(word);
    final ProductionRule startRule = grammar.productions().productionsFor(grammar.startSymbol()).get(0);
    final var accepting = new EarleySituation(startRule.start(), startRule.target(), 0, word.length(), 1);
    return processed.get(word.length()).contains(accepting);
  }

  /**
   * Compute the situations reached at every position of the word.
   *
   * @param word word made of terminal characters
   * @return one set of situations per position, from {@code 0} to the length of the word
   */
  public List<Set<EarleySituation>> process(String word) {
    final int length = word.length();
    final List<Set<EarleySituation>> processed = new ArrayList<>(length + 1);
    for (int i = 0; i <= length; i++) {
      processed.add(new LinkedHashSet<>());
    }

    final Deque<EarleySituation> toVisit = new ArrayDeque<>();
    for (ProductionRule rule : grammar.productions().productionsFor(grammar.startSymbol())) {
      toVisit.add(EarleySituation.predict(rule, 0));
    }

    for (int position = 0; position <= length; position++) {
      final Set<EarleySituation> current = processed.get(position);

      // Non-terminals completed without consuming anything at this position
      final Set<String> nullable = new HashSet<>();

      while (!toVisit.isEmpty()) {
        final EarleySituation situation = toVisit.poll();
        if (!current.add(situation)) {
          continue;
        }

        if (situation.isComplete()) {
          // Completion
          if (situation.h() == position) {
            nullable.add(situation.start());
          }
          for (EarleySituation waiting : List.copyOf(processed.get(situation.h()))) {
            if (!waiting.isComplete() && waiting.nextSymbol().equals(situation.start())) {
              toVisit.add(waiting.advance(position));
            }
          }
        } else if (grammar.isNonTerminal(situation.nextSymbol())) {
          // Prediction
          final String nonTerminal = situation.nextSymbol();
          for (ProductionRule rule : grammar.productions().productionsFor(nonTerminal)) {
            toVisit.add(EarleySituation.predict(rule, position));
          }
          if (nullable.contains(nonTerminal)) {
            toVisit.add(situation.advance(position));
          }
        } else if (position < length && situation.nextSymbol().equals(String.valueOf(word.charAt(position)))) {
          // Scanning
          processed.get(position + 1).add(situation.advance(position + 1));
        }
      }
      LOG.trace("Situations at {}: {}", position, current);

      // Scanned situations seed the next position
      if (position < length) {
        final Set<EarleySituation> next = processed.get(position + 1);
        toVisit.addAll(next);
        next.clear();
      }
    }
    return processed;
  }
}
