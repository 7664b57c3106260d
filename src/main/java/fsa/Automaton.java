package fsa;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finite automaton over an ordered alphabet of string symbols.
 *
 * <p>Implemented by {@link DeterministicAutomaton},
 * {@link NonDeterministicAutomaton} and
 * {@link EpsilonNonDeterministicAutomaton}. Each of them can run words on its
 * own, and conversions only ever go from one concrete variant to the next.
 */
public interface Automaton {

  /**
   * Alphabet of the automaton, in the order transition targets are given.
   *
   * @return unmodifiable list of symbols
   */
  List<String> alphabet();

  /**
   * Symbols that can appear in an input word.
   *
   * @return the alphabet, minus any reserved symbol
   */
  default List<String> inputSymbols() {
    return alphabet();
  }

  /**
   * States of the automaton.
   *
   * @return unmodifiable set of states, in insertion order
   */
  Set<State> states();

  /**
   * Start state.
   *
   * @return start state, if one was added
   */
  Optional<State> startState();

  /**
   * Accepting states.
   *
   * @return states flagged as accepting
   */
  Set<State> acceptingStates();

  /**
   * Check whether the automaton accepts a word.
   *
   * @param word sequence of input symbols
   * @return whether the run ends in an accepting configuration
   * @throws InvalidSymbolException if the word has a symbol outside {@link #inputSymbols()}
   * @throws NoStartStateException if there is no start state
   */
  boolean accepts(List<String> word);

  /**
   * Check whether the automaton accepts a word where every character is one
   * symbol (surrounding whitespace is ignored).
   *
   * @param word word to check
   * @return whether the word is accepted
   */
  default boolean accepts(String word) {
    return accepts(AbstractAutomaton.symbolsOf(word));
  }

  /**
   * All accepted words of length 1 to {@code maxLength}.
   *
   * <p>Every word over {@link #inputSymbols()} is tried, so this is
   * exponential in {@code maxLength}.
   *
   * @param maxLength longest word to try
   * @return accepted words, shortest first, then in alphabet order
   */
  List<List<String>> acceptedWords(int maxLength);

  /**
   * Human readable target of a transition, for display.
   *
   * @param state source state
   * @param symbol symbol of the alphabet
   * @return label of the target
   */
  String targetLabel(State state, String symbol);

  /**
   * Title of the transition table of this kind of automaton.
   *
   * @return table title
   */
  String tableTitle();
}
