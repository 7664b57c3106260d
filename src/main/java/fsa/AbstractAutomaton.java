package fsa;

import fsa.graph.StateTable;
import fsa.graph.TransitionFunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared shape of the automata: an ordered alphabet, a set of states, a
 * transition function over them and at most one start state.
 *
 * <p>States and their outgoing transitions are added in one step through
 * {@link #addState(String, List, boolean, boolean)}. Targets are given by
 * name, and may name states that have not been added yet.
 *
 * @param <T> transition target as given when adding a state
 * @param <R> result of running the automaton on a word
 */
public abstract class AbstractAutomaton<T, R> implements Automaton, DotGraph<String, String> {

  /**
   * Ordered alphabet, not modifiable.
   */
  protected final List<String> symbols;

  /**
   * Start state, set at most once (until the state is removed).
   */
  protected State startState;

  protected AbstractAutomaton(List<String> symbols) {
    final Set<String> distinct = new LinkedHashSet<>(symbols);
    if (distinct.size() != symbols.size()) {
      throw new IllegalArgumentException("alphabet has repeated symbols: " + symbols);
    }
    this.symbols = List.copyOf(symbols);
  }

  /**
   * Transition function of the automaton.
   */
  protected abstract TransitionFunction<T, R> transitions();

  /**
   * States registry shared with the transition function.
   */
  protected abstract StateTable stateTable();

  /**
   * Run the automaton on a word.
   *
   * @param word sequence of input symbols
   * @return final state (or set of states)
   * @throws InvalidSymbolException if the word has a symbol outside {@link #inputSymbols()}
   * @throws NoStartStateException if there is no start state
   */
  public abstract R run(List<String> word);

  /**
   * Is the result of a run accepting?
   */
  protected abstract boolean isAccepting(R result);

  /**
   * Add a state along with its outgoing transitions.
   *
   * @param name name of the state
   * @param targets one target per alphabet symbol, in alphabet order
   * @param starting is this the start state?
   * @param accepting is this an accepting state?
   * @return the new state
   * @throws DuplicateStartStateException if there already is a start state
   */
  public State addState(String name, List<T> targets, boolean starting, boolean accepting) {
    final State state = new State(name, starting, accepting);
    if (targets.size() != symbols.size()) {
      throw new IllegalArgumentException(
        "expected " + symbols.size() + " transition targets for state '" + name + "' but got " + targets.size()
      );
    }
    if (starting && startState != null) {
      throw new DuplicateStartStateException(startState.name(), name);
    }

    transitions().addState(state);
    try {
      transitions().setTransitionsForState(state, targets);
    } catch (RuntimeException e) {
      // A rejected row must not leave the state registered
      transitions().removeState(state);
      throw e;
    }
    if (starting) {
      startState = state;
    }
    return state;
  }

  /**
   * Add an ordinary state along with its outgoing transitions.
   *
   * @param name name of the state
   * @param targets one target per alphabet symbol, in alphabet order
   * @return the new state
   */
  public State addState(String name, List<T> targets) {
    return addState(name, targets, false, false);
  }

  @Override
  public List<String> alphabet() {
    return symbols;
  }

  @Override
  public Set<State> states() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(stateTable().states()));
  }

  /**
   * Look up a state by name.
   *
   * @param name name of the state
   * @return the state, if it is part of the automaton
   */
  public Optional<State> state(String name) {
    return stateTable().find(name).filter(states()::contains);
  }

  @Override
  public Optional<State> startState() {
    return Optional.ofNullable(startState);
  }

  @Override
  public Set<State> acceptingStates() {
    return states()
      .stream()
      .filter(State::accepting)
      .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  @Override
  public boolean accepts(List<String> word) {
    return isAccepting(run(word));
  }

  @Override
  public List<List<String>> acceptedWords(int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maximum word length must not be negative");
    }
    final List<String> inputs = inputSymbols();
    final List<List<String>> accepted = new ArrayList<>();

    // Words of the current length, in alphabet order
    List<List<String>> words = List.of(List.of());
    for (int length = 1; length <= maxLength; length++) {
      final List<List<String>> longer = new ArrayList<>(words.size() * inputs.size());
      for (List<String> prefix : words) {
        for (String symbol : inputs) {
          final List<String> word = new ArrayList<>(prefix.size() + 1);
          word.addAll(prefix);
          word.add(symbol);
          longer.add(Collections.unmodifiableList(word));
        }
      }
      words = longer;

      for (List<String> word : words) {
        if (accepts(word)) {
          accepted.add(word);
        }
      }
    }
    return accepted;
  }

  /**
   * Check a word can be run: all symbols are input symbols and there is a
   * start state.
   *
   * @param word word to check
   * @return the start state
   */
  protected State verifyWord(List<String> word) {
    final List<String> inputs = inputSymbols();
    for (String symbol : word) {
      if (!inputs.contains(symbol)) {
        throw new InvalidSymbolException(symbol, "invalid symbol '" + symbol + "' in word " + word);
      }
    }
    if (startState == null) {
      throw new NoStartStateException();
    }
    return startState;
  }

  /**
   * Split a string into one-character symbols, ignoring surrounding whitespace.
   *
   * @param word word as a string
   * @return symbols of the word
   */
  public static List<String> symbolsOf(String word) {
    return word
      .strip()
      .codePoints()
      .mapToObj(Character::toString)
      .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public Stream<DotGraph.Vertex<String>> vertices() {
    return states()
      .stream()
      .map(state -> new DotGraph.Vertex<>(state.name(), state.accepting()));
  }

  @Override
  public Stream<DotGraph.Edge<String, String>> edges() {
    final Stream<DotGraph.Edge<String, String>> initialEdge = startState()
      .stream()
      .map(start -> new DotGraph.Edge<String, String>(null, start.name(), null));
    final Stream<DotGraph.Edge<String, String>> transitionEdges = states()
      .stream()
      .flatMap(from -> symbols
        .stream()
        .flatMap(symbol -> transitions()
          .targetNames(from, symbol)
          .stream()
          .map(to -> new DotGraph.Edge<>(from.name(), to, symbol))
        )
      );
    return Stream.concat(initialEdge, transitionEdges);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(alphabet = " + symbols + ", states = " + states() + ")";
  }
}
