package fsa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-deterministic finite automaton with epsilon moves.
 *
 * <p>The alphabet given at construction gets the reserved symbol
 * {@value #EPSILON} appended, so every state lists its epsilon targets last.
 * Epsilon closures are recomputed after every added state.
 */
public final class EpsilonNonDeterministicAutomaton extends NonDeterministicAutomaton {

  private static final Logger LOG = LoggerFactory.getLogger(EpsilonNonDeterministicAutomaton.class);

  /**
   * Reserved symbol for epsilon moves.
   */
  public static final String EPSILON = "e";

  /**
   * Epsilon closure of every registered state (the null state included).
   *
   * <p>{@code null} while some epsilon move targets a state that has not been
   * added yet.
   */
  private Map<String, NameSet> closures;

  /**
   * Input symbols, without {@link #EPSILON}.
   */
  private final List<String> inputSymbols;

  /**
   * Create an automaton with epsilon moves.
   *
   * @param symbols input symbols (must not contain {@value #EPSILON})
   * @throws InvalidSymbolException if {@code symbols} contains {@value #EPSILON}
   */
  public EpsilonNonDeterministicAutomaton(List<String> symbols) {
    super(withEpsilon(symbols));
    this.inputSymbols = List.copyOf(symbols);
    recomputeClosures();
  }

  private static List<String> withEpsilon(List<String> symbols) {
    if (symbols.contains(EPSILON)) {
      throw new InvalidSymbolException(EPSILON, "symbol '" + EPSILON + "' is reserved for epsilon moves");
    }
    final List<String> extended = new ArrayList<>(symbols);
    extended.add(EPSILON);
    return extended;
  }

  /**
   * Add a state along with its outgoing transitions.
   *
   * @param name name of the state
   * @param targets one set of targets per input symbol, then the epsilon targets
   * @param starting is this the start state?
   * @param accepting is this an accepting state?
   * @return the new state
   */
  @Override
  public State addState(String name, List<Set<String>> targets, boolean starting, boolean accepting) {
    final State state = super.addState(name, targets, starting, accepting);
    recomputeClosures();
    return state;
  }

  @Override
  public List<String> inputSymbols() {
    return inputSymbols;
  }

  @Override
  public String tableTitle() {
    return "e-NF Automaton table";
  }

  /**
   * Run the automaton on a word, taking every epsilon move available before
   * and after each symbol.
   *
   * @param word sequence of input symbols (without {@value #EPSILON})
   * @return set of states the run ends in
   * @throws DanglingTargetException if an epsilon move still targets a missing state
   */
  @Override
  public Set<State> run(List<String> word) {
    Set<State> current = closure(Set.of(verifyWord(word)));
    for (String symbol : word) {
      current = closure(step(current, symbol));
    }
    return current;
  }

  /**
   * Epsilon closure of a single state.
   *
   * @param state state of the automaton
   * @return states reachable with zero or more epsilon moves, {@code state} included
   * @throws DanglingTargetException if {@code state} is not part of the automaton
   */
  public Set<State> closure(State state) {
    return new LinkedHashSet<>(resolve(closureOf(closures(), state)));
  }

  /**
   * Union of the epsilon closures of some states.
   *
   * @param states states of the automaton
   * @return states reachable from any of {@code states} with zero or more epsilon moves
   * @throws DanglingTargetException if one of {@code states} is not part of the automaton
   */
  public Set<State> closure(Collection<State> states) {
    final Map<String, NameSet> closures = closures();
    final Set<State> result = new LinkedHashSet<>();
    for (State state : states) {
      result.addAll(resolve(closureOf(closures, state)));
    }
    return result;
  }

  /**
   * Remove the epsilon moves.
   *
   * <p>Each state keeps its name and start flag. On a symbol, it moves to
   * the closure of everything its own closure moves to, and it accepts if
   * anything in its closure accepts.
   *
   * @return equivalent automaton without epsilon moves
   */
  public NonDeterministicAutomaton toNfa() {
    final var nfa = new NonDeterministicAutomaton(inputSymbols);
    for (State state : states()) {
      final Set<State> stateClosure = closure(state);
      final List<Set<String>> targets = new ArrayList<>(inputSymbols.size());
      for (String symbol : inputSymbols) {
        targets.add(
          closure(step(stateClosure, symbol))
            .stream()
            .map(State::name)
            .collect(Collectors.toCollection(LinkedHashSet::new))
        );
      }
      final boolean accepting = stateClosure.stream().anyMatch(State::accepting);
      nfa.addState(state.name(), targets, state.starting(), accepting);
    }
    return nfa;
  }

  /**
   * Convert into a DFA, by removing epsilon moves then using subset
   * construction.
   *
   * @param naming how to name the states of the DFA
   * @return equivalent deterministic automaton
   */
  @Override
  public DeterministicAutomaton toDfa(StateNaming naming) {
    return toNfa().toDfa(naming);
  }

  /**
   * Closures, computed now if they could not be computed eagerly.
   *
   * @throws DanglingTargetException if an epsilon move targets a missing state
   */
  private Map<String, NameSet> closures() {
    if (closures == null) {
      closures = computeClosures();
    }
    return closures;
  }

  private static NameSet closureOf(Map<String, NameSet> closures, State state) {
    final NameSet closure = closures.get(state.name());
    if (closure == null) {
      throw new DanglingTargetException(state.name());
    }
    return closure;
  }

  /**
   * Recompute all closures, or leave them unset if some epsilon target is a
   * forward reference to a state not added yet.
   */
  private void recomputeClosures() {
    final Optional<String> missing = stateTable()
      .states()
      .stream()
      .flatMap(state -> targetNames(state, EPSILON).stream())
      .filter(name -> !stateTable().contains(name))
      .findFirst();
    if (missing.isPresent()) {
      LOG.debug("Deferring epsilon closures until state '{}' is added", missing.get());
      closures = null;
    } else {
      closures = computeClosures();
    }
  }

  /**
   * Compute the closure of every state by work-list propagation.
   *
   * <p>A state is pushed at most once per closure, so cycles of epsilon moves
   * terminate.
   */
  private Map<String, NameSet> computeClosures() {
    final Map<String, NameSet> computed = new HashMap<>();
    for (State state : stateTable().states()) {
      final Set<String> closure = new LinkedHashSet<>();
      final Deque<String> toVisit = new ArrayDeque<>();
      closure.add(state.name());
      toVisit.push(state.name());

      while (!toVisit.isEmpty()) {
        final State next = stateTable().resolve(toVisit.pop());
        for (String target : targetNames(next, EPSILON)) {
          if (closure.add(target)) {
            toVisit.push(target);
          }
        }
      }
      computed.put(state.name(), new NameSet(closure));
    }
    LOG.debug("Epsilon closures {}", computed);
    return Collections.unmodifiableMap(computed);
  }
}
