package fsa;

import fsa.graph.NonDeterministicTransitionFunction;
import fsa.graph.StateTable;
import fsa.graph.TransitionFunction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-deterministic finite automaton.
 *
 * <p>Each (state, symbol) pair maps to a set of targets. A missing entry is the
 * same as an empty set of targets, which is displayed as the null state
 * {@value #NULL_STATE_NAME}.
 */
public class NonDeterministicAutomaton extends AbstractAutomaton<Set<String>, Set<State>> {

  private static final Logger LOG = LoggerFactory.getLogger(NonDeterministicAutomaton.class);

  /**
   * Name of the null state, reserved in every non-deterministic automaton.
   */
  public static final String NULL_STATE_NAME = "∅";

  private final StateTable stateTable = new StateTable();
  private final NonDeterministicTransitionFunction transitionFunction;

  /**
   * Sink with no roles and no outgoing transitions, standing for the empty
   * set of targets. It is registered like any other state, but it is not
   * listed in {@link #states()}.
   */
  private final State nullState = State.of(NULL_STATE_NAME);

  public NonDeterministicAutomaton(List<String> symbols) {
    super(symbols);
    this.transitionFunction = new NonDeterministicTransitionFunction(stateTable, this.symbols);
    transitionFunction.addState(nullState);
  }

  @Override
  protected TransitionFunction<Set<String>, Set<State>> transitions() {
    return transitionFunction;
  }

  @Override
  protected StateTable stateTable() {
    return stateTable;
  }

  public State nullState() {
    return nullState;
  }

  @Override
  public Set<State> states() {
    return stateTable
      .states()
      .stream()
      .filter(state -> !state.equals(nullState))
      .collect(Collectors.collectingAndThen(Collectors.toCollection(LinkedHashSet::new), Collections::unmodifiableSet));
  }

  /**
   * Run the automaton on a word.
   *
   * @param word sequence of input symbols
   * @return set of states the run ends in
   */
  @Override
  public Set<State> run(List<String> word) {
    Set<State> current = Set.of(verifyWord(word));
    for (String symbol : word) {
      final Set<State> next = step(current, symbol);
      LOG.trace("{} --{}--> {}", current, symbol, next);
      current = next;
    }
    return current;
  }

  @Override
  protected boolean isAccepting(Set<State> result) {
    return result.stream().anyMatch(State::accepting);
  }

  /**
   * Union of the targets of a set of states on one symbol.
   *
   * @param states source states
   * @param symbol input symbol
   * @return every state reachable from one of {@code states} on {@code symbol}
   */
  public Set<State> step(Collection<State> states, String symbol) {
    final Set<State> next = new LinkedHashSet<>();
    for (State state : states) {
      next.addAll(transitionFunction.evaluate(state, symbol));
    }
    return next;
  }

  /**
   * Targets of a state on one symbol.
   *
   * @param state source state
   * @param symbol input symbol
   * @return target states, possibly empty
   */
  public Set<State> transition(State state, String symbol) {
    return transitionFunction.evaluate(state, symbol);
  }

  @Override
  public String targetLabel(State state, String symbol) {
    final var targets = transitionFunction.targetNames(state, symbol);
    if (targets.isEmpty()) {
      return NULL_STATE_NAME;
    }
    return targets.stream().collect(Collectors.joining(", ", "{", "}"));
  }

  @Override
  public String tableTitle() {
    return "NF Automaton table";
  }

  /**
   * Convert into a DFA using subset construction, naming states {@code s0},
   * {@code s1}, ...
   *
   * @return equivalent deterministic automaton
   */
  public DeterministicAutomaton toDfa() {
    return toDfa(StateNaming.SEQUENTIAL);
  }

  /**
   * Convert into a DFA using subset construction.
   *
   * <p>Sets of states are explored breadth-first from the singleton set of the
   * start state. Each set reached becomes one DFA state, in the order in which
   * it was first seen (the empty set, if it is reached, is a rejecting sink).
   * Only reachable sets are built, so the result has no unreachable states.
   *
   * @param naming how to name the states of the DFA
   * @return equivalent deterministic automaton
   * @throws NoStartStateException if there is no start state
   */
  public DeterministicAutomaton toDfa(StateNaming naming) {
    if (startState == null) {
      throw new NoStartStateException();
    }
    final List<String> inputs = inputSymbols();

    // All `NameSet`s here are power set states
    final Map<NameSet, List<NameSet>> images = new LinkedHashMap<>();
    final Set<NameSet> seenStates = new HashSet<>();
    final Deque<NameSet> toVisit = new ArrayDeque<>();

    final NameSet initialState = NameSet.of(startState.name());
    seenStates.add(initialState);
    toVisit.add(initialState);

    while (!toVisit.isEmpty()) {
      final NameSet powerState = toVisit.poll();
      final List<State> members = resolve(powerState);

      final List<NameSet> targets = new ArrayList<>(inputs.size());
      for (String symbol : inputs) {
        final NameSet target = NameSet.ofStates(step(members, symbol));
        targets.add(target);
        if (seenStates.add(target)) {
          toVisit.add(target);
        }
      }
      images.put(powerState, targets);
    }

    // Name the power set states in the order they were visited
    final Map<NameSet, String> names = new HashMap<>();
    int index = 0;
    for (NameSet powerState : images.keySet()) {
      final String name = naming == StateNaming.SEQUENTIAL ? "s" + index : powerState.toString();
      names.put(powerState, name);
      index++;
    }
    LOG.debug("Subset construction named states {}", names);

    final var dfa = new DeterministicAutomaton(inputs);
    boolean first = true;
    for (Map.Entry<NameSet, List<NameSet>> entry : images.entrySet()) {
      final NameSet powerState = entry.getKey();
      final List<String> targets = entry
        .getValue()
        .stream()
        .map(names::get)
        .collect(Collectors.toList());
      final boolean accepting = resolve(powerState).stream().anyMatch(State::accepting);
      dfa.addState(names.get(powerState), targets, first, accepting);
      first = false;
    }
    return dfa;
  }

  /**
   * Resolve a set of names into live states.
   */
  protected final List<State> resolve(NameSet names) {
    return names
      .stream()
      .map(stateTable::resolve)
      .collect(Collectors.toList());
  }

  /**
   * Stored targets of a state on one symbol, without resolving them.
   */
  protected final Collection<String> targetNames(State state, String symbol) {
    return transitionFunction.targetNames(state, symbol);
  }
}
