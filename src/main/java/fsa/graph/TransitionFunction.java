package fsa.graph;

import fsa.DanglingTargetException;
import fsa.State;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relation from (state, symbol) pairs to targets.
 *
 * <p>Rows are keyed by the handle of their source state in the shared
 * {@link StateTable}, while targets are stored by name. This lets a state
 * refer to targets which have not been added yet (they are only resolved when
 * the function is evaluated) and it means removing a state never leaves a
 * strong reference behind: a stale target name simply stops resolving.
 *
 * @param <T> stored target (a name, or a set of names)
 * @param <R> resolved target (a state, or a set of states)
 */
public abstract class TransitionFunction<T, R> {

  /**
   * States known to the owning automaton.
   */
  protected final StateTable states;

  /**
   * Ordered input symbols.
   */
  protected final List<String> symbols;

  /**
   * Outgoing transitions, indexed by the handle of the source state.
   */
  private final Map<Integer, Map<String, T>> rows = new HashMap<>();

  protected TransitionFunction(StateTable states, List<String> symbols) {
    this.states = states;
    this.symbols = List.copyOf(symbols);
  }

  /**
   * Register a state, with no outgoing transitions yet.
   *
   * @param state new state
   */
  public void addState(State state) {
    final int handle = states.add(state);
    rows.put(handle, new HashMap<>());
  }

  /**
   * Remove a state and its outgoing transitions.
   *
   * <p>Transitions of other states pointing at the removed state are left
   * alone: they become dangling and fail when evaluated.
   *
   * @param state state to remove
   */
  public void removeState(State state) {
    rows.remove(states.remove(state.name()));
  }

  /**
   * Bind the outgoing transitions of a state, one target per symbol.
   *
   * @param state source state
   * @param targets targets in the same order as the symbols ({@code null} for no transition)
   */
  public void setTransitionsForState(State state, List<T> targets) {
    if (targets.size() != symbols.size()) {
      throw new IllegalArgumentException(
        "expected " + symbols.size() + " transition targets for state '" + state.name()
          + "' but got " + targets.size()
      );
    }
    final Map<String, T> row = row(state);
    for (int i = 0; i < symbols.size(); i++) {
      final T target = targets.get(i);
      if (target == null) {
        row.remove(symbols.get(i));
      } else {
        row.put(symbols.get(i), normalize(target));
      }
    }
  }

  /**
   * Bind a single transition.
   *
   * @param state source state
   * @param symbol input symbol
   * @param target target ({@code null} removes the transition)
   */
  public void setTransition(State state, String symbol, T target) {
    if (!symbols.contains(symbol)) {
      throw new IllegalArgumentException("symbol '" + symbol + "' is not in " + symbols);
    }
    if (target == null) {
      row(state).remove(symbol);
    } else {
      row(state).put(symbol, normalize(target));
    }
  }

  /**
   * Stored (unresolved) target.
   *
   * @param state source state
   * @param symbol input symbol
   * @return stored target, if there is an entry
   */
  public Optional<T> target(State state, String symbol) {
    return Optional.ofNullable(row(state).get(symbol));
  }

  /**
   * Stored targets of a state, in symbol order.
   *
   * @param state source state
   * @return list with one entry per symbol ({@code null} where there is no entry)
   */
  public List<T> targets(State state) {
    final Map<String, T> row = row(state);
    final List<T> targets = new ArrayList<>(symbols.size());
    for (String symbol : symbols) {
      targets.add(row.get(symbol));
    }
    return Collections.unmodifiableList(targets);
  }

  /**
   * Names referenced by one entry (useful for rendering and graph walks).
   *
   * @param state source state
   * @param symbol input symbol
   * @return referenced names, possibly empty
   */
  public abstract Collection<String> targetNames(State state, String symbol);

  /**
   * Evaluate the function, resolving target names against the live states.
   *
   * @param state source state
   * @param symbol input symbol
   * @return resolved target
   */
  public abstract R evaluate(State state, String symbol);

  /**
   * Copy a target before storing it, so that callers can't mutate it.
   */
  protected abstract T normalize(T target);

  /**
   * Row of transitions for a live state.
   */
  protected final Map<String, T> row(State state) {
    final int handle = states
      .handle(state.name())
      .orElseThrow(() -> new DanglingTargetException(state.name()));
    return rows.get(handle);
  }

  /**
   * Every row of a live state, keyed by its source state.
   */
  protected final Map<State, Map<String, T>> liveRows() {
    final Map<State, Map<String, T>> live = new LinkedHashMap<>();
    for (State state : states.states()) {
      live.put(state, row(state));
    }
    return live;
  }

  public List<String> symbols() {
    return symbols;
  }
}
