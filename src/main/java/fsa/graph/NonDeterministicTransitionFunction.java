package fsa.graph;

import fsa.State;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Transition function where every (state, symbol) pair maps to a (possibly
 * empty) set of target states.
 */
public final class NonDeterministicTransitionFunction extends TransitionFunction<Set<String>, Set<State>> {

  public NonDeterministicTransitionFunction(StateTable states, List<String> symbols) {
    super(states, symbols);
  }

  /**
   * Evaluate the transitions from a state with a symbol.
   *
   * @param state source state
   * @param symbol input symbol
   * @return target states (empty if there is no entry)
   * @throws fsa.DanglingTargetException if any target is not a live state
   */
  @Override
  public Set<State> evaluate(State state, String symbol) {
    final Set<String> targets = row(state).get(symbol);
    if (targets == null) {
      return Collections.emptySet();
    }
    final Set<State> resolved = new LinkedHashSet<>();
    for (String target : targets) {
      resolved.add(states.resolve(target));
    }
    return resolved;
  }

  @Override
  public Collection<String> targetNames(State state, String symbol) {
    final Set<String> targets = row(state).get(symbol);
    return targets == null ? Collections.emptySet() : targets;
  }

  @Override
  protected Set<String> normalize(Set<String> target) {
    for (String name : target) {
      if (name == null) {
        throw new IllegalArgumentException("transition targets must not contain null");
      }
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(target));
  }
}
