package fsa.graph;

import fsa.State;
import fsa.UndefinedTransitionException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Transition function where every (state, symbol) pair maps to at most one
 * target state.
 *
 * <p>The owning automaton is expected to be complete over its alphabet, but
 * missing entries are tolerated until they are evaluated.
 */
public final class DeterministicTransitionFunction extends TransitionFunction<String, State> {

  public DeterministicTransitionFunction(StateTable states, List<String> symbols) {
    super(states, symbols);
  }

  /**
   * Evaluate the transition from a state with a symbol.
   *
   * @param state source state
   * @param symbol input symbol
   * @return target state
   * @throws UndefinedTransitionException if there is no entry for the pair
   * @throws fsa.DanglingTargetException if the target is not a live state
   */
  @Override
  public State evaluate(State state, String symbol) {
    final String target = row(state).get(symbol);
    if (target == null) {
      throw new UndefinedTransitionException(state.name(), symbol);
    }
    return states.resolve(target);
  }

  @Override
  public Collection<String> targetNames(State state, String symbol) {
    final String target = row(state).get(symbol);
    return target == null ? Collections.emptyList() : Collections.singletonList(target);
  }

  /**
   * Point dangling targets at their replacement.
   *
   * <p>Only targets which no longer resolve get rewritten: a live state
   * sharing a name with a key of {@code replacements} is left alone.
   *
   * @param replacements mapping from removed state names to new target names
   * @return number of rewritten transitions
   */
  public int redirectDangling(Map<String, String> replacements) {
    int redirected = 0;
    for (Map<String, String> row : liveRows().values()) {
      for (Map.Entry<String, String> entry : row.entrySet()) {
        final String target = entry.getValue();
        final String replacement = replacements.get(target);
        if (replacement != null && !states.contains(target)) {
          entry.setValue(replacement);
          redirected++;
        }
      }
    }
    return redirected;
  }

  @Override
  protected String normalize(String target) {
    return target;
  }
}
