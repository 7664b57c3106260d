package fsa;

import fsa.graph.DeterministicTransitionFunction;
import fsa.graph.StateTable;
import fsa.graph.TransitionFunction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic finite automaton.
 *
 * <p>Every state should have exactly one target per alphabet symbol. Partial
 * automata can be built, but running into a missing transition raises an
 * {@link UndefinedTransitionException} rather than silently rejecting.
 */
public final class DeterministicAutomaton extends AbstractAutomaton<String, State> {

  private static final Logger LOG = LoggerFactory.getLogger(DeterministicAutomaton.class);

  /**
   * Prefix of the names given to merged states during minimization.
   */
  public static final String MERGED_STATE_PREFIX = "m";

  private StateTable stateTable;
  private DeterministicTransitionFunction transitionFunction;

  public DeterministicAutomaton(List<String> symbols) {
    super(symbols);
    this.stateTable = new StateTable();
    this.transitionFunction = new DeterministicTransitionFunction(stateTable, this.symbols);
  }

  @Override
  protected TransitionFunction<String, State> transitions() {
    return transitionFunction;
  }

  @Override
  protected StateTable stateTable() {
    return stateTable;
  }

  /**
   * Run the automaton on a word.
   *
   * @param word sequence of input symbols
   * @return state the run ends in
   * @throws UndefinedTransitionException if the run hits a missing transition
   * @throws DanglingTargetException if the run hits a transition to a removed state
   */
  @Override
  public State run(List<String> word) {
    State current = verifyWord(word);
    for (String symbol : word) {
      final State next = transitionFunction.evaluate(current, symbol);
      LOG.trace("{} --{}--> {}", current, symbol, next);
      current = next;
    }
    return current;
  }

  @Override
  protected boolean isAccepting(State result) {
    return result.accepting();
  }

  /**
   * Target of a transition.
   *
   * @param state source state
   * @param symbol input symbol
   * @return target state
   */
  public State transition(State state, String symbol) {
    return transitionFunction.evaluate(state, symbol);
  }

  @Override
  public String targetLabel(State state, String symbol) {
    return transitionFunction.target(state, symbol).orElse("-");
  }

  @Override
  public String tableTitle() {
    return "DF Automaton table";
  }

  /**
   * Deep copy of the automaton (states, transitions and start state).
   *
   * @return independent copy
   */
  public DeterministicAutomaton copy() {
    final var copy = new DeterministicAutomaton(symbols);
    for (State state : states()) {
      copy.addState(state.name(), transitionFunction.targets(state), state.starting(), state.accepting());
    }
    return copy;
  }

  /**
   * States reachable from the start state.
   *
   * @return reachable states, in breadth-first order
   * @throws EmptyAutomatonException if the automaton has no states
   * @throws NoStartStateException if there is no start state
   */
  public Set<State> reachableStates() {
    requireStart("explore");
    final Set<State> reached = new LinkedHashSet<>();
    final Deque<State> toVisit = new ArrayDeque<>();
    reached.add(startState);
    toVisit.add(startState);

    while (!toVisit.isEmpty()) {
      final State state = toVisit.poll();
      for (String symbol : symbols) {
        final State target = transitionFunction.evaluate(state, symbol);
        if (reached.add(target)) {
          toVisit.add(target);
        }
      }
    }
    return reached;
  }

  /**
   * Delete every state which can't be reached from the start state.
   *
   * <p>Only unreachable states point at unreachable states, so no live
   * transition is left dangling.
   *
   * @return removed states (empty if nothing was removed)
   */
  public Set<State> removeUnreachableStates() {
    final Set<State> reachable = reachableStates();
    final Set<State> removed = new LinkedHashSet<>();
    for (State state : states()) {
      if (!reachable.contains(state)) {
        transitionFunction.removeState(state);
        removed.add(state);
      }
    }
    if (!removed.isEmpty()) {
      LOG.debug("Removed unreachable states {}", removed);
    }
    return removed;
  }

  /**
   * Partition the reachable states into classes of equivalent states.
   *
   * <p>The automaton itself is not modified.
   *
   * @return equivalence classes (singletons included), ordered by their first member
   */
  public List<SortedSet<String>> equivalenceClasses() {
    final var work = copy();
    work.removeUnreachableStates();
    return work.refinedPartition();
  }

  /**
   * Minimize the automaton in place.
   *
   * <p>Unreachable states are removed and each class of equivalent states is
   * merged into one state named {@code m0}, {@code m1}, ... The work happens on
   * a copy which replaces the contents of this automaton only once every step
   * succeeded, so a failure (for instance a missing transition) leaves the
   * automaton as it was.
   *
   * @return this automaton
   * @throws EmptyAutomatonException if the automaton has no states
   * @throws NoStartStateException if there is no start state
   * @throws UndefinedTransitionException if a reachable state lacks a transition
   */
  public DeterministicAutomaton minimize() {
    requireStart("minimize");
    final var work = copy();
    work.removeUnreachableStates();
    work.mergeEquivalentStates(work.refinedPartition());

    this.stateTable = work.stateTable;
    this.transitionFunction = work.transitionFunction;
    this.startState = work.startState;
    return this;
  }

  /**
   * Minimized copy of the automaton.
   *
   * @return new minimal automaton accepting the same language
   */
  public DeterministicAutomaton minimized() {
    return copy().minimize();
  }

  /**
   * Hopcroft's partition refinement.
   *
   * <p>The initial partition separates accepting from non-accepting states.
   * A block is split whenever some states in it move into a splitter block on
   * a symbol and others don't. When the split block is not pending in the
   * worklist, only the smaller half is queued (the first half on ties).
   *
   * @return the coarsest partition compatible with acceptance and transitions
   */
  private List<SortedSet<String>> refinedPartition() {

    // Keys are symbols, then target states, values are source states
    final Map<String, Map<String, Set<String>>> reversedTransitions = new HashMap<>();
    for (State from : states()) {
      for (String symbol : symbols) {
        final State to = transitionFunction.evaluate(from, symbol);
        reversedTransitions
          .computeIfAbsent(symbol, k -> new HashMap<>())
          .computeIfAbsent(to.name(), k -> new HashSet<>())
          .add(from.name());
      }
    }

    // Set up initial partition
    final List<SortedSet<String>> partition = new ArrayList<>();
    final SortedSet<String> accepting = new TreeSet<>();
    final SortedSet<String> rejecting = new TreeSet<>();
    for (State state : states()) {
      (state.accepting() ? accepting : rejecting).add(state.name());
    }
    if (!accepting.isEmpty()) {
      partition.add(accepting);
    }
    if (!rejecting.isEmpty()) {
      partition.add(rejecting);
    }

    // Worklist
    final Deque<SortedSet<String>> toVisit = new ArrayDeque<>(partition);

    while (!toVisit.isEmpty()) {
      final SortedSet<String> splitter = toVisit.poll();

      for (String symbol : symbols) {
        final Map<String, Set<String>> reversed = reversedTransitions.getOrDefault(symbol, Collections.emptyMap());

        // States moving into the splitter on this symbol
        final Set<String> preImage = new HashSet<>();
        for (String state : splitter) {
          preImage.addAll(reversed.getOrDefault(state, Collections.emptySet()));
        }
        if (preImage.isEmpty()) {
          continue;
        }

        // Blocks appended during this pass are already split along `preImage`
        final int blockCount = partition.size();
        for (int i = 0; i < blockCount; i++) {
          final SortedSet<String> block = partition.get(i);
          final SortedSet<String> inPreImage = new TreeSet<>();
          final SortedSet<String> notInPreImage = new TreeSet<>();
          for (String state : block) {
            (preImage.contains(state) ? inPreImage : notInPreImage).add(state);
          }

          // Skip to the next block if no refinement is needed
          if (inPreImage.isEmpty() || notInPreImage.isEmpty()) {
            continue;
          }

          // Update partition
          partition.set(i, inPreImage);
          partition.add(notInPreImage);

          // Update worklist
          if (toVisit.remove(block)) {
            toVisit.add(inPreImage);
            toVisit.add(notInPreImage);
          } else if (inPreImage.size() <= notInPreImage.size()) {
            toVisit.add(inPreImage);
          } else {
            toVisit.add(notInPreImage);
          }
        }
      }
    }

    partition.sort(Comparator.comparing(SortedSet::first));
    LOG.debug("Refined partition {}", partition);
    return partition;
  }

  /**
   * Merge every class of more than one state into a single fresh state.
   *
   * @param partition equivalence classes of the states
   */
  private void mergeEquivalentStates(List<SortedSet<String>> partition) {
    int ordinal = 0;
    for (SortedSet<String> equivalenceClass : partition) {
      if (equivalenceClass.size() < 2) {
        continue;
      }

      // Fresh name for the merged state
      String mergedName;
      do {
        mergedName = MERGED_STATE_PREFIX + ordinal++;
      } while (stateTable.contains(mergedName));

      // Outgoing transitions come from any member (they agree up to equivalence)
      final State representative = stateTable.resolve(equivalenceClass.first());
      final List<String> targets = new ArrayList<>(symbols.size());
      for (String target : transitionFunction.targets(representative)) {
        targets.add(equivalenceClass.contains(target) ? mergedName : target);
      }

      boolean starting = false;
      boolean accepting = false;
      final Map<String, String> replacements = new LinkedHashMap<>();
      for (String member : equivalenceClass) {
        final State state = stateTable.resolve(member);
        starting |= state.starting();
        accepting |= state.accepting();
        if (state.equals(startState)) {
          startState = null;
        }
        transitionFunction.removeState(state);
        replacements.put(member, mergedName);
      }

      addState(mergedName, targets, starting, accepting);
      final int redirected = transitionFunction.redirectDangling(replacements);
      LOG.debug(
        "Merged {} into {} (redirected {} transitions)",
        equivalenceClass,
        mergedName,
        redirected
      );
    }
  }

  private void requireStart(String operation) {
    if (stateTable.size() == 0) {
      throw new EmptyAutomatonException(operation);
    }
    if (startState == null) {
      throw new NoStartStateException();
    }
  }

  /**
   * Names of the states, sorted.
   *
   * @return sorted state names
   */
  public SortedSet<String> stateNames() {
    return states()
      .stream()
      .map(State::name)
      .collect(Collectors.toCollection(TreeSet::new));
  }
}
