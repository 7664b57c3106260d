package fsa;

/**
 * State of a finite automaton.
 *
 * <p>States compare by name and by both role flags, so two states sharing a
 * name but differing in roles are distinct. An automaton should only ever use
 * one canonical {@code State} per name.
 *
 * @param name name, unique inside the owning automaton
 * @param starting is this the (single) start state?
 * @param accepting is this an accepting state?
 */
public record State(String name, boolean starting, boolean accepting) {

  public State {
    if (name == null) {
      throw new IllegalArgumentException("state name must not be null");
    }
  }

  /**
   * Ordinary state with no roles.
   *
   * @param name name of the state
   * @return state which is neither starting nor accepting
   */
  public static State of(String name) {
    return new State(name, false, false);
  }

  /**
   * Render the state as {@code >name*}, where the prefix marks the start state
   * and the suffix marks an accepting state.
   */
  @Override
  public String toString() {
    return (starting ? ">" : "") + name + (accepting ? "*" : "");
  }
}
