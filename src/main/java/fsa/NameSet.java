package fsa;

import java.util.Arrays;
import java.util.Collection;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of state names, usable as a map key.
 *
 * <p>Elements are kept sorted, so two sets with the same members are equal
 * (and hash the same) no matter the order in which the members were found.
 */
public final class NameSet {

  // Sorted and distinct elements
  private final String[] elements;

  public static NameSet of(String... names) {
    return new NameSet(Arrays.asList(names));
  }

  public static NameSet ofStates(Collection<State> states) {
    return new NameSet(states.stream().map(State::name).collect(Collectors.toList()));
  }

  public NameSet(Collection<String> names) {
    this.elements = new TreeSet<String>(names).toArray(new String[0]);
  }

  public Stream<String> stream() {
    return Arrays.stream(elements);
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(String name) {
    return Arrays.binarySearch(elements, name) >= 0;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof NameSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((NameSet) obj).elements);
    }
  }

  /**
   * Render as {@code {a, b}}, or as {@code ∅} for the empty set.
   */
  @Override
  public String toString() {
    if (elements.length == 0) {
      return NonDeterministicAutomaton.NULL_STATE_NAME;
    }
    return Arrays
      .stream(elements)
      .collect(Collectors.joining(", ", "{", "}"));
  }
}
