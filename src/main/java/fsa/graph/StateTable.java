package fsa.graph;

import fsa.DanglingTargetException;
import fsa.State;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Arena of states addressed by integer handles.
 *
 * <p>Handles are stable: a state keeps its handle until it is removed, at
 * which point the slot is tombstoned and never reused. A name can be
 * registered again after removal, but it then gets a fresh handle. Anything
 * still holding the old handle (or the old name) finds a tombstone and fails
 * loudly with a {@link DanglingTargetException}.
 */
public final class StateTable {

  /**
   * Slots indexed by handle, {@code null} for tombstones.
   */
  private final List<State> slots = new ArrayList<>();

  /**
   * Names of the slots (kept for tombstones too, for error messages).
   */
  private final List<String> slotNames = new ArrayList<>();

  /**
   * Live states only, in order of registration.
   */
  private final Map<String, Integer> handles = new LinkedHashMap<>();

  /**
   * Register a new state.
   *
   * @param state state to register
   * @return handle of the state
   * @throws IllegalArgumentException if a live state already has that name
   */
  public int add(State state) {
    if (handles.containsKey(state.name())) {
      throw new IllegalArgumentException("state '" + state.name() + "' is already defined");
    }
    final int handle = slots.size();
    slots.add(state);
    slotNames.add(state.name());
    handles.put(state.name(), handle);
    return handle;
  }

  /**
   * Tombstone the state with the given name.
   *
   * @param name name of a live state
   * @return handle the state had
   * @throws DanglingTargetException if there is no live state with that name
   */
  public int remove(String name) {
    final Integer handle = handles.remove(name);
    if (handle == null) {
      throw new DanglingTargetException(name);
    }
    slots.set(handle, null);
    return handle;
  }

  public boolean contains(String name) {
    return handles.containsKey(name);
  }

  /**
   * Look up the handle of a live state.
   *
   * @param name name of the state
   * @return handle, if the state is live
   */
  public OptionalInt handle(String name) {
    final Integer handle = handles.get(name);
    return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
  }

  /**
   * Dereference a handle.
   *
   * @param handle handle previously returned by {@link #add(State)}
   * @return live state
   * @throws DanglingTargetException if the handle has been tombstoned
   */
  public State get(int handle) {
    final State state = slots.get(handle);
    if (state == null) {
      throw new DanglingTargetException(slotNames.get(handle));
    }
    return state;
  }

  /**
   * Resolve a name into a live state.
   *
   * @param name name of the state
   * @return live state
   * @throws DanglingTargetException if no live state has that name
   */
  public State resolve(String name) {
    final Integer handle = handles.get(name);
    if (handle == null) {
      throw new DanglingTargetException(name);
    }
    return get(handle);
  }

  public Optional<State> find(String name) {
    final Integer handle = handles.get(name);
    return handle == null ? Optional.empty() : Optional.of(slots.get(handle));
  }

  /**
   * Live states, in order of registration.
   *
   * @return unmodifiable snapshot of the live states
   */
  public List<State> states() {
    return Collections.unmodifiableList(
      handles
        .values()
        .stream()
        .map(slots::get)
        .collect(Collectors.toList())
    );
  }

  public int size() {
    return handles.size();
  }

  @Override
  public String toString() {
    return "StateTable" + states();
  }
}
