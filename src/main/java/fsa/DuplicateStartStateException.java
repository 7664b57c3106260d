package fsa;

/**
 * A second state was flagged as starting.
 */
public class DuplicateStartStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -1748937004522195028L;

  /**
   * Name of the start state already present.
   */
  public final String existingStart;

  /**
   * Name of the rejected state.
   */
  public final String rejectedStart;

  public DuplicateStartStateException(String existingStart, String rejectedStart) {
    super(
      "automaton can't have more than one start state ('" + existingStart
        + "' is already starting, rejected '" + rejectedStart + "')"
    );
    this.existingStart = existingStart;
    this.rejectedStart = rejectedStart;
  }
}
