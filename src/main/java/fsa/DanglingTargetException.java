package fsa;

/**
 * A transition points at a state name which is not (or no longer) part of the
 * automaton.
 */
public class DanglingTargetException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -3398671282104583551L;

  /**
   * Target name which could not be resolved.
   */
  public final String targetName;

  public DanglingTargetException(String targetName) {
    super("state with name '" + targetName + "' is not defined");
    this.targetName = targetName;
  }
}
