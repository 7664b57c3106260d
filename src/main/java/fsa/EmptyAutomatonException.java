package fsa;

public class EmptyAutomatonException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 5092218713870066243L;

  public EmptyAutomatonException(String operation) {
    super("can't " + operation + " an automaton without states");
  }
}
