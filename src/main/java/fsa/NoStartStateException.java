package fsa;

public class NoStartStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 4761038420193376215L;

  public NoStartStateException() {
    super("there is no starting state");
  }
}
