package fsa;

/**
 * Base class of all errors raised by the automaton engine.
 *
 * <p>None of these are recoverable inside the engine: they propagate straight
 * to the caller of the operation that triggered them.
 */
public class AutomatonException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = 2911735069201374422L;

  public AutomatonException(String message) {
    super(message);
  }
}
