package fsa.grammar;

import java.text.ParseException;

/**
 * A line of grammar text is not a production rule.
 */
public class MalformedProductionException extends ParseException {

  @java.io.Serial
  private static final long serialVersionUID = 2873154190447130823L;

  /**
   * Offending line.
   */
  public final String line;

  public MalformedProductionException(String line, String message, int errorOffset) {
    super(message + " in '" + line + "'", errorOffset);
    this.line = line;
  }
}
