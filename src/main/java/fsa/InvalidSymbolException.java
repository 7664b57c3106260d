package fsa;

/**
 * A symbol is outside of the alphabet of the automaton (or is reserved).
 */
public class InvalidSymbolException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -6022317406283311275L;

  /**
   * Offending symbol.
   */
  public final String symbol;

  public InvalidSymbolException(String symbol, String message) {
    super(message);
    this.symbol = symbol;
  }
}
