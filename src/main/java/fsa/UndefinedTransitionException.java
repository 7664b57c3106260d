package fsa;

/**
 * A deterministic transition function has no entry for a state and symbol.
 */
public class UndefinedTransitionException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 8150330994475873019L;

  public final String stateName;
  public final String symbol;

  public UndefinedTransitionException(String stateName, String symbol) {
    super("no transition defined from state '" + stateName + "' with symbol '" + symbol + "'");
    this.stateName = stateName;
    this.symbol = symbol;
  }
}
