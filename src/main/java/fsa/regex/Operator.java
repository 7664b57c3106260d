package fsa.regex;

/**
 * Operator of a regular expression, as seen by the postfix converter.
 *
 * @param symbol character of the operator
 * @param precedence binding strength (higher binds tighter)
 * @param leftAssociative do equal-precedence operators group to the left?
 * @param unary is this a postfix unary operator (like Kleene star)?
 */
public record Operator(char symbol, int precedence, boolean leftAssociative, boolean unary) {

  public static Operator binary(char symbol, int precedence) {
    return new Operator(symbol, precedence, true, false);
  }

  public static Operator postfix(char symbol, int precedence) {
    return new Operator(symbol, precedence, true, true);
  }
}
