package fsa.grammar.earley;

import fsa.grammar.ProductionRule;

/**
 * Earley situation: a production with a dot, recognized from one position of
 * the word up to another.
 *
 * @param start left side of the production
 * @param target right side of the production
 * @param h position in the word where recognition of the production started
 * @param i position in the word reached so far
 * @param p position of the dot in {@code target}
 */
public record EarleySituation(String start, String target, int h, int i, int p) {

  /**
   * Situation predicting a production at some position.
   */
  static EarleySituation predict(ProductionRule rule, int position) {
    return new EarleySituation(rule.start(), rule.target(), position, position, 0);
  }

  /**
   * Is the dot at the end of the production?
   */
  public boolean isComplete() {
    return p == target.length();
  }

  /**
   * Symbol right after the dot.
   *
   * @throws IllegalStateException if the situation is complete
   */
  public String nextSymbol() {
    if (isComplete()) {
      throw new IllegalStateException("situation " + this + " is complete");
    }
    return String.valueOf(target.charAt(p));
  }

  /**
   * Same situation with the dot moved over one symbol.
   *
   * @param reached position in the word reached after that symbol
   */
  public EarleySituation advance(int reached) {
    return new EarleySituation(start, target, h, reached, p + 1);
  }

  @Override
  public String toString() {
    return start + "🠖" + target.substring(0, p) + "⚫" + target.substring(p) + " [" + h + ", " + i + "]";
  }
}
