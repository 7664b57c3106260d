package fsa.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Production {@code start -> target} of a context-free grammar.
 *
 * <p>Every character of {@code target} is one symbol, so an empty target is
 * an epsilon production.
 *
 * @param start non-terminal on the left side
 * @param target symbols on the right side
 */
public record ProductionRule(String start, String target) {

  /**
   * Separators accepted between the two sides of a production.
   */
  public static final Pattern SEPARATOR = Pattern.compile("->|🠖");

  public ProductionRule {
    if (start.isEmpty()) {
      throw new IllegalArgumentException("production must have a non-terminal on its left side");
    }
  }

  /**
   * Symbol at some position of the right side.
   *
   * @param position index of the symbol
   * @return symbol at {@code position}
   */
  public String symbolAt(int position) {
    return String.valueOf(target.charAt(position));
  }

  /**
   * Parse a line such as {@code S -> aS | b} into one rule per alternative.
   *
   * <p>Whitespace on the right side is ignored.
   *
   * @param line text of the productions
   * @return one rule per alternative, in order
   * @throws MalformedProductionException if there is no separator or no left side
   */
  public static List<ProductionRule> fromString(String line) throws MalformedProductionException {
    final Matcher separator = SEPARATOR.matcher(line);
    if (!separator.find()) {
      throw new MalformedProductionException(line, "missing '->' separator", 0);
    }
    final String start = line.substring(0, separator.start()).strip();
    if (start.isEmpty()) {
      throw new MalformedProductionException(line, "missing left side", separator.start());
    }
    final String right = line.substring(separator.end());
    if (SEPARATOR.matcher(right).find()) {
      throw new MalformedProductionException(line, "more than one separator", separator.end());
    }

    final List<ProductionRule> rules = new ArrayList<>();
    for (String alternative : right.split("\\|", -1)) {
      rules.add(new ProductionRule(start, alternative.replaceAll("\\s+", "")));
    }
    return rules;
  }

  @Override
  public String toString() {
    return start + "🠖" + target;
  }
}
