package fsa.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of production rules.
 */
public final class ProductionList {

  private static final Logger LOG = LoggerFactory.getLogger(ProductionList.class);

  private final List<ProductionRule> productions = new ArrayList<>();

  public void addProductions(Collection<ProductionRule> rules) {
    productions.addAll(rules);
  }

  public List<ProductionRule> productions() {
    return Collections.unmodifiableList(productions);
  }

  /**
   * Productions with a given left side.
   *
   * @param symbol non-terminal
   * @return productions of {@code symbol}, in order
   */
  public List<ProductionRule> productionsFor(String symbol) {
    return productions
      .stream()
      .filter(rule -> rule.start().equals(symbol))
      .collect(Collectors.toList());
  }

  public ProductionList copy() {
    final var copy = new ProductionList();
    copy.addProductions(productions);
    return copy;
  }

  /**
   * Parse productions, one line of alternatives at a time.
   *
   * <p>Lines which are not productions (blank lines included) are skipped.
   *
   * @param text grammar text
   * @return productions of every well-formed line
   */
  public static ProductionList fromString(String text) {
    final var list = new ProductionList();
    for (String line : text.split("\\R")) {
      try {
        list.addProductions(ProductionRule.fromString(line));
      } catch (MalformedProductionException e) {
        LOG.debug("Skipping line: {}", e.getMessage());
      }
    }
    return list;
  }

  @Override
  public String toString() {
    return productions
      .stream()
      .map(ProductionRule::toString)
      .collect(Collectors.joining(", "));
  }
}
