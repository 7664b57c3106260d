package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Exhaustive word enumeration for language comparisons.
 */
public final class Words {

  private Words() { }

  /**
   * Every word over the alphabet of length 0 to {@code maxLength}.
   */
  public static List<List<String>> upTo(List<String> alphabet, int maxLength) {
    final List<List<String>> all = new ArrayList<>();
    List<List<String>> current = List.of(List.of());
    all.addAll(current);
    for (int length = 1; length <= maxLength; length++) {
      final List<List<String>> next = new ArrayList<>();
      for (List<String> prefix : current) {
        for (String symbol : alphabet) {
          final List<String> word = new ArrayList<>(prefix);
          word.add(symbol);
          next.add(word);
        }
      }
      all.addAll(next);
      current = next;
    }
    return all;
  }

  /**
   * Check two recognizers agree on every word up to some length.
   */
  public static void assertSameLanguage(
    List<String> alphabet,
    int maxLength,
    Predicate<List<String>> expected,
    Predicate<List<String>> actual
  ) {
    for (List<String> word : upTo(alphabet, maxLength)) {
      assertEquals(expected.test(word), actual.test(word), "disagreement on " + word);
    }
  }
}
