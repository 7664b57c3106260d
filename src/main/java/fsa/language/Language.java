package fsa.language;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finite language, as a set of words.
 */
public final class Language {

  /**
   * Shortest words first, then in lexicographic order.
   */
  public static final Comparator<String> WORD_ORDER = Comparator
    .comparingInt(String::length)
    .thenComparing(Comparator.naturalOrder());

  private final Set<String> words;

  public Language(Collection<String> words) {
    this.words = Collections.unmodifiableSet(new HashSet<>(words));
  }

  public static Language of(String... words) {
    return new Language(Arrays.asList(words));
  }

  public Set<String> words() {
    return words;
  }

  public boolean contains(String word) {
    return words.contains(word);
  }

  /**
   * Concatenation of this language with another.
   *
   * @param other language of the suffixes
   * @return every word of this language followed by every word of {@code other}
   */
  public Language concat(Language other) {
    final Set<String> product = new HashSet<>();
    for (String prefix : words) {
      for (String suffix : other.words) {
        product.add(prefix + suffix);
      }
    }
    return new Language(product);
  }

  /**
   * Concatenation of {@code power} copies of this language.
   *
   * @param power number of copies
   * @return the language {@code {""}} if {@code power} is 0
   */
  public Language power(int power) {
    if (power < 0) {
      throw new IllegalArgumentException("power must not be negative: " + power);
    }
    Language result = of("");
    for (int i = 0; i < power; i++) {
      result = result.concat(this);
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Language other && words.equals(other.words);
  }

  @Override
  public int hashCode() {
    return words.hashCode();
  }

  @Override
  public String toString() {
    return words
      .stream()
      .sorted(WORD_ORDER)
      .collect(Collectors.joining(", ", "{", "}"));
  }
}
