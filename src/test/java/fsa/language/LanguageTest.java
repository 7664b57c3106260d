package fsa.language;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class LanguageTest {

  @Test
  public void concatenation() {
    assertEquals(
      Language.of("ac", "ad", "bc", "bd"),
      Language.of("a", "b").concat(Language.of("c", "d"))
    );
    assertEquals(Language.of(), Language.of("a").concat(Language.of()));
  }

  @Test
  public void powers() {
    final var language = Language.of("a", "b");
    assertEquals(Language.of(""), language.power(0));
    assertEquals(language, language.power(1));
    assertEquals(Language.of("aa", "ab", "ba", "bb"), language.power(2));
    assertEquals(8, language.power(3).words().size());
    assertThrows(IllegalArgumentException.class, () -> language.power(-1));
  }

  @Test
  public void rendersShortestWordsFirst() {
    assertEquals("{a, b, ab}", Language.of("ab", "b", "a").toString());
    assertEquals("{}", Language.of().toString());
  }
}
