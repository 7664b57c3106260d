package fsa.codegen;

/**
 * Recognizer over words encoded as indices into an alphabet.
 *
 * <p>Implementations are generated at runtime by {@link CompiledDfa}.
 */
public interface SymbolRecognizer {

  /**
   * Check whether a word is accepted.
   *
   * @param symbolIndices word, as the alphabet position of each symbol
   * @return whether the run ends in an accepting state
   */
  boolean accepts(int[] symbolIndices);
}
