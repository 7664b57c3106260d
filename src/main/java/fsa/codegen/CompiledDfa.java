package fsa.codegen;

import fsa.AbstractAutomaton;
import fsa.DeterministicAutomaton;
import fsa.InvalidSymbolException;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA compiled into a hidden JVM class.
 *
 * <p>The generated class implements {@link SymbolRecognizer}. Each state of
 * the automaton becomes a block of bytecode and each transition a jump, so
 * recognition runs without any map lookups. The compiled recognizer is a
 * snapshot: later changes to the automaton are not reflected.
 */
public final class CompiledDfa implements SymbolRecognizer {

  private static final Logger LOG = LoggerFactory.getLogger(CompiledDfa.class);

  private static final String CLASS_NAME = "fsa/codegen/SymbolRecognizer$Compiled";

  private final List<String> symbols;
  private final Map<String, Integer> symbolIndices;
  private final SymbolRecognizer recognizer;

  private CompiledDfa(List<String> symbols, SymbolRecognizer recognizer) {
    this.symbols = symbols;
    this.recognizer = recognizer;
    this.symbolIndices = new HashMap<>();
    for (int i = 0; i < symbols.size(); i++) {
      symbolIndices.put(symbols.get(i), i);
    }
  }

  /**
   * Compile the reachable part of a DFA.
   *
   * @param dfa automaton to compile
   * @return recognizer agreeing with {@code dfa} on every word
   * @throws fsa.NoStartStateException if there is no start state
   * @throws fsa.UndefinedTransitionException if a reachable state lacks a transition
   */
  public static CompiledDfa compile(
    DeterministicAutomaton dfa
  ) throws IllegalAccessException, NoSuchMethodException {
    final byte[] classBytes = generateRecognizerClass(dfa, CLASS_NAME).toByteArray();

    // Load the class and get a handle on the constructor
    final MethodHandles.Lookup lookup = MethodHandles
      .lookup()
      .defineHiddenClass(classBytes, true);
    final var constructor = lookup.findConstructor(
      lookup.lookupClass(),
      MethodType.methodType(void.class)
    );

    final SymbolRecognizer recognizer;
    try {
      recognizer = (SymbolRecognizer) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct recognizer", error);
    }
    return new CompiledDfa(dfa.alphabet(), recognizer);
  }

  /**
   * Code generator for a compiled recognizer.
   *
   * @param dfa automaton to compile
   * @param className name of the hidden class to generate
   * @return class implementing {@code SymbolRecognizer}
   */
  static ClassWriter generateRecognizerClass(DeterministicAutomaton dfa, String className) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.SYMBOLRECOGNIZER_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `acceptsStatic` static helper method
    {
      final var mv = Method.ACCEPTSSTATIC_M.newMethod(cw, Opcodes.ACC_PRIVATE);
      mv.visitCode();
      final var codegen = new DfaMethodCodegen(mv, dfa);
      codegen.visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
      LOG.debug("Generated recognizer for {} states over {}", codegen.stateCount(), dfa.alphabet());
    }

    // `accepts` method (just calls out to `acceptsStatic`)
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 1);
      Method.ACCEPTSSTATIC_M.invokeMethod(mv, className);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  @Override
  public boolean accepts(int[] symbolIndices) {
    return recognizer.accepts(symbolIndices);
  }

  /**
   * Check whether a word is accepted.
   *
   * @param word sequence of symbols of the alphabet
   * @return whether the word is accepted
   * @throws InvalidSymbolException if the word has a symbol outside the alphabet
   */
  public boolean accepts(List<String> word) {
    final int[] indices = new int[word.size()];
    for (int i = 0; i < indices.length; i++) {
      final Integer index = symbolIndices.get(word.get(i));
      if (index == null) {
        throw new InvalidSymbolException(
          word.get(i),
          "invalid symbol '" + word.get(i) + "' in word " + word
        );
      }
      indices[i] = index;
    }
    return recognizer.accepts(indices);
  }

  /**
   * Check whether a word is accepted, where every character is one symbol.
   *
   * @param word word to check (surrounding whitespace is ignored)
   * @return whether the word is accepted
   */
  public boolean accepts(String word) {
    return accepts(AbstractAutomaton.symbolsOf(word));
  }

  public List<String> alphabet() {
    return symbols;
  }

  @Override
  public String toString() {
    return "CompiledDfa(alphabet = " + symbols + ")";
  }
}
