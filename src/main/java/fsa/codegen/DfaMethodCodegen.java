package fsa.codegen;

import fsa.DeterministicAutomaton;
import fsa.State;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Functionality for generating the body of a DFA recognizing function.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks with transitions encoded
 * as jumps to other blocks. The generated method has the type
 * {@code static boolean acceptsStatic(int[] symbolIndices)}.
 */
class DfaMethodCodegen extends BytecodeHelpers {

  /**
   * Offset for the argument of type {@code int[]}, corresponding to the word.
   */
  private final int inputLocal;

  /**
   * Offset for a local of type {@code int}, the (ascending) offset in the
   * word.
   */
  private final int offsetLocal;

  /**
   * Offset for a local of type {@code int}, the length of the word.
   */
  private final int lengthLocal;

  /**
   * Alphabet of the automaton, giving meaning to the symbol indices.
   */
  private final List<String> symbols;

  /**
   * Labels associated with DFA states, with the start state first.
   */
  private final Map<State, Label> stateLabels;

  /**
   * Target of every transition out of every state.
   */
  private final Map<State, List<State>> transitions;

  /**
   * Label for the block which ends in {@code true} being returned.
   */
  private final Label returnSuccess;

  /**
   * Label for the block which ends in {@code false} being returned.
   */
  private final Label returnFailure;

  /**
   * Prepare code generation for the reachable part of a DFA.
   *
   * @param mv method visitor for {@code acceptsStatic}
   * @param dfa automaton for which code is generated
   * @throws fsa.NoStartStateException if there is no start state
   * @throws fsa.UndefinedTransitionException if a reachable state lacks a transition
   */
  public DfaMethodCodegen(MethodVisitor mv, DeterministicAutomaton dfa) {
    super(mv);
    this.symbols = dfa.alphabet();

    // Intialize all local offsets (incrementing offset works since all locals are single-width)
    int nextLocal = 0;
    this.inputLocal = nextLocal++;
    this.offsetLocal = nextLocal++;
    this.lengthLocal = nextLocal++;

    // Reachable states come in breadth-first order, so the start state is first
    final var labels = new LinkedHashMap<State, Label>();
    final var targets = new LinkedHashMap<State, List<State>>();
    for (State state : dfa.reachableStates()) {
      labels.put(state, new Label());
      final var stateTargets = new ArrayList<State>(symbols.size());
      for (String symbol : symbols) {
        stateTargets.add(dfa.transition(state, symbol));
      }
      targets.put(state, stateTargets);
    }
    this.stateLabels = labels;
    this.transitions = targets;
    this.returnSuccess = new Label();
    this.returnFailure = new Label();
  }

  /**
   * Number of states compiled into the method.
   */
  public int stateCount() {
    return stateLabels.size();
  }

  public void visitDfa() {
    initializeLocals();

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.values().iterator().next());

    // Symbol indices handled by each state block
    final int[] values = new int[symbols.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }

    // Lay out the blocks for each state
    for (Map.Entry<State, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      final State state = entry.getKey();

      // Increment the offset and, if it reaches the length, return whether the state accepts
      mv.visitIincInsn(offsetLocal, 1);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, state.accepting() ? returnSuccess : returnFailure);

      // Get the next symbol index
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitInsn(Opcodes.IALOAD);

      // Jump to the target state (out of range indices are rejected)
      final List<State> stateTargets = transitions.get(state);
      final Label[] labels = new Label[stateTargets.size()];
      for (int i = 0; i < labels.length; i++) {
        labels[i] = stateLabels.get(stateTargets.get(i));
      }
      visitLookupBranch(returnFailure, values, labels);
    }

    // Final blocks
    visitReturnConstant(returnSuccess, true);
    visitReturnConstant(returnFailure, false);
  }

  /**
   * Initialize local variables that aren't arguments.
   */
  private void initializeLocals() {

    // The first state block increments this to 0
    visitConstantInt(-1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);

    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitInsn(Opcodes.ARRAYLENGTH);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);
  }

  private void visitReturnConstant(Label label, boolean result) {
    mv.visitLabel(label);
    mv.visitInsn(result ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }
}
