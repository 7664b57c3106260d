package fsa;

/**
 * How the states of a DFA obtained from subset construction get named.
 */
public enum StateNaming {

  /**
   * States are named {@code s0}, {@code s1}, ... in the order in which subset
   * construction discovered them (the start state is always {@code s0}).
   */
  SEQUENTIAL,

  /**
   * States are named after the set of states they stand for, for instance
   * {@code {q_1, q_2}}. The empty set is named {@code ∅}.
   */
  SUBSET
}
