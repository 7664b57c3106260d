package fsa;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class TransitionTableTest {

  @Test
  public void deterministicTable() {
    final String expected = String.join(
      "\n",
      " DF Automaton table",
      "+--------+----+----+",
      "| State  | 0  | 1  | ",
      "+--------+----+----+",
      "| >q0    | q0 | q1 | ",
      "+--------+----+----+",
      "|  q1*   | q0 | q1 | ",
      "+--------+----+----+",
      "",
      ""
    );
    assertEquals(expected, TransitionTable.render(DeterministicAutomatonTest.endsInOne()));
  }

  @Test
  public void nonDeterministicTableWithTitleBox() {
    final String expected = String.join(
      "\n",
      "============================",
      "|    NF Automaton table    |",
      "+--------+------+----------+",
      "| State  | 0    | 1        | ",
      "+--------+------+----------+",
      "| >q1    | {q1} | {q1, q2} | ",
      "+--------+------+----------+",
      "|  q2    | {q3} | {q3}     | ",
      "+--------+------+----------+",
      "|  q3*   | ∅    | ∅        | ",
      "+--------+------+----------+",
      "",
      ""
    );
    assertEquals(expected, TransitionTable.render(NonDeterministicAutomatonTest.secondToLastIsOne()));
  }

  @Test
  public void emptyAutomatonCannotBeRendered() {
    assertThrows(
      EmptyAutomatonException.class,
      () -> TransitionTable.render(new NonDeterministicAutomaton(List.of("0", "1")))
    );
  }
}
