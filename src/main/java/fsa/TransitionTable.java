package fsa;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-width text rendering of the transition table of an automaton.
 *
 * <p>The table has one column per alphabet symbol and one row per state,
 * sorted by name. States are rendered as {@code >name*} (start marker then
 * name then accept marker) and rows of non-start states are indented by one
 * space so that names line up. A title box sits on top when it fits.
 */
public final class TransitionTable {

  private static final String STATE_HEADER = "State";

  private TransitionTable() { }

  /**
   * Render the transition table.
   *
   * @param automaton automaton to render
   * @return table text, one line per row, with a trailing blank line
   * @throws EmptyAutomatonException if the automaton has no states
   */
  public static String render(Automaton automaton) {
    if (automaton.states().isEmpty()) {
      throw new EmptyAutomatonException("print");
    }
    final List<State> sortedStates = new ArrayList<>(automaton.states());
    sortedStates.sort(Comparator.comparing(State::name));
    final List<String> symbols = automaton.alphabet();

    // Width of the state column and of each symbol column
    int maxStateLength = STATE_HEADER.length();
    for (State state : sortedStates) {
      maxStateLength = Math.max(maxStateLength, state.toString().length());
    }
    final int padLeft = maxStateLength + 2;
    final int[] widths = new int[symbols.size()];
    for (int i = 0; i < symbols.size(); i++) {
      final String symbol = symbols.get(i);
      int width = symbol.length() + 1;
      for (State state : sortedStates) {
        width = Math.max(width, automaton.targetLabel(state, symbol).length() + 1);
      }
      widths[i] = width;
    }

    final var divider = new StringBuilder("+").append("-".repeat(padLeft + 1));
    final var header = new StringBuilder(padRight("| " + STATE_HEADER, padLeft + 2)).append("| ");
    for (int i = 0; i < symbols.size(); i++) {
      divider.append('+').append("-".repeat(widths[i] + 1));
      header.append(padRight(symbols.get(i), widths[i])).append("| ");
    }
    divider.append('+');

    final var table = new StringBuilder();

    // Title, boxed if there is room for it
    final String title = " " + automaton.tableTitle();
    final int space = header.length() - title.length() - 2;
    if (space > 2) {
      final String centered = padLeft(title, title.length() + space / 2 - 1);
      table.append("=".repeat(header.length() - 1)).append('\n');
      table.append('|').append(padRight(centered, header.length() - 3)).append("|\n");
    } else {
      table.append(title).append('\n');
    }

    table.append(divider).append('\n');
    table.append(header).append('\n');
    table.append(divider).append('\n');
    for (State state : sortedStates) {
      final String indent = state.starting() ? "" : " ";
      table.append("| ").append(padRight(indent + state, padLeft)).append("| ");
      for (int i = 0; i < symbols.size(); i++) {
        table.append(padRight(automaton.targetLabel(state, symbols.get(i)), widths[i])).append("| ");
      }
      table.append('\n').append(divider).append('\n');
    }
    table.append('\n');
    return table.toString();
  }

  private static String padRight(String str, int width) {
    return str.length() >= width ? str : str + " ".repeat(width - str.length());
  }

  private static String padLeft(String str, int width) {
    return str.length() >= width ? str : " ".repeat(width - str.length()) + str;
  }
}
