package fsa.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Shunting-yard conversion of regular expressions to postfix notation.
 *
 * <p>Operands are letters and digits. Concatenation of adjacent operands is
 * implicit in the input and made explicit with the concatenation operator, so
 * {@code a(b+c)*} becomes {@code abc+*,}. Whitespace is ignored.
 */
public final class PostfixConverter {

  /**
   * Union {@code +}, explicit concatenation {@code ,} and Kleene star {@code *}.
   */
  public static final Map<Character, Operator> DEFAULT_OPERATORS = Map.of(
    '+', Operator.binary('+', 2),
    ',', Operator.binary(',', 3),
    '*', Operator.postfix('*', 4)
  );

  /**
   * Default concatenation operator.
   */
  public static final char DEFAULT_CONCATENATION = ',';

  private final Map<Character, Operator> operators;
  private final char concatenation;

  /**
   * Make a converter for a given operator table.
   *
   * @param operators operators by symbol (parentheses are always grouping)
   * @param concatenation symbol of the binary operator inserted between adjacent operands
   */
  public PostfixConverter(Map<Character, Operator> operators, char concatenation) {
    final Operator concatenationOperator = operators.get(concatenation);
    if (concatenationOperator == null || concatenationOperator.unary()) {
      throw new IllegalArgumentException("concatenation '" + concatenation + "' must be a binary operator");
    }
    if (operators.containsKey('(') || operators.containsKey(')')) {
      throw new IllegalArgumentException("parentheses can't be operators");
    }
    this.operators = Map.copyOf(operators);
    this.concatenation = concatenation;
  }

  public PostfixConverter() {
    this(DEFAULT_OPERATORS, DEFAULT_CONCATENATION);
  }

  /**
   * Make implicit concatenations explicit.
   *
   * @param infix regular expression
   * @return same expression, without whitespace, with a concatenation operator
   *   between every operand, closing parenthesis or postfix operator and the
   *   operand or opening parenthesis after it
   */
  public String explicitConcatenation(String infix) {
    final var result = new StringBuilder();
    boolean endsOperand = false;
    for (int index = 0; index < infix.length(); index++) {
      final char token = infix.charAt(index);
      if (Character.isWhitespace(token)) {
        continue;
      }
      final boolean startsOperand = token == '(' || isOperand(token);
      if (endsOperand && startsOperand) {
        result.append(concatenation);
      }
      result.append(token);

      final Operator operator = operators.get(token);
      endsOperand = token == ')' || isOperand(token) || (operator != null && operator.unary());
    }
    return result.toString();
  }

  /**
   * Convert an infix regular expression to postfix.
   *
   * @param infix regular expression
   * @return postfix form, one character per operand or operator
   * @throws PatternSyntaxException on unbalanced parentheses, a misplaced
   *   operator or a character that is neither operand nor operator
   */
  public String toPostfix(String infix) {
    final String tokens = explicitConcatenation(infix);
    final var output = new StringBuilder();
    final Deque<Character> stack = new ArrayDeque<>();

    // Was the last token the end of an operand?
    boolean afterOperand = false;

    for (int index = 0; index < tokens.length(); index++) {
      final char token = tokens.charAt(index);
      final Operator operator = operators.get(token);

      if (isOperand(token)) {
        output.append(token);
        afterOperand = true;
      } else if (token == '(') {
        stack.push(token);
        afterOperand = false;
      } else if (token == ')') {
        if (!afterOperand) {
          throw new PatternSyntaxException("Missing operand before ')'", tokens, index);
        }
        while (!stack.isEmpty() && stack.peek() != '(') {
          output.append(stack.pop());
        }
        if (stack.isEmpty()) {
          throw new PatternSyntaxException("Unbalanced ')'", tokens, index);
        }
        stack.pop();
      } else if (operator == null) {
        throw new PatternSyntaxException("Unknown symbol '" + token + "'", tokens, index);
      } else if (!afterOperand) {
        throw new PatternSyntaxException("Missing operand before '" + token + "'", tokens, index);
      } else if (operator.unary()) {
        // Postfix operators apply to the operand just emitted
        output.append(token);
      } else {
        while (!stack.isEmpty() && stack.peek() != '(' && popsBefore(operators.get(stack.peek()), operator)) {
          output.append(stack.pop());
        }
        stack.push(token);
        afterOperand = false;
      }
    }

    if (!tokens.isEmpty() && !afterOperand) {
      throw new PatternSyntaxException("Missing operand at end of expression", tokens, tokens.length());
    }
    while (!stack.isEmpty()) {
      final char operator = stack.pop();
      if (operator == '(') {
        throw new PatternSyntaxException("Unclosed '('", tokens, tokens.lastIndexOf('('));
      }
      output.append(operator);
    }
    return output.toString();
  }

  private static boolean popsBefore(Operator top, Operator incoming) {
    return top.precedence() > incoming.precedence()
      || (top.precedence() == incoming.precedence() && incoming.leftAssociative());
  }

  private boolean isOperand(char token) {
    return Character.isLetterOrDigit(token) && !operators.containsKey(token);
  }
}
