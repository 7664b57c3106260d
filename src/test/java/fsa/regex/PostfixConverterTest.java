package fsa.regex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

public class PostfixConverterTest {

  private final PostfixConverter converter = new PostfixConverter();

  @Test
  public void implicitConcatenation() {
    assertEquals("a,b", converter.explicitConcatenation("ab"));
    assertEquals("a,(b+c)*,d", converter.explicitConcatenation("a (b+c)* d"));
    assertEquals("a*,b", converter.explicitConcatenation("a*b"));
  }

  @Test
  public void precedence() {
    assertEquals("ab,c+", converter.toPostfix("ab+c"));
    assertEquals("abc,+", converter.toPostfix("a+bc"));
    assertEquals("ab*,", converter.toPostfix("ab*"));
    assertEquals("abc+*,", converter.toPostfix("a(b+c)*"));
  }

  @Test
  public void leftAssociativity() {
    assertEquals("ab+c+", converter.toPostfix("a+b+c"));
    assertEquals("ab,c,", converter.toPostfix("a,b,c"));
  }

  @Test
  public void emptyExpression() {
    assertEquals("", converter.toPostfix("  "));
  }

  @Test
  public void malformedExpressions() {
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("(a+b"));
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("a+b)"));
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("a+"));
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("+a"));
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("()"));
    assertThrows(PatternSyntaxException.class, () -> converter.toPostfix("a-b"));
  }

  @Test
  public void customOperators() {
    final var custom = new PostfixConverter(
      Map.of(
        '|', Operator.binary('|', 1),
        '.', Operator.binary('.', 2),
        '*', Operator.postfix('*', 3)
      ),
      '.'
    );
    assertEquals("abc.|", custom.toPostfix("a|bc"));
    assertEquals("ab|*c.", custom.toPostfix("(a|b)*c"));
  }

  @Test
  public void concatenationMustBeBinary() {
    assertThrows(
      IllegalArgumentException.class,
      () -> new PostfixConverter(Map.of('*', Operator.postfix('*', 4)), '*')
    );
    assertThrows(
      IllegalArgumentException.class,
      () -> new PostfixConverter(PostfixConverter.DEFAULT_OPERATORS, '.')
    );
  }
}
