package cassia.exec;

import antlr.ANTLRException;
import cassia.base.grammars.ExpressionLexer;
import cassia.base.grammars.ExpressionParser;
import cassia.base.grammars.ParsedStatement;
import cassia.hir.Expression;

import java.util.Collections;
import java.util.Set;

/**
* Entry points of the expression parser. The results are raw trees; pass
* them to {@link cassia.hir.Symbolic#simplify} or to
* {@link cassia.transforms.Evaluation#evaluate} to obtain canonical forms.
*/
public class Parser
{
  // No instantiation is used.
  private Parser()
  {
  }

  /**
   * Parses an expression that calls no user functions.
   *
   * @param text the input.
   * @return the raw expression tree.
   * @throws ANTLRException if the input is not an expression.
   * @throws cassia.hir.ExpressionTooComplexException if the input nests
   *     deeper than the "max-depth" option allows.
   */
  public static Expression parse(String text) throws ANTLRException
  {
    return parse(text, Collections.<String>emptySet());
  }

  /**
   * Parses an expression in which the given names are user functions.
   *
   * @param text the input.
   * @param function_names the names parsed as function calls.
   * @return the raw expression tree.
   * @throws ANTLRException if the input is not an expression.
   */
  public static Expression parse(String text, Set<String> function_names)
      throws ANTLRException
  {
    ExpressionParser parser =
        new ExpressionParser(new ExpressionLexer(text), function_names);
    return parser.topExpression();
  }

  /**
   * Parses a statement: an expression or a definition.
   *
   * @param text the input.
   * @param function_names the names parsed as function calls.
   * @param filename the name reported in error messages, or null.
   * @return the parsed statement.
   * @throws ANTLRException if the input is not a statement.
   */
  public static ParsedStatement parseStatement(String text,
      Set<String> function_names, String filename) throws ANTLRException
  {
    ExpressionParser parser = new ExpressionParser(
        new ExpressionLexer(text, filename), function_names);
    parser.setFilename(filename);
    return parser.statement();
  }

  /**
   * Parses a statement in which the given names are user functions.
   */
  public static ParsedStatement parseStatement(String text,
      Set<String> function_names) throws ANTLRException
  {
    return parseStatement(text, function_names, null);
  }
}
