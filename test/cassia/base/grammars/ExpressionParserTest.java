package cassia.base.grammars;

import antlr.ANTLRException;
import antlr.RecognitionException;
import antlr.TokenStreamException;
import cassia.hir.Expression;
import cassia.hir.ExpressionTooComplexException;
import cassia.hir.FunctionCall;
import cassia.hir.Symbolic;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private static final Set<String> no_functions = Collections.<String>emptySet();

    private static Expression parse(String text) throws ANTLRException {
        return new ExpressionParser(new ExpressionLexer(text), no_functions).topExpression();
    }

    private static String simplify(String text) throws ANTLRException {
        return Symbolic.simplify(parse(text)).toString();
    }

    private static ParsedStatement statement(String text, Set<String> names)
            throws ANTLRException {
        return new ExpressionParser(new ExpressionLexer(text), names).statement();
    }

    @Test
    public void followsPrecedence() throws Exception {
        assertEquals("1 + 2*3", parse("1 + 2*3").toString());
        assertEquals("7", simplify("1 + 2*3"));
        assertEquals("512", simplify("2^3^2"));
        assertEquals("-4", simplify("-2^2"));
        assertEquals("9", simplify("(1 + 2)^2"));
        assertEquals("1/8", simplify("2^-3"));
        assertEquals("6", simplify("3!"));
        assertEquals("720", simplify("3!!"));
        assertEquals(simplify("a/(b*c)"), simplify("a/b/c"));
    }

    @Test
    public void multipliesImplicitly() throws Exception {
        assertEquals("2*x", simplify("2x"));
        assertEquals("2 + 2*x", simplify("2(x + 1)"));
        assertEquals("x*y", simplify("x y"));
        assertEquals("3*x", simplify("6/2x"));
        assertEquals("2*sin(x)", simplify("2sin(x)"));
    }

    @Test
    public void convertsDecimalsToRationals() throws Exception {
        assertEquals("1/4", simplify("0.25"));
        assertEquals("3/2", simplify("1.50"));
        assertEquals("2", simplify("2.0"));
    }

    @Test
    public void parsesBuiltins() throws Exception {
        assertEquals("2", simplify("sqrt(4)"));
        assertEquals("UNDEFINED", simplify("UNDEFINED"));
        assertEquals("Deriv(f, x)", simplify("Deriv(f, x)"));
        assertEquals("-1*sin(x)", simplify("sin(-x)"));
    }

    @Test
    public void parsesDefinitions() throws Exception {
        ParsedStatement stmt = statement("a = 1 + 2", no_functions);
        assertEquals(ParsedStatement.VARIABLE_DEFINITION, stmt.getKind());
        assertEquals("a", stmt.getName());
        assertTrue(stmt.isDefinition());
        assertEquals("3", Symbolic.simplify(stmt.getExpression()).toString());

        stmt = statement("f(x, y) = x*y + f(x, y - 1)", no_functions);
        assertEquals(ParsedStatement.FUNCTION_DEFINITION, stmt.getKind());
        assertEquals("f", stmt.getName());
        assertEquals("[x, y]", stmt.getParameters().toString());
        // The body may call the function being defined.
        assertTrue(stmt.getExpression().getChild(1) instanceof FunctionCall);

        stmt = statement("f(2) + 1", no_functions);
        assertEquals(ParsedStatement.EXPRESSION, stmt.getKind());
        assertFalse(stmt.isDefinition());
        assertNull(stmt.getName());
        assertEquals("1 + 2*f", Symbolic.simplify(stmt.getExpression()).toString());

        stmt = statement("f(2) + 1", Collections.singleton("f"));
        assertEquals("1 + f(2)", Symbolic.simplify(stmt.getExpression()).toString());
    }

    @Test
    public void readsPrintedForms() throws Exception {
        String[] inputs = {"1/x", "sin(x)^2/2", "3 - x", "(x + 1)^3", "sqrt(2)*y",
                           "-x/2 + exp(-x)", "(x + 1)!", "ln(x)^(2/3)", "a^b^c"};
        for (String input : inputs) {
            Expression u = Symbolic.simplify(parse(input));
            assertEquals(u, Symbolic.simplify(parse(u.toString())), input);
        }
    }

    @Test
    public void rejectsMalformedInput() throws Exception {
        String[] inputs = {"1 +", "(1 + 2", "sin x", "x = ", "1 2 )", "Deriv(x, 2)"};
        for (String input : inputs) {
            try {
                statement(input, no_functions);
                fail("expected a syntax error for " + input);
            } catch(RecognitionException ex) {
                // expected
            }
        }
    }

    private static String nested(int levels) {
        StringBuilder sb = new StringBuilder(2 * levels + 1);
        for (int i = 0; i < levels; i++) {
            sb.append('(');
        }
        sb.append('x');
        for (int i = 0; i < levels; i++) {
            sb.append(')');
        }
        return sb.toString();
    }

    @Test
    public void limitsNesting() throws Exception {
        assertEquals("x", parse(nested(100)).toString());
        try {
            parse(nested(20000));
            fail("expected deep nesting to be rejected");
        } catch(ExpressionTooComplexException ex) {
            assertEquals(Symbolic.getMaxDepth(), ex.getDepth());
        }
        try {
            parse("x^-(" + nested(Symbolic.getMaxDepth()) + ")");
            fail("expected deep nesting to be rejected");
        } catch(ExpressionTooComplexException ex) {
            assertTrue(ex.getMessage().contains("nests too deeply"), ex.getMessage());
        }
    }

    @Test
    public void rejectsUnexpectedCharacters() throws Exception {
        try {
            parse("1 $ 2");
            fail("expected a lexical error");
        } catch(TokenStreamException ex) {
            assertTrue(ex.getMessage().contains("unexpected character '$'"), ex.getMessage());
        }
    }

    @Test
    public void rejectsReservedNames() throws Exception {
        String[] inputs = {"sin = 3", "sqrt(x) = x", "UNDEFINED = 1", "Deriv = 2"};
        for (String input : inputs) {
            try {
                statement(input, no_functions);
                fail("expected " + input + " to be rejected");
            } catch(RecognitionException ex) {
                assertTrue(ex.getMessage().startsWith("cannot redefine"), ex.getMessage());
            }
        }
        try {
            statement("f(f) = 1", no_functions);
            fail("expected a self-referential parameter to be rejected");
        } catch(RecognitionException ex) {
            assertEquals("f cannot be a parameter of itself", ex.getMessage());
        }
    }

}
