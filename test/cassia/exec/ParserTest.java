package cassia.exec;

import antlr.RecognitionException;
import cassia.base.grammars.ParsedStatement;
import cassia.hir.FunctionCall;
import cassia.hir.Variable;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    @Test
    public void parsesExpressions() throws Exception {
        assertTrue(Parser.parse("x") instanceof Variable);
        assertTrue(Parser.parse("f(x)", Collections.singleton("f")) instanceof FunctionCall);
        assertEquals("x^2", Parser.parse("x^2").toString());
    }

    @Test
    public void parsesStatements() throws Exception {
        ParsedStatement stmt = Parser.parseStatement("f(t) = t + 1",
                Collections.<String>emptySet());
        assertEquals(ParsedStatement.FUNCTION_DEFINITION, stmt.getKind());
        assertEquals("t + 1", stmt.getExpression().toString());
    }

    @Test
    public void reportsPositions() throws Exception {
        try {
            Parser.parseStatement("1 + (2", Collections.<String>emptySet(), "input.txt");
            fail("expected a syntax error");
        } catch(RecognitionException ex) {
            assertEquals("input.txt", ex.getFilename());
            assertEquals(1, ex.getLine());
            assertTrue(ex.getMessage().contains("expecting ')'"), ex.getMessage());
        }
    }

    @Test
    public void rejectsDefinitionsInExpressions() throws Exception {
        try {
            Parser.parse("a = 1");
            fail("expected a syntax error");
        } catch(RecognitionException ex) {
            // expected
        }
    }

}
