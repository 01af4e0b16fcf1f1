package cassia.transforms;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import cassia.hir.Variable;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SubstitutionTest {

    private final Variable x = new Variable("x");

    private final Variable y = new Variable("y");

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    @Test
    public void substitutesAndSimplifies() throws Exception {
        assertEquals("6", Substitution.substitute(simplify("x^2 + x"), x, Symbolic.integer(2)).toString());
        assertEquals(simplify("sin(y)^2 + 1"),
                Substitution.substitute(simplify("x^2 + 1"), x, simplify("sin(y)")));
        assertEquals("UNDEFINED", Substitution.substitute(simplify("1/x"), x, Symbolic.integer(0)).toString());
    }

    @Test
    public void replacesSimultaneously() throws Exception {
        Map<Expression, Expression> swap = new HashMap<Expression, Expression>();
        swap.put(x, y);
        swap.put(y, x);
        assertEquals("2*x + y", Substitution.substitute(simplify("x + 2y"), swap).toString());
    }

    @Test
    public void matchesCompleteOperandsOnly() throws Exception {
        Expression u = simplify("x + y + z");
        assertFalse(Substitution.contains(u, simplify("x + y")));
        assertTrue(Substitution.contains(simplify("sin(x + y)*z"), simplify("x + y")));
        assertEquals(u, Substitution.substitute(u, simplify("x + y"), new Variable("w")));
        assertTrue(Substitution.freeOf(simplify("2*z"), Arrays.asList(x, y)));
        assertFalse(Substitution.freeOf(simplify("2*z + y"), Arrays.asList(x, y)));
    }

    @Test
    public void keepsTreeWithoutSimplification() throws Exception {
        Expression raw = Parser.parse("x + x");
        Map<Expression, Expression> map = new HashMap<Expression, Expression>();
        map.put(x, y);
        assertEquals("y + y", Substitution.replace(raw, map).toString());
    }

}
