package cassia.transforms;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AlgebraicExpansionTest {

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    private static Expression expand(String text) throws Exception {
        return AlgebraicExpansion.expand(simplify(text));
    }

    @Test
    public void expandsPowersOfSums() throws Exception {
        assertEquals("1 + 2*x + x^2", expand("(x + 1)^2").toString());
        assertEquals(simplify("x^3 + 3x^2*y + 3x*y^2 + y^3"), expand("(x + y)^3"));
        assertEquals("(1 + x)^(-1)", expand("(x + 1)^(-1)").toString());
    }

    @Test
    public void distributesProducts() throws Exception {
        assertEquals(simplify("x^2 - y^2"), expand("(x + y)*(x - y)"));
        assertEquals(simplify("a*c + a*d + b*c + b*d"), expand("(a + b)*(c + d)"));
        assertEquals("0", expand("(x + 1)*(x - 1) - x^2 + 1").toString());
    }

    @Test
    public void expandsFunctionArguments() throws Exception {
        assertEquals(simplify("sin(x + x^2)"), expand("sin(x*(x + 1))"));
    }

    @Test
    public void expandsMainOperatorOnly() throws Exception {
        Expression u = simplify("x*(y + (z + 1)^2)");
        assertEquals(simplify("x*y + x*(1 + z)^2"), AlgebraicExpansion.expandMainOperator(u));
        assertEquals(simplify("x*y + x + 2*x*z + x*z^2"), AlgebraicExpansion.expand(u));
        assertEquals(simplify("sin(x)"), AlgebraicExpansion.expandMainOperator(simplify("sin(x)")));
    }

    @Test
    public void keepsExpandedForms() throws Exception {
        Expression u = expand("(x + 2)^4");
        assertEquals(u, AlgebraicExpansion.expand(u));
        assertEquals("1", AlgebraicExpansion.expandPower(simplify("x + 1"), 0).toString());
    }

}
