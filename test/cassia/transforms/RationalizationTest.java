package cassia.transforms;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RationalizationTest {

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    @Test
    public void splitsNumeratorAndDenominator() throws Exception {
        Expression u = simplify("2/3*x*y^(-2)");
        assertEquals("2*x", Rationalization.numerator(u).toString());
        assertEquals("3*y^2", Rationalization.denominator(u).toString());
        assertEquals("1", Rationalization.denominator(simplify("x + 1")).toString());
        assertEquals("1", Rationalization.numerator(simplify("(x + 1)^(-3)")).toString());
        assertEquals("(1 + x)^3", Rationalization.denominator(simplify("(x + 1)^(-3)")).toString());
    }

    @Test
    public void bringsSumsOverCommonDenominator() throws Exception {
        Expression r = Rationalization.rationalize(simplify("1/x + 1/y"));
        assertEquals("x + y", Rationalization.numerator(r).toString());
        assertEquals("x*y", Rationalization.denominator(r).toString());
    }

    @Test
    public void rationalizesNestedFractions() throws Exception {
        Expression r = Rationalization.rationalize(simplify("1/(1 + 1/x)"));
        assertEquals("x", Rationalization.numerator(r).toString());
        assertEquals("1 + x", Rationalization.denominator(r).toString());
    }

    @Test
    public void keepsPolynomials() throws Exception {
        Expression u = simplify("x^2 + 2x + 1");
        assertEquals(u, Rationalization.rationalize(u));
    }

}
