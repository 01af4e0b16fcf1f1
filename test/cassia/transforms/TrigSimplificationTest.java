package cassia.transforms;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TrigSimplificationTest {

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    @Test
    public void provesPythagoreanIdentity() throws Exception {
        assertEquals("1", TrigSimplification.simplify(simplify("sin(x)^2 + cos(x)^2")).toString());
        assertEquals("1", TrigSimplification.simplify(simplify("sin(2x)/(2*sin(x)*cos(x))")).toString());
    }

    @Test
    public void substitutesQuotients() throws Exception {
        assertEquals("sin(x)*cos(x)^(-1)", TrigSimplification.substitute(simplify("tan(x)")).toString());
        assertEquals("sin(x)^(-1)", TrigSimplification.substitute(simplify("csc(x)")).toString());
        assertEquals(simplify("1 + sin(y)*cos(y)^(-1)"),
                TrigSimplification.substitute(simplify("1 + tan(y)")));
    }

    @Test
    public void expandsAngles() throws Exception {
        assertEquals("2*sin(x)*cos(x)", TrigSimplification.expand(simplify("sin(2x)")).toString());
        assertEquals(simplify("cos(x)*cos(y) - sin(x)*sin(y)"),
                TrigSimplification.expand(simplify("cos(x + y)")));
        assertEquals(simplify("-2*sin(x)*cos(x)"),
                TrigSimplification.expand(simplify("sin(-2x)")));
    }

    @Test
    public void contractsProductsAndPowers() throws Exception {
        assertEquals("1/2*sin(2*x)", TrigSimplification.contract(simplify("sin(x)*cos(x)")).toString());
        assertEquals(simplify("1/2 - cos(2x)/2"), TrigSimplification.contract(simplify("sin(x)^2")));
        assertEquals(simplify("cos(x - y)/2 - cos(x + y)/2"),
                TrigSimplification.contract(simplify("sin(x)*sin(y)")));
    }

    @Test
    public void vanishingDenominatorIsUndefined() throws Exception {
        assertEquals("UNDEFINED",
                TrigSimplification.simplify(simplify("1/(sin(x)^2 + cos(x)^2 - 1)")).toString());
    }

}
