package cassia.transforms;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import cassia.hir.Undefined;
import cassia.hir.Variable;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DifferentiationTest {

    private final Variable x = new Variable("x");

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    private void assertDerivative(String expected, String text) throws Exception {
        assertEquals(expected, Differentiation.derivative(Parser.parse(text), x).toString(), text);
    }

    @Test
    public void differentiatesElementaryFunctions() throws Exception {
        assertDerivative("sec(x)^2", "tan(x)");
        assertDerivative("cos(x)", "sin(x)");
        assertDerivative("-1*sin(x)", "cos(x)");
        assertDerivative("exp(x)", "exp(x)");
        assertDerivative("x^(-1)", "ln(x)");
        assertDerivative("tan(x)*sec(x)", "sec(x)");
        assertDerivative("-1*csc(x)^2", "cot(x)");
        assertDerivative("(1 + x^2)^(-1)", "arctan(x)");
    }

    @Test
    public void appliesPowerAndChainRules() throws Exception {
        assertDerivative("3*x^2", "x^3");
        assertDerivative("1", "x");
        assertDerivative("0", "y^2");
        assertDerivative("2*exp(2*x)", "exp(2x)");
        assertDerivative("2*cos(x^2)*x", "sin(x^2)");
        assertDerivative("y", "x*y");
        assertEquals(simplify("x^x + x^x*ln(x)"),
                     Differentiation.derivative(Parser.parse("x^x"), x));
    }

    @Test
    public void isLinear() throws Exception {
        Expression f = simplify("sin(x)*x"), g = simplify("x^3 + ln(x)");
        Expression a = Symbolic.integer(3), b = Symbolic.rational(5, 2);
        Expression lhs = Differentiation.derivative(
                Symbolic.add(Symbolic.multiply(a, f), Symbolic.multiply(b, g)), x);
        Expression rhs = Symbolic.add(
                Symbolic.multiply(a, Differentiation.derivative(f, x)),
                Symbolic.multiply(b, Differentiation.derivative(g, x)));
        assertEquals(AlgebraicExpansion.expand(rhs), AlgebraicExpansion.expand(lhs));
    }

    @Test
    public void keepsUnresolvedDerivatives() throws Exception {
        assertDerivative("Deriv(x!, x)", "x!");
        assertEquals("Deriv(f(x), x)", Differentiation.derivative(Parser.parse("f(x)",
                Collections.singleton("f")), x).toString());
    }

    @Test
    public void computesHigherDerivatives() throws Exception {
        assertEquals("6", Differentiation.derivative(Parser.parse("x^3"), x, 3).toString());
        assertEquals("0", Differentiation.derivative(Parser.parse("x^3"), x, 4).toString());
        assertEquals("2*x", Differentiation.derivative(Parser.parse("x + x"), x, 0).toString());
        try {
            Differentiation.derivative(x, x, -1);
            fail("a negative order was accepted");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("negative"));
        }
    }

    @Test
    public void propagatesUndefined() throws Exception {
        assertTrue(Differentiation.derivative(Parser.parse("1/0 + x"), x) instanceof Undefined);
    }

    @Test
    public void rejectsNonVariableTarget() throws Exception {
        try {
            Differentiation.derivative(simplify("x^2"), simplify("2x"));
            fail("differentiated with respect to 2*x");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("not a variable"));
        }
    }

}
