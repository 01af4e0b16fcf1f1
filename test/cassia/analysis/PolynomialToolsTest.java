package cassia.analysis;

import cassia.exec.Parser;
import cassia.hir.Expression;
import cassia.hir.Symbolic;
import cassia.hir.Variable;
import cassia.transforms.AlgebraicExpansion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PolynomialToolsTest {

    private final Variable x = new Variable("x");

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    @Test
    public void recognizesPolynomials() throws Exception {
        assertTrue(PolynomialTools.isPolynomial(simplify("3x^2 + 2x + 1"), x));
        assertTrue(PolynomialTools.isPolynomial(simplify("sin(y)*x + y"), x));
        assertFalse(PolynomialTools.isPolynomial(simplify("x^(1/2)"), x));
        assertFalse(PolynomialTools.isPolynomial(simplify("sin(x)"), x));
        assertFalse(PolynomialTools.isPolynomial(simplify("1/x"), x));
    }

    @Test
    public void computesDegrees() throws Exception {
        assertEquals(Integer.valueOf(2), PolynomialTools.degree(simplify("3x^2 + 2x + 1"), x));
        assertEquals(Integer.valueOf(-1), PolynomialTools.degree(simplify("0"), x));
        assertEquals(Integer.valueOf(0), PolynomialTools.degree(simplify("y"), x));
        assertEquals(Integer.valueOf(4), PolynomialTools.degree(simplify("x^3*y + x^4"), x));
        assertNull(PolynomialTools.degree(simplify("1/x"), x));
    }

    @Test
    public void extractsCoefficients() throws Exception {
        Expression u = simplify("3x^2 + 2x + 1");
        assertEquals("3", PolynomialTools.coefficient(u, x, 2).toString());
        assertEquals("2", PolynomialTools.coefficient(u, x, 1).toString());
        assertEquals("1", PolynomialTools.coefficient(u, x, 0).toString());
        assertEquals("0", PolynomialTools.coefficient(u, x, 5).toString());
        assertEquals("a", PolynomialTools.coefficient(simplify("a*x^2 + b*x"), x, 2).toString());
        assertEquals("2", PolynomialTools.leadingCoefficient(simplify("5 + 2x^3"), x).toString());
    }

    @Test
    public void extractsLinearAndQuadraticForms() throws Exception {
        Expression[] ab = PolynomialTools.linearForm(simplify("2x + 3"), x);
        assertEquals("2", ab[0].toString());
        assertEquals("3", ab[1].toString());
        assertNull(PolynomialTools.linearForm(simplify("x^2"), x));
        Expression[] abc = PolynomialTools.quadraticForm(simplify("x^2 + 2x + 5"), x);
        assertEquals("1", abc[0].toString());
        assertEquals("2", abc[1].toString());
        assertEquals("5", abc[2].toString());
        assertNull(PolynomialTools.quadraticForm(simplify("x^3"), x));
    }

    @Test
    public void dividesPolynomials() throws Exception {
        Expression[] qr = PolynomialTools.polynomialDivide(simplify("x^2 - 1"), simplify("x - 1"), x);
        assertEquals(simplify("x + 1"), qr[0]);
        assertEquals("0", qr[1].toString());
        qr = PolynomialTools.polynomialDivide(simplify("x^2"), simplify("x - 1"), x);
        assertEquals(simplify("x + 1"), qr[0]);
        assertEquals("1", qr[1].toString());
    }

    @Test
    public void rejectsInvalidDivisions() throws Exception {
        try {
            PolynomialTools.polynomialDivide(simplify("x^2"), simplify("0"), x);
            fail("division by zero was performed");
        } catch (ArithmeticException ex) {
            assertTrue(ex.getMessage().contains("zero"));
        }
        try {
            PolynomialTools.polynomialDivide(simplify("sin(x)"), simplify("x"), x);
            fail("a non-polynomial was divided");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("polynomial"));
        }
    }

    @Test
    public void computesMonicGcd() throws Exception {
        Expression u = simplify("x^2 - 1"), v = simplify("x^2 - 2x + 1");
        assertEquals(simplify("x - 1"), PolynomialTools.polynomialGcd(u, v, x));
        Expression[] gab = PolynomialTools.extendedGcd(u, v, x);
        assertEquals(gab[0], AlgebraicExpansion.expand(Symbolic.add(
                Symbolic.multiply(gab[1], u), Symbolic.multiply(gab[2], v))));
    }

    @Test
    public void factorsSquareFree() throws Exception {
        List<Expression> factors = PolynomialTools.squareFreeFactor(simplify("x^3 - x^2"), x);
        assertEquals(3, factors.size());
        assertEquals("1", factors.get(0).toString());
        assertEquals(simplify("x - 1"), factors.get(1));
        assertEquals("x^2", factors.get(2).toString());
        factors = PolynomialTools.squareFreeFactor(simplify("2x^2 + 4x + 2"), x);
        assertEquals(2, factors.size());
        assertEquals("2", factors.get(0).toString());
        assertEquals(simplify("x^2 + 2x + 1"), factors.get(1));
    }

    @Test
    public void splitsPartialFractions() throws Exception {
        Expression[] parts = PolynomialTools.partialFractions(
                simplify("1"), simplify("x - 1"), simplify("x^2"), x);
        assertEquals("1", parts[0].toString());
        assertEquals(simplify("-1 - x"), parts[1]);
        assertNull(PolynomialTools.partialFractions(
                simplify("1"), simplify("x - 1"), simplify("x^2 - 1"), x));
    }

}
