package cassia.hir;

import cassia.exec.Driver;
import cassia.exec.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolicTest {

    private static Expression simplify(String text) throws Exception {
        return Symbolic.simplify(Parser.parse(text));
    }

    private static void assertSimplifies(String expected, String text) throws Exception {
        assertEquals(expected, simplify(text).toString(), text);
    }

    @AfterEach
    public void restoreOptions() {
        Driver.registerOptions();
    }

    @Test
    public void evaluatesIntegerArithmetic() throws Exception {
        assertSimplifies("7", "1+2*3");
        assertSimplifies("-1", "2-3");
        assertSimplifies("1024", "2^10");
        assertSimplifies("120", "5!");
    }

    @Test
    public void keepsRationalsExact() throws Exception {
        assertSimplifies("1/2", "1/3+1/6");
        assertSimplifies("3/4", "0.75");
        assertSimplifies("9/4", "(2/3)^(-2)");
        assertSimplifies("-1/2", "-2/4");
    }

    @Test
    public void collectsLikeTerms() throws Exception {
        Expression lhs = simplify("2(x+1)+3(x+1)");
        assertEquals(simplify("5x+5"), lhs);
        assertEquals("5 + 5*x", lhs.toString());
        assertSimplifies("2*x", "x+x");
        assertSimplifies("0", "x-x");
        assertSimplifies("x^2", "x*x");
        assertSimplifies("1", "x/x");
        assertSimplifies("x^5", "x^2*x^3");
        // Factors that combine into a number join the leading coefficient.
        assertSimplifies("-2/3*y", "2^(1/2)*2^(1/2)*(-1/3)*y");
        assertSimplifies("-2/3*y^(-1)", "2^(1/2)/(y/2^(1/2)*(-3))");
        assertSimplifies("6*x", "3^(1/2)*2*x*3^(1/2)");
    }

    @Test
    public void appliesPowerRules() throws Exception {
        assertSimplifies("UNDEFINED", "0^-1");
        assertSimplifies("UNDEFINED", "0^0");
        assertSimplifies("0", "0^3");
        assertSimplifies("1", "1^y");
        assertSimplifies("1", "y^0");
        assertSimplifies("y", "y^1");
        assertSimplifies("x^6", "(x^2)^3");
        assertSimplifies("x", "(x^(1/2))^2");
        assertSimplifies("x^2*y^2", "(x*y)^2");
        assertSimplifies("2", "4^(1/2)");
        assertSimplifies("4", "8^(2/3)");
        assertSimplifies("2^(1/2)", "sqrt(2)");
    }

    @Test
    public void leavesHugePowersUnevaluated() throws Exception {
        Expression e = simplify("2^100000");
        assertTrue(e instanceof Power);
        assertEquals("2^100000", e.toString());
    }

    @Test
    public void appliesFunctionReflexes() throws Exception {
        assertSimplifies("0", "sin(0)");
        assertSimplifies("1", "cos(0)");
        assertSimplifies("1", "exp(0)");
        assertSimplifies("0", "ln(1)");
        assertSimplifies("UNDEFINED", "ln(0)");
        assertSimplifies("-1*sin(x)", "sin(-x)");
        assertSimplifies("cos(x)", "cos(-x)");
        assertSimplifies("x", "exp(ln(x))");
        assertSimplifies("x", "ln(exp(x))");
        assertSimplifies("2*ln(x)", "ln(x^2)");
        assertSimplifies("ln(x) + ln(y)", "ln(x*y)");
    }

    @Test
    public void absorbsUndefined() throws Exception {
        assertSimplifies("UNDEFINED", "x + UNDEFINED");
        assertSimplifies("UNDEFINED", "0*UNDEFINED");
        assertSimplifies("UNDEFINED", "sin(1/0)");
        assertSimplifies("UNDEFINED", "x^UNDEFINED");
        assertSimplifies("UNDEFINED", "UNDEFINED!");
    }

    @Test
    public void isIdempotent() throws Exception {
        String[] inputs = {
            "2(x+1)+3(x+1)", "x*y*x^2/y", "(a+b)^2*c", "sin(-x)^2 + cos(x)",
            "ln(2*x^3)", "x^(1/2)*x^(1/2)", "3!*a + a/2", "exp(x)*exp(y)",
            "2^(1/2)*2^(1/2)*(-1/3)*y", "2^(1/2)/(y/2^(1/2)*(-3))",
            "5*3^(1/2)*x*3^(1/2) + 1"
        };
        for (String input : inputs) {
            Expression once = simplify(input);
            assertEquals(once, Symbolic.simplify(once), input);
        }
    }

    @Test
    public void isCommutative() throws Exception {
        assertEquals(simplify("a+b+c"), simplify("c+a+b"));
        assertEquals(simplify("a*b*c"), simplify("b*c*a"));
        assertEquals(simplify("sin(x)*x + y"), simplify("y + x*sin(x)"));
        assertEquals(simplify("x^2 + 2x + 1"), simplify("1 + x^2 + x*2"));
    }

    @Test
    public void constructorFunctionsSimplify() {
        Variable x = new Variable("x");
        assertEquals("2*x", Symbolic.add(x, x).toString());
        assertEquals("0", Symbolic.subtract(x, x).toString());
        assertEquals("x^2", Symbolic.multiply(x, x).toString());
        assertEquals("1", Symbolic.divide(x, x).toString());
        assertEquals("-1*x", Symbolic.negate(x).toString());
        assertEquals("0", Symbolic.sum(new ArrayList<Expression>()).toString());
        assertEquals("1", Symbolic.product(new ArrayList<Expression>()).toString());
        assertEquals("x^3", Symbolic.power(x, 3).toString());
        assertEquals("6", Symbolic.factorial(Symbolic.integer(3)).toString());
        assertEquals("1/3", Symbolic.rational(2, 6).toString());
    }

    @Test
    public void viewsOperands() throws Exception {
        Expression e = simplify("x + 2*y");
        List<Expression> terms = Symbolic.getTerms(e);
        assertEquals(2, terms.size());
        assertEquals(Arrays.asList(Symbolic.integer(2), new Variable("y")),
                     Symbolic.getFactors(terms.get(1)));
        assertEquals(1, Symbolic.getTerms(new Variable("x")).size());
    }

    @Test
    public void deepNestingTripsDepthGuard() {
        Expression e = new Variable("x");
        for (int i = 0; i < 1000; i++) {
            e = new ElementaryFunction(ElementaryKind.SIN, e);
        }
        try {
            Symbolic.simplify(e);
            fail("nesting of 1000 levels was simplified");
        } catch (ExpressionTooComplexException ex) {
            assertEquals(Symbolic.DEFAULT_MAX_DEPTH, ex.getDepth());
        }
    }

    @Test
    public void depthLimitFollowsOption() {
        Expression e = new Variable("x");
        for (int i = 0; i < 1000; i++) {
            e = new ElementaryFunction(ElementaryKind.SIN, e);
        }
        Driver.setOptionValue("max-depth", "5000");
        assertEquals(5000, Symbolic.getMaxDepth());
        assertTrue(Symbolic.simplify(e) instanceof ElementaryFunction);
    }

}
