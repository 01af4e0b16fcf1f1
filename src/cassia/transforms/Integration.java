package cassia.transforms;

import cassia.analysis.PolynomialTools;
import cassia.exec.Driver;
import cassia.hir.DepthFirstIterator;
import cassia.hir.ElementaryFunction;
import cassia.hir.ElementaryKind;
import cassia.hir.Expression;
import cassia.hir.ExpressionOrder;
import cassia.hir.ExpressionTooComplexException;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Power;
import cassia.hir.PrintTools;
import cassia.hir.Product;
import cassia.hir.Sum;
import cassia.hir.Symbolic;
import cassia.hir.Undefined;
import cassia.hir.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
* Heuristic integration. The integrator tries its strategies in a fixed
* order: the table of basic forms, linearity, derivative-divides
* substitution, rational functions, integration by parts and, as a last
* resort, integration of the expanded or trigonometrically simplified
* integrand. Each attempt consumes one unit of a retry budget read from the
* "integration-budget" option, so every call terminates.
*/
public class Integration {

    /** The default number of attempts one integration may make. */
    public static final int DEFAULT_BUDGET = 400;

    // Nesting limit of recursive attempts.
    private static final int MAX_NESTING = 64;

    private static final String pass_name = "[Integration]";

    private int budget;

    private int nesting;

    private int fresh_count;

    private boolean exhausted;

    private Integration(int budget) {
        this.budget = budget;
        nesting = 0;
        fresh_count = 0;
        exhausted = false;
    }

    /**
    * Returns the retry budget read from the "integration-budget" option.
    */
    public static int getBudget() {
        String value = Driver.getOptionValue("integration-budget");
        if (value == null) {
            return DEFAULT_BUDGET;
        }
        try {
            int ret = Integer.parseInt(value.trim());
            return (ret > 0) ? ret : DEFAULT_BUDGET;
        } catch(NumberFormatException ex) {
            return DEFAULT_BUDGET;
        }
    }

    /**
    * Integrates {@code u} with respect to the expression {@code wrt}, which
    * must be a variable.
    *
    * @throws IllegalArgumentException if {@code wrt} is not a variable.
    */
    public static IntegrationResult integrate(Expression u, Expression wrt) {
        if (!(wrt instanceof Variable)) {
            throw new IllegalArgumentException("cannot integrate with respect to "
                    + wrt + ", which is not a variable");
        }
        return integrate(u, (Variable)wrt);
    }

    /**
    * Integrates {@code u} with respect to {@code x}. The antiderivative is
    * returned without a constant of integration. An undefined integrand
    * integrates to {@link Undefined#UNDEFINED}.
    *
    * @param u the integrand.
    * @param x the variable of integration.
    * @return the outcome of the integration.
    */
    public static IntegrationResult integrate(Expression u, Variable x) {
        Integration integration = new Integration(getBudget());
        try {
            Expression v = Symbolic.simplify(u);
            if (v instanceof Undefined) {
                return IntegrationResult.integrated(v);
            }
            Expression ret = integration.integrate(v, x, true);
            if (ret != null) {
                return IntegrationResult.integrated(ret);
            }
        } catch(ExpressionTooComplexException ex) {
            PrintTools.printlnStatus(1, pass_name, ex.getMessage());
            return IntegrationResult.tooComplex();
        }
        if (integration.exhausted) {
            PrintTools.printlnStatus(1, pass_name, "budget exhausted for", u);
            return IntegrationResult.tooComplex();
        }
        return IntegrationResult.notFound();
    }

    // One attempt; returns null on failure.
    private Expression integrate(Expression u, Variable x, boolean fallback) {
        if (exhausted || budget <= 0 || nesting >= MAX_NESTING) {
            exhausted = true;
            return null;
        }
        budget--;
        nesting++;
        try {
            PrintTools.printlnStatus(2, pass_name, "integrate", u, "d" + x);
            Expression ret = accept(integrateTable(u, x));
            if (ret == null) {
                ret = accept(integrateLinear(u, x));
            }
            if (ret == null) {
                ret = accept(integrateSubstitution(u, x));
            }
            if (ret == null) {
                ret = accept(integrateRational(u, x));
            }
            if (ret == null) {
                ret = accept(integrateByParts(u, x));
            }
            if (ret == null && fallback) {
                ret = accept(integrateFallback(u, x));
            }
            if (ret == null) {
                PrintTools.printlnStatus(2, pass_name, "no antiderivative for", u);
            } else {
                PrintTools.printlnStatus(2, pass_name, u, "->", ret);
            }
            return ret;
        } finally {
            nesting--;
        }
    }

    // A strategy that produces UNDEFINED has failed.
    private static Expression accept(Expression e) {
        if (e == null || e instanceof Undefined) {
            return null;
        }
        return e;
    }

    // Constants, powers of x, exponentials of x and the basic table.
    private Expression integrateTable(Expression u, Variable x) {
        if (Substitution.freeOf(u, x)) {
            return Symbolic.multiply(u, x);
        }
        if (u instanceof Power) {
            Expression base = u.base(), n = u.exponent();
            if (base.equals(x) && Substitution.freeOf(n, x)
                    && !n.equals(IntegerLiteral.MINUS_ONE)) {
                Expression m = Symbolic.add(n, IntegerLiteral.ONE);
                return Symbolic.divide(Symbolic.power(x, m), m);
            }
            if (n.equals(x) && Substitution.freeOf(base, x)) {
                return Symbolic.divide(u, Symbolic.ln(base));
            }
        }
        return IntegrationTable.lookup(u, x);
    }

    // Sums term by term; constant factors move out of the integral.
    private Expression integrateLinear(Expression u, Variable x) {
        if (u instanceof Sum) {
            List<Expression> terms = new ArrayList<Expression>(u.getChildren().size());
            for (Expression term : u.getChildren()) {
                Expression integral = integrate(term, x, true);
                if (integral == null) {
                    return null;
                }
                terms.add(integral);
            }
            return Symbolic.sum(terms);
        } else if (u instanceof Product) {
            List<Expression> free = new ArrayList<Expression>();
            List<Expression> dependent = new ArrayList<Expression>();
            for (Expression factor : u.getChildren()) {
                if (Substitution.freeOf(factor, x)) {
                    free.add(factor);
                } else {
                    dependent.add(factor);
                }
            }
            if (free.isEmpty()) {
                return null;
            }
            Expression integral = integrate(Symbolic.product(dependent), x, true);
            if (integral == null) {
                return null;
            }
            return Symbolic.multiply(Symbolic.product(free), integral);
        }
        return null;
    }

    /**
    * Derivative-divides substitution: for a candidate {@code g} taken from
    * the function arguments, bases and exponents of {@code u}, the integrand
    * {@code u/g'} is rewritten with {@code g} replaced by a fresh variable.
    * The substitution succeeds when the result no longer depends on
    * {@code x}.
    */
    private Expression integrateSubstitution(Expression u, Variable x) {
        for (Expression g : trialSubstitutions(u)) {
            if (g.equals(x) || g.equals(u) || Substitution.freeOf(g, x)) {
                continue;
            }
            Expression dg = Differentiation.derivative(g, x);
            if (Symbolic.isZero(dg) || dg instanceof Undefined) {
                continue;
            }
            Variable fresh = new Variable("_u" + (++fresh_count));
            Expression v = Substitution.substitute(Symbolic.divide(u, dg), g, fresh);
            if (!Substitution.freeOf(v, x) || v instanceof Undefined) {
                continue;
            }
            Expression integral = integrate(v, fresh, true);
            if (integral != null) {
                return Substitution.substitute(integral, fresh, g);
            }
            if (exhausted) {
                return null;
            }
        }
        return null;
    }

    // Function nodes, their arguments, and the bases and exponents of powers.
    private static Set<Expression> trialSubstitutions(Expression u) {
        Set<Expression> ret = new TreeSet<Expression>(ExpressionOrder.getInstance());
        DepthFirstIterator<Expression> iter = new DepthFirstIterator<Expression>(u);
        for (ElementaryFunction f : iter.getList(ElementaryFunction.class)) {
            if (f.getKind() != ElementaryKind.DERIV) {
                ret.add(f);
                ret.add(f.getArgument());
            }
        }
        iter.reset();
        for (Power p : iter.getList(Power.class)) {
            ret.add(p.base());
            ret.add(p.exponent());
        }
        return ret;
    }

    /**
    * Rational functions {@code n/d} of polynomials in {@code x}. Improper
    * fractions are divided first; a linear denominator gives a logarithm, a
    * quadratic one with negative discriminant an arctangent, and a
    * denominator with two square-free factors is split into partial
    * fractions.
    */
    private Expression integrateRational(Expression u, Variable x) {
        Expression w = Rationalization.rationalize(u);
        Expression n = AlgebraicExpansion.expand(Rationalization.numerator(w));
        Expression d = AlgebraicExpansion.expand(Rationalization.denominator(w));
        if (Substitution.freeOf(d, x)
                || !PolynomialTools.isPolynomial(n, x)
                || !PolynomialTools.isPolynomial(d, x)) {
            return null;
        }
        try {
            int nd = PolynomialTools.degree(n, x);
            int dd = PolynomialTools.degree(d, x);
            if (nd >= dd) {
                Expression[] qr = PolynomialTools.polynomialDivide(n, d, x);
                Expression integral = integrate(qr[0], x, false);
                if (integral == null) {
                    return null;
                }
                if (Symbolic.isZero(qr[1])) {
                    return integral;
                }
                Expression rest = integrate(Symbolic.divide(qr[1], d), x, false);
                return (rest == null) ? null : Symbolic.add(integral, rest);
            }
            if (dd == 1) {
                Expression a = PolynomialTools.linearForm(d, x)[0];
                return Symbolic.multiply(Symbolic.divide(n, a), Symbolic.ln(d));
            }
            if (dd == 2) {
                return integrateQuadratic(n, d, x);
            }
            return integratePartialFractions(n, d, x);
        } catch(ArithmeticException ex) {
            PrintTools.printlnStatus(2, pass_name, "rational strategy failed:", ex.getMessage());
            return null;
        } catch(IllegalArgumentException ex) {
            PrintTools.printlnStatus(2, pass_name, "rational strategy failed:", ex.getMessage());
            return null;
        }
    }

    // (r*x + s)/(a*x^2 + b*x + c) = alpha*(2*a*x + b)/den + beta/den.
    private Expression integrateQuadratic(Expression n, Expression d, Variable x) {
        Expression[] abc = PolynomialTools.quadraticForm(d, x);
        Expression[] rs = PolynomialTools.linearForm(n, x);
        if (abc == null || rs == null) {
            return null;
        }
        Expression a = abc[0], b = abc[1], c = abc[2];
        Expression r = rs[0], s = rs[1];
        Expression two_a = Symbolic.multiply(Literal.valueOf(2), a);
        Expression alpha = Symbolic.divide(r, two_a);
        Expression beta = Symbolic.subtract(s, Symbolic.multiply(alpha, b));
        List<Expression> terms = new ArrayList<Expression>(2);
        if (!Symbolic.isZero(alpha)) {
            terms.add(Symbolic.multiply(alpha, Symbolic.ln(d)));
        }
        if (!Symbolic.isZero(beta)) {
            Expression reciprocal = integrateReciprocalQuadratic(a, b, c, x);
            if (reciprocal == null) {
                return null;
            }
            terms.add(Symbolic.multiply(beta, reciprocal));
        }
        return Symbolic.sum(terms);
    }

    // Antiderivative of 1/(a*x^2 + b*x + c) for a discriminant that is not
    // positive.
    private static Expression integrateReciprocalQuadratic(Expression a, Expression b,
                                                           Expression c, Variable x) {
        Expression discriminant = Symbolic.subtract(Symbolic.power(b, 2),
                Symbolic.product(Literal.valueOf(4), a, c));
        if (!(discriminant instanceof Literal)) {
            return null;
        }
        Literal D = (Literal)discriminant;
        Expression linear = Symbolic.add(
                Symbolic.product(Literal.valueOf(2), a, x), b);
        if (D.isZero()) {
            return Symbolic.divide(Literal.valueOf(-2), linear);
        }
        if (D.isPositive()) {
            return null;
        }
        Expression root = Symbolic.sqrt(D.negate());
        return Symbolic.multiply(Symbolic.divide(Literal.valueOf(2), root),
                Symbolic.arctan(Symbolic.divide(linear, root)));
    }

    // n/(c*f1*f2) with two coprime square-free factors.
    private Expression integratePartialFractions(Expression n, Expression d, Variable x) {
        List<Expression> factors = PolynomialTools.squareFreeFactor(d, x);
        if (factors.size() != 3) {
            return null;
        }
        Expression c = factors.get(0), f1 = factors.get(1), f2 = factors.get(2);
        Expression[] parts = PolynomialTools.partialFractions(n, f1, f2, x);
        if (parts == null) {
            return null;
        }
        Expression i1 = integrate(Symbolic.divide(parts[0], f1), x, false);
        if (i1 == null) {
            return null;
        }
        Expression i2 = integrate(Symbolic.divide(parts[1], f2), x, false);
        if (i2 == null) {
            return null;
        }
        return Symbolic.divide(Symbolic.add(i1, i2), c);
    }

    /**
    * Integration by parts of {@code x^n*f(a*x + b)} for a positive integer
    * {@code n} and {@code f} one of exp, sin and cos.
    */
    private Expression integrateByParts(Expression u, Variable x) {
        if (!(u instanceof Product) || u.getChildren().size() != 2) {
            return null;
        }
        for (int i = 0; i < 2; i++) {
            Expression p = u.getChild(i), f = u.getChild(1 - i);
            int n = powerOf(p, x);
            if (n <= 0 || !(f instanceof ElementaryFunction)) {
                continue;
            }
            ElementaryKind kind = ((ElementaryFunction)f).getKind();
            if (kind != ElementaryKind.EXP && kind != ElementaryKind.SIN
                    && kind != ElementaryKind.COS) {
                continue;
            }
            Expression arg = ((ElementaryFunction)f).getArgument();
            Expression[] ab = PolynomialTools.linearForm(arg, x);
            if (ab == null || Symbolic.isZero(ab[0])
                    || !Substitution.freeOf(ab[0], x)) {
                continue;
            }
            return byParts(n, kind, arg, ab[0], x);
        }
        return null;
    }

    // The exponent of x^n, one for x itself, and zero otherwise.
    private static int powerOf(Expression p, Variable x) {
        if (p.equals(x)) {
            return 1;
        }
        if (p instanceof Power && p.base().equals(x)
                && p.exponent() instanceof IntegerLiteral) {
            IntegerLiteral n = (IntegerLiteral)p.exponent();
            if (n.signum() > 0 && n.fitsInt()) {
                return n.getValue().intValue();
            }
        }
        return 0;
    }

    // Repeated integration by parts, lowering the power of x each step.
    private static Expression byParts(int n, ElementaryKind kind, Expression arg,
                                      Expression a, Variable x) {
        Expression f = Symbolic.function(kind, arg);
        Expression g;
        if (kind == ElementaryKind.EXP) {
            g = f;
        } else if (kind == ElementaryKind.SIN) {
            g = Symbolic.negate(Symbolic.cos(arg));
        } else {
            g = Symbolic.sin(arg);
        }
        // g/a is an antiderivative of f.
        Expression antiderivative = Symbolic.divide(g, a);
        if (n == 0) {
            return antiderivative;
        }
        ElementaryKind next = kind;
        Expression sign = IntegerLiteral.ONE;
        if (kind == ElementaryKind.SIN) {
            next = ElementaryKind.COS;
            sign = IntegerLiteral.MINUS_ONE;
        } else if (kind == ElementaryKind.COS) {
            next = ElementaryKind.SIN;
        }
        Expression rest = byParts(n - 1, next, arg, a, x);
        Expression factor = Symbolic.divide(Literal.valueOf(n), a);
        return Symbolic.subtract(
                Symbolic.multiply(Symbolic.power(x, n), antiderivative),
                Symbolic.product(sign, factor, rest));
    }

    // Integrates the expanded form, then the trigonometric normal form.
    private Expression integrateFallback(Expression u, Variable x) {
        Expression expanded = AlgebraicExpansion.expand(u);
        if (!expanded.equals(u)) {
            Expression integral = integrate(expanded, x, false);
            if (integral != null) {
                return integral;
            }
        }
        if (exhausted) {
            return null;
        }
        Expression trig = TrigSimplification.simplify(u);
        if (!trig.equals(u) && !trig.equals(expanded) && !(trig instanceof Undefined)) {
            return integrate(trig, x, false);
        }
        return null;
    }

}
