package cassia.analysis;

import cassia.hir.Expression;
import cassia.hir.IntegerLiteral;
import cassia.hir.Power;
import cassia.hir.Product;
import cassia.hir.Sum;
import cassia.hir.Symbolic;
import cassia.hir.Variable;
import cassia.transforms.AlgebraicExpansion;
import cassia.transforms.Differentiation;
import cassia.transforms.Substitution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Polynomial algebra over generalized polynomial expressions. A generalized
* polynomial in the generalized variables {@code vars} is a sum of monomials,
* and a monomial is a product of coefficients free of {@code vars} and of
* generalized variables raised to positive integer powers. The generalized
* variables may be any expressions, e.g. {@code sin(x)}. All inputs are
* expected in simplified form; the division based methods also expect
* expanded input and rational coefficients.
*/
public final class PolynomialTools {

    // Upper bound of the division steps per degree of the dividend.
    private static final int MAX_DIVISION_STEPS = 64;

    private PolynomialTools() {
    }

    /**
    * Checks if {@code u} is a monomial in the given generalized variables.
    */
    public static boolean isMonomial(Expression u, List<? extends Expression> vars) {
        if (vars.contains(u)) {
            return true;
        }
        if (u instanceof Power) {
            return vars.contains(u.base()) && positiveExponent(u.exponent()) > 1;
        } else if (u instanceof Product) {
            for (Expression factor : u.getChildren()) {
                if (!isMonomial(factor, vars)) {
                    return false;
                }
            }
            return true;
        }
        return Substitution.freeOf(u, vars);
    }

    /**
    * Checks if {@code u} is a polynomial in the given generalized variables.
    */
    public static boolean isPolynomial(Expression u, List<? extends Expression> vars) {
        if (!(u instanceof Sum)) {
            return isMonomial(u, vars);
        }
        if (vars.contains(u)) {
            return true;
        }
        for (Expression term : u.getChildren()) {
            if (!isMonomial(term, vars)) {
                return false;
            }
        }
        return true;
    }

    /** Checks if {@code u} is a polynomial in {@code x}. */
    public static boolean isPolynomial(Expression u, Expression x) {
        return isPolynomial(u, Collections.singletonList(x));
    }

    /**
    * Returns the total degree of {@code u} in the generalized variables,
    * -1 for the zero polynomial, or null if {@code u} is not a polynomial.
    */
    public static Integer degree(Expression u, List<? extends Expression> vars) {
        if (Symbolic.isZero(u)) {
            return -1;
        }
        if (u instanceof Sum && !vars.contains(u)) {
            int ret = 0;
            for (Expression term : u.getChildren()) {
                Integer d = degreeMonomial(term, vars);
                if (d == null) {
                    return null;
                }
                ret = Math.max(ret, d);
            }
            return ret;
        }
        return degreeMonomial(u, vars);
    }

    /** Returns the degree of {@code u} in {@code x}; see {@link #degree(Expression, List)}. */
    public static Integer degree(Expression u, Expression x) {
        return degree(u, Collections.singletonList(x));
    }

    // Degree of a monomial, or null.
    private static Integer degreeMonomial(Expression u, List<? extends Expression> vars) {
        if (vars.contains(u)) {
            return 1;
        }
        if (u instanceof Power) {
            int n = positiveExponent(u.exponent());
            if (vars.contains(u.base()) && n > 1) {
                return n;
            }
        } else if (u instanceof Product) {
            int ret = 0;
            for (Expression factor : u.getChildren()) {
                Integer d = degreeMonomial(factor, vars);
                if (d == null) {
                    return null;
                }
                ret += d;
            }
            return ret;
        }
        return Substitution.freeOf(u, vars) ? Integer.valueOf(0) : null;
    }

    /**
    * Returns the sum of the coefficients of {@code x^j} in {@code u}, or null
    * if {@code u} is not a polynomial in {@code x}.
    */
    public static Expression coefficient(Expression u, Expression x, int j) {
        if (!(u instanceof Sum) || u.equals(x)) {
            Expression[] cm = coefficientMonomial(u, x);
            if (cm == null) {
                return null;
            }
            return (degreeOf(cm) == j) ? cm[0] : IntegerLiteral.ZERO;
        }
        List<Expression> coefficients = new ArrayList<Expression>();
        for (Expression term : u.getChildren()) {
            Expression[] cm = coefficientMonomial(term, x);
            if (cm == null) {
                return null;
            }
            if (degreeOf(cm) == j) {
                coefficients.add(cm[0]);
            }
        }
        return Symbolic.sum(coefficients);
    }

    // [coefficient, degree] of a monomial in x, or null.
    private static Expression[] coefficientMonomial(Expression u, Expression x) {
        if (u.equals(x)) {
            return new Expression[] {IntegerLiteral.ONE, IntegerLiteral.ONE};
        }
        if (u instanceof Power) {
            int n = positiveExponent(u.exponent());
            if (u.base().equals(x) && n > 1) {
                return new Expression[] {IntegerLiteral.ONE, u.exponent()};
            }
        } else if (u instanceof Product) {
            Expression m = IntegerLiteral.ZERO;
            Expression c = u;
            for (Expression factor : u.getChildren()) {
                Expression[] f = coefficientMonomial(factor, x);
                if (f == null) {
                    return null;
                }
                if (!Symbolic.isZero(f[1])) {
                    m = f[1];
                    c = Symbolic.divide(u, Symbolic.power(x, m));
                }
            }
            return new Expression[] {c, m};
        }
        if (Substitution.freeOf(u, x)) {
            return new Expression[] {u, IntegerLiteral.ZERO};
        }
        return null;
    }

    private static int degreeOf(Expression[] cm) {
        return ((IntegerLiteral)cm[1]).getValue().intValue();
    }

    /**
    * Returns the leading coefficient of {@code u} in {@code x}, or null if
    * {@code u} is not a polynomial in {@code x}.
    */
    public static Expression leadingCoefficient(Expression u, Expression x) {
        Integer d = degree(u, x);
        if (d == null) {
            return null;
        }
        if (d < 0) {
            return IntegerLiteral.ZERO;
        }
        return coefficient(u, x, d);
    }

    /**
    * Returns {@code [a, b]} with {@code u = a*x + b}, or null if {@code u} is
    * not a polynomial of degree at most one in {@code x}.
    */
    public static Expression[] linearForm(Expression u, Expression x) {
        Integer d = degree(u, x);
        if (d == null || d > 1) {
            return null;
        }
        return new Expression[] {coefficient(u, x, 1), coefficient(u, x, 0)};
    }

    /**
    * Returns {@code [a, b, c]} with {@code u = a*x^2 + b*x + c}, or null if
    * {@code u} is not a polynomial of degree at most two in {@code x}.
    */
    public static Expression[] quadraticForm(Expression u, Expression x) {
        Integer d = degree(u, x);
        if (d == null || d > 2) {
            return null;
        }
        return new Expression[] {
                coefficient(u, x, 2), coefficient(u, x, 1), coefficient(u, x, 0)};
    }

    /**
    * Divides {@code u} by {@code v} as polynomials in the first variable of
    * {@code vars}; the other symbols are treated as coefficients.
    *
    * @return {@code [quotient, remainder]}.
    * @throws ArithmeticException if {@code v} is zero or the division does
    *       not terminate.
    * @throws IllegalArgumentException if an operand is not a polynomial.
    */
    public static Expression[] polynomialDivide(Expression u, Expression v,
                                                List<? extends Expression> vars) {
        return polynomialDivide(u, v, vars.get(0));
    }

    /**
    * Divides {@code u} by {@code v} as polynomials in {@code x}.
    * @see #polynomialDivide(Expression, Expression, List)
    */
    public static Expression[] polynomialDivide(Expression u, Expression v, Expression x) {
        if (Symbolic.isZero(v)) {
            throw new ArithmeticException("polynomial division by zero");
        }
        Integer m = degree(u, x), n = degree(v, x);
        if (m == null || n == null) {
            throw new IllegalArgumentException("not a polynomial in " + x);
        }
        Expression lcv = leadingCoefficient(v, x);
        Expression q = IntegerLiteral.ZERO;
        Expression r = u;
        int steps = MAX_DIVISION_STEPS * (Math.max(m, 0) + 1);
        while (m >= n) {
            if (--steps < 0) {
                throw new ArithmeticException("polynomial division of " + u
                        + " by " + v + " does not terminate");
            }
            Expression lcr = leadingCoefficient(r, x);
            Expression s = Symbolic.divide(lcr, lcv);
            Expression monomial = Symbolic.multiply(s, Symbolic.power(x, m - n));
            q = Symbolic.add(q, monomial);
            Expression top = Symbolic.multiply(lcr, Symbolic.power(x, m));
            Expression rest = Symbolic.subtract(v, Symbolic.multiply(lcv, Symbolic.power(x, n)));
            r = AlgebraicExpansion.expand(Symbolic.subtract(Symbolic.subtract(r, top),
                    Symbolic.multiply(rest, monomial)));
            m = degree(r, x);
            if (m == null) {
                throw new IllegalArgumentException("not a polynomial in " + x);
            }
        }
        return new Expression[] {q, r};
    }

    /** Returns the polynomial quotient of {@code u} and {@code v} in {@code x}. */
    public static Expression quotient(Expression u, Expression v, Expression x) {
        return polynomialDivide(u, v, x)[0];
    }

    /** Returns the polynomial remainder of {@code u} and {@code v} in {@code x}. */
    public static Expression remainder(Expression u, Expression v, Expression x) {
        return polynomialDivide(u, v, x)[1];
    }

    /**
    * Returns the monic greatest common divisor of two polynomials in
    * {@code x} with rational coefficients.
    */
    public static Expression polynomialGcd(Expression u, Expression v, Expression x) {
        if (Symbolic.isZero(u) && Symbolic.isZero(v)) {
            return IntegerLiteral.ZERO;
        }
        Expression a = u, b = v;
        while (!Symbolic.isZero(b)) {
            Expression r = remainder(a, b, x);
            a = b;
            b = r;
        }
        return AlgebraicExpansion.expand(
                Symbolic.divide(a, leadingCoefficient(a, x)));
    }

    /**
    * Returns {@code [g, A, B]} where {@code g} is the monic greatest common
    * divisor of {@code u} and {@code v} and {@code A*u + B*v = g}.
    */
    public static Expression[] extendedGcd(Expression u, Expression v, Expression x) {
        if (Symbolic.isZero(u) && Symbolic.isZero(v)) {
            return new Expression[] {
                    IntegerLiteral.ZERO, IntegerLiteral.ZERO, IntegerLiteral.ZERO};
        }
        Expression a = u, b = v;
        Expression app = IntegerLiteral.ONE, ap = IntegerLiteral.ZERO;
        Expression bpp = IntegerLiteral.ZERO, bp = IntegerLiteral.ONE;
        while (!Symbolic.isZero(b)) {
            Expression[] qr = polynomialDivide(a, b, x);
            Expression na = AlgebraicExpansion.expand(
                    Symbolic.subtract(app, Symbolic.multiply(qr[0], ap)));
            Expression nb = AlgebraicExpansion.expand(
                    Symbolic.subtract(bpp, Symbolic.multiply(qr[0], bp)));
            app = ap;
            ap = na;
            bpp = bp;
            bp = nb;
            a = b;
            b = qr[1];
        }
        Expression c = leadingCoefficient(a, x);
        return new Expression[] {
                AlgebraicExpansion.expand(Symbolic.divide(a, c)),
                AlgebraicExpansion.expand(Symbolic.divide(app, c)),
                AlgebraicExpansion.expand(Symbolic.divide(bpp, c))};
    }

    /**
    * Computes the square-free factorization of a polynomial in {@code x}
    * with rational coefficients.
    *
    * @return {@code [c, f1, f2, ...]} where {@code c} is the leading
    *       coefficient and each {@code fi} is the expanded i-th power of a
    *       square-free factor; factors equal to one are left out.
    */
    public static List<Expression> squareFreeFactor(Expression u, Variable x) {
        List<Expression> ret = new ArrayList<Expression>(4);
        Expression c = leadingCoefficient(u, x);
        if (c == null) {
            throw new IllegalArgumentException("not a polynomial in " + x);
        }
        ret.add(c);
        if (Symbolic.isZero(u) || degree(u, x) == 0) {
            return ret;
        }
        Expression monic = AlgebraicExpansion.expand(Symbolic.divide(u, c));
        Expression derivative = AlgebraicExpansion.expand(
                Differentiation.derivative(monic, x));
        Expression r = polynomialGcd(monic, derivative, x);
        Expression f = quotient(monic, r, x);
        int j = 1;
        while (degree(r, x) > 0) {
            Expression g = polynomialGcd(r, f, x);
            Expression s = quotient(f, g, x);
            addFactor(ret, s, j);
            r = quotient(r, g, x);
            f = g;
            j++;
        }
        addFactor(ret, f, j);
        return ret;
    }

    private static void addFactor(List<Expression> factors, Expression s, int j) {
        if (!Symbolic.isOne(s)) {
            factors.add(AlgebraicExpansion.expandPower(s, j));
        }
    }

    /**
    * Splits {@code u/(v1*v2)} into {@code u1/v1 + u2/v2} for coprime
    * polynomials {@code v1} and {@code v2} in {@code x}, where the degree of
    * {@code u} is less than the degree of {@code v1*v2}.
    *
    * @return {@code [u1, u2]}, or null if {@code v1} and {@code v2} have a
    *       common factor.
    */
    public static Expression[] partialFractions(Expression u, Expression v1,
                                                Expression v2, Expression x) {
        Expression[] gcd = extendedGcd(v1, v2, x);
        if (!Symbolic.isOne(gcd[0])) {
            return null;
        }
        // A*v1 + B*v2 = 1, so u/(v1*v2) = u*B/v1 + u*A/v2.
        Expression u1 = remainder(AlgebraicExpansion.expand(
                Symbolic.multiply(u, gcd[2])), v1, x);
        Expression u2 = remainder(AlgebraicExpansion.expand(
                Symbolic.multiply(u, gcd[1])), v2, x);
        return new Expression[] {u1, u2};
    }

    // The value of a positive integer exponent, or zero.
    private static int positiveExponent(Expression e) {
        if (e instanceof IntegerLiteral) {
            IntegerLiteral n = (IntegerLiteral)e;
            if (n.signum() > 0 && n.fitsInt()) {
                return n.getValue().intValue();
            }
        }
        return 0;
    }

}
