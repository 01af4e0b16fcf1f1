package cassia.transforms;

import cassia.hir.Expression;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Power;
import cassia.hir.Product;
import cassia.hir.Sum;
import cassia.hir.Symbolic;

import java.util.ArrayList;
import java.util.List;

/**
* Numerator, denominator and rationalization of simplified expressions. A
* factor with a negative literal exponent belongs to the denominator; the
* rationalized form of an expression is a single quotient whose numerator
* and denominator have no common denominators left.
*/
public final class Rationalization {

    private Rationalization() {
    }

    /** Returns the numerator of a simplified expression. */
    public static Expression numerator(Expression u) {
        if (u instanceof Literal) {
            return Literal.valueOf(((Literal)u).getNumerator());
        } else if (u instanceof Power) {
            if (isNegativeLiteral(u.exponent())) {
                return IntegerLiteral.ONE;
            }
            return u;
        } else if (u instanceof Product) {
            List<Expression> factors = new ArrayList<Expression>(u.getChildren().size());
            for (Expression factor : u.getChildren()) {
                factors.add(numerator(factor));
            }
            return Symbolic.product(factors);
        }
        return u;
    }

    /** Returns the denominator of a simplified expression. */
    public static Expression denominator(Expression u) {
        if (u instanceof Literal) {
            return Literal.valueOf(((Literal)u).getDenominator());
        } else if (u instanceof Power) {
            if (isNegativeLiteral(u.exponent())) {
                return Symbolic.power(u.base(), ((Literal)u.exponent()).negate());
            }
            return IntegerLiteral.ONE;
        } else if (u instanceof Product) {
            List<Expression> factors = new ArrayList<Expression>(u.getChildren().size());
            for (Expression factor : u.getChildren()) {
                factors.add(denominator(factor));
            }
            return Symbolic.product(factors);
        }
        return IntegerLiteral.ONE;
    }

    /**
    * Returns the rationalized form of a simplified expression: sums of
    * fractions are brought over a common denominator, recursively.
    */
    public static Expression rationalize(Expression u) {
        if (u instanceof Power) {
            return Symbolic.power(rationalize(u.base()), u.exponent());
        } else if (u instanceof Product) {
            List<Expression> factors = new ArrayList<Expression>(u.getChildren().size());
            for (Expression factor : u.getChildren()) {
                factors.add(rationalize(factor));
            }
            return Symbolic.product(factors);
        } else if (u instanceof Sum) {
            List<Expression> terms = u.getChildren();
            Expression ret = rationalize(terms.get(0));
            for (int i = 1; i < terms.size(); i++) {
                ret = rationalizeSum(ret, rationalize(terms.get(i)));
            }
            return ret;
        }
        return u;
    }

    // u + v over the common denominator.
    private static Expression rationalizeSum(Expression u, Expression v) {
        Expression m = numerator(u), r = denominator(u);
        Expression n = numerator(v), s = denominator(v);
        if (Symbolic.isOne(r) && Symbolic.isOne(s)) {
            return Symbolic.add(u, v);
        }
        Expression num = rationalizeSum(Symbolic.multiply(m, s), Symbolic.multiply(n, r));
        return Symbolic.divide(num, Symbolic.multiply(r, s));
    }

    private static boolean isNegativeLiteral(Expression e) {
        return (e instanceof Literal) && ((Literal)e).isNegative();
    }

}
