package cassia.transforms;

import cassia.analysis.GCD;
import cassia.hir.ElementaryFunction;
import cassia.hir.Expression;
import cassia.hir.FunctionCall;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Power;
import cassia.hir.Product;
import cassia.hir.Sum;
import cassia.hir.Symbolic;

import java.util.ArrayList;
import java.util.List;

/**
* Algebraic expansion: products are distributed over sums and sums raised to
* positive integer powers are expanded with the binomial theorem. The
* arguments of function applications are expanded as well.
*/
public final class AlgebraicExpansion {

    private AlgebraicExpansion() {
    }

    /**
    * Returns the expanded form of a simplified expression.
    */
    public static Expression expand(Expression u) {
        if (u instanceof Sum) {
            List<Expression> terms = new ArrayList<Expression>(u.getChildren().size());
            for (Expression term : u.getChildren()) {
                terms.add(expand(term));
            }
            return Symbolic.sum(terms);
        } else if (u instanceof Product) {
            Expression ret = IntegerLiteral.ONE;
            for (Expression factor : u.getChildren()) {
                ret = expandProduct(ret, expand(factor));
            }
            return ret;
        } else if (u instanceof Power) {
            Expression base = expand(u.base());
            Expression exponent = u.exponent();
            int n = positiveInteger(exponent);
            if (n > 0) {
                return expandPower(base, n);
            }
            return Symbolic.power(base, exponent);
        } else if (u instanceof ElementaryFunction || u instanceof FunctionCall) {
            List<Expression> args = new ArrayList<Expression>(u.getChildren().size());
            for (Expression arg : u.getChildren()) {
                args.add(expand(arg));
            }
            return Symbolic.simplify(u.withChildren(args));
        }
        return u;
    }

    /**
    * Expands only the top-level operator: a product is distributed over the
    * sums among its factors and a sum raised to a positive integer power is
    * expanded, while the operands themselves are left as they are.
    */
    public static Expression expandMainOperator(Expression u) {
        if (u instanceof Product) {
            Expression ret = IntegerLiteral.ONE;
            for (Expression factor : u.getChildren()) {
                ret = expandProduct(ret, factor);
            }
            return ret;
        } else if (u instanceof Power) {
            int n = positiveInteger(u.exponent());
            if (n > 0) {
                return expandPower(u.base(), n);
            }
        }
        return u;
    }

    /**
    * Returns the expanded product of two expanded expressions.
    */
    public static Expression expandProduct(Expression r, Expression s) {
        if (r instanceof Sum) {
            List<Expression> terms = new ArrayList<Expression>(r.getChildren().size());
            for (Expression term : r.getChildren()) {
                terms.add(expandProduct(term, s));
            }
            return Symbolic.sum(terms);
        } else if (s instanceof Sum) {
            return expandProduct(s, r);
        }
        return Symbolic.multiply(r, s);
    }

    /**
    * Returns the expanded n-th power of an expanded expression.
    */
    public static Expression expandPower(Expression u, int n) {
        if (n == 0) {
            return IntegerLiteral.ONE;
        }
        if (!(u instanceof Sum)) {
            return Symbolic.power(u, n);
        }
        List<Expression> terms = u.getChildren();
        Expression f = terms.get(0);
        Expression r = Symbolic.sum(terms.subList(1, terms.size()));
        List<Expression> sum = new ArrayList<Expression>(n + 1);
        for (int k = 0; k <= n; k++) {
            Expression c = Literal.valueOf(GCD.binomial(n, k));
            Expression head = Symbolic.product(c, Symbolic.power(f, n - k));
            sum.add(expandProduct(head, expandPower(r, k)));
        }
        return Symbolic.sum(sum);
    }

    // The value of a positive integer literal that fits an int, else zero.
    private static int positiveInteger(Expression e) {
        if (e instanceof IntegerLiteral) {
            IntegerLiteral n = (IntegerLiteral)e;
            if (n.signum() > 0 && n.fitsInt()) {
                return n.getValue().intValue();
            }
        }
        return 0;
    }

}
