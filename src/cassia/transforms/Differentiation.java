package cassia.transforms;

import cassia.hir.ElementaryFunction;
import cassia.hir.ElementaryKind;
import cassia.hir.Expression;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Power;
import cassia.hir.Product;
import cassia.hir.Sum;
import cassia.hir.Symbolic;
import cassia.hir.Undefined;
import cassia.hir.Variable;

import java.util.ArrayList;
import java.util.List;

/**
* Symbolic differentiation. The derivative is built as a raw tree by the
* usual rules and simplified once at the end. Sub-expressions the rules do
* not cover, such as factorials and user function calls, are kept as the
* unresolved marker {@code Deriv(f, x)}.
*/
public final class Differentiation {

    private static final Literal minus_one_half = Literal.valueOf(-1, 2);

    private Differentiation() {
    }

    /**
    * Returns the derivative of {@code u} with respect to the expression
    * {@code wrt}, which must be a variable.
    *
    * @throws IllegalArgumentException if {@code wrt} is not a variable.
    */
    public static Expression derivative(Expression u, Expression wrt) {
        if (!(wrt instanceof Variable)) {
            throw new IllegalArgumentException("cannot differentiate with respect to "
                    + wrt + ", which is not a variable");
        }
        return derivative(u, (Variable)wrt);
    }

    /**
    * Returns the simplified derivative of {@code u} with respect to
    * {@code x}.
    */
    public static Expression derivative(Expression u, Variable x) {
        Expression v = Symbolic.simplify(u);
        if (v instanceof Undefined) {
            return v;
        }
        return Symbolic.simplify(differentiate(v, x));
    }

    /**
    * Returns the n-th derivative of {@code u} with respect to {@code x}.
    *
    * @throws IllegalArgumentException if n is negative.
    */
    public static Expression derivative(Expression u, Variable x, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("negative order " + n);
        }
        Expression ret = Symbolic.simplify(u);
        for (int i = 0; i < n && !(ret instanceof Undefined); i++) {
            ret = derivative(ret, x);
        }
        return ret;
    }

    // Raw derivative of a simplified expression.
    private static Expression differentiate(Expression u, Variable x) {
        if (u.equals(x)) {
            return IntegerLiteral.ONE;
        }
        if (Substitution.freeOf(u, x)) {
            return IntegerLiteral.ZERO;
        }
        if (u instanceof Power) {
            return differentiatePower(u.base(), u.exponent(), x);
        } else if (u instanceof Sum) {
            List<Expression> terms = new ArrayList<Expression>(u.getChildren().size());
            for (Expression term : u.getChildren()) {
                terms.add(differentiate(term, x));
            }
            return new Sum(terms);
        } else if (u instanceof Product) {
            List<Expression> factors = u.getChildren();
            Expression first = factors.get(0);
            Expression rest = (factors.size() == 2) ? factors.get(1)
                    : new Product(factors.subList(1, factors.size()));
            return new Sum(new Product(differentiate(first, x), rest),
                           new Product(first, differentiate(rest, x)));
        } else if (u instanceof ElementaryFunction) {
            return differentiateFunction((ElementaryFunction)u, x);
        }
        return ElementaryFunction.derivativeMarker(u, x);
    }

    // (v^w)' = w*v^(w-1)*v' + w'*v^w*ln(v), leaving out vanishing terms.
    private static Expression differentiatePower(Expression v, Expression w, Variable x) {
        List<Expression> terms = new ArrayList<Expression>(2);
        if (!Substitution.freeOf(v, x)) {
            List<Expression> factors = new ArrayList<Expression>(3);
            factors.add(w);
            factors.add(new Power(v, new Sum(w, IntegerLiteral.MINUS_ONE)));
            factors.add(differentiate(v, x));
            terms.add(new Product(factors));
        }
        if (!Substitution.freeOf(w, x)) {
            List<Expression> factors = new ArrayList<Expression>(3);
            factors.add(differentiate(w, x));
            factors.add(new Power(v, w));
            factors.add(new ElementaryFunction(ElementaryKind.LN, v));
            terms.add(new Product(factors));
        }
        return (terms.size() == 1) ? terms.get(0) : new Sum(terms);
    }

    // Chain rule over the table of elementary derivatives.
    private static Expression differentiateFunction(ElementaryFunction f, Variable x) {
        ElementaryKind kind = f.getKind();
        if (kind == ElementaryKind.DERIV) {
            return ElementaryFunction.derivativeMarker(f, x);
        }
        Expression u = f.getArgument();
        Expression outer;
        if (kind == ElementaryKind.EXP) {
            outer = f;
        } else if (kind == ElementaryKind.LN) {
            outer = new Power(u, IntegerLiteral.MINUS_ONE);
        } else if (kind == ElementaryKind.SIN) {
            outer = new ElementaryFunction(ElementaryKind.COS, u);
        } else if (kind == ElementaryKind.COS) {
            outer = negate(new ElementaryFunction(ElementaryKind.SIN, u));
        } else if (kind == ElementaryKind.TAN) {
            outer = new Power(new ElementaryFunction(ElementaryKind.SEC, u),
                              Literal.valueOf(2));
        } else if (kind == ElementaryKind.SEC) {
            outer = new Product(new ElementaryFunction(ElementaryKind.SEC, u),
                                new ElementaryFunction(ElementaryKind.TAN, u));
        } else if (kind == ElementaryKind.CSC) {
            outer = negate(new Product(new ElementaryFunction(ElementaryKind.CSC, u),
                                       new ElementaryFunction(ElementaryKind.COT, u)));
        } else if (kind == ElementaryKind.COT) {
            outer = negate(new Power(new ElementaryFunction(ElementaryKind.CSC, u),
                                     Literal.valueOf(2)));
        } else if (kind == ElementaryKind.ARCSIN) {
            outer = new Power(oneMinusSquare(u), minus_one_half);
        } else if (kind == ElementaryKind.ARCCOS) {
            outer = negate(new Power(oneMinusSquare(u), minus_one_half));
        } else {
            // arctan
            outer = new Power(new Sum(IntegerLiteral.ONE,
                                      new Power(u, Literal.valueOf(2))),
                              IntegerLiteral.MINUS_ONE);
        }
        return new Product(outer, differentiate(u, x));
    }

    private static Expression oneMinusSquare(Expression u) {
        return new Sum(IntegerLiteral.ONE, negate(new Power(u, Literal.valueOf(2))));
    }

    private static Expression negate(Expression e) {
        return new Product(IntegerLiteral.MINUS_ONE, e);
    }

}
