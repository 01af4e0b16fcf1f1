package cassia.hir;

import cassia.exec.Driver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Class Symbolic provides static utility methods that build and simplify
* expressions symbolically. Every constructor function returns the
* automatically simplified form of its result, so callers never hold a raw
* tree unless they build one explicitly with the node constructors.
*/
public class Symbolic {

    /** The default nesting limit of one simplification. */
    public static final int DEFAULT_MAX_DEPTH = 400;

    // No instantiation is used.
    private Symbolic() {
    }

    /**
    * Returns the nesting limit read from the "max-depth" option.
    */
    public static int getMaxDepth() {
        String value = Driver.getOptionValue("max-depth");
        if (value == null) {
            return DEFAULT_MAX_DEPTH;
        }
        try {
            int ret = Integer.parseInt(value.trim());
            return (ret > 0) ? ret : DEFAULT_MAX_DEPTH;
        } catch(NumberFormatException ex) {
            return DEFAULT_MAX_DEPTH;
        }
    }

    /**
    * Returns the automatically simplified form of the given expression. The
    * operation is idempotent and never fails for indeterminate input, which
    * simplifies to {@link Undefined#UNDEFINED}.
    * @param e the given expression.
    * @return the simplified expression.
    * @throws ExpressionTooComplexException if the expression nests deeper
    *       than the "max-depth" option allows.
    */
    public static Expression simplify(Expression e) {
        return new AutoSimplifier(getMaxDepth()).simplify(e);
    }

    /**
    * Returns addition of the two expressions with simplification.
    */
    public static Expression add(Expression e1, Expression e2) {
        return simplify(new Sum(e1, e2));
    }

    /**
    * Returns subtraction of two expressions with simplification.
    */
    public static Expression subtract(Expression e1, Expression e2) {
        return simplify(new Sum(e1, new Product(IntegerLiteral.MINUS_ONE, e2)));
    }

    /**
    * Returns multiplication of two expressions with simplification.
    */
    public static Expression multiply(Expression e1, Expression e2) {
        return simplify(new Product(e1, e2));
    }

    /**
    * Returns division of two expressions with simplification.
    */
    public static Expression divide(Expression e1, Expression e2) {
        return simplify(new Quotient(e1, e2));
    }

    /**
    * Returns the power {@code e1^e2} with simplification.
    */
    public static Expression power(Expression e1, Expression e2) {
        return simplify(new Power(e1, e2));
    }

    /**
    * Returns the power {@code e^n} with simplification.
    */
    public static Expression power(Expression e, long n) {
        return simplify(new Power(e, Literal.valueOf(n)));
    }

    /**
    * Returns the negation of the expression with simplification.
    */
    public static Expression negate(Expression e) {
        return simplify(new Product(IntegerLiteral.MINUS_ONE, e));
    }

    /**
    * Returns the sum of the given expressions with simplification; the empty
    * sum is zero.
    */
    public static Expression sum(List<? extends Expression> terms) {
        if (terms.isEmpty()) {
            return IntegerLiteral.ZERO;
        }
        return simplify(new Sum(terms));
    }

    /**
    * Returns the product of the given expressions with simplification; the
    * empty product is one.
    */
    public static Expression product(List<? extends Expression> factors) {
        if (factors.isEmpty()) {
            return IntegerLiteral.ONE;
        }
        return simplify(new Product(factors));
    }

    /**
    * Returns the product of the given expressions with simplification.
    */
    public static Expression product(Expression... factors) {
        return product(Arrays.asList(factors));
    }

    /**
    * Returns the factorial of the expression with simplification.
    */
    public static Expression factorial(Expression e) {
        return simplify(new Factorial(e));
    }

    /**
    * Returns the application of the given elementary function with
    * simplification.
    */
    public static Expression function(ElementaryKind kind, Expression arg) {
        return simplify(new ElementaryFunction(kind, arg));
    }

    public static Expression sin(Expression e) {
        return function(ElementaryKind.SIN, e);
    }

    public static Expression cos(Expression e) {
        return function(ElementaryKind.COS, e);
    }

    public static Expression tan(Expression e) {
        return function(ElementaryKind.TAN, e);
    }

    public static Expression csc(Expression e) {
        return function(ElementaryKind.CSC, e);
    }

    public static Expression sec(Expression e) {
        return function(ElementaryKind.SEC, e);
    }

    public static Expression cot(Expression e) {
        return function(ElementaryKind.COT, e);
    }

    public static Expression arctan(Expression e) {
        return function(ElementaryKind.ARCTAN, e);
    }

    public static Expression arccos(Expression e) {
        return function(ElementaryKind.ARCCOS, e);
    }

    public static Expression arcsin(Expression e) {
        return function(ElementaryKind.ARCSIN, e);
    }

    public static Expression exp(Expression e) {
        return function(ElementaryKind.EXP, e);
    }

    public static Expression ln(Expression e) {
        return function(ElementaryKind.LN, e);
    }

    /** Returns the square root {@code e^(1/2)} with simplification. */
    public static Expression sqrt(Expression e) {
        return simplify(new Power(e, Literal.valueOf(1, 2)));
    }

    /** Returns the integer literal of the given value. */
    public static Literal integer(long value) {
        return Literal.valueOf(value);
    }

    /**
    * Returns the reduced rational literal {@code num/den}.
    * @throws ArithmeticException if the denominator is zero.
    */
    public static Literal rational(long num, long den) {
        return Literal.valueOf(num, den);
    }

    /**
    * Returns the terms of a simplified expression viewed as a sum.
    */
    public static List<Expression> getTerms(Expression e) {
        List<Expression> ret = new ArrayList<Expression>();
        if (e instanceof Sum) {
            ret.addAll(e.getChildren());
        } else {
            ret.add(e);
        }
        return ret;
    }

    /**
    * Returns the factors of a simplified expression viewed as a product.
    */
    public static List<Expression> getFactors(Expression e) {
        List<Expression> ret = new ArrayList<Expression>();
        if (e instanceof Product) {
            ret.addAll(e.getChildren());
        } else {
            ret.add(e);
        }
        return ret;
    }

    /** Checks if the expression is the literal zero. */
    public static boolean isZero(Expression e) {
        return (e instanceof Literal) && ((Literal)e).isZero();
    }

    /** Checks if the expression is the literal one. */
    public static boolean isOne(Expression e) {
        return (e instanceof Literal) && ((Literal)e).isOne();
    }

}
