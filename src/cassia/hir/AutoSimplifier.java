package cassia.hir;

import cassia.analysis.GCD;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* AutoSimplifier rewrites an expression into its automatically simplified
* form. Every call to {@link Symbolic#simplify(Expression)} owns a fresh
* instance, whose depth counter bounds the recursion of one simplification.
* The rules follow the usual bottom-up scheme: children first, then the rule
* set of the node class. Products and sums are normalized by merging ordered
* operand lists.
*/
class AutoSimplifier {

    // Literal results above this many bits are left unevaluated.
    private static final long MAX_LITERAL_BITS = 1L << 16;

    // Factorials of larger operands are left unevaluated.
    private static final int MAX_FACTORIAL = 5000;

    private final int max_depth;

    private int depth;

    AutoSimplifier(int max_depth) {
        this.max_depth = max_depth;
        this.depth = 0;
    }

    // Enters one nesting level, failing if the limit is exceeded.
    private void enter() {
        if (++depth > max_depth) {
            throw new ExpressionTooComplexException(
                    "expression nests too deeply to simplify", max_depth);
        }
    }

    private void leave() {
        if (depth > 0) {
            depth--;
        }
    }

    /**
    * Returns the simplified form of the given expression.
    */
    Expression simplify(Expression e) {
        if (e instanceof Literal || e instanceof Variable || e instanceof Undefined) {
            return e;
        }
        enter();
        try {
            List<Expression> children = e.getChildren();
            List<Expression> simplified = new ArrayList<Expression>(children.size());
            for (Expression child : children) {
                Expression s = simplify(child);
                if (s instanceof Undefined) {
                    return Undefined.UNDEFINED;
                }
                simplified.add(s);
            }
            Expression u = e.withChildren(simplified);
            if (u instanceof Power) {
                return simplifyPower(u.base(), u.exponent());
            } else if (u instanceof Product) {
                return simplifyProduct(u.getChildren());
            } else if (u instanceof Sum) {
                return simplifySum(u.getChildren());
            } else if (u instanceof Quotient) {
                return simplifyQuotient(((Quotient)u).getDividend(),
                                        ((Quotient)u).getDivisor());
            } else if (u instanceof Factorial) {
                return simplifyFactorial((Factorial)u);
            } else if (u instanceof ElementaryFunction) {
                return simplifyFunction((ElementaryFunction)u);
            } else {
                // User function calls keep their simplified arguments.
                return u;
            }
        } finally {
            leave();
        }
    }

    /**
    * Simplifies {@code v^w} for simplified operands.
    */
    Expression simplifyPower(Expression v, Expression w) {
        if (v instanceof Undefined || w instanceof Undefined) {
            return Undefined.UNDEFINED;
        }
        enter();
        try {
            if (v instanceof Literal && ((Literal)v).isZero()) {
                if (w instanceof Literal && ((Literal)w).isPositive()) {
                    return IntegerLiteral.ZERO;
                }
                return Undefined.UNDEFINED;
            }
            if (v instanceof Literal && ((Literal)v).isOne()) {
                return IntegerLiteral.ONE;
            }
            if (!(w instanceof Literal)) {
                return new Power(v, w);
            }
            Literal n = (Literal)w;
            if (n.isZero()) {
                return IntegerLiteral.ONE;
            }
            if (n.isOne()) {
                return v;
            }
            if (n.isInteger()) {
                return simplifyIntegerPower(v, (IntegerLiteral)n);
            }
            return simplifyRationalPower(v, n);
        } finally {
            leave();
        }
    }

    // v^n for an integer n other than zero and one.
    private Expression simplifyIntegerPower(Expression v, IntegerLiteral n) {
        if (v instanceof Literal) {
            Literal result = literalPower((Literal)v, n);
            return (result == null) ? new Power(v, n) : result;
        } else if (v instanceof Power) {
            Expression s = simplifyProduct(Arrays.asList(v.exponent(), n));
            return simplifyPower(v.base(), s);
        } else if (v instanceof Product) {
            return distributePower(v, n);
        }
        return new Power(v, n);
    }

    // v^(p/q) for a proper rational exponent.
    private Expression simplifyRationalPower(Expression v, Literal w) {
        if (v instanceof Literal) {
            BigInteger q = w.getDenominator();
            if (q.bitLength() < 32) {
                Literal root = ((Literal)v).root(q.intValue());
                if (root != null) {
                    return simplifyPower(root, Literal.valueOf(w.getNumerator()));
                }
            }
            return new Power(v, w);
        } else if (v instanceof Power && v.exponent() instanceof Literal) {
            Literal s = ((Literal)v.exponent()).multiply(w);
            if (s.isInteger()) {
                return simplifyPower(v.base(), s);
            }
            return new Power(v, w);
        } else if (v instanceof Product) {
            return distributePower(v, w);
        }
        return new Power(v, w);
    }

    // (f1*f2*...)^w = f1^w*f2^w*...
    private Expression distributePower(Expression product, Expression w) {
        List<Expression> factors = product.getChildren();
        List<Expression> powers = new ArrayList<Expression>(factors.size());
        for (Expression factor : factors) {
            powers.add(simplifyPower(factor, w));
        }
        return simplifyProduct(powers);
    }

    // Exact power of a literal, or null if the result would be too large.
    private static Literal literalPower(Literal v, IntegerLiteral n) {
        if (!n.fitsInt()) {
            return null;
        }
        int e = n.getValue().intValue();
        long bits = (long)Math.max(v.getNumerator().bitLength(),
                                   v.getDenominator().bitLength());
        if (bits * Math.abs((long)e) > MAX_LITERAL_BITS) {
            return null;
        }
        return v.pow(e);
    }

    /**
    * Simplifies the product of the given simplified factors.
    */
    Expression simplifyProduct(List<Expression> factors) {
        for (Expression factor : factors) {
            if (factor instanceof Undefined) {
                return Undefined.UNDEFINED;
            }
        }
        for (Expression factor : factors) {
            if (factor instanceof Literal && ((Literal)factor).isZero()) {
                return IntegerLiteral.ZERO;
            }
        }
        if (factors.size() == 1) {
            return factors.get(0);
        }
        enter();
        try {
            List<Expression> v = mergeProductList(factors);
            for (Expression factor : v) {
                if (factor instanceof Undefined) {
                    return Undefined.UNDEFINED;
                }
                if (factor instanceof Literal && ((Literal)factor).isZero()) {
                    return IntegerLiteral.ZERO;
                }
            }
            if (v.isEmpty()) {
                return IntegerLiteral.ONE;
            } else if (v.size() == 1) {
                return v.get(0);
            } else if (v.size() == 2 && v.get(0) instanceof Literal
                       && v.get(1) instanceof Sum) {
                return distributeCoefficient((Literal)v.get(0), v.get(1));
            }
            return new Product(v);
        } finally {
            leave();
        }
    }

    // c*(t1 + t2 + ...) = c*t1 + c*t2 + ...
    private Expression distributeCoefficient(Literal c, Expression sum) {
        List<Expression> terms = sum.getChildren();
        List<Expression> products = new ArrayList<Expression>(terms.size());
        for (Expression term : terms) {
            products.add(simplifyProduct(Arrays.<Expression>asList(c, term)));
        }
        return simplifySum(products);
    }

    // Merges a list of two or more factors from the right.
    private List<Expression> mergeProductList(List<Expression> factors) {
        int n = factors.size();
        List<Expression> w = rec2Product(factors.get(n - 2), factors.get(n - 1));
        for (int i = n - 3; i >= 0; i--) {
            w = mergeProducts(productOperands(factors.get(i)), w);
        }
        return w;
    }

    // Combines two factors into zero, one or two ordered factors.
    private List<Expression> rec2Product(Expression u1, Expression u2) {
        if (u1 instanceof Product || u2 instanceof Product) {
            return mergeProducts(productOperands(u1), productOperands(u2));
        }
        if (u1 instanceof Literal && u2 instanceof Literal) {
            Literal p = ((Literal)u1).multiply((Literal)u2);
            if (p.isOne()) {
                return new ArrayList<Expression>(0);
            }
            return singleton(p);
        }
        if (u1 instanceof Literal && ((Literal)u1).isOne()) {
            return singleton(u2);
        }
        if (u2 instanceof Literal && ((Literal)u2).isOne()) {
            return singleton(u1);
        }
        if (u1.base().equals(u2.base())) {
            Expression s = simplifySum(Arrays.asList(u1.exponent(), u2.exponent()));
            Expression p = simplifyPower(u1.base(), s);
            if (p instanceof Literal && ((Literal)p).isOne()) {
                return new ArrayList<Expression>(0);
            } else if (p instanceof Product) {
                return new ArrayList<Expression>(p.getChildren());
            }
            return singleton(p);
        }
        return ordered(u1, u2);
    }

    // Merges two ordered factor lists.
    private List<Expression> mergeProducts(List<Expression> p, List<Expression> q) {
        List<Expression> out = new ArrayList<Expression>(p.size() + q.size());
        int i = 0, j = 0;
        while (i < p.size() && j < q.size()) {
            Expression p1 = p.get(i), q1 = q.get(j);
            List<Expression> h = rec2Product(p1, q1);
            if (h.isEmpty()) {
                i++;
                j++;
            } else if (h.size() == 2 && h.get(0) == p1 && h.get(1) == q1) {
                out.add(p1);
                i++;
            } else if (h.size() == 2 && h.get(0) == q1 && h.get(1) == p1) {
                out.add(q1);
                j++;
            } else if (h.size() == 1 && !(h.get(0) instanceof Literal)) {
                out.add(h.get(0));
                i++;
                j++;
            } else {
                // The combined factor may belong anywhere, even before the
                // factors already emitted, so merge it back into all of them.
                List<Expression> rest = mergeProducts(p.subList(i + 1, p.size()),
                                                      q.subList(j + 1, q.size()));
                return mergeProducts(h, concat(out, rest));
            }
        }
        out.addAll(p.subList(i, p.size()));
        out.addAll(q.subList(j, q.size()));
        return out;
    }

    // The operands of a product, or the expression itself.
    private static List<Expression> productOperands(Expression e) {
        if (e instanceof Product) {
            return e.getChildren();
        }
        return Collections.singletonList(e);
    }

    /**
    * Simplifies the sum of the given simplified terms.
    */
    Expression simplifySum(List<Expression> terms) {
        for (Expression term : terms) {
            if (term instanceof Undefined) {
                return Undefined.UNDEFINED;
            }
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        enter();
        try {
            List<Expression> v = mergeSumList(terms);
            for (Expression term : v) {
                if (term instanceof Undefined) {
                    return Undefined.UNDEFINED;
                }
            }
            if (v.isEmpty()) {
                return IntegerLiteral.ZERO;
            } else if (v.size() == 1) {
                return v.get(0);
            }
            return new Sum(v);
        } finally {
            leave();
        }
    }

    // Merges a list of two or more terms from the right.
    private List<Expression> mergeSumList(List<Expression> terms) {
        int n = terms.size();
        List<Expression> w = rec2Sum(terms.get(n - 2), terms.get(n - 1));
        for (int i = n - 3; i >= 0; i--) {
            w = mergeSums(sumOperands(terms.get(i)), w);
        }
        return w;
    }

    // Combines two terms into zero, one or two ordered terms.
    private List<Expression> rec2Sum(Expression u1, Expression u2) {
        if (u1 instanceof Sum || u2 instanceof Sum) {
            return mergeSums(sumOperands(u1), sumOperands(u2));
        }
        if (u1 instanceof Literal && u2 instanceof Literal) {
            Literal s = ((Literal)u1).add((Literal)u2);
            if (s.isZero()) {
                return new ArrayList<Expression>(0);
            }
            return singleton(s);
        }
        if (u1 instanceof Literal && ((Literal)u1).isZero()) {
            return singleton(u2);
        }
        if (u2 instanceof Literal && ((Literal)u2).isZero()) {
            return singleton(u1);
        }
        if (!(u1 instanceof Literal) && u1.term().equals(u2.term())) {
            Literal c = ((Literal)u1.coefficient()).add((Literal)u2.coefficient());
            if (c.isZero()) {
                return new ArrayList<Expression>(0);
            }
            Expression p = simplifyProduct(Arrays.<Expression>asList(c, u1.term()));
            if (p instanceof Sum) {
                return new ArrayList<Expression>(p.getChildren());
            }
            return singleton(p);
        }
        return ordered(u1, u2);
    }

    // Merges two ordered term lists.
    private List<Expression> mergeSums(List<Expression> p, List<Expression> q) {
        List<Expression> out = new ArrayList<Expression>(p.size() + q.size());
        int i = 0, j = 0;
        while (i < p.size() && j < q.size()) {
            Expression p1 = p.get(i), q1 = q.get(j);
            List<Expression> h = rec2Sum(p1, q1);
            if (h.isEmpty()) {
                i++;
                j++;
            } else if (h.size() == 2 && h.get(0) == p1 && h.get(1) == q1) {
                out.add(p1);
                i++;
            } else if (h.size() == 2 && h.get(0) == q1 && h.get(1) == p1) {
                out.add(q1);
                j++;
            } else if (h.size() == 1 && !(h.get(0) instanceof Literal)) {
                out.add(h.get(0));
                i++;
                j++;
            } else {
                List<Expression> rest = mergeSums(p.subList(i + 1, p.size()),
                                                  q.subList(j + 1, q.size()));
                return mergeSums(h, concat(out, rest));
            }
        }
        out.addAll(p.subList(i, p.size()));
        out.addAll(q.subList(j, q.size()));
        return out;
    }

    // The operands of a sum, or the expression itself.
    private static List<Expression> sumOperands(Expression e) {
        if (e instanceof Sum) {
            return e.getChildren();
        }
        return Collections.singletonList(e);
    }

    /**
    * Simplifies the quotient {@code u/v} of simplified operands.
    */
    Expression simplifyQuotient(Expression u, Expression v) {
        if (u instanceof Literal && v instanceof Literal) {
            if (((Literal)v).isZero()) {
                return Undefined.UNDEFINED;
            }
            return ((Literal)u).divide((Literal)v);
        }
        Expression reciprocal = simplifyPower(v, IntegerLiteral.MINUS_ONE);
        return simplifyProduct(Arrays.asList(u, reciprocal));
    }

    // n! for a non-negative integer n of moderate size.
    private Expression simplifyFactorial(Factorial f) {
        Expression operand = f.getOperand();
        if (operand instanceof IntegerLiteral) {
            IntegerLiteral n = (IntegerLiteral)operand;
            if (n.signum() >= 0 && n.fitsInt()
                    && n.getValue().intValue() <= MAX_FACTORIAL) {
                return Literal.valueOf(GCD.factorial(n.getValue()));
            }
        }
        return f;
    }

    /**
    * Applies the reflex rules of the elementary functions to an application
    * with a simplified argument.
    */
    Expression simplifyFunction(ElementaryFunction f) {
        ElementaryKind kind = f.getKind();
        if (kind == ElementaryKind.DERIV) {
            return f;
        }
        enter();
        try {
            Expression arg = f.getArgument();
            if (arg instanceof Literal && ((Literal)arg).isZero()) {
                return valueAtZero(f);
            }
            if (kind == ElementaryKind.LN) {
                return simplifyLogarithm(f);
            }
            if (kind == ElementaryKind.EXP) {
                if (ElementaryFunction.isKind(arg, ElementaryKind.LN)) {
                    return ((ElementaryFunction)arg).getArgument();
                }
                return f;
            }
            if (isNegative(arg) && (kind.isOdd() || kind.isEven())) {
                Expression negated = simplifyProduct(
                        Arrays.<Expression>asList(IntegerLiteral.MINUS_ONE, arg));
                Expression g = new ElementaryFunction(kind, negated);
                if (kind.isEven()) {
                    return g;
                }
                return simplifyProduct(
                        Arrays.<Expression>asList(IntegerLiteral.MINUS_ONE, g));
            }
            return f;
        } finally {
            leave();
        }
    }

    // Known values of the elementary functions at zero.
    private static Expression valueAtZero(ElementaryFunction f) {
        ElementaryKind kind = f.getKind();
        if (kind == ElementaryKind.SIN || kind == ElementaryKind.TAN
                || kind == ElementaryKind.ARCSIN || kind == ElementaryKind.ARCTAN) {
            return IntegerLiteral.ZERO;
        } else if (kind == ElementaryKind.COS || kind == ElementaryKind.SEC
                   || kind == ElementaryKind.EXP) {
            return IntegerLiteral.ONE;
        } else if (kind == ElementaryKind.CSC || kind == ElementaryKind.COT
                   || kind == ElementaryKind.LN) {
            return Undefined.UNDEFINED;
        }
        return f;
    }

    // ln rules: ln(1) = 0, ln(b^e) = e*ln(b), ln(a*b) = ln(a) + ln(b).
    private Expression simplifyLogarithm(ElementaryFunction f) {
        Expression arg = f.getArgument();
        if (arg instanceof Literal) {
            Literal l = (Literal)arg;
            if (l.isOne()) {
                return IntegerLiteral.ZERO;
            } else if (!l.isPositive()) {
                return Undefined.UNDEFINED;
            }
            return f;
        }
        if (ElementaryFunction.isKind(arg, ElementaryKind.EXP)) {
            return ((ElementaryFunction)arg).getArgument();
        }
        if (arg instanceof Power) {
            Expression ln = simplifyFunction(
                    new ElementaryFunction(ElementaryKind.LN, arg.base()));
            return simplifyProduct(Arrays.asList(arg.exponent(), ln));
        }
        if (arg instanceof Product && ((Literal)arg.coefficient()).isPositive()) {
            List<Expression> factors = arg.getChildren();
            List<Expression> logs = new ArrayList<Expression>(factors.size());
            for (Expression factor : factors) {
                logs.add(simplifyFunction(
                        new ElementaryFunction(ElementaryKind.LN, factor)));
            }
            return simplifySum(logs);
        }
        return f;
    }

    // Negative literal, or a product led by a negative literal.
    private static boolean isNegative(Expression e) {
        if (e instanceof Literal) {
            return ((Literal)e).isNegative();
        } else if (e instanceof Product) {
            return ((Literal)e.coefficient()).isNegative();
        }
        return false;
    }

    private static List<Expression> ordered(Expression u1, Expression u2) {
        List<Expression> ret = new ArrayList<Expression>(2);
        if (ExpressionOrder.precedes(u2, u1)) {
            ret.add(u2);
            ret.add(u1);
        } else {
            ret.add(u1);
            ret.add(u2);
        }
        return ret;
    }

    private static List<Expression> singleton(Expression e) {
        List<Expression> ret = new ArrayList<Expression>(2);
        ret.add(e);
        return ret;
    }

    private static List<Expression> concat(List<Expression> a, List<Expression> b) {
        List<Expression> ret = new ArrayList<Expression>(a.size() + b.size());
        ret.addAll(a);
        ret.addAll(b);
        return ret;
    }

}
