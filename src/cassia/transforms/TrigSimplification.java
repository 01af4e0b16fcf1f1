package cassia.transforms;

import cassia.analysis.GCD;
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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
* Trigonometric identities. {@link #expand} rewrites sines and cosines of
* sums and of integer multiples in terms of sines and cosines of the parts;
* {@link #contract} goes the other way and replaces powers and products of
* sines and cosines by sums of sines and cosines of multiple angles.
* {@link #simplify} combines both on the numerator and the denominator of the
* rationalized expression, which proves identities such as
* {@code sin(x)^2 + cos(x)^2 = 1}.
*/
public final class TrigSimplification {

    private TrigSimplification() {
    }

    /**
    * Replaces tan, cot, sec and csc by quotients of sin and cos.
    */
    public static Expression substitute(Expression u) {
        List<Expression> children = u.getChildren();
        if (children.isEmpty()) {
            return u;
        }
        List<Expression> args = new ArrayList<Expression>(children.size());
        for (Expression child : children) {
            args.add(substitute(child));
        }
        Expression v = Symbolic.simplify(u.withChildren(args));
        if (!(v instanceof ElementaryFunction)) {
            return v;
        }
        ElementaryFunction f = (ElementaryFunction)v;
        ElementaryKind kind = f.getKind();
        if (kind == ElementaryKind.TAN) {
            return Symbolic.divide(Symbolic.sin(f.getArgument()), Symbolic.cos(f.getArgument()));
        } else if (kind == ElementaryKind.COT) {
            return Symbolic.divide(Symbolic.cos(f.getArgument()), Symbolic.sin(f.getArgument()));
        } else if (kind == ElementaryKind.SEC) {
            return Symbolic.divide(IntegerLiteral.ONE, Symbolic.cos(f.getArgument()));
        } else if (kind == ElementaryKind.CSC) {
            return Symbolic.divide(IntegerLiteral.ONE, Symbolic.sin(f.getArgument()));
        }
        return v;
    }

    /**
    * Expands sines and cosines of sums and integer multiples.
    */
    public static Expression expand(Expression u) {
        List<Expression> children = u.getChildren();
        if (children.isEmpty()) {
            return u;
        }
        List<Expression> args = new ArrayList<Expression>(children.size());
        for (Expression child : children) {
            args.add(expand(child));
        }
        Expression v = Symbolic.simplify(u.withChildren(args));
        if (ElementaryFunction.isKind(v, ElementaryKind.SIN)) {
            return expandRules(((ElementaryFunction)v).getArgument())[0];
        } else if (ElementaryFunction.isKind(v, ElementaryKind.COS)) {
            return expandRules(((ElementaryFunction)v).getArgument())[1];
        }
        return v;
    }

    // Returns [sin(a), cos(a)] in expanded form.
    private static Expression[] expandRules(Expression a) {
        if (a instanceof Sum) {
            List<Expression> terms = a.getChildren();
            Expression[] f = expandRules(terms.get(0));
            Expression[] r = expandRules(Symbolic.sum(terms.subList(1, terms.size())));
            Expression s = Symbolic.add(Symbolic.multiply(f[0], r[1]),
                                        Symbolic.multiply(f[1], r[0]));
            Expression c = Symbolic.subtract(Symbolic.multiply(f[1], r[1]),
                                             Symbolic.multiply(f[0], r[0]));
            return new Expression[] {s, c};
        }
        if (a instanceof Product && a.getChild(0) instanceof IntegerLiteral) {
            IntegerLiteral f = (IntegerLiteral)a.getChild(0);
            if (f.fitsInt()) {
                int n = f.getValue().intValue();
                Expression theta = Symbolic.divide(a, f);
                Expression s = multipleAngleSin(Math.abs(n), theta);
                Expression c = multipleAngleCos(Math.abs(n), theta);
                if (n < 0) {
                    s = Symbolic.negate(s);
                }
                return new Expression[] {s, c};
            }
        }
        return new Expression[] {Symbolic.sin(a), Symbolic.cos(a)};
    }

    // cos(n*t) = sum over even j of (-1)^(j/2)*C(n,j)*cos(t)^(n-j)*sin(t)^j
    private static Expression multipleAngleCos(int n, Expression theta) {
        Expression[] sc = expandRules(theta);
        List<Expression> terms = new ArrayList<Expression>(n / 2 + 1);
        for (int j = 0; j <= n; j += 2) {
            long sign = ((j / 2) % 2 == 0) ? 1 : -1;
            terms.add(Symbolic.product(
                    Literal.valueOf(GCD.binomial(n, j).multiply(BigInteger.valueOf(sign))),
                    Symbolic.power(sc[1], n - j), Symbolic.power(sc[0], j)));
        }
        return Symbolic.sum(terms);
    }

    // sin(n*t) = sum over odd j of (-1)^((j-1)/2)*C(n,j)*cos(t)^(n-j)*sin(t)^j
    private static Expression multipleAngleSin(int n, Expression theta) {
        Expression[] sc = expandRules(theta);
        List<Expression> terms = new ArrayList<Expression>(n / 2 + 1);
        for (int j = 1; j <= n; j += 2) {
            long sign = (((j - 1) / 2) % 2 == 0) ? 1 : -1;
            terms.add(Symbolic.product(
                    Literal.valueOf(GCD.binomial(n, j).multiply(BigInteger.valueOf(sign))),
                    Symbolic.power(sc[1], n - j), Symbolic.power(sc[0], j)));
        }
        return Symbolic.sum(terms);
    }

    /**
    * Replaces powers and products of sines and cosines by linear
    * combinations of sines and cosines.
    */
    public static Expression contract(Expression u) {
        List<Expression> children = u.getChildren();
        if (children.isEmpty()) {
            return u;
        }
        List<Expression> args = new ArrayList<Expression>(children.size());
        for (Expression child : children) {
            args.add(contract(child));
        }
        Expression v = Symbolic.simplify(u.withChildren(args));
        if (v instanceof Product || v instanceof Power) {
            return contractRules(v);
        }
        return v;
    }

    private static Expression contractRules(Expression u) {
        Expression v = AlgebraicExpansion.expandMainOperator(u);
        if (v instanceof Power) {
            return contractPower(v);
        } else if (v instanceof Product) {
            Expression[] cd = separateSinCos(v);
            Expression c = cd[0], d = cd[1];
            if (Symbolic.isOne(d) || isSinCos(d)) {
                return v;
            } else if (d instanceof Power) {
                return AlgebraicExpansion.expandMainOperator(
                        Symbolic.multiply(c, contractPower(d)));
            }
            return AlgebraicExpansion.expandMainOperator(
                    Symbolic.multiply(c, contractProduct(d)));
        } else if (v instanceof Sum) {
            List<Expression> terms = new ArrayList<Expression>(v.getChildren().size());
            for (Expression term : v.getChildren()) {
                if (term instanceof Product || term instanceof Power) {
                    terms.add(contractRules(term));
                } else {
                    terms.add(term);
                }
            }
            return Symbolic.sum(terms);
        }
        return v;
    }

    // Power reduction of sin(t)^n and cos(t)^n for a positive integer n.
    private static Expression contractPower(Expression u) {
        Expression b = u.base();
        Expression e = u.exponent();
        if (!isSinCos(b) || !(e instanceof IntegerLiteral)
                || ((IntegerLiteral)e).signum() <= 0 || !((IntegerLiteral)e).fitsInt()) {
            return u;
        }
        int n = ((IntegerLiteral)e).getValue().intValue();
        Expression theta = ((ElementaryFunction)b).getArgument();
        boolean sine = ElementaryFunction.isKind(b, ElementaryKind.SIN);
        Literal scale = Literal.valueOf(BigInteger.valueOf(2),
                                        BigInteger.valueOf(2).pow(n));
        List<Expression> terms = new ArrayList<Expression>(n / 2 + 2);
        if (n % 2 == 0) {
            terms.add(Literal.valueOf(GCD.binomial(n, n / 2),
                                      BigInteger.valueOf(2).pow(n)));
            if (sine && (n / 2) % 2 == 1) {
                scale = scale.negate();
            }
            for (int j = 0; j < n / 2; j++) {
                Literal c = Literal.valueOf(GCD.binomial(n, j));
                if (sine && j % 2 == 1) {
                    c = c.negate();
                }
                terms.add(Symbolic.product(scale, c, Symbolic.cos(
                        Symbolic.multiply(Literal.valueOf(n - 2 * j), theta))));
            }
        } else {
            if (sine && ((n - 1) / 2) % 2 == 1) {
                scale = scale.negate();
            }
            for (int j = 0; j <= (n - 1) / 2; j++) {
                Literal c = Literal.valueOf(GCD.binomial(n, j));
                if (sine && j % 2 == 1) {
                    c = c.negate();
                }
                Expression angle = Symbolic.multiply(Literal.valueOf(n - 2 * j), theta);
                Expression f = sine ? Symbolic.sin(angle) : Symbolic.cos(angle);
                terms.add(Symbolic.product(scale, c, f));
            }
        }
        return Symbolic.sum(terms);
    }

    // Product-to-sum identities over a product of sines, cosines and their powers.
    private static Expression contractProduct(Expression u) {
        List<Expression> factors = u.getChildren();
        if (factors.size() == 2) {
            Expression a = factors.get(0), b = factors.get(1);
            if (a instanceof Power) {
                return contractRules(Symbolic.multiply(contractPower(a), b));
            }
            if (b instanceof Power) {
                return contractRules(Symbolic.multiply(a, contractPower(b)));
            }
            Expression theta = ((ElementaryFunction)a).getArgument();
            Expression phi = ((ElementaryFunction)b).getArgument();
            Expression sum = Symbolic.add(theta, phi);
            Expression half = Literal.valueOf(1, 2);
            boolean sin_a = ElementaryFunction.isKind(a, ElementaryKind.SIN);
            boolean sin_b = ElementaryFunction.isKind(b, ElementaryKind.SIN);
            if (sin_a && sin_b) {
                return Symbolic.product(half, Symbolic.subtract(
                        Symbolic.cos(Symbolic.subtract(theta, phi)), Symbolic.cos(sum)));
            } else if (!sin_a && !sin_b) {
                return Symbolic.product(half, Symbolic.add(
                        Symbolic.cos(sum), Symbolic.cos(Symbolic.subtract(theta, phi))));
            } else if (sin_a) {
                return Symbolic.product(half, Symbolic.add(
                        Symbolic.sin(sum), Symbolic.sin(Symbolic.subtract(theta, phi))));
            }
            return Symbolic.product(half, Symbolic.add(
                    Symbolic.sin(sum), Symbolic.sin(Symbolic.subtract(phi, theta))));
        }
        Expression a = factors.get(0);
        Expression b = contractProduct(Symbolic.product(factors.subList(1, factors.size())));
        return contractRules(Symbolic.multiply(a, b));
    }

    // Splits a product into [other factors, sine and cosine factors].
    private static Expression[] separateSinCos(Expression u) {
        List<Expression> c = new ArrayList<Expression>();
        List<Expression> d = new ArrayList<Expression>();
        for (Expression factor : u.getChildren()) {
            if (isSinCos(factor) || (factor instanceof Power && isSinCos(factor.base())
                    && factor.exponent() instanceof IntegerLiteral
                    && ((IntegerLiteral)factor.exponent()).signum() > 0)) {
                d.add(factor);
            } else {
                c.add(factor);
            }
        }
        return new Expression[] {Symbolic.product(c), Symbolic.product(d)};
    }

    private static boolean isSinCos(Expression e) {
        return ElementaryFunction.isKind(e, ElementaryKind.SIN)
                || ElementaryFunction.isKind(e, ElementaryKind.COS);
    }

    /**
    * Simplifies a trigonometric expression: the rationalized expression's
    * numerator and denominator are expanded, then contracted.
    *
    * @return the simplified quotient, or {@link Undefined#UNDEFINED} if the
    *       denominator vanishes.
    */
    public static Expression simplify(Expression u) {
        Expression w = Rationalization.rationalize(substitute(Symbolic.simplify(u)));
        Expression n = contract(AlgebraicExpansion.expand(expand(Rationalization.numerator(w))));
        Expression d = contract(AlgebraicExpansion.expand(expand(Rationalization.denominator(w))));
        if (Symbolic.isZero(d)) {
            return Undefined.UNDEFINED;
        }
        return Symbolic.divide(n, d);
    }

}
