package cassia.hir;

import cassia.analysis.GCD;

import java.math.BigInteger;
import java.util.List;

/**
* Represents an exact rational number. Literals are always kept in lowest
* terms with a positive denominator, and a literal whose denominator is one is
* always an {@link IntegerLiteral}; {@link #valueOf(BigInteger, BigInteger)}
* performs this normalization. All arithmetic is exact.
*/
public abstract class Literal extends Expression {

    /** Constructs an empty literal */
    protected Literal() {
        // Literals are always leaves.
        super();
    }

    /** Returns the numerator of the literal in lowest terms. */
    public abstract BigInteger getNumerator();

    /** Returns the positive denominator of the literal in lowest terms. */
    public abstract BigInteger getDenominator();

    /**
    * Returns the literal for the given integer.
    */
    public static Literal valueOf(long value) {
        return new IntegerLiteral(value);
    }

    /**
    * Returns the literal for the given integer.
    */
    public static Literal valueOf(BigInteger value) {
        return new IntegerLiteral(value);
    }

    /**
    * Returns the literal for the fraction num/den reduced to lowest terms.
    *
    * @param num the numerator.
    * @param den the denominator.
    * @return an integer literal if the fraction reduces to an integer, a
    *       rational literal otherwise.
    * @throws ArithmeticException if the denominator is zero.
    */
    public static Literal valueOf(BigInteger num, BigInteger den) {
        if (den.signum() == 0) {
            throw new ArithmeticException("zero denominator in " + num + "/0");
        }
        if (den.signum() < 0) {
            num = num.negate();
            den = den.negate();
        }
        BigInteger gcd = GCD.compute(num, den);
        if (gcd.compareTo(BigInteger.ONE) > 0) {
            num = num.divide(gcd);
            den = den.divide(gcd);
        }
        if (den.equals(BigInteger.ONE)) {
            return new IntegerLiteral(num);
        }
        return new RationalLiteral(num, den);
    }

    /**
    * Returns the literal for the fraction num/den reduced to lowest terms.
    */
    public static Literal valueOf(long num, long den) {
        return valueOf(BigInteger.valueOf(num), BigInteger.valueOf(den));
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    /** Checks if the literal is an integer. */
    public boolean isInteger() {
        return getDenominator().equals(BigInteger.ONE);
    }

    /** Returns -1, 0, or 1 as the literal is negative, zero, or positive. */
    public int signum() {
        return getNumerator().signum();
    }

    public boolean isZero() {
        return signum() == 0;
    }

    public boolean isOne() {
        return isInteger() && getNumerator().equals(BigInteger.ONE);
    }

    public boolean isNegative() {
        return signum() < 0;
    }

    public boolean isPositive() {
        return signum() > 0;
    }

    /**
    * Compares the numeric values of two literals.
    */
    public int compareValue(Literal l) {
        // a/b < c/d iff a*d < c*b for positive b and d.
        return getNumerator().multiply(l.getDenominator()).compareTo(
                l.getNumerator().multiply(getDenominator()));
    }

    /** Returns this+l. */
    public Literal add(Literal l) {
        BigInteger lcm = GCD.lcm(getDenominator(), l.getDenominator());
        BigInteger num = getNumerator().multiply(lcm.divide(getDenominator()))
                .add(l.getNumerator().multiply(lcm.divide(l.getDenominator())));
        return valueOf(num, lcm);
    }

    /** Returns this-l. */
    public Literal subtract(Literal l) {
        return add(l.negate());
    }

    /** Returns this*l. */
    public Literal multiply(Literal l) {
        return valueOf(getNumerator().multiply(l.getNumerator()),
                       getDenominator().multiply(l.getDenominator()));
    }

    /**
    * Returns this/l.
    * @throws ArithmeticException if l is zero.
    */
    public Literal divide(Literal l) {
        return valueOf(getNumerator().multiply(l.getDenominator()),
                       getDenominator().multiply(l.getNumerator()));
    }

    /** Returns -this. */
    public Literal negate() {
        return valueOf(getNumerator().negate(), getDenominator());
    }

    /**
    * Returns 1/this.
    * @throws ArithmeticException if this is zero.
    */
    public Literal reciprocal() {
        return valueOf(getDenominator(), getNumerator());
    }

    /**
    * Returns this raised to the given integer power.
    * @throws ArithmeticException if this is zero and the exponent negative.
    */
    public Literal pow(int exponent) {
        if (exponent < 0) {
            return reciprocal().pow(-exponent);
        }
        return valueOf(getNumerator().pow(exponent),
                       getDenominator().pow(exponent));
    }

    /**
    * Returns the exact q-th root of this literal, or null if the numerator or
    * the denominator is not a perfect q-th power.
    */
    public Literal root(int q) {
        BigInteger num = GCD.root(getNumerator(), q);
        BigInteger den = GCD.root(getDenominator(), q);
        if (num == null || den == null) {
            return null;
        }
        return valueOf(num, den);
    }

    /** Literals have no children. */
    public Expression withChildren(List<Expression> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException("literals have no children");
        }
        return this;
    }

}
