package cassia.hir;

import cassia.analysis.GCD;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.math.BigInteger;

/**
* Represents a fraction that is not an integer. Instances are always in
* lowest terms with a denominator greater than one; use
* {@link Literal#valueOf(BigInteger, BigInteger)} to build one from an
* arbitrary fraction.
*/
public class RationalLiteral extends Literal {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(RationalLiteral.class);
    }

    private final BigInteger numerator;

    private final BigInteger denominator;

    /**
    * Constructs a rational literal from a fraction already in lowest terms.
    *
    * @throws IllegalArgumentException if the fraction is not normalized.
    */
    public RationalLiteral(BigInteger numerator, BigInteger denominator) {
        if (denominator.compareTo(BigInteger.ONE) <= 0) {
            throw new IllegalArgumentException(
                    "rational literal needs a denominator above one: "
                    + numerator + "/" + denominator);
        }
        if (!GCD.compute(numerator, denominator).equals(BigInteger.ONE)) {
            throw new IllegalArgumentException(
                    "rational literal not in lowest terms: "
                    + numerator + "/" + denominator);
        }
        object_print_method = class_print_method;
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
    * Prints a literal to a stream.
    *
    * @param l The literal to print.
    * @param o The writer on which to print the literal.
    */
    public static void defaultPrint(RationalLiteral l, PrintWriter o) {
        o.print(l.numerator.toString());
        o.print("/");
        o.print(l.denominator.toString());
    }

    @Override
    public BigInteger getNumerator() {
        return numerator;
    }

    @Override
    public BigInteger getDenominator() {
        return denominator;
    }

    @Override
    protected int precedence() {
        return (numerator.signum() < 0) ? SUM_PRECEDENCE : PRODUCT_PRECEDENCE;
    }

}
