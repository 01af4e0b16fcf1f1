package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.math.BigInteger;

/** Represents an arbitrary-precision integer. */
public class IntegerLiteral extends Literal {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(IntegerLiteral.class);
    }

    /** The integer zero */
    public static final IntegerLiteral ZERO = new IntegerLiteral(0);

    /** The integer one */
    public static final IntegerLiteral ONE = new IntegerLiteral(1);

    /** The integer minus one */
    public static final IntegerLiteral MINUS_ONE = new IntegerLiteral(-1);

    private final BigInteger value;

    /** Constructs an integer literal with the specified numeric value. */
    public IntegerLiteral(long value) {
        this(BigInteger.valueOf(value));
    }

    /** Constructs an integer literal with the specified numeric value. */
    public IntegerLiteral(BigInteger value) {
        object_print_method = class_print_method;
        this.value = value;
    }

    /**
    * Prints a literal to a stream.
    *
    * @param l The literal to print.
    * @param o The writer on which to print the literal.
    */
    public static void defaultPrint(IntegerLiteral l, PrintWriter o) {
        o.print(l.value.toString());
    }

    /** Returns the numeric value of the integer literal. */
    public BigInteger getValue() {
        return value;
    }

    @Override
    public BigInteger getNumerator() {
        return value;
    }

    @Override
    public BigInteger getDenominator() {
        return BigInteger.ONE;
    }

    /**
    * Checks if the value fits in an int, which is required for using it as
    * an exponent or a repetition count.
    */
    public boolean fitsInt() {
        return value.bitLength() < 32;
    }

    @Override
    protected int precedence() {
        return (value.signum() < 0) ? SUM_PRECEDENCE : ATOM_PRECEDENCE;
    }

}
