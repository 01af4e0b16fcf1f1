package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/** Represents a base raised to an exponent. */
public class Power extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Power.class);
    }

    /** Constructs base^exponent. */
    public Power(Expression base, Expression exponent) {
        super(Arrays.asList(base, exponent));
        object_print_method = class_print_method;
    }

    /**
    * Prints a power to a stream.
    *
    * @param p The power to print.
    * @param o The writer on which to print the power.
    */
    public static void defaultPrint(Power p, PrintWriter o) {
        printOperand(p.base(), FACTORIAL_PRECEDENCE, o);
        o.print("^");
        printOperand(p.exponent(), FACTORIAL_PRECEDENCE, o);
    }

    @Override
    public Expression base() {
        return children.get(0);
    }

    @Override
    public Expression exponent() {
        return children.get(1);
    }

    public Expression withChildren(List<Expression> children) {
        if (children.size() != 2) {
            throw new IllegalArgumentException("power takes two operands");
        }
        return new Power(children.get(0), children.get(1));
    }

    @Override
    protected int precedence() {
        return POWER_PRECEDENCE;
    }

}
