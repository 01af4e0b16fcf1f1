package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/**
* Represents a division as read by the parser. Simplification replaces every
* quotient by an exact literal or by {@code dividend * divisor^(-1)}, so
* quotients never appear in simplified expressions.
*/
public class Quotient extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Quotient.class);
    }

    /** Constructs dividend/divisor. */
    public Quotient(Expression dividend, Expression divisor) {
        super(Arrays.asList(dividend, divisor));
        object_print_method = class_print_method;
    }

    /**
    * Prints a quotient to a stream.
    */
    public static void defaultPrint(Quotient q, PrintWriter o) {
        printOperand(q.getDividend(), PRODUCT_PRECEDENCE, o);
        o.print("/");
        printOperand(q.getDivisor(), POWER_PRECEDENCE, o);
    }

    public Expression getDividend() {
        return children.get(0);
    }

    public Expression getDivisor() {
        return children.get(1);
    }

    public Expression withChildren(List<Expression> children) {
        if (children.size() != 2) {
            throw new IllegalArgumentException("quotient takes two operands");
        }
        return new Quotient(children.get(0), children.get(1));
    }

    @Override
    protected int precedence() {
        return PRODUCT_PRECEDENCE;
    }

}
