package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/**
* Represents a sum of terms. A simplified sum has at least two terms, none of
* which is a sum, sorted in ascending {@link ExpressionOrder}, with at most one
* leading literal. Raw sums built by the parser have no such guarantee.
*/
public class Sum extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Sum.class);
    }

    /**
    * Constructs a sum of the specified terms.
    *
    * @throws IllegalArgumentException if there are no terms.
    */
    public Sum(List<? extends Expression> terms) {
        super(terms);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("empty sum");
        }
        object_print_method = class_print_method;
    }

    /** Constructs the sum of two terms. */
    public Sum(Expression lhs, Expression rhs) {
        this(Arrays.asList(lhs, rhs));
    }

    /**
    * Prints a sum to a stream.
    *
    * @param s The sum to print.
    * @param o The writer on which to print the sum.
    */
    public static void defaultPrint(Sum s, PrintWriter o) {
        List<Expression> terms = s.children;
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) {
                o.print(" + ");
            }
            printOperand(terms.get(i), SUM_PRECEDENCE, o);
        }
    }

    public Expression withChildren(List<Expression> children) {
        return new Sum(children);
    }

    @Override
    protected int precedence() {
        return SUM_PRECEDENCE;
    }

}
