package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/**
* The absorbing value of indeterminate results such as {@code 0^(-1)} or
* {@code ln(0)}. Any operation receiving it as an operand returns it. It is a
* value, not an error: simplification never throws for indeterminate input.
*/
public final class Undefined extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Undefined.class);
    }

    /** The only instance */
    public static final Undefined UNDEFINED = new Undefined();

    private Undefined() {
        object_print_method = class_print_method;
    }

    /**
    * Prints the undefined value to a stream.
    */
    public static void defaultPrint(Undefined u, PrintWriter o) {
        o.print("UNDEFINED");
    }

    /** Checks if the given expression is the undefined value. */
    public static boolean isUndefined(Expression e) {
        return e instanceof Undefined;
    }

    public Expression withChildren(List<Expression> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException("UNDEFINED has no children");
        }
        return this;
    }

}
