package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.List;

/** Represents the factorial of an operand. */
public class Factorial extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Factorial.class);
    }

    /** Constructs operand!. */
    public Factorial(Expression operand) {
        super(Collections.singletonList(operand));
        object_print_method = class_print_method;
    }

    /**
    * Prints a factorial to a stream.
    */
    public static void defaultPrint(Factorial f, PrintWriter o) {
        printOperand(f.getOperand(), ATOM_PRECEDENCE, o);
        o.print("!");
    }

    public Expression getOperand() {
        return children.get(0);
    }

    public Expression withChildren(List<Expression> children) {
        if (children.size() != 1) {
            throw new IllegalArgumentException("factorial takes one operand");
        }
        return new Factorial(children.get(0));
    }

    @Override
    protected int precedence() {
        return FACTORIAL_PRECEDENCE;
    }

}
