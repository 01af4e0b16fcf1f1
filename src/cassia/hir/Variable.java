package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.List;

/** Represents a symbol. Variables are compared by name only. */
public class Variable extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Variable.class);
    }

    private final String name;

    /**
    * Constructs a variable with the specified name.
    *
    * @throws IllegalArgumentException if the name is null or empty.
    */
    public Variable(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("variable without a name");
        }
        object_print_method = class_print_method;
        this.name = name;
    }

    /**
    * Prints a variable to a stream.
    *
    * @param v The variable to print.
    * @param o The writer on which to print the variable.
    */
    public static void defaultPrint(Variable v, PrintWriter o) {
        o.print(v.name);
    }

    /** Returns the name of the variable. */
    public String getName() {
        return name;
    }

    /** Variables have no children. */
    public Expression withChildren(List<Expression> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException("variables have no children");
        }
        return this;
    }

}
