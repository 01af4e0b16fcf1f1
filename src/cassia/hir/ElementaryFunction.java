package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
* Represents an application of an elementary function: the trigonometric and
* inverse trigonometric functions, exp, ln, and the unresolved derivative
* marker. All of them share this node so that ordering and traversal treat
* them uniformly. Sign and zero reflexes such as {@code sin(-x) = -sin(x)} are
* applied by {@link Symbolic#function(ElementaryKind, Expression)}, not by the
* constructor.
*/
public class ElementaryFunction extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(ElementaryFunction.class);
    }

    private final ElementaryKind kind;

    /**
    * Constructs an application of the given function.
    *
    * @param kind the function.
    * @param args the arguments.
    * @throws IllegalArgumentException if the number of arguments does not
    *       match the arity of the function.
    */
    public ElementaryFunction(ElementaryKind kind, List<? extends Expression> args) {
        super(args);
        if (kind == null) {
            throw new IllegalArgumentException("missing function kind");
        }
        if (args.size() != kind.getArity()) {
            throw new IllegalArgumentException(kind + " takes "
                    + kind.getArity() + " argument(s) but " + args.size()
                    + " given");
        }
        object_print_method = class_print_method;
        this.kind = kind;
    }

    /** Constructs an application of a unary function. */
    public ElementaryFunction(ElementaryKind kind, Expression arg) {
        this(kind, Collections.singletonList(arg));
    }

    /**
    * Constructs the unresolved derivative marker of {@code e} with respect to
    * {@code wrt}.
    */
    public static ElementaryFunction derivativeMarker(Expression e, Variable wrt) {
        return new ElementaryFunction(ElementaryKind.DERIV, Arrays.asList(e, wrt));
    }

    /**
    * Prints a function application to a stream.
    *
    * @param f The function to print.
    * @param o The writer on which to print the function.
    */
    public static void defaultPrint(ElementaryFunction f, PrintWriter o) {
        f.kind.print(o);
        o.print("(");
        printList(f.children, ", ", o);
        o.print(")");
    }

    /** Returns the function applied by this node. */
    public ElementaryKind getKind() {
        return kind;
    }

    /** Returns the first argument. */
    public Expression getArgument() {
        return children.get(0);
    }

    /** Checks if this node applies the given function. */
    public boolean isKind(ElementaryKind k) {
        return kind == k;
    }

    /** Checks if the given expression applies the specified function. */
    public static boolean isKind(Expression e, ElementaryKind k) {
        return (e instanceof ElementaryFunction) && ((ElementaryFunction)e).kind == k;
    }

    public Expression withChildren(List<Expression> children) {
        return new ElementaryFunction(kind, children);
    }

}
