package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
* Represents a user-defined function. A function node plays two roles:
* <ul>
* <li>a <b>definition</b> holds the formal parameters and the body written in
* terms of them, and no arguments;</li>
* <li>a <b>call</b> holds the supplied arguments, and optionally the definition
* it was bound to. A call without a definition refers to a function that is
* resolved later through an {@link Environment}.</li>
* </ul>
* The children of a function node are its arguments; the body is not a child
* since its variables are the parameters, not free symbols.
*/
public class FunctionCall extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(FunctionCall.class);
    }

    private final String name;

    private final List<Variable> parameters;

    private final Expression body;

    // True if the node supplies arguments.
    private final boolean applied;

    // Full constructor.
    private FunctionCall(String name, List<Variable> parameters, Expression body,
                         List<? extends Expression> args) {
        super(args == null ? empty_list : args);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("function without a name");
        }
        object_print_method = class_print_method;
        this.name = name;
        this.parameters = Collections.unmodifiableList(
                new ArrayList<Variable>(parameters));
        this.body = body;
        this.applied = (args != null);
    }

    /**
    * Constructs the definition {@code name(parameters) = body}.
    *
    * @throws IllegalArgumentException if there are no parameters, a
    *       parameter is repeated, or the body is null.
    */
    public static FunctionCall define(String name, List<Variable> parameters,
                                      Expression body) {
        if (parameters.isEmpty()) {
            throw new IllegalArgumentException(name + " has no parameters");
        }
        Set<String> seen = new HashSet<String>();
        for (Variable param : parameters) {
            if (!seen.add(param.getName())) {
                throw new IllegalArgumentException(name
                        + " repeats the parameter " + param);
            }
        }
        if (body == null) {
            throw new IllegalArgumentException(name + " has no body");
        }
        return new FunctionCall(name, parameters, body, null);
    }

    /**
    * Constructs a call of a function that is not bound to a definition yet.
    */
    public static FunctionCall call(String name, List<? extends Expression> args) {
        return new FunctionCall(name, Collections.<Variable>emptyList(), null, args);
    }

    /**
    * Returns a call of this definition with the given arguments.
    *
    * @throws IllegalArgumentException if the number of arguments does not
    *       match the number of parameters.
    */
    public FunctionCall apply(List<? extends Expression> args) {
        if (body != null && args.size() != parameters.size()) {
            throw new IllegalArgumentException(name + " takes "
                    + parameters.size() + " argument(s) but " + args.size()
                    + " given");
        }
        return new FunctionCall(name, parameters, body, args);
    }

    /**
    * Prints a function to a stream; a definition prints its parameters and a
    * call prints its arguments.
    */
    public static void defaultPrint(FunctionCall f, PrintWriter o) {
        o.print(f.name);
        o.print("(");
        if (f.applied) {
            printList(f.children, ", ", o);
        } else {
            printList(f.parameters, ", ", o);
        }
        o.print(")");
    }

    public String getName() {
        return name;
    }

    /** Returns the formal parameters; empty for an unbound call. */
    public List<Variable> getParameters() {
        return parameters;
    }

    /** Returns the body, or null for an unbound call. */
    public Expression getBody() {
        return body;
    }

    /** Returns the supplied arguments, or null for a definition. */
    public List<Expression> getArguments() {
        return applied ? children : null;
    }

    /** Checks if this node is a definition rather than a call. */
    public boolean isDefinition() {
        return !applied;
    }

    /** Checks if this node carries a body. */
    public boolean hasBody() {
        return body != null;
    }

    public Expression withChildren(List<Expression> children) {
        if (!applied) {
            if (!children.isEmpty()) {
                throw new IllegalArgumentException(
                        "a function definition has no arguments");
            }
            return this;
        }
        return new FunctionCall(name, parameters, body, children);
    }

}
