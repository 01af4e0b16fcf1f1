package cassia.hir;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
* An immutable table of definitions. A name is bound either to a value (the
* definition of a variable) or to a {@link FunctionCall} definition holding
* parameters and body. Every update returns a new environment and leaves the
* receiver unchanged, so an environment can be passed down into evaluation
* and narrowed for a function body without affecting the caller.
*/
public final class Environment {

    private static final Environment empty_environment =
            new Environment(new TreeMap<String, Expression>());

    private final Map<String, Expression> definitions;

    private Environment(Map<String, Expression> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /** Returns the environment without definitions. */
    public static Environment empty() {
        return empty_environment;
    }

    /**
    * Returns a new environment binding the variable name to the value.
    *
    * @throws IllegalArgumentException if the value is null.
    */
    public Environment define(String name, Expression value) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("incomplete definition of " + name);
        }
        TreeMap<String, Expression> map = new TreeMap<String, Expression>(definitions);
        map.put(name, value);
        return new Environment(map);
    }

    /**
    * Returns a new environment binding the name to the function definition
    * {@code name(parameters) = body}.
    *
    * @throws IllegalArgumentException if the definition is malformed or a
    *       parameter carries the name of the function.
    */
    public Environment defineFunction(String name, List<Variable> parameters,
                                      Expression body) {
        for (Variable param : parameters) {
            if (param.getName().equals(name)) {
                throw new IllegalArgumentException(name
                        + " cannot be a parameter of itself");
            }
        }
        FunctionCall definition = FunctionCall.define(name, parameters, body);
        TreeMap<String, Expression> map = new TreeMap<String, Expression>(definitions);
        map.put(name, definition);
        return new Environment(map);
    }

    /**
    * Returns a new environment without the definitions of the given
    * variables.
    */
    public Environment without(List<Variable> variables) {
        TreeMap<String, Expression> map = new TreeMap<String, Expression>(definitions);
        boolean changed = false;
        for (Variable v : variables) {
            changed |= (map.remove(v.getName()) != null);
        }
        return changed ? new Environment(map) : this;
    }

    /** Returns the definition bound to the name, or null. */
    public Expression lookup(String name) {
        return definitions.get(name);
    }

    /** Returns the function definition bound to the name, or null. */
    public FunctionCall lookupFunction(String name) {
        Expression e = definitions.get(name);
        if (e instanceof FunctionCall && ((FunctionCall)e).isDefinition()) {
            return (FunctionCall)e;
        }
        return null;
    }

    /** Checks if the name is bound. */
    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    /** Returns the bound names in alphabetical order. */
    public Set<String> getNames() {
        return definitions.keySet();
    }

    /** Returns the names bound to function definitions. */
    public Set<String> getFunctionNames() {
        Set<String> ret = new TreeSet<String>();
        for (String name : definitions.keySet()) {
            if (lookupFunction(name) != null) {
                ret.add(name);
            }
        }
        return ret;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(80);
        sb.append("{");
        String sep = "";
        for (Map.Entry<String, Expression> entry : definitions.entrySet()) {
            sb.append(sep);
            Expression e = entry.getValue();
            if (e instanceof FunctionCall && ((FunctionCall)e).isDefinition()) {
                sb.append(e).append(" = ").append(((FunctionCall)e).getBody());
            } else {
                sb.append(entry.getKey()).append(" = ").append(e);
            }
            sep = ", ";
        }
        sb.append("}");
        return sb.toString();
    }

}
