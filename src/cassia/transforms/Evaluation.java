package cassia.transforms;

import cassia.hir.Environment;
import cassia.hir.Expression;
import cassia.hir.ExpressionTooComplexException;
import cassia.hir.FunctionCall;
import cassia.hir.PrintTools;
import cassia.hir.Symbolic;
import cassia.hir.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
* Evaluation of expressions against an {@link Environment}. Defined
* variables are replaced by their evaluated definitions and user functions
* are applied with lexical parameter scoping: the body is evaluated without
* the parameters' outer definitions, then every parameter is replaced by its
* argument in one simultaneous substitution. Names without a definition
* evaluate to themselves, and calls of unknown functions stay as calls.
*/
public final class Evaluation {

    private final int max_depth;

    private int depth;

    private Evaluation(int max_depth) {
        this.max_depth = max_depth;
        this.depth = 0;
    }

    /**
    * Returns the simplified value of {@code u} in the environment
    * {@code env}.
    *
    * @throws ExpressionTooComplexException if the definitions are cyclic or
    *       nest deeper than the "max-depth" option allows.
    * @throws IllegalArgumentException if a function is called with the
    *       wrong number of arguments.
    */
    public static Expression evaluate(Expression u, Environment env) {
        Evaluation evaluation = new Evaluation(Symbolic.getMaxDepth());
        return Symbolic.simplify(evaluation.eval(u, env));
    }

    private Expression eval(Expression u, Environment env) {
        if (++depth > max_depth) {
            throw new ExpressionTooComplexException(
                    "definitions nest too deeply to evaluate " + u, max_depth);
        }
        try {
            if (u instanceof Variable) {
                Expression definition = env.lookup(((Variable)u).getName());
                if (definition == null || env.lookupFunction(((Variable)u).getName()) != null) {
                    return u;
                }
                return eval(definition, env);
            }
            List<Expression> children = u.getChildren();
            if (children.isEmpty()) {
                return u;
            }
            List<Expression> values = new ArrayList<Expression>(children.size());
            boolean changed = false;
            for (Expression child : children) {
                Expression value = eval(child, env);
                changed |= (value != child);
                values.add(value);
            }
            if (u instanceof FunctionCall) {
                return apply((FunctionCall)u, values, env);
            }
            return changed ? u.withChildren(values) : u;
        } finally {
            depth--;
        }
    }

    // Applies the definition bound to the call, if any.
    private Expression apply(FunctionCall call, List<Expression> args, Environment env) {
        FunctionCall definition = env.lookupFunction(call.getName());
        if (definition == null && call.hasBody()) {
            definition = call;
        }
        if (definition == null) {
            PrintTools.printlnStatus(3, "[Evaluation] unknown function", call.getName());
            return call.withChildren(args);
        }
        List<Variable> params = definition.getParameters();
        if (params.size() != args.size()) {
            throw new IllegalArgumentException(call.getName() + " takes "
                    + params.size() + " argument(s) but " + args.size() + " given");
        }
        Expression body = eval(definition.getBody(), env.without(params));
        Map<Expression, Expression> bindings = new HashMap<Expression, Expression>();
        for (int i = 0; i < params.size(); i++) {
            bindings.put(params.get(i), args.get(i));
        }
        return Symbolic.simplify(Substitution.replace(body, bindings));
    }

}
