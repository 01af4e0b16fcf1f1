package cassia.base.grammars;

import cassia.hir.Expression;
import cassia.hir.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* One statement of the input language: an expression, the definition of a
* variable, or the definition of a function.
*/
public class ParsedStatement {

    public static final int EXPRESSION = 0;

    public static final int VARIABLE_DEFINITION = 1;

    public static final int FUNCTION_DEFINITION = 2;

    private final int kind;

    private final String name;

    private final List<Variable> parameters;

    private final Expression expression;

    ParsedStatement(int kind, String name, List<Variable> parameters,
                    Expression expression) {
        this.kind = kind;
        this.name = name;
        this.parameters = Collections.unmodifiableList(
                new ArrayList<Variable>(parameters));
        this.expression = expression;
    }

    public int getKind() {
        return kind;
    }

    /** Returns the defined name, or null for a plain expression. */
    public String getName() {
        return name;
    }

    /** Returns the parameters of a function definition. */
    public List<Variable> getParameters() {
        return parameters;
    }

    /** Returns the expression, or the right-hand side of a definition. */
    public Expression getExpression() {
        return expression;
    }

    public boolean isDefinition() {
        return kind != EXPRESSION;
    }

}
