package cassia.transforms;

import cassia.hir.ElementaryKind;
import cassia.hir.Expression;
import cassia.hir.IntegerLiteral;
import cassia.hir.Literal;
import cassia.hir.Symbolic;
import cassia.hir.Variable;

import java.util.HashMap;
import java.util.Map;

/**
* Antiderivatives of the basic integrands. Entries are written in the
* anonymous variable {@code _t}, which the parser cannot produce, and are
* keyed by their printed canonical form.
*/
final class IntegrationTable {

    private static final Variable t = new Variable("_t");

    private static final Map<String, Expression> table = new HashMap<String, Expression>(32);

    static {
        Expression sin = Symbolic.sin(t), cos = Symbolic.cos(t);
        Expression tan = Symbolic.tan(t), cot = Symbolic.cot(t);
        Expression sec = Symbolic.sec(t), csc = Symbolic.csc(t);
        Expression square = Symbolic.power(t, 2);
        put(t, Symbolic.product(Literal.valueOf(1, 2), square));
        put(Symbolic.power(t, -1), Symbolic.ln(t));
        put(sin, Symbolic.negate(cos));
        put(cos, sin);
        put(Symbolic.exp(t), Symbolic.exp(t));
        put(Symbolic.power(sec, 2), tan);
        put(Symbolic.power(csc, 2), Symbolic.negate(cot));
        put(Symbolic.multiply(csc, cot), Symbolic.negate(csc));
        put(Symbolic.multiply(sec, tan), sec);
        put(Symbolic.ln(t), Symbolic.subtract(Symbolic.multiply(t, Symbolic.ln(t)), t));
        put(tan, Symbolic.negate(Symbolic.ln(cos)));
        put(cot, Symbolic.ln(sin));
        put(Symbolic.power(Symbolic.add(IntegerLiteral.ONE, square), -1),
            Symbolic.function(ElementaryKind.ARCTAN, t));
        put(Symbolic.power(Symbolic.subtract(IntegerLiteral.ONE, square), Literal.valueOf(-1, 2)),
            Symbolic.function(ElementaryKind.ARCSIN, t));
    }

    private IntegrationTable() {
    }

    private static void put(Expression integrand, Expression antiderivative) {
        table.put(integrand.toString(), antiderivative);
    }

    /**
    * Returns the tabulated antiderivative of {@code u} with respect to
    * {@code x}, or null.
    */
    static Expression lookup(Expression u, Variable x) {
        Expression key = Substitution.substitute(u, x, t);
        Expression antiderivative = table.get(key.toString());
        if (antiderivative == null) {
            return null;
        }
        return Substitution.substitute(antiderivative, t, x);
    }

    /** Returns the number of entries. */
    static int size() {
        return table.size();
    }

}
