package cassia.transforms;

import cassia.hir.Expression;
import cassia.hir.Symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
* Structural queries and replacement of complete sub-expressions. Only whole
* operands match: {@code x + y} is found in {@code x + y + z} only if it is a
* child of the tree, which it is not, since {@code x + y + z} has three
* terms. Replacement results are simplified.
*/
public final class Substitution {

    private Substitution() {
    }

    /**
    * Checks if {@code t} occurs as a complete sub-expression of {@code u}.
    */
    public static boolean contains(Expression u, Expression t) {
        if (u.equals(t)) {
            return true;
        }
        for (Expression child : u.getChildren()) {
            if (contains(child, t)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Checks if {@code t} does not occur in {@code u}.
    */
    public static boolean freeOf(Expression u, Expression t) {
        return !contains(u, t);
    }

    /**
    * Checks if none of the given expressions occurs in {@code u}.
    */
    public static boolean freeOf(Expression u, List<? extends Expression> ts) {
        for (Expression t : ts) {
            if (contains(u, t)) {
                return false;
            }
        }
        return true;
    }

    /**
    * Replaces every occurrence of {@code t} in {@code u} by {@code r} and
    * simplifies the result.
    */
    public static Expression substitute(Expression u, Expression t, Expression r) {
        return Symbolic.simplify(replace(u, Collections.singletonMap(t, r)));
    }

    /**
    * Replaces the keys of the map by their values simultaneously and
    * simplifies the result. A replaced value is never searched again, so
    * {@code {x: y, y: x}} swaps the two variables.
    */
    public static Expression substitute(Expression u, Map<? extends Expression, ? extends Expression> map) {
        return Symbolic.simplify(replace(u, map));
    }

    /**
    * Replaces the keys of the map by their values simultaneously without
    * simplifying the result.
    */
    public static Expression replace(Expression u, Map<? extends Expression, ? extends Expression> map) {
        Expression r = map.get(u);
        if (r != null) {
            return r;
        }
        List<Expression> children = u.getChildren();
        if (children.isEmpty()) {
            return u;
        }
        List<Expression> replaced = new ArrayList<Expression>(children.size());
        boolean changed = false;
        for (Expression child : children) {
            Expression c = replace(child, map);
            changed |= (c != child);
            replaced.add(c);
        }
        return changed ? u.withChildren(replaced) : u;
    }

}
