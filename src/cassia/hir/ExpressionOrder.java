package cassia.hir;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
* ExpressionOrder is the total order that sorts the operands of simplified
* sums and products. The order is defined recursively:
* <ul>
* <li>literals come first and compare by value;</li>
* <li>variables compare by name;</li>
* <li>sums (products) compare operand-wise from the last operand backward,
* and a proper suffix sorts first;</li>
* <li>powers compare bases, then exponents;</li>
* <li>factorials compare operands;</li>
* <li>elementary functions compare by kind, then argument-wise;</li>
* <li>user function calls compare by name, then argument-wise;</li>
* <li>mixed pairs are compared by viewing the simpler operand as a one-operand
* sum or product, or as a power with exponent one.</li>
* </ul>
* Two expressions compare as equal exactly when they print identically.
*/
public class ExpressionOrder implements Comparator<Expression> {

    // Ranks used to dispatch mixed comparisons; the lower rank drives.
    private static final int
            LITERAL = 0,
            PRODUCT = 1,
            POWER = 2,
            SUM = 3,
            FACTORIAL = 4,
            ELEMENTARY = 5,
            CALL = 6,
            VARIABLE = 7,
            OTHER = 8;

    private static final ExpressionOrder instance = new ExpressionOrder();

    protected ExpressionOrder() {
    }

    /** Returns the shared comparator. */
    public static ExpressionOrder getInstance() {
        return instance;
    }

    /**
    * Compares two expressions.
    * @return zero if both are equal, negative if {@code u} sorts first.
    */
    public int compare(Expression u, Expression v) {
        if (u.equals(v)) {
            return 0;
        }
        return precedes(u, v) ? -1 : 1;
    }

    /**
    * Checks if {@code u} sorts strictly before {@code v}.
    */
    public static boolean precedes(Expression u, Expression v) {
        if (u == v) {
            return false;
        }
        int ru = rank(u), rv = rank(v);
        if (ru == rv) {
            return precedesSameKind(u, v, ru);
        }
        if (ru > rv) {
            return !precedes(v, u);
        }
        switch (ru) {
        case LITERAL:
            return true;
        case PRODUCT:
            if (rv == OTHER) {
                return true;
            }
            return precedesBackward(u.getChildren(),
                                    Collections.singletonList(v));
        case POWER:
            if (rv == OTHER) {
                return true;
            }
            return precedesPower(u, v);
        case SUM:
            if (rv == OTHER) {
                return true;
            }
            return precedesBackward(u.getChildren(),
                                    Collections.singletonList(v));
        case FACTORIAL:
            if (rv == OTHER) {
                return true;
            }
            Expression operand = ((Factorial)u).getOperand();
            if (operand.equals(v)) {
                return false;
            }
            return precedes(operand, v);
        case ELEMENTARY:
            if (rv == VARIABLE) {
                return precedesName(((ElementaryFunction)u).getKind().toString(),
                                    ((Variable)v).getName());
            }
            return true;
        case CALL:
            if (rv == VARIABLE) {
                return precedesName(((FunctionCall)u).getName(),
                                    ((Variable)v).getName());
            }
            return true;
        default:
            return true;
        }
    }

    // Ranks an expression for dispatching.
    private static int rank(Expression e) {
        if (e instanceof Literal) {
            return LITERAL;
        } else if (e instanceof Product) {
            return PRODUCT;
        } else if (e instanceof Power) {
            return POWER;
        } else if (e instanceof Sum) {
            return SUM;
        } else if (e instanceof Factorial) {
            return FACTORIAL;
        } else if (e instanceof ElementaryFunction) {
            return ELEMENTARY;
        } else if (e instanceof FunctionCall) {
            return CALL;
        } else if (e instanceof Variable) {
            return VARIABLE;
        } else {
            return OTHER;
        }
    }

    // Compares two expressions of the same rank.
    private static boolean precedesSameKind(Expression u, Expression v, int rank) {
        switch (rank) {
        case LITERAL:
            return ((Literal)u).compareValue((Literal)v) < 0;
        case PRODUCT:
        case SUM:
            return precedesBackward(u.getChildren(), v.getChildren());
        case POWER:
            if (u.base().equals(v.base())) {
                return precedes(u.exponent(), v.exponent());
            }
            return precedes(u.base(), v.base());
        case FACTORIAL:
            return precedes(((Factorial)u).getOperand(),
                            ((Factorial)v).getOperand());
        case ELEMENTARY:
            int ku = ((ElementaryFunction)u).getKind().getPrecedence();
            int kv = ((ElementaryFunction)v).getKind().getPrecedence();
            if (ku != kv) {
                return ku < kv;
            }
            return precedesForward(u.getChildren(), v.getChildren());
        case CALL:
            String nu = ((FunctionCall)u).getName();
            String nv = ((FunctionCall)v).getName();
            if (!nu.equals(nv)) {
                return nu.compareTo(nv) < 0;
            }
            return precedesForward(u.getChildren(), v.getChildren());
        case VARIABLE:
            return ((Variable)u).getName().compareTo(((Variable)v).getName()) < 0;
        default:
            // Only raw quotients and UNDEFINED get here; order them by kind,
            // then by operands.
            if (u.getClass() != v.getClass()) {
                return u instanceof Quotient;
            }
            return precedesForward(u.getChildren(), v.getChildren());
        }
    }

    // Compares the power u with v viewed as v^1.
    private static boolean precedesPower(Expression u, Expression v) {
        if (u.base().equals(v)) {
            return precedes(u.exponent(), IntegerLiteral.ONE);
        }
        return precedes(u.base(), v);
    }

    // A function named like the variable sorts after it.
    private static boolean precedesName(String function_name, String variable_name) {
        if (function_name.equals(variable_name)) {
            return false;
        }
        return function_name.compareTo(variable_name) < 0;
    }

    /**
    * Compares two operand lists starting from the last operands; the first
    * mismatch decides, and a proper suffix sorts first.
    */
    protected static boolean precedesBackward(List<Expression> a, List<Expression> b) {
        int i = a.size() - 1, j = b.size() - 1;
        while (i >= 0 && j >= 0) {
            Expression x = a.get(i), y = b.get(j);
            if (!x.equals(y)) {
                return precedes(x, y);
            }
            i--;
            j--;
        }
        return a.size() < b.size();
    }

    /**
    * Compares two argument lists starting from the first arguments; the first
    * mismatch decides, and a proper prefix sorts first.
    */
    protected static boolean precedesForward(List<Expression> a, List<Expression> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            Expression x = a.get(i), y = b.get(i);
            if (!x.equals(y)) {
                return precedes(x, y);
            }
        }
        return a.size() < b.size();
    }

}
