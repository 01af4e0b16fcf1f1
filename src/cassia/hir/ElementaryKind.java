package cassia.hir;

import java.io.PrintWriter;
import java.util.HashMap;

/**
* The elementary functions known to the kernel. The numeric code of a kind is
* also its position in the ordering of elementary functions:
* sin &lt; cos &lt; tan &lt; csc &lt; sec &lt; cot &lt; arctan &lt; arccos &lt;
* arcsin &lt; exp &lt; ln &lt; Deriv.
*/
public class ElementaryKind implements Printable {

    private static HashMap<String, ElementaryKind> op_map =
            new HashMap<String, ElementaryKind>(16);

    private static String[] names = {
            "sin", "cos", "tan", "csc", "sec", "cot",
            "arctan", "arccos", "arcsin", "exp", "ln", "Deriv" };

    // Symmetry of each function under negation of its argument.
    private static final int NONE = 0, ODD = 1, EVEN = 2;

    private static int[] symmetry = {
            ODD, EVEN, ODD, ODD, EVEN, ODD, ODD, NONE, ODD, NONE, NONE, NONE };

    /** sin */
    public static final ElementaryKind SIN = new ElementaryKind(0);

    /** cos */
    public static final ElementaryKind COS = new ElementaryKind(1);

    /** tan */
    public static final ElementaryKind TAN = new ElementaryKind(2);

    /** csc */
    public static final ElementaryKind CSC = new ElementaryKind(3);

    /** sec */
    public static final ElementaryKind SEC = new ElementaryKind(4);

    /** cot */
    public static final ElementaryKind COT = new ElementaryKind(5);

    /** arctan */
    public static final ElementaryKind ARCTAN = new ElementaryKind(6);

    /** arccos */
    public static final ElementaryKind ARCCOS = new ElementaryKind(7);

    /** arcsin */
    public static final ElementaryKind ARCSIN = new ElementaryKind(8);

    /** exp */
    public static final ElementaryKind EXP = new ElementaryKind(9);

    /** ln */
    public static final ElementaryKind LN = new ElementaryKind(10);

    /**
    * Unresolved derivative marker; Deriv(f, x) stands for the derivative of
    * f with respect to x that could not be computed.
    */
    public static final ElementaryKind DERIV = new ElementaryKind(11);

    protected int value;

    /**
    * Used internally -- you may not create arbitrary kinds and may only use
    * the ones provided as static members.
    *
    * @param value The numeric code of the kind.
    */
    private ElementaryKind(int value) {
        this.value = value;
        op_map.put(names[value], this);
    }

    /**
    * Returns the kind with the specified name, or null if there is none. The
    * derivative marker is not reachable by name.
    */
    public static ElementaryKind fromString(String s) {
        ElementaryKind kind = op_map.get(s);
        return (kind == DERIV) ? null : kind;
    }

    /** Returns the number of arguments the function takes. */
    public int getArity() {
        return (this == DERIV) ? 2 : 1;
    }

    /** Checks if f(-x) = -f(x). */
    public boolean isOdd() {
        return symmetry[value] == ODD;
    }

    /** Checks if f(-x) = f(x). */
    public boolean isEven() {
        return symmetry[value] == EVEN;
    }

    /** Checks if this is one of the six trigonometric functions. */
    public boolean isTrigonometric() {
        return value <= COT.value;
    }

    /** Returns the position of this kind in the function ordering. */
    public int getPrecedence() {
        return value;
    }

    /* All kinds are provided as static objects, so identity is equality. */

    /** Prints the function name on the specified print writer. */
    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    /** Returns the function name. */
    @Override
    public String toString() {
        return names[value];
    }

}
