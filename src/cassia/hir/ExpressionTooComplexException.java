package cassia.hir;

/**
* Thrown when simplification or evaluation nests deeper than the limit set
* by the {@code max-depth} option. Deep recursion over a large or cyclic
* expression is reported with this exception instead of a stack overflow.
*/
public class ExpressionTooComplexException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int depth;

    public ExpressionTooComplexException(String message, int depth) {
        super(message + " (depth limit " + depth + ")");
        this.depth = depth;
    }

    /** Returns the depth limit that was exceeded. */
    public int getDepth() {
        return depth;
    }

}
