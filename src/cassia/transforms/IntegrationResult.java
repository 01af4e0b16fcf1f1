package cassia.transforms;

import cassia.hir.Expression;

/**
* The outcome of {@link Integration#integrate}. An integration either finds
* an antiderivative, gives up, or runs out of its retry budget. Giving up is
* a normal result and is distinct from the antiderivative
* {@link cassia.hir.Undefined#UNDEFINED}.
*/
public class IntegrationResult {

    /** An antiderivative was found. */
    public static final int INTEGRATED = 0;

    /** No strategy applies. */
    public static final int NOT_FOUND = 1;

    /** The retry budget or the nesting limit was exhausted. */
    public static final int TOO_COMPLEX = 2;

    private static final String[] status_names = {
            "INTEGRATED", "NOT_FOUND", "TOO_COMPLEX" };

    private final int status;

    private final Expression antiderivative;

    private IntegrationResult(int status, Expression antiderivative) {
        this.status = status;
        this.antiderivative = antiderivative;
    }

    static IntegrationResult integrated(Expression antiderivative) {
        return new IntegrationResult(INTEGRATED, antiderivative);
    }

    static IntegrationResult notFound() {
        return new IntegrationResult(NOT_FOUND, null);
    }

    static IntegrationResult tooComplex() {
        return new IntegrationResult(TOO_COMPLEX, null);
    }

    public int getStatus() {
        return status;
    }

    public boolean isIntegrated() {
        return status == INTEGRATED;
    }

    /**
    * Returns the antiderivative.
    * @throws IllegalStateException if no antiderivative was found.
    */
    public Expression getAntiderivative() {
        if (status != INTEGRATED) {
            throw new IllegalStateException("no antiderivative: " + this);
        }
        return antiderivative;
    }

    @Override
    public String toString() {
        if (status == INTEGRATED) {
            return antiderivative.toString();
        }
        return status_names[status];
    }

}
