package cassia.hir;

import java.io.PrintWriter;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/**
* Represents a product of factors. A simplified product has at least two
* factors, none of which is a product or zero, sorted in ascending
* {@link ExpressionOrder}; a literal factor, if any, comes first and is the
* coefficient of the product.
*/
public class Product extends Expression {

    private static Method class_print_method;

    static {
        class_print_method = getPrintMethod(Product.class);
    }

    /**
    * Constructs a product of the specified factors.
    *
    * @throws IllegalArgumentException if there are no factors.
    */
    public Product(List<? extends Expression> factors) {
        super(factors);
        if (factors.isEmpty()) {
            throw new IllegalArgumentException("empty product");
        }
        object_print_method = class_print_method;
    }

    /** Constructs the product of two factors. */
    public Product(Expression lhs, Expression rhs) {
        this(Arrays.asList(lhs, rhs));
    }

    /**
    * Prints a product to a stream. A literal in leading position is printed
    * bare; elsewhere negative and fractional literals get parentheses.
    *
    * @param p The product to print.
    * @param o The writer on which to print the product.
    */
    public static void defaultPrint(Product p, PrintWriter o) {
        List<Expression> factors = p.children;
        for (int i = 0; i < factors.size(); i++) {
            Expression factor = factors.get(i);
            if (i > 0) {
                o.print("*");
            }
            if (factor instanceof Literal) {
                printOperand(factor, (i == 0) ? SUM_PRECEDENCE : POWER_PRECEDENCE, o);
            } else {
                printOperand(factor, PRODUCT_PRECEDENCE, o);
            }
        }
    }

    /**
    * Returns the leading literal factor, or one.
    */
    @Override
    public Expression coefficient() {
        Expression first = children.get(0);
        return (first instanceof Literal) ? first : IntegerLiteral.ONE;
    }

    /**
    * Returns the product without its leading literal factor.
    */
    @Override
    public Expression term() {
        if (!(children.get(0) instanceof Literal)) {
            return this;
        }
        if (children.size() == 2) {
            return children.get(1);
        }
        return new Product(children.subList(1, children.size()));
    }

    public Expression withChildren(List<Expression> children) {
        return new Product(children);
    }

    @Override
    protected int precedence() {
        // A leading negative literal binds like a unary minus.
        Expression first = children.get(0);
        if (first instanceof Literal && ((Literal)first).isNegative()) {
            return SUM_PRECEDENCE;
        }
        return PRODUCT_PRECEDENCE;
    }

}
