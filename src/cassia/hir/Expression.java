package cassia.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class for all expressions. Expressions are immutable trees; every
* transformation returns a new tree which may share sub-trees with its input.
* Two expressions are equal if and only if their printed forms are identical,
* which is what makes the canonical form produced by {@link Symbolic#simplify}
* meaningful: simplified expressions that are mathematically equal print the
* same. Expressions are ordered by {@link ExpressionOrder}.
*/
public abstract class Expression implements Comparable<Expression>, Traversable {

    /** Printing precedence of a sum, the loosest binding */
    protected static final int SUM_PRECEDENCE = 1;

    /** Printing precedence of a product or quotient */
    protected static final int PRODUCT_PRECEDENCE = 2;

    /** Printing precedence of a power */
    protected static final int POWER_PRECEDENCE = 3;

    /** Printing precedence of a factorial */
    protected static final int FACTORIAL_PRECEDENCE = 4;

    /** Printing precedence of atoms that never need parentheses */
    protected static final int ATOM_PRECEDENCE = 5;

    /** Empty child list for expressions having no children */
    protected static final List<Expression> empty_list =
            Collections.unmodifiableList(new ArrayList<Expression>(0));

    /** The print method for the expression */
    protected Method object_print_method;

    /** The children of the expression; never modified after construction */
    protected final List<Expression> children;

    // Printed form, computed once since the tree never changes.
    private String text;

    /** Constructor for leaf expressions. */
    protected Expression() {
        children = empty_list;
    }

    /**
    * Constructor for derived classes having children.
    *
    * @param children the child expressions, copied into an unmodifiable list.
    * @throws IllegalArgumentException if any child is null.
    */
    protected Expression(List<? extends Expression> children) {
        List<Expression> copy = new ArrayList<Expression>(children.size());
        for (int i = 0; i < children.size(); i++) {
            Expression child = children.get(i);
            if (child == null) {
                throw new IllegalArgumentException(
                        getClass().getSimpleName() + " with a null child");
            }
            copy.add(child);
        }
        this.children = Collections.unmodifiableList(copy);
    }

    /**
    * Returns a new node of the same kind holding the given children. The new
    * node is not simplified. Leaves return themselves.
    *
    * @param children the new children.
    * @return the rebuilt node.
    * @throws IllegalArgumentException if the number of children does not fit
    *       the node kind.
    */
    public abstract Expression withChildren(List<Expression> children);

    /* Comparable interface */
    public int compareTo(Expression e) {
        return ExpressionOrder.getInstance().compare(this, e);
    }

    /**
    * Checks if the given object is an expression with the same printed form.
    * @param o the object to be compared with.
    * @return true if both print identically.
    */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression)) {
            return false;
        }
        return toString().equals(o.toString());
    }

    /**
    * Returns the hash code of the expression. It returns the hash code of the
    * string representation since expressions are compared lexically.
    */
    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /* Traversable interface */
    public List<Expression> getChildren() {
        return children;
    }

    /**
    * Returns the child at the specified position.
    *
    * @param index the position of the child.
    * @return the child expression.
    */
    public Expression getChild(int index) {
        return children.get(index);
    }

    /**
    * Returns the base of this expression when it is viewed as a power; an
    * expression that is not a power is its own base.
    */
    public Expression base() {
        return this;
    }

    /**
    * Returns the exponent of this expression when it is viewed as a power; an
    * expression that is not a power has exponent one.
    */
    public Expression exponent() {
        return IntegerLiteral.ONE;
    }

    /**
    * Returns the numeric coefficient of this expression when it is viewed as
    * a term of a sum; only products have a coefficient other than one.
    */
    public Expression coefficient() {
        return IntegerLiteral.ONE;
    }

    /**
    * Returns this expression without its numeric coefficient.
    */
    public Expression term() {
        return this;
    }

    /** Checks if this expression is a numeric literal. */
    public boolean isConstant() {
        return false;
    }

    /**
    * Prints the expression on the specified print writer.
    *
    * @param o the target print writer.
    */
    public void print(PrintWriter o) {
        if (object_print_method == null) {
            return;
        }
        try {
            object_print_method.invoke(null, new Object[] {this, o});
        } catch(IllegalAccessException e) {
            System.err.println(e);
            e.printStackTrace();
            Tools.exit(1);
        } catch(InvocationTargetException e) {
            System.err.println(e.getCause());
            e.printStackTrace();
            Tools.exit(1);
        }
    }

    /** Returns a string representation of the expression */
    @Override
    public String toString() {
        if (text == null) {
            StringWriter sw = new StringWriter(40);
            print(new PrintWriter(sw));
            text = sw.toString();
        }
        return text;
    }

    /**
    * Returns the precedence used to decide whether this expression needs
    * parentheses when printed as an operand.
    */
    protected int precedence() {
        return ATOM_PRECEDENCE;
    }

    /**
    * Prints an operand, surrounded by parentheses if its precedence is lower
    * than the specified one.
    *
    * @param e the operand.
    * @param min_precedence the least precedence printed without parentheses.
    * @param o the target print writer.
    */
    protected static void printOperand(Expression e, int min_precedence,
                                       PrintWriter o) {
        if (e.precedence() < min_precedence) {
            o.print("(");
            e.print(o);
            o.print(")");
        } else {
            e.print(o);
        }
    }

    /**
    * Prints a list of expressions separated by the given string.
    */
    protected static void printList(List<? extends Expression> list, String sep,
                                    PrintWriter o) {
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                o.print(sep);
            }
            list.get(i).print(o);
        }
    }

    /**
    * Looks up the static print method of the given expression class; every
    * concrete class declares {@code defaultPrint(Class, PrintWriter)}.
    */
    protected static Method getPrintMethod(Class<? extends Expression> c) {
        try {
            return c.getMethod("defaultPrint", c, PrintWriter.class);
        } catch(NoSuchMethodException e) {
            throw new InternalError();
        }
    }

}
