package cassia.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print its data. Every expression
* class provides a default way of printing itself in the infix notation read
* by the parser, and {@link Object#toString()} of an expression is defined by
* this print method.
*/
public interface Printable {

    /**
    * Prints the object on the specified writer.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
