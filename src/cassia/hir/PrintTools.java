package cassia.hir;

import cassia.exec.Driver;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collection;
import java.util.Iterator;

/**
* <b>PrintTools</b> provides tools that perform printing of collections of
* expressions or status messages.
*/
public final class PrintTools {

    // Short names for system properties
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Returns the verbosity set by the -verbosity command-line flag; zero if
    * the flag is missing or malformed.
    */
    public static int getVerbosity() {
        String s = Driver.getOptionValue("verbosity");
        if (s == null) {
            return 0;
        }
        try {
            return Integer.parseInt(s.trim());
        } catch(NumberFormatException ex) {
            return 0;
        }
    }

    /**
    * Prints a Printable object to System.err if the
    * verbosity level is greater than min_verbosity.
    *
    * @param p A Printable object.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(Printable p, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(p + "");
        }
    }

    /**
    * Prints a string to System.err if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void printlnStatus(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.err.println(message);
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * This method minimizes overheads from string composition since it is done
    * only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Converts a collection of objects to a string with the given separator.
    * Expressions are printed with their own print method.
    *
    * @param coll the collection to be converted.
    * @param separator the separating string.
    * @return the converted string.
    */
    public static String collectionToString(Collection<?> coll, String separator) {
        if (coll == null || coll.isEmpty()) {
            return "";
        }
        StringWriter sw = new StringWriter(80);
        PrintWriter pw = new PrintWriter(sw);
        Iterator<?> iter = coll.iterator();
        printObject(iter.next(), pw);
        while (iter.hasNext()) {
            pw.print(separator);
            printObject(iter.next(), pw);
        }
        pw.flush();
        return sw.toString();
    }

    // Prints a printable object with its print method, others with toString.
    private static void printObject(Object o, PrintWriter pw) {
        if (o instanceof Printable) {
            ((Printable)o).print(pw);
        } else {
            pw.print(o);
        }
    }

}
