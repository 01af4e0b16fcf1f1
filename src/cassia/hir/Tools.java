package cassia.hir;

/**
* Miscellaneous helpers shared by the whole kernel.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Prints the message to the error stream and exits with status one.
    */
    public static void exit(String msg) {
        System.err.println(msg);
        Tools.exit(1);
    }

    /** Flag for selecting how exit() is handled. */
    private static boolean exit_throws_exception = false;

    /**
    * Selects how Tools.exit() behaves.
    * Setting <b>flag = true</b> causes <b>Tools.exit()</b> throw a runtime
    * exception instead of invoking <b>System.exit()</b>.
    * @param flag the boolean flag
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Invokes exit operation.
    * Depending on the flag set by {@link #exitThrowsException(boolean)}, this
    * method either calls {@link System#exit(int)} or throws a
    * {@link RuntimeException}.
    * @param status the exit status
    * @exception RuntimeException if the last call to
    *       {@link #exitThrowsException(boolean)} is with <b>true</b>.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new RuntimeException("Exiting with status " + status);
        } else {
            System.exit(status);
        }
    }

}
