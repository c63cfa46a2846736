package org.example.builtins;

/**
 * Receives non-fatal diagnostics from builtins. Implementations must not throw;
 * a warning never changes the value a builtin returns.
 */
public interface WarningSink {

    void warn(String message);

    /** Prints {@code WARNING: <message>} to standard error. */
    WarningSink STDERR = message -> System.err.println("WARNING: " + message);
}
