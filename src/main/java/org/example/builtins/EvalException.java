package org.example.builtins;

/**
 * Raised by the registry and the batch runner, never by a builtin itself.
 * Messages start with an upper-case code such as {@code UNKNOWN_FUNCTION:}.
 */
public final class EvalException extends RuntimeException {
    public EvalException(String msg){ super(msg); }
    public EvalException(String msg, Throwable cause){ super(msg, cause); }
}
