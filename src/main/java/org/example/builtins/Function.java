package org.example.builtins;

import java.util.List;

/**
 * A builtin. Receives already-evaluated arguments and returns one value; an
 * argument-count or type mismatch yields {@link UndefVal}, never an exception.
 */
@FunctionalInterface
public interface Function {
    Value invoke(Context ctx, List<Value> args);
}
