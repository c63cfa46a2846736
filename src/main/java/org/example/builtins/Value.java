package org.example.builtins;

/**
 * A dynamically-typed value handed to and returned from builtin functions.
 * The set of variants is closed: consumers switch on {@link #type()}.
 */
public interface Value {

    enum Type { UNDEFINED, NUMBER, STRING, VECTOR }

    Type type();
}
