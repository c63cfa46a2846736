package org.example.builtins;

/**
 * The absent/error value. Builtins return it instead of throwing.
 */
public final class UndefVal implements Value {

    public static final UndefVal INSTANCE = new UndefVal();

    private UndefVal(){}

    public Type type(){ return Type.UNDEFINED; }

    @Override public boolean equals(Object o){ return o instanceof UndefVal; }
    @Override public int hashCode(){ return 0; }
    @Override public String toString(){ return ValuePrinter.print(this); }
}
