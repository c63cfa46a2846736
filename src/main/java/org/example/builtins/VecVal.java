package org.example.builtins;

import java.util.*;

/**
 * An ordered, immutable sequence of values. Elements may be of mixed type and
 * nest arbitrarily; a vector of vectors doubles as a table of rows.
 */
public final class VecVal implements Value {

    public static final VecVal EMPTY = new VecVal(Collections.emptyList());

    final List<Value> v;

    public VecVal(List<? extends Value> v){ this.v = List.copyOf(v); }

    public static VecVal of(Value... items){ return new VecVal(Arrays.asList(items)); }

    /** Shorthand for a vector of numbers, handy for tables of points. */
    public static VecVal ofNumbers(double... xs){
        List<Value> out = new ArrayList<>(xs.length);
        for (double x : xs) out.add(new NumVal(x));
        return new VecVal(out);
    }

    public Type type(){ return Type.VECTOR; }

    public List<Value> values(){ return v; }

    public int size(){ return v.size(); }

    public Value get(int index){ return v.get(index); }

    @Override
    public boolean equals(Object o){
        return o instanceof VecVal && ((VecVal) o).v.equals(v);
    }

    @Override public int hashCode(){ return v.hashCode(); }
    @Override public String toString(){ return ValuePrinter.print(this); }
}
