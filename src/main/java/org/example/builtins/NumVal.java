package org.example.builtins;

public final class NumVal implements Value {

    final double v;

    public NumVal(double v){ this.v = v; }

    public static NumVal ofInt(long x){ return new NumVal((double) x); }

    public Type type(){ return Type.NUMBER; }

    public double value(){ return v; }

    // NaN never equals itself, -0 equals 0
    @Override
    public boolean equals(Object o){
        return o instanceof NumVal && ((NumVal) o).v == v;
    }

    @Override
    public int hashCode(){ return v == 0.0 ? 0 : Double.hashCode(v); }

    @Override public String toString(){ return ValuePrinter.print(this); }
}
