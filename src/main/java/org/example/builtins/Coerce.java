package org.example.builtins;

import java.util.*;

/**
 * Variant accessors. None of them throw: a value of the wrong variant reads as
 * zero, an empty vector, or {@code null} where the caller has to tell the
 * difference.
 */
public final class Coerce {

    private Coerce(){}

    public static boolean isNumber(Value v){ return v.type() == Value.Type.NUMBER; }
    public static boolean isString(Value v){ return v.type() == Value.Type.STRING; }
    public static boolean isVector(Value v){ return v.type() == Value.Type.VECTOR; }

    public static double toDouble(Value v){
        return isNumber(v) ? ((NumVal) v).v : 0.0;
    }

    public static List<Value> toVector(Value v){
        return isVector(v) ? ((VecVal) v).v : Collections.emptyList();
    }

    public static String toString(Value v){
        return ValuePrinter.print(v);
    }

    /**
     * Reads a two-element numeric vector, as used for {@code [x, y]} pairs.
     * Returns null for anything else, including vectors of any other size.
     */
    public static double[] getVec2(Value v){
        List<Value> items = toVector(v);
        if (items.size() != 2 || !isNumber(items.get(0)) || !isNumber(items.get(1))) return null;
        return new double[] { toDouble(items.get(0)), toDouble(items.get(1)) };
    }

    /** Same as {@link #getVec2} for three elements. */
    public static double[] getVec3(Value v){
        List<Value> items = toVector(v);
        if (items.size() != 3) return null;
        for (Value item : items) if (!isNumber(item)) return null;
        return new double[] { toDouble(items.get(0)), toDouble(items.get(1)), toDouble(items.get(2)) };
    }

    /**
     * Truncates a count or index argument. Returns -1 when the value is not a
     * finite, non-negative number.
     */
    public static int toIndex(Value v){
        if (!isNumber(v)) return -1;
        double d = toDouble(v);
        if (Double.isNaN(d) || Double.isInfinite(d) || d < 0) return -1;
        return d >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) d;
    }

    /** Ordering is defined for numbers only; every other pair is "not less". */
    public static boolean less(Value a, Value b){
        return isNumber(a) && isNumber(b) && toDouble(a) < toDouble(b);
    }

    public static boolean greater(Value a, Value b){
        return less(b, a);
    }
}
