package org.example.builtins;

import java.math.BigDecimal;
import java.util.*;

/**
 * Display form of values, used by {@code str()} and in warning messages.
 * Strings print raw at the top level and quoted inside vectors.
 */
public final class ValuePrinter {

    private ValuePrinter(){}

    public static String print(Value val){
        if (val == null) return "undef";
        switch (val.type()) {
            case STRING: return ((StrVal) val).v;
            case NUMBER: return printNumber(((NumVal) val).v);
            case VECTOR: return printVector((VecVal) val);
            case UNDEFINED:
            default: return "undef";
        }
    }

    static String printNumber(double d){
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    private static String printVector(VecVal vec){
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vec.v.size(); i++) {
            if (i > 0) sb.append(", ");
            Value item = vec.v.get(i);
            if (item.type() == Value.Type.STRING) sb.append('"').append(((StrVal) item).v).append('"');
            else sb.append(print(item));
        }
        return sb.append(']').toString();
    }
}
