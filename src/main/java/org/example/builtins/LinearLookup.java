package org.example.builtins;

import java.util.*;

/**
 * {@code lookup(x, [[x0, y0], [x1, y1], ...])}: piecewise-linear interpolation
 * over a table of points in any order.
 *
 * <p>A single pass keeps the tightest point at or below {@code x} ({@code low})
 * and at or above it ({@code high}), both starting from the first row. Outside
 * the table the result clamps: below every key it is the y of {@code high},
 * above every key the y of {@code low}.
 */
final class LinearLookup {

    private LinearLookup(){}

    static Value invoke(Context ctx, List<Value> a){
        if (a.size() != 2) return UndefVal.INSTANCE;
        return lookup(a.get(0), a.get(1));
    }

    static Value lookup(Value key, Value table){
        if (!Coerce.isNumber(key)) return UndefVal.INSTANCE;
        double x = Coerce.toDouble(key);

        List<Value> rows = Coerce.toVector(table);
        if (rows.size() < 2) return UndefVal.INSTANCE;
        double[][] points = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            points[i] = Coerce.getVec2(rows.get(i));
            if (points[i] == null) return UndefVal.INSTANCE;
        }

        double lowX = points[0][0], lowY = points[0][1];
        double highX = lowX, highY = lowY;
        for (int i = 1; i < points.length; i++) {
            double px = points[i][0], py = points[i][1];
            if (px <= x && (px > lowX || lowX > x)) {
                lowX = px;
                lowY = py;
            }
            if (px >= x && (px < highX || highX < x)) {
                highX = px;
                highY = py;
            }
        }

        if (x <= lowX) return new NumVal(highY);
        if (x >= highX) return new NumVal(lowY);
        double f = (x - lowX) / (highX - lowX);
        return new NumVal(highY * f + lowY * (1 - f));
    }
}
