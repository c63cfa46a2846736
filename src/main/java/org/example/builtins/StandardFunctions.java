package org.example.builtins;

import java.io.*;
import java.util.*;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

public final class StandardFunctions {

    // beyond this an angle has no significant bits left after reduction modulo 360
    static final double TRIG_HUGE_VAL = (1L << 26) * 360.0 * (1L << 26);

    // rands() refuses to build more numbers than this in one call
    static final int MAX_RANDS = 1_000_000;

    static final String VERSION_RESOURCE = "/builtins-version.properties";

    private StandardFunctions(){}

    public static void registerAll(FunctionRegistry r){

        // ----------------- Tables -----------------
        r.register("search", TableSearch::invoke);
        r.register("lookup", LinearLookup::invoke);

        // ----------------- Numeric -----------------
        r.register("abs", (ctx,a)-> unary(a, Math::abs));
        r.register("sign", (ctx,a)-> unary(a, x -> x < 0 ? -1.0 : (x > 0 ? 1.0 : 0.0)));
        r.register("round", (ctx,a)-> unary(a, StandardFunctions::roundHalfAway));
        r.register("ceil", (ctx,a)-> unary(a, Math::ceil));
        r.register("floor", (ctx,a)-> unary(a, Math::floor));
        r.register("sqrt", (ctx,a)-> unary(a, Math::sqrt));
        r.register("exp", (ctx,a)-> unary(a, Math::exp));
        r.register("ln", (ctx,a)-> unary(a, Math::log));
        r.register("pow", (ctx,a)-> binary(a, Math::pow));

        // log(x) is base 10, log(b, x) is base b
        r.register("log", (ctx,a)->{
            if (a.size() == 1) return unary(a, x -> Math.log(x) / Math.log(10.0));
            return binary(a, (b, x) -> Math.log(x) / Math.log(b));
        });

        r.register("min", (ctx,a)-> extreme(a, false));
        r.register("max", (ctx,a)-> extreme(a, true));

        // rands(min, max, count[, seed])
        r.register("rands", (ctx,a)->{
            if (a.size() != 3 && a.size() != 4) return UndefVal.INSTANCE;
            for (Value v : a) if (!Coerce.isNumber(v)) return UndefVal.INSTANCE;
            double min = Coerce.toDouble(a.get(0));
            double max = Coerce.toDouble(a.get(1));
            if (max < min) { double tmp = min; min = max; max = tmp; }
            double n = Coerce.toDouble(a.get(2));
            if (!Double.isFinite(n) || n > MAX_RANDS) return UndefVal.INSTANCE;
            int count = Math.max(0, (int) n);
            Random rng = a.size() == 4
                    ? ctx.random.seeded((long) Coerce.toDouble(a.get(3)))
                    : ctx.random.unseeded();
            List<Value> out = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                out.add(new NumVal(min == max ? min : RandomSource.uniform(rng, min, max)));
            }
            return new VecVal(out);
        });

        // ----------------- Trigonometry (degrees) -----------------
        r.register("sin", (ctx,a)-> unary(a, StandardFunctions::sinDegrees));
        r.register("cos", (ctx,a)-> unary(a, StandardFunctions::cosDegrees));
        r.register("tan", (ctx,a)-> unary(a, x -> Math.tan(Math.toRadians(x))));
        r.register("asin", (ctx,a)-> unary(a, x -> Math.toDegrees(Math.asin(x))));
        r.register("acos", (ctx,a)-> unary(a, x -> Math.toDegrees(Math.acos(x))));
        r.register("atan", (ctx,a)-> unary(a, x -> Math.toDegrees(Math.atan(x))));
        r.register("atan2", (ctx,a)-> binary(a, (y, x) -> Math.toDegrees(Math.atan2(y, x))));

        // ----------------- Strings & vectors -----------------
        r.register("len", (ctx,a)->{
            if (a.size() != 1) return UndefVal.INSTANCE;
            Value v = a.get(0);
            if (Coerce.isVector(v)) return NumVal.ofInt(((VecVal) v).size());
            if (Coerce.isString(v)) return NumVal.ofInt(((StrVal) v).length());
            return UndefVal.INSTANCE;
        });
        r.register("str", (ctx,a)->{
            StringBuilder sb = new StringBuilder();
            for (Value v : a) sb.append(Coerce.toString(v));
            return new StrVal(sb.toString());
        });
        r.register("concat", (ctx,a)->{
            List<Value> out = new ArrayList<>();
            for (Value v : a) {
                if (Coerce.isVector(v)) out.addAll(((VecVal) v).v);
                else out.add(v);
            }
            return new VecVal(out);
        });
        r.register("norm", (ctx,a)->{
            if (a.size() != 1 || !Coerce.isVector(a.get(0))) return UndefVal.INSTANCE;
            double sum = 0;
            for (Value v : Coerce.toVector(a.get(0))) {
                if (!Coerce.isNumber(v)) {
                    ctx.warnings.warn("Incorrect arguments to norm()");
                    return UndefVal.INSTANCE;
                }
                double x = Coerce.toDouble(v);
                sum += x * x;
            }
            return new NumVal(Math.sqrt(sum));
        });
        r.register("cross", StandardFunctions::cross);

        // ----------------- Version -----------------
        r.register("version", (ctx,a)-> version());
        r.register("version_num", (ctx,a)->{
            if (a.size() > 1) return UndefVal.INSTANCE;
            Value val = a.isEmpty() ? version() : a.get(0);
            double[] ymd = Coerce.getVec3(val);
            if (ymd == null) {
                double[] ym = Coerce.getVec2(val);
                if (ym == null) return UndefVal.INSTANCE;
                ymd = new double[] { ym[0], ym[1], 0 };
            }
            return new NumVal(ymd[0] * 10000 + ymd[1] * 100 + ymd[2]);
        });
    }

    // ---------- helpers ----------
    static Value unary(List<Value> a, DoubleUnaryOperator op){
        if (a.size() != 1 || !Coerce.isNumber(a.get(0))) return UndefVal.INSTANCE;
        return new NumVal(op.applyAsDouble(Coerce.toDouble(a.get(0))));
    }

    static Value binary(List<Value> a, DoubleBinaryOperator op){
        if (a.size() != 2 || !Coerce.isNumber(a.get(0)) || !Coerce.isNumber(a.get(1))) return UndefVal.INSTANCE;
        return new NumVal(op.applyAsDouble(Coerce.toDouble(a.get(0)), Coerce.toDouble(a.get(1))));
    }

    /**
     * min/max. A single non-empty vector argument yields its extreme element;
     * otherwise every argument must be a number.
     */
    static Value extreme(List<Value> a, boolean max){
        if (a.isEmpty()) return UndefVal.INSTANCE;
        Value first = a.get(0);
        if (a.size() == 1 && Coerce.isVector(first) && ((VecVal) first).size() > 0) {
            List<Value> items = Coerce.toVector(first);
            Value best = items.get(0);
            for (int i = 1; i < items.size(); i++) {
                Value v = items.get(i);
                if (max ? Coerce.greater(v, best) : Coerce.less(v, best)) best = v;
            }
            return best;
        }
        if (!Coerce.isNumber(first)) return UndefVal.INSTANCE;
        double best = Coerce.toDouble(first);
        for (int i = 1; i < a.size(); i++) {
            if (!Coerce.isNumber(a.get(i))) return UndefVal.INSTANCE;
            double x = Coerce.toDouble(a.get(i));
            if (max ? x > best : x < best) best = x;
        }
        return new NumVal(best);
    }

    /** C-style round(): halves go away from zero. */
    static double roundHalfAway(double x){
        double r = Math.floor(Math.abs(x));
        if (Math.abs(x) - r >= 0.5) r += 1.0;
        return Math.copySign(r, x);
    }

    /** Reduces an angle in degrees into [0, 360), or NaN when it is too large to reduce. */
    private static double reduceDegrees(double x){
        if (x < 360.0 && x >= 0.0) return x;
        if (x < TRIG_HUGE_VAL && x > -TRIG_HUGE_VAL) return x - 360.0 * Math.floor(x / 360.0);
        return Double.NaN;
    }

    // Exact at multiples of 30 and 45 degrees, where Math.sin(toRadians(x)) is not.
    static double sinDegrees(double deg){
        double x = reduceDegrees(deg);
        if (Double.isNaN(x)) return Double.NaN;
        boolean oppose = x >= 180.0;
        if (oppose) x -= 180.0;
        if (x > 90.0) x = 180.0 - x;
        if (x < 45.0) {
            x = x == 30.0 ? 0.5 : Math.sin(Math.toRadians(x));
        } else if (x == 45.0) {
            x = Math.sqrt(0.5);
        } else {
            x = Math.cos(Math.toRadians(90.0 - x));
        }
        return oppose ? -x : x;
    }

    static double cosDegrees(double deg){
        double x = reduceDegrees(deg);
        if (Double.isNaN(x)) return Double.NaN;
        boolean oppose = x >= 180.0;
        if (oppose) x -= 180.0;
        if (x > 90.0) {
            x = 180.0 - x;
            oppose = !oppose;
        }
        if (x > 45.0) {
            x = x == 60.0 ? 0.5 : Math.sin(Math.toRadians(90.0 - x));
        } else if (x == 45.0) {
            x = Math.sqrt(0.5);
        } else {
            x = Math.cos(Math.toRadians(x));
        }
        return oppose ? -x : x;
    }

    static Value cross(Context ctx, List<Value> a){
        if (a.size() != 2) {
            ctx.warnings.warn("Invalid number of parameters for cross()");
            return UndefVal.INSTANCE;
        }
        if (!Coerce.isVector(a.get(0)) || !Coerce.isVector(a.get(1))) {
            ctx.warnings.warn("Invalid type of parameters for cross()");
            return UndefVal.INSTANCE;
        }
        List<Value> v0 = Coerce.toVector(a.get(0)), v1 = Coerce.toVector(a.get(1));
        if (v0.size() != 3 || v1.size() != 3) {
            ctx.warnings.warn("Invalid vector size of parameter for cross()");
            return UndefVal.INSTANCE;
        }
        double[] p = new double[3], q = new double[3];
        for (int i = 0; i < 3; i++) {
            if (!Coerce.isNumber(v0.get(i)) || !Coerce.isNumber(v1.get(i))) {
                ctx.warnings.warn("Invalid value in parameter vector for cross()");
                return UndefVal.INSTANCE;
            }
            p[i] = Coerce.toDouble(v0.get(i));
            q[i] = Coerce.toDouble(v1.get(i));
            if (Double.isNaN(p[i]) || Double.isNaN(q[i])) {
                ctx.warnings.warn("Invalid value (NaN) in parameter vector for cross()");
                return UndefVal.INSTANCE;
            }
            if (Double.isInfinite(p[i]) || Double.isInfinite(q[i])) {
                ctx.warnings.warn("Invalid value (INF) in parameter vector for cross()");
                return UndefVal.INSTANCE;
            }
        }
        return VecVal.ofNumbers(
                p[1] * q[2] - p[2] * q[1],
                p[2] * q[0] - p[0] * q[2],
                p[0] * q[1] - p[1] * q[0]);
    }

    // ----------------- Version -----------------
    private static VecVal cachedVersion;

    static synchronized VecVal version(){
        if (cachedVersion == null) cachedVersion = loadVersion();
        return cachedVersion;
    }

    private static VecVal loadVersion(){
        Properties p = new Properties();
        try (InputStream in = StandardFunctions.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) throw new EvalException("DOMAIN_ERROR: missing " + VERSION_RESOURCE);
            p.load(in);
        } catch (IOException e) {
            throw new EvalException("PARSE_ERROR: cannot read " + VERSION_RESOURCE, e);
        }
        List<Value> parts = new ArrayList<>();
        parts.add(NumVal.ofInt(parseIntProp(p, "version.year", true)));
        parts.add(NumVal.ofInt(parseIntProp(p, "version.month", true)));
        if (p.getProperty("version.day") != null) parts.add(NumVal.ofInt(parseIntProp(p, "version.day", false)));
        return new VecVal(parts);
    }

    private static int parseIntProp(Properties p, String key, boolean required){
        String v = p.getProperty(key);
        if (v == null) {
            if (required) throw new EvalException("DOMAIN_ERROR: missing config key '" + key + "'");
            return 0;
        }
        try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e){ throw new EvalException("DOMAIN_ERROR: bad integer for '" + key + "'"); }
    }
}
