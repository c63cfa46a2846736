package org.example.builtins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class LinearLookupTest {

    private static Value lookup(double x, String tableJson) {
        return LinearLookup.lookup(new NumVal(x), ValueJson.parse(tableJson));
    }

    private static double lookupNumber(double x, String tableJson) {
        Value v = lookup(x, tableJson);
        assertThat(v.type()).isEqualTo(Value.Type.NUMBER);
        return Coerce.toDouble(v);
    }

    // ==================== Interpolation ====================

    @Test
    void testInterpolatesBetweenNeighbours() {
        assertThat(lookupNumber(5, "[[0,0],[10,100]]")).isEqualTo(50.0);
        assertThat(lookupNumber(2.5, "[[0,0],[10,100]]")).isEqualTo(25.0);
    }

    @Test
    void testTableOrderDoesNotMatter() {
        String table = "[[10,100],[0,0],[20,400]]";
        assertThat(lookupNumber(5, table)).isEqualTo(50.0);
        assertThat(lookupNumber(15, table)).isEqualTo(250.0);
    }

    @Test
    void testExactKeyReturnsItsValue() {
        String table = "[[10,100],[0,0],[20,400],[-5,-7]]";
        assertThat(lookupNumber(10, table)).isEqualTo(100.0);
        assertThat(lookupNumber(0, table)).isEqualTo(0.0);
        assertThat(lookupNumber(20, table)).isEqualTo(400.0);
        assertThat(lookupNumber(-5, table)).isEqualTo(-7.0);
    }

    @Test
    void testBelowAllKeysClampsToClosestAbove() {
        // key 0 is the nearest bracket, its y is not the smallest y in the table
        assertThat(lookupNumber(-3, "[[10,5],[0,7],[20,1]]")).isEqualTo(7.0);
        assertThat(lookupNumber(-3, "[[0,7],[10,5],[20,1]]")).isEqualTo(7.0);
    }

    @Test
    void testAboveAllKeysClampsToClosestBelow() {
        assertThat(lookupNumber(25, "[[10,5],[0,7],[20,1]]")).isEqualTo(1.0);
        assertThat(lookupNumber(1e9, "[[20,1],[10,5],[0,7]]")).isEqualTo(1.0);
    }

    @Test
    void testResultIndependentOfRowOrder() {
        List<double[]> points = new ArrayList<>();
        points.add(new double[] { -4, 3 });
        points.add(new double[] { 0, -1 });
        points.add(new double[] { 2.5, 8 });
        points.add(new double[] { 7, 8.5 });
        points.add(new double[] { 11, -2 });

        String sorted = toTable(points);
        Random rnd = new Random(7);
        for (int round = 0; round < 20; round++) {
            Collections.shuffle(points, rnd);
            String shuffled = toTable(points);
            for (double x = -6; x <= 13; x += 0.25) {
                assertThat(lookup(x, shuffled)).as("x=%s in %s", x, shuffled).isEqualTo(lookup(x, sorted));
            }
        }
    }

    @Test
    void testInterpolatedValueStaysBetweenBracketValues() {
        String table = "[[7,8.5],[-4,3],[11,-2],[0,-1],[2.5,8]]";
        double[][] brackets = { { -4, 3, 0, -1 }, { 0, -1, 2.5, 8 }, { 2.5, 8, 7, 8.5 }, { 7, 8.5, 11, -2 } };
        for (double[] b : brackets) {
            double lo = Math.min(b[1], b[3]), hi = Math.max(b[1], b[3]);
            for (int step = 1; step < 10; step++) {
                double x = b[0] + (b[2] - b[0]) * step / 10.0;
                assertThat(lookupNumber(x, table)).as("x=%s", x).isBetween(lo, hi);
            }
        }
    }

    @Test
    void testBlendWeightsFollowDistance() {
        assertThat(lookupNumber(1, "[[0,10],[4,30]]")).isCloseTo(15.0, within(1e-12));
    }

    // ==================== Malformed tables ====================

    @Test
    void testSinglePairIsUndefined() {
        assertThat(lookup(1, "[[0,5]]")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "[]")).isEqualTo(UndefVal.INSTANCE);
    }

    @Test
    void testNonNumericPairIsUndefined() {
        assertThat(lookup(1, "[[0,\"a\"],[2,4]]")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "[[0,0],[2,\"b\"]]")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "[[0,0],[2,4,6]]")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "[[0],[2,4]]")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "[0,[2,4]]")).isEqualTo(UndefVal.INSTANCE);
    }

    @Test
    void testTableMustBeVector() {
        assertThat(lookup(1, "\"table\"")).isEqualTo(UndefVal.INSTANCE);
        assertThat(lookup(1, "null")).isEqualTo(UndefVal.INSTANCE);
    }

    @Test
    void testKeyMustBeNumber() {
        Value table = ValueJson.parse("[[0,0],[10,100]]");
        assertThat(LinearLookup.lookup(new StrVal("5"), table)).isEqualTo(UndefVal.INSTANCE);
        assertThat(LinearLookup.lookup(UndefVal.INSTANCE, table)).isEqualTo(UndefVal.INSTANCE);
    }

    @Test
    void testArityThroughRegistry() {
        FunctionRegistry registry = new FunctionRegistry();
        StandardFunctions.registerAll(registry);
        Context ctx = new Context(new CollectingWarningSink(), new RandomSource(1L));
        Value table = ValueJson.parse("[[0,0],[10,100]]");

        assertThat(registry.call(ctx, "lookup", List.of(new NumVal(5), table))).isEqualTo(new NumVal(50));
        assertThat(registry.call(ctx, "lookup", List.of(new NumVal(5)))).isEqualTo(UndefVal.INSTANCE);
        assertThat(registry.call(ctx, "lookup", List.of(new NumVal(5), table, table))).isEqualTo(UndefVal.INSTANCE);
    }

    private static String toTable(List<double[]> points) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < points.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append('[').append(points.get(i)[0]).append(',').append(points.get(i)[1]).append(']');
        }
        return sb.append(']').toString();
    }
}
