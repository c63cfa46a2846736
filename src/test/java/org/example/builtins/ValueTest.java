package org.example.builtins;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ValueTest {

    // ==================== Equality ====================

    @Test
    void testEqualityRequiresSameVariant() {
        assertThat(new NumVal(1)).isEqualTo(new NumVal(1.0));
        assertThat(new NumVal(1)).isNotEqualTo(new StrVal("1"));
        assertThat(new StrVal("1")).isNotEqualTo(VecVal.of(new StrVal("1")));
        assertThat(UndefVal.INSTANCE).isNotEqualTo(new NumVal(0));
        assertThat(VecVal.EMPTY).isNotEqualTo(new StrVal(""));
    }

    @Test
    void testNumberEqualityFollowsDoubleComparison() {
        assertThat(new NumVal(0.0)).isEqualTo(new NumVal(-0.0));
        assertThat(new NumVal(0.0).hashCode()).isEqualTo(new NumVal(-0.0).hashCode());
        assertThat(new NumVal(Double.NaN)).isNotEqualTo(new NumVal(Double.NaN));
    }

    @Test
    void testVectorsCompareElementWise() {
        Value a = ValueJson.parse("[1, [\"x\", 2], null]");
        Value b = VecVal.of(new NumVal(1), VecVal.of(new StrVal("x"), new NumVal(2)), UndefVal.INSTANCE);
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(ValueJson.parse("[1, [\"x\", 3], null]"));
        assertThat(a).isNotEqualTo(ValueJson.parse("[1, [\"x\", 2]]"));
    }

    @Test
    void testVectorIsImmutableCopy() {
        List<Value> items = new ArrayList<>(List.of(new NumVal(1)));
        VecVal vec = new VecVal(items);
        items.add(new NumVal(2));
        assertThat(vec.size()).isEqualTo(1);
    }

    // ==================== Strings ====================

    @Test
    void testStringIndexesByCodePoint() {
        StrVal s = new StrVal("a🂡Л");
        assertThat(s.value().length()).isEqualTo(4);
        assertThat(s.length()).isEqualTo(3);
        assertThat(s.codePointAt(1)).isEqualTo(0x1F0A1);
        assertThat(s.codePointAt(2)).isEqualTo('Л');
        assertThat(new StrVal(null).length()).isZero();
    }

    // ==================== Accessors ====================

    @Test
    void testAccessorsFallBackInsteadOfThrowing() {
        assertThat(Coerce.toDouble(new StrVal("5"))).isEqualTo(0.0);
        assertThat(Coerce.toVector(new NumVal(5))).isEmpty();
        assertThat(Coerce.getVec2(ValueJson.parse("[1, 2]"))).containsExactly(1.0, 2.0);
        assertThat(Coerce.getVec2(ValueJson.parse("[1, 2, 3]"))).isNull();
        assertThat(Coerce.getVec2(ValueJson.parse("[1, \"2\"]"))).isNull();
        assertThat(Coerce.getVec3(ValueJson.parse("[1, 2, 3]"))).containsExactly(1.0, 2.0, 3.0);
        assertThat(Coerce.getVec3(new StrVal("abc"))).isNull();
    }

    @Test
    void testToIndex() {
        assertThat(Coerce.toIndex(new NumVal(3.7))).isEqualTo(3);
        assertThat(Coerce.toIndex(new NumVal(0))).isZero();
        assertThat(Coerce.toIndex(new NumVal(-1))).isEqualTo(-1);
        assertThat(Coerce.toIndex(new NumVal(Double.NaN))).isEqualTo(-1);
        assertThat(Coerce.toIndex(new NumVal(Double.POSITIVE_INFINITY))).isEqualTo(-1);
        assertThat(Coerce.toIndex(new NumVal(1e12))).isEqualTo(Integer.MAX_VALUE);
        assertThat(Coerce.toIndex(new StrVal("1"))).isEqualTo(-1);
    }

    @Test
    void testOrderingOnlyForNumbers() {
        assertThat(Coerce.less(new NumVal(1), new NumVal(2))).isTrue();
        assertThat(Coerce.greater(new NumVal(1), new NumVal(2))).isFalse();
        assertThat(Coerce.less(new StrVal("a"), new StrVal("b"))).isFalse();
        assertThat(Coerce.greater(new StrVal("b"), new StrVal("a"))).isFalse();
        assertThat(Coerce.less(new NumVal(1), new StrVal("2"))).isFalse();
    }

    // ==================== Display form ====================

    @Test
    void testPrinting() {
        assertThat(ValuePrinter.print(new NumVal(3))).isEqualTo("3");
        assertThat(ValuePrinter.print(new NumVal(-0.0))).isEqualTo("0");
        assertThat(ValuePrinter.print(new NumVal(0.25))).isEqualTo("0.25");
        assertThat(ValuePrinter.print(new NumVal(100))).isEqualTo("100");
        assertThat(ValuePrinter.print(new NumVal(Double.NaN))).isEqualTo("nan");
        assertThat(ValuePrinter.print(new NumVal(Double.NEGATIVE_INFINITY))).isEqualTo("-inf");
        assertThat(ValuePrinter.print(UndefVal.INSTANCE)).isEqualTo("undef");
        assertThat(ValuePrinter.print(ValueJson.parse("[1, \"a\", [], [null, 2.5]]")))
                .isEqualTo("[1, \"a\", [], [undef, 2.5]]");
        assertThat(new StrVal("raw").toString()).isEqualTo("raw");
    }
}
