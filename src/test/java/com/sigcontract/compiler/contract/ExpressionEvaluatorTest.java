package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.model.Expr;
import com.sigcontract.compiler.model.Expr.CompareOp;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static final BigInteger TWO_TO_64 = BigInteger.TWO.pow(64);

    private static boolean holds(CompareOp op, Object left, Object right) {
        return ExpressionEvaluator.test(Expr.compare(op, Expr.var("a"), Expr.var("b")), Map.of("a", left, "b", right));
    }

    // ==================== Integers ====================

    @Test
    void integerAcceptsExactValuesOfEveryNumberType() {
        assertThat(ExpressionEvaluator.integer(7)).isEqualTo(7L);
        assertThat(ExpressionEvaluator.integer(BigInteger.valueOf(-3))).isEqualTo(-3L);
        assertThat(ExpressionEvaluator.integer(new BigDecimal("4.00"))).isEqualTo(4L);
        assertThat(ExpressionEvaluator.integer(5.0d)).isEqualTo(5L);
    }

    @Test
    void integerRejectsValuesThatWouldBeTruncated() {
        assertThatThrownBy(() -> ExpressionEvaluator.integer(TWO_TO_64)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> ExpressionEvaluator.integer(new BigDecimal("2.5"))).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> ExpressionEvaluator.integer(1e30)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> ExpressionEvaluator.integer(Double.NaN)).isInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> ExpressionEvaluator.integer("3")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arithmeticOverHugeOperandsFailsInsteadOfWrapping() {
        Expr successor = Expr.add(Expr.var("n"), Expr.lit(1));

        assertThat(ExpressionEvaluator.evaluate(successor, Map.of("n", BigInteger.valueOf(41)))).isEqualTo(42L);
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate(successor, Map.of("n", TWO_TO_64)))
                .isInstanceOf(ArithmeticException.class);
    }

    // ==================== Comparisons ====================

    @Test
    void comparesMixedNumbersExactly() {
        assertThat(holds(CompareOp.GE, TWO_TO_64, 0L)).isTrue();
        assertThat(holds(CompareOp.GT, TWO_TO_64.add(BigInteger.ONE), TWO_TO_64)).isTrue();
        assertThat(holds(CompareOp.EQ, new BigDecimal("3.0"), 3)).isTrue();
        assertThat(holds(CompareOp.LT, 2.5d, 3L)).isTrue();
        assertThat(holds(CompareOp.GT, Double.POSITIVE_INFINITY, Long.MAX_VALUE)).isTrue();
    }

    @Test
    void comparesTextAndBooleans() {
        assertThat(holds(CompareOp.LT, "apple", "banana")).isTrue();
        assertThat(holds(CompareOp.EQ, "kiwi", "kiwi")).isTrue();
        assertThat(holds(CompareOp.LT, false, true)).isTrue();
        assertThat(holds(CompareOp.NE, true, false)).isTrue();
    }

    @Test
    void unrelatedTypesAreNotComparable() {
        assertThatThrownBy(() -> holds(CompareOp.LT, "1", 1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cannot compare");
        assertThat(holds(CompareOp.EQ, Map.of("x", 1), Map.of("x", 1))).isTrue();
    }
}
