package com.sigcontract.compiler.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ExprsTest {

    private static final Expr N = Expr.var("n");
    private static final Expr M = Expr.var("m");

    @Test
    void foldsConstantArithmetic() {
        assertThat(Exprs.fold(Expr.add(Expr.lit(2), Expr.lit(3)))).isEqualTo(Expr.lit(5));
        assertThat(Exprs.fold(Expr.sub(Expr.lit(2), Expr.lit(3)))).isEqualTo(Expr.lit(-1));
        assertThat(Exprs.fold(Expr.add(N, Expr.sub(Expr.lit(1), Expr.lit(1))))).isEqualTo(N);
        assertThat(Exprs.fold(Expr.add(Expr.lit(0), M))).isEqualTo(M);
    }

    @Test
    void substitutionReplacesOnlyMappedSymbols() {
        Expr sum = Expr.add(N, M);

        Expr substituted = Exprs.substitute(sum, Map.of("m", Expr.lit(4)));

        assertThat(substituted).isEqualTo(Expr.add(N, Expr.lit(4)));
        assertThat(Exprs.freeVariables(substituted)).containsExactly("n");
    }

    @Test
    void quantifierBindersAreNotFree() {
        Expr forAll = new Expr.ForAll("x", Expr.var("xs"),
                Expr.compare(Expr.CompareOp.LE, Expr.var("x"), N));

        assertThat(Exprs.freeVariables(forAll)).containsExactly("xs", "n");
    }

    @Test
    void sumsFlattenAndRebuild() {
        Expr nested = Expr.add(Expr.add(N, M), Expr.lit(1));

        List<Expr> terms = Exprs.summands(nested);

        assertThat(terms).containsExactly(N, M, Expr.lit(1));
        assertThat(Exprs.sum(terms)).isEqualTo(nested);
        assertThat(Exprs.sum(List.of())).isEqualTo(Expr.lit(0));
    }

    @Test
    void detectsArithmeticAnywhereInTheTree() {
        assertThat(Exprs.containsArithmetic(Expr.len(Expr.var("xs")))).isFalse();
        assertThat(Exprs.containsArithmetic(Expr.compare(Expr.CompareOp.EQ, Expr.len(Expr.var("xs")), Expr.add(N, M))))
                .isTrue();
    }

    @Test
    void rendersInSurfaceSyntax() {
        assertThat(Expr.add(N, M).render()).isEqualTo("n + m");
        assertThat(Expr.len(Expr.var("xs")).render()).isEqualTo("len(xs)");
    }
}
