package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.analysis.ConstraintExtractor;
import com.sigcontract.compiler.exception.ContractViolationException;
import com.sigcontract.compiler.parser.SignatureParser;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for guarded functions: a contract accepts exactly the
 * inputs its signature admits.
 */
class GuardedFunctionPropertyTest {

    private static ContractCode contract(String text) {
        return new ContractSynthesizer().synthesize(
                new ConstraintExtractor().extract(new SignatureParser().parse(text)), EmissionProfile.defaults());
    }

    private static final ContractEvaluator NAT = new ContractEvaluator(contract("pred(n: Nat) -> Int"));
    private static final ContractEvaluator INDEX =
            new ContractEvaluator(contract("index(i: Fin(n), xs: SizedSequence(Int, n)) -> Int"));
    private static final ContractEvaluator TAKE =
            new ContractEvaluator(contract("take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)"));

    // ==================== Preconditions ====================

    @Property(tries = 200)
    void naturalNumbersAcceptExactlyTheNonnegative(@ForAll @IntRange(min = -1000, max = 1000) int n) {
        Map<String, Object> arguments = Map.of("n", n);

        if (n >= 0) {
            assertThat(NAT.violatedConstraints(arguments)).isEmpty();
        } else {
            assertThatThrownBy(() -> NAT.checkPreconditions(arguments))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("[pred.c1 Nonnegative]");
        }
    }

    @Property(tries = 200)
    void boundedIndexAcceptsZeroUpToLengthExclusive(@ForAll @IntRange(min = -5, max = 25) int i,
                                                    @ForAll @Size(max = 20) List<Integer> xs) {
        Map<String, Object> arguments = Map.of("i", i, "xs", xs);
        boolean inside = 0 <= i && i < xs.size();

        assertThat(INDEX.violatedConstraints(arguments).isEmpty()).isEqualTo(inside);
    }

    @Property(tries = 100)
    void offByOneAtTheUpperBoundIsRejected(@ForAll @Size(max = 20) List<Integer> xs) {
        assertThat(INDEX.violatedConstraints(Map.of("i", xs.size(), "xs", xs))).containsExactly("index.c1");
        if (!xs.isEmpty()) {
            assertThat(INDEX.violatedConstraints(Map.of("i", xs.size() - 1, "xs", xs))).isEmpty();
        }
    }

    @Property(tries = 200)
    void takeAcceptsCountsUpToTheLength(@ForAll @IntRange(min = -3, max = 15) int n,
                                        @ForAll @Size(max = 12) List<Integer> xs) {
        Set<String> violated = TAKE.violatedConstraints(Map.of("n", n, "xs", xs));

        if (n < 0) {
            assertThat(violated).contains("take.c1");
        } else if (n > xs.size()) {
            assertThat(violated).containsExactly("take.c2");
        } else {
            assertThat(violated).isEmpty();
        }
    }

    // ==================== Postconditions ====================

    @Property(tries = 100)
    void concatenationSatisfiesTheAppendPostcondition(@ForAll @Size(max = 10) List<Integer> xs,
                                                      @ForAll @Size(max = 10) List<Integer> ys) {
        GuardedFunction append = new GuardedFunction(
                contract("append(xs: SizedSequence(Int, n), ys: SizedSequence(Int, m)) -> SizedSequence(Int, n + m)"),
                arguments -> {
                    List<Object> out = new ArrayList<>((List<?>) arguments.get("xs"));
                    out.addAll((List<?>) arguments.get("ys"));
                    return out;
                });

        Object result = append.apply(Map.of("xs", xs, "ys", ys));

        assertThat((List<?>) result).hasSize(xs.size() + ys.size());
    }

    @Property(tries = 100)
    void droppingAnElementBreaksTheAppendPostcondition(@ForAll @Size(max = 10) List<Integer> xs,
                                                       @ForAll @Size(min = 1, max = 10) List<Integer> ys) {
        GuardedFunction lossy = new GuardedFunction(
                contract("append(xs: SizedSequence(Int, n), ys: SizedSequence(Int, m)) -> SizedSequence(Int, n + m)"),
                arguments -> {
                    List<Object> out = new ArrayList<>((List<?>) arguments.get("xs"));
                    List<?> tail = (List<?>) arguments.get("ys");
                    out.addAll(tail.subList(1, tail.size()));
                    return out;
                });

        assertThatThrownBy(() -> lossy.apply(Map.of("xs", xs, "ys", ys)))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("postcondition violated [append.c1 LengthEquals]: length of result must equal n + m");
    }
}
