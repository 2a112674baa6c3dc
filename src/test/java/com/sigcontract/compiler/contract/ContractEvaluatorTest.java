package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.analysis.ConstraintExtractor;
import com.sigcontract.compiler.exception.ContractViolationException;
import com.sigcontract.compiler.exception.ContractViolationException.Phase;
import com.sigcontract.compiler.exception.UnreachableCaseException;
import com.sigcontract.compiler.parser.SignatureParser;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ContractEvaluatorTest {

    private static final String TAKE = "take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)";
    private static final String INDEX = "index(i: Fin(n), xs: SizedSequence(T, n)) -> T";

    private static ContractCode contract(String text, EmissionProfile profile) {
        return new ContractSynthesizer().synthesize(
                new ConstraintExtractor().extract(new SignatureParser().parse(text)), profile);
    }

    private static ContractEvaluator evaluator(String text) {
        return new ContractEvaluator(contract(text, EmissionProfile.defaults()));
    }

    private static Map<String, Object> args(Object... keysAndValues) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            arguments.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return arguments;
    }

    private static GuardedFunction take(EmissionProfile profile) {
        return new GuardedFunction(contract(TAKE, profile), arguments -> {
            List<?> xs = (List<?>) arguments.get("xs");
            int n = ((Number) arguments.get("n")).intValue();
            return new ArrayList<>(xs.subList(0, n));
        });
    }

    // ==================== Preconditions ====================

    @Test
    void takeRejectsCountLongerThanTheSequence() {
        GuardedFunction take = take(EmissionProfile.defaults());

        assertThatThrownBy(() -> take.apply(args("n", 6, "xs", List.of(1, 2, 3, 4, 5))))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("precondition violated [take.c2 LengthAtLeast]: length of xs must be at least n")
                .satisfies(e -> {
                    ContractViolationException violation = (ContractViolationException) e;
                    assertThat(violation.getConstraintId()).isEqualTo("take.c2");
                    assertThat(violation.getPhase()).isEqualTo(Phase.PRECONDITION);
                });
    }

    @Test
    void takeAcceptsPrefixes() {
        GuardedFunction take = take(EmissionProfile.defaults());

        assertThat(take.apply(args("n", 3, "xs", List.of(1, 2, 3, 4, 5)))).isEqualTo(List.of(1, 2, 3));
        assertThat(take.apply(args("n", 0, "xs", List.of()))).isEqualTo(List.of());
    }

    @Test
    void preconditionsFailFastInDependencyOrder() {
        ContractEvaluator evaluator = evaluator(TAKE);

        // n = -1 breaks Nonnegative only; the length check still holds
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("n", -1, "xs", List.of())))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("[take.c1 Nonnegative]");
        assertThat(evaluator.violatedConstraints(args("n", -1, "xs", List.of()))).containsExactly("take.c1");
    }

    @Test
    void indexAcceptsOnlyPositionsInsideTheSequence() {
        ContractEvaluator evaluator = evaluator(INDEX);
        List<Integer> xs = List.of(10, 20, 30, 40, 50);

        assertThatCode(() -> evaluator.checkPreconditions(args("i", 4, "xs", xs))).doesNotThrowAnyException();
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("i", 5, "xs", xs)))
                .hasMessage("precondition violated [index.c1 IndexBound]: index must satisfy 0 ≤ i < n");
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("i", -1, "xs", xs)))
                .isInstanceOf(ContractViolationException.class);
    }

    @Test
    void mergedLengthConstraintRejectsMismatchedSequences() {
        ContractEvaluator evaluator = evaluator("zip(xs: SizedSequence(Int, n), ys: SizedSequence(Int, n)) -> Int");

        assertThat(evaluator.violatedConstraints(args("xs", List.of(1, 2), "ys", List.of(3, 4)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("xs", List.of(1, 2), "ys", List.of(3)))).containsExactly("zip.c1");
    }

    @Test
    void elementConstraintsQuantifyOverTheSequence() {
        ContractEvaluator evaluator = evaluator("counts(xs: SizedSequence(Nat, 3)) -> Int");

        assertThat(evaluator.violatedConstraints(args("xs", List.of(0, 1, 2)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("xs", List.of(0, -1, 2)))).containsExactly("counts.c2");
        assertThat(evaluator.violatedConstraints(args("xs", List.of(0, 1)))).containsExactly("counts.c1");
    }

    @Test
    void refinementPredicateIsChecked() {
        ContractEvaluator evaluator = evaluator("positive(x: {v: Int | v > 0}) -> Int");

        assertThat(evaluator.violatedConstraints(args("x", 1))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("x", 0))).containsExactly("positive.c1");
    }

    @Test
    void missingArgumentIsAnError() {
        ContractEvaluator evaluator = evaluator(INDEX);

        assertThatThrownBy(() -> evaluator.checkPreconditions(args("i", 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xs");
    }

    @Test
    void wrongShapeCountsAsViolation() {
        ContractEvaluator evaluator = evaluator(INDEX);

        assertThat(evaluator.violatedConstraints(args("i", "zero", "xs", List.of(1)))).containsExactly("index.c1");
    }

    @Test
    void hugeLengthArgumentsAreRejectedRatherThanTruncated() {
        ContractEvaluator evaluator = evaluator("g(n: Nat, xs: Vect(n + 1, Int)) -> Int");

        assertThat(evaluator.violatedConstraints(args("n", BigInteger.ZERO, "xs", List.of(1)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("n", BigInteger.TWO.pow(64), "xs", List.of(1))))
                .containsExactly("g.c2");
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("n", BigInteger.TWO.pow(64), "xs", List.of(1))))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("[g.c2 LengthEquals]");
    }

    // ==================== Postconditions ====================

    @Test
    void postconditionCatchesWrongResultLength() {
        ContractEvaluator evaluator = evaluator(TAKE);

        assertThatThrownBy(() -> evaluator.checkPostconditions(args("n", 2, "xs", List.of(1, 2, 3)), List.of(1)))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("postcondition violated [take.c3 LengthEquals]: length of result must equal n")
                .satisfies(e -> assertThat(((ContractViolationException) e).getPhase()).isEqualTo(Phase.POSTCONDITION));
    }

    @Test
    void postconditionFailuresAreAggregated() {
        ContractEvaluator evaluator = evaluator("pair(n: Nat) -> Record { a: Nat, b: Nat }");
        Map<String, Object> result = new HashMap<>();
        result.put("a", -1);
        result.put("b", -2);

        assertThat(evaluator.violatedPostconditions(args("n", 1), result)).hasSize(2);
        assertThatThrownBy(() -> evaluator.checkPostconditions(args("n", 1), result))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("[pair.c2 Nonnegative]")
                .hasMessageContaining("; ")
                .hasMessageContaining("[pair.c3 Nonnegative]")
                .satisfies(e -> assertThat(((ContractViolationException) e).getConstraintId()).isEqualTo("pair.c2"));
    }

    // ==================== Records ====================

    @Test
    void recordInvariantsAreCheckedOnEntry() {
        ContractEvaluator evaluator = evaluator("area(r: Record { w: Nat, h: Nat }) -> Nat");

        assertThatCode(() -> evaluator.checkPreconditions(args("r", Map.of("w", 2, "h", 3))))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("r", Map.of("w", -2, "h", 3))))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("invariant violated [area.c1 Nonnegative]: r.w must be nonnegative (r.w ≥ 0)")
                .satisfies(e -> assertThat(((ContractViolationException) e).getPhase()).isEqualTo(Phase.INVARIANT));
    }

    @Test
    void recordInvariantsHoldForEveryElement() {
        ContractEvaluator evaluator = evaluator("total(ps: SizedSequence(Record Point { x: Nat }, 2)) -> Int");

        assertThat(evaluator.violatedConstraints(args("ps", List.of(Map.of("x", 1), Map.of("x", 2))))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("ps", List.of(Map.of("x", 1), Map.of("x", -2)))))
                .containsExactly("total.c2");
    }

    @Test
    void recordInvariantRejectsMismatchedFieldLength() {
        ContractEvaluator evaluator = evaluator("rows(m: Record Matrix { n: Nat, cells: SizedSequence(Int, n) }) -> Int");

        assertThat(evaluator.violatedConstraints(args("m", Map.of("n", 2, "cells", List.of(1, 2))))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("m", Map.of("n", 3, "cells", List.of(1, 2))))).hasSize(1);
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("m", Map.of("n", 3, "cells", List.of(1, 2)))))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageStartingWith("invariant violated [rows.")
                .hasMessageContaining("LengthEquals]");
    }

    @Test
    void recordInvariantsReadingParametersRunAfterTheirGuards() {
        ContractEvaluator evaluator = evaluator("f(n: Nat, r: Record P { xs: Vect(n, Int) }) -> Int");

        assertThatThrownBy(() -> evaluator.checkPreconditions(args("n", -1, "r", Map.of("xs", List.of()))))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("[f.c1 Nonnegative]")
                .satisfies(e -> assertThat(((ContractViolationException) e).getPhase()).isEqualTo(Phase.PRECONDITION));
        assertThatThrownBy(() -> evaluator.checkPreconditions(args("n", 2, "r", Map.of("xs", List.of(1)))))
                .isInstanceOf(ContractViolationException.class)
                .satisfies(e -> assertThat(((ContractViolationException) e).getPhase()).isEqualTo(Phase.INVARIANT));
        assertThat(evaluator.violatedConstraints(args("n", -1, "r", Map.of("xs", List.of())))).first().isEqualTo("f.c1");
    }

    // ==================== Optionals ====================

    @Test
    void absentOptionalSkipsNestedChecks() {
        ContractEvaluator evaluator = evaluator("lookup(i: Maybe(Fin(n)), xs: SizedSequence(Int, n)) -> Int");

        assertThat(evaluator.violatedConstraints(args("i", null, "xs", List.of(1)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("i", Optional.empty(), "xs", List.of(1)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("i", 0, "xs", List.of(1)))).isEmpty();
        assertThat(evaluator.violatedConstraints(args("i", Optional.of(1), "xs", List.of(1)))).containsExactly("lookup.c2");
    }

    @Test
    void taggedOptionalWithoutTagIsUnreachable() {
        ContractEvaluator evaluator = new ContractEvaluator(contract(
                "lookup(i: Maybe(Fin(n)), xs: SizedSequence(Int, n)) -> Int",
                EmissionProfile.defaults().withOptionalRepresentation(EmissionProfile.OptionalRepresentation.TAGGED)));

        assertThatThrownBy(() -> evaluator.checkPreconditions(args("i", 0, "xs", List.of(1))))
                .isInstanceOf(UnreachableCaseException.class)
                .satisfies(e -> assertThat(((UnreachableCaseException) e).getConstraintId()).isEqualTo("lookup.c1"));
    }

    // ==================== Assertion styles ====================

    @Test
    void returnResultStyleReportsViolationsAsValues() {
        GuardedFunction take = take(EmissionProfile.defaults()
                .withAssertionStyle(EmissionProfile.AssertionStyle.RETURN_RESULT));

        Object rejected = take.invoke(args("n", 6, "xs", List.of(1, 2)));
        assertThat(rejected).isInstanceOf(ContractResult.class);
        ContractResult result = (ContractResult) rejected;
        assertThat(result.isViolation()).isTrue();
        assertThat(result.constraintId()).isEqualTo("take.c2");
        assertThatThrownBy(result::orThrow).isInstanceOf(ContractViolationException.class);

        ContractResult accepted = (ContractResult) take.invoke(args("n", 1, "xs", List.of(1, 2)));
        assertThat(accepted.success()).isTrue();
        assertThat(accepted.value()).isEqualTo(List.of(1));
    }

    @Test
    void exceptionStyleReturnsThePlainValue() {
        GuardedFunction take = take(EmissionProfile.defaults());

        assertThat(take.invoke(args("n", 1, "xs", List.of(7, 8)))).isEqualTo(List.of(7));
    }
}
