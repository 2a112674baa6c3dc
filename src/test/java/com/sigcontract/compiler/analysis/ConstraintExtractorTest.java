package com.sigcontract.compiler.analysis;

import com.sigcontract.compiler.exception.UnresolvedBoundException;
import com.sigcontract.compiler.exception.UnsupportedTypeException;
import com.sigcontract.compiler.model.*;
import com.sigcontract.compiler.parser.SignatureParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConstraintExtractorTest {

    private final SignatureParser parser = new SignatureParser();
    private final ConstraintExtractor extractor = new ConstraintExtractor();

    private ConstraintModel extract(String text) {
        return extractor.extract(parser.parse(text));
    }

    // ==================== Sequences and witnesses ====================

    @Test
    void takeBindsTheImplicitSymbolFromTheSequence() {
        ConstraintModel model = extract("take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)");

        assertThat(model.getConstraints()).extracting(Constraint::getId)
                .containsExactly("take.c1", "take.c2", "take.c3");
        assertThat(model.getConstraints()).extracting(Constraint::describe)
                .containsExactly("Nonnegative(n)", "LengthAtLeast(xs, n)", "LengthEquals(result, n)");

        assertThat(model.getBindings()).containsKey("m");
        SymbolBinding m = model.getBindings().get("m");
        assertThat(m.kind()).isEqualTo(SymbolBinding.Kind.LENGTH_WITNESS);
        assertThat(m.value().render()).isEqualTo("len(xs) - n");
    }

    @Test
    void returnConstraintsHaveReturnOrigin() {
        ConstraintModel model = extract("take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)");

        Constraint onResult = model.get("take.c3");
        assertThat(onResult.getOrigin()).isEqualTo(Constraint.Origin.RETURN);
        assertThat(onResult.getScope()).isEqualTo(Constraint.Scope.RETURN);
        assertThat(model.get("take.c1").getOrigin()).isEqualTo(Constraint.Origin.PARAMETER);
    }

    @Test
    void indexBoundResolvesToTheSequenceLength() {
        ConstraintModel model = extract("index(i: Fin(n), xs: SizedSequence(T, n)) -> T");

        assertThat(model.getConstraints()).hasSize(1);
        Constraint bound = model.get("index.c1");
        assertThat(bound.getKind()).isEqualTo(ConstraintKind.INDEX_BOUND);
        assertThat(bound.getResolved().render()).isEqualTo("len(xs)");
        assertThat(bound.restate()).isEqualTo("index must satisfy 0 ≤ i < n");
    }

    @Test
    void sequencesSharingALengthMergeIntoOneCrossParameterConstraint() {
        ConstraintModel model = extract("zip(xs: SizedSequence(Int, n), ys: SizedSequence(Int, n), n: Nat) -> Int");

        List<Constraint> lengths = model.ofKind(ConstraintKind.LENGTH_EQUALS);
        assertThat(lengths).hasSize(1);
        Constraint merged = lengths.get(0);
        assertThat(merged.getSubjects()).extracting(Subject::path).containsExactly("xs", "ys");
        assertThat(merged.getScope()).isEqualTo(Constraint.Scope.CROSS_PARAMETER);
        assertThat(model.ofKind(ConstraintKind.NONNEGATIVE)).extracting(Constraint::describe)
                .containsExactly("Nonnegative(n)");
    }

    @Test
    void implicitSharedLengthKeepsTheRelation() {
        ConstraintModel model = extract("zip(xs: SizedSequence(Int, n), ys: SizedSequence(Int, n)) -> Int");

        assertThat(model.getConstraints()).hasSize(1);
        assertThat(model.get("zip.c1").getSubjects()).extracting(Subject::path).containsExactly("xs", "ys");
    }

    @Test
    void lengthOfAFreshSequenceStatesNothing() {
        ConstraintModel model = extract("sum(xs: SizedSequence(Int, n)) -> Int");

        assertThat(model.isUnconstrained()).isTrue();
    }

    @Test
    void existentialResultLengthIsDropped() {
        ConstraintModel model = extract("filter(xs: SizedSequence(Int, n)) -> SizedSequence(Int, k)");

        assertThat(model.getConstraints()).isEmpty();
    }

    @Test
    void existentialLengthWithPositiveFloorBecomesLowerBound() {
        ConstraintModel model = extract("pad(xs: SizedSequence(Int, n)) -> SizedSequence(Int, k + 1)");

        assertThat(model.getConstraints()).extracting(Constraint::describe)
                .containsExactly("LengthAtLeast(result, 1)");
    }

    @Test
    void elementTypesAreConstrainedUnderTheSequence() {
        ConstraintModel model = extract("counts(xs: SizedSequence(Nat, 3)) -> Int");

        assertThat(model.getConstraints()).extracting(Constraint::describe)
                .containsExactly("LengthEquals(xs, 3)", "Nonnegative(xs[*])");
    }

    // ==================== Optionals and records ====================

    @Test
    void optionalYieldsDisjointWithNestedChildren() {
        ConstraintModel model = extract("lookup(i: Maybe(Fin(n)), xs: SizedSequence(Int, n)) -> Int");

        Constraint disjoint = model.ofKind(ConstraintKind.DISJOINT).get(0);
        List<Constraint> children = model.children(disjoint.getId());
        assertThat(children).hasSize(1);
        assertThat(children.get(0).getKind()).isEqualTo(ConstraintKind.INDEX_BOUND);
        assertThat(children.get(0).getParentId()).isEqualTo(disjoint.getId());
        assertThat(children.get(0).getSubject().path()).isEqualTo("i?");
    }

    @Test
    void optionalInsideSequenceElementsIsUnsupported() {
        assertThatThrownBy(() -> extract("flags(xs: SizedSequence(Maybe(Nat), 3)) -> Int"))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    void recordFieldsBecomeInvariantsOfTheRecord() {
        ConstraintModel model = extract("area(r: Record { w: Nat, h: Nat }) -> Nat");

        assertThat(model.getConstraints()).extracting(Constraint::describe)
                .containsExactly("Nonnegative(r.w)", "Nonnegative(r.h)", "Nonnegative(result)");
        Constraint width = model.get("area.c1");
        assertThat(width.getOrigin()).isEqualTo(Constraint.Origin.RECORD_INVARIANT);
        assertThat(width.getRecordName()).isEqualTo("RRecord");
        assertThat(width.getRecordSubject().path()).isEqualTo("r");
    }

    @Test
    void laterRecordFieldsMayReferToEarlierOnes() {
        ConstraintModel model = extract("rows(m: Record Matrix { n: Nat, cells: SizedSequence(Int, n) }) -> Int");

        Constraint cells = model.ofKind(ConstraintKind.LENGTH_EQUALS).get(0);
        assertThat(cells.getSubject().path()).isEqualTo("m.cells");
        assertThat(cells.getResolved().render()).isEqualTo("m.n");
        assertThat(cells.getRecordName()).isEqualTo("Matrix");
    }

    @Test
    void refinementPredicateMentionsTheSubject() {
        ConstraintModel model = extract("positive(x: {v: Int | v > 0}) -> Int");

        Constraint predicate = model.get("positive.c1");
        assertThat(predicate.getKind()).isEqualTo(ConstraintKind.PREDICATE_HOLDS);
        assertThat(predicate.restate()).isEqualTo("x must satisfy x > 0");
    }

    // ==================== Failures and determinism ====================

    @Test
    void freeSymbolUnderSubtractionIsUnresolved() {
        assertThatThrownBy(() -> extract("drop(xs: SizedSequence(Int, 5 - k)) -> Int"))
                .isInstanceOf(UnresolvedBoundException.class)
                .satisfies(e -> {
                    UnresolvedBoundException unresolved = (UnresolvedBoundException) e;
                    assertThat(unresolved.getSymbol()).isEqualTo("k");
                    assertThat(unresolved.category()).isEqualTo("unresolved-bound");
                });
    }

    @Test
    void unknownBoundSymbolIsUnresolved() {
        assertThatThrownBy(() -> extract("at(i: Fin(q)) -> Int"))
                .isInstanceOf(UnresolvedBoundException.class);
    }

    @Test
    void extractionIsDeterministic() {
        String text = "lookup(i: Maybe(Fin(n)), xs: SizedSequence(Nat, n), r: Record { a: Nat }) -> SizedSequence(Int, n)";

        assertThat(extract(text)).isEqualTo(extract(text));
    }
}
