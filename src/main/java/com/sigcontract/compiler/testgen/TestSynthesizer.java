package com.sigcontract.compiler.testgen;

import com.sigcontract.compiler.contract.Check;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.ContractEvaluator;
import com.sigcontract.compiler.contract.ContractSynthesizer;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.contract.ExpressionEvaluator;
import com.sigcontract.compiler.exception.UnsatisfiableConstraintsException;
import com.sigcontract.compiler.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds a {@link TestPlan} from a {@link ConstraintModel}.
 *
 * For every input constraint the plan holds a case violating exactly that
 * constraint (or, when the constraint cannot be broken alone, one the entry
 * check rejects for it first), a case at its extremal satisfying value and, for length, index
 * and arithmetic constraints, a property-based case. Disjoint constraints get
 * one case per branch instead. Result constraints get a boundary case over
 * the inputs that drive them and a property case. One happy-path case covers
 * the whole signature. Whatever cannot be produced is listed as uncovered.
 *
 * Inputs are found by searching the {@link InputSpace} and judged by the
 * synthesized contract itself, so a case violates exactly the constraints
 * the contract would reject it for.
 */
public class TestSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(TestSynthesizer.class);

    private final ContractSynthesizer contractSynthesizer = new ContractSynthesizer();
    private final TestSynthesisOptions options;

    public TestSynthesizer() {
        this(TestSynthesisOptions.defaults());
    }

    public TestSynthesizer(TestSynthesisOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public TestSynthesisOptions getOptions() {
        return options;
    }

    public TestPlan synthesize(ConstraintModel model) {
        return synthesize(model, null);
    }

    /**
     * @param reference when given, accepted cases record its output and
     *                  differential cases are drawn from each property case
     * @throws UnsatisfiableConstraintsException if no input satisfies every constraint
     */
    public TestPlan synthesize(ConstraintModel model, ReferenceImplementation reference) {
        Run run = new Run(model);
        TestPlan plan = run.plan(reference);
        logger.info("Synthesized {} test cases for {} ({} uncovered)",
                plan.getCases().size(), model.getFunctionName(), plan.getUncovered().size());
        return plan;
    }

    private final class Run {
        private final ConstraintModel model;
        private final ContractEvaluator evaluator;
        private final Map<String, Check.Guard> guards = new HashMap<>();
        private final InputSpace space;
        private final CandidateSearch search;
        private final List<TestCase> cases = new ArrayList<>();
        private final List<TestPlan.Uncovered> uncovered = new ArrayList<>();

        Run(ConstraintModel model) {
            this.model = model;
            ContractCode code = contractSynthesizer.synthesize(model, EmissionProfile.defaults());
            this.evaluator = new ContractEvaluator(code);
            code.getPreconditions().forEach(this::indexGuards);
            code.getPostconditions().forEach(this::indexGuards);
            code.getInvariants().forEach(inv -> inv.checks().forEach(this::indexGuards));
            this.space = new InputSpace(model.getSignature());
            this.search = new CandidateSearch(space, options);
        }

        private void indexGuards(Check check) {
            if (check instanceof Check.Guard guard) {
                guards.put(guard.constraintId(), guard);
            } else if (check instanceof Check.Branch branch) {
                branch.cases().forEach(c -> c.checks().forEach(this::indexGuards));
            }
        }

        TestPlan plan(ReferenceImplementation reference) {
            List<InputSpace.Dimension> dimensions = space.dimensions();
            CandidateSearch.Candidate happy = search.find(dimensions, CandidateSearch.Ladder.TYPICAL, this::valid)
                    .orElseThrow(() -> new UnsatisfiableConstraintsException(model.getFunctionName(), search.examined()));
            add(TestCaseKind.HAPPY_PATH, null, happy.inputs(), null, ExpectedOutcome.accept(), List.of());

            for (Constraint constraint : model.getConstraints()) {
                if (isResultSide(constraint)) {
                    resultCases(constraint, dimensions);
                } else if (constraint.getKind() == ConstraintKind.DISJOINT) {
                    branchCases(constraint, dimensions);
                } else {
                    violationCase(constraint, dimensions);
                    boundaryCase(constraint, dimensions);
                    if (wantsProperty(constraint)) {
                        propertyCase(constraint, GeneratorSpec.Property.INPUT_ACCEPTANCE);
                    }
                }
            }

            List<TestCase> finished = cases;
            if (reference != null) {
                finished = withReference(reference);
            }
            return new TestPlan(model.getFunctionName(), finished, uncovered);
        }

        private boolean isResultSide(Constraint constraint) {
            return constraint.getSubjects().stream().allMatch(s -> s.root().equals(Subject.RESULT_NAME));
        }

        private boolean valid(CandidateSearch.Candidate candidate) {
            return evaluator.violatedConstraints(candidate.inputs()).isEmpty();
        }

        private boolean violatesExactly(CandidateSearch.Candidate candidate, String constraintId) {
            return evaluator.violatedConstraints(candidate.inputs()).equals(Set.of(constraintId));
        }

        /**
         * True if the fail-fast entry check rejects the candidate for the
         * given constraint first, whatever it would report afterwards.
         */
        private boolean rejectedFirstFor(CandidateSearch.Candidate candidate, String constraintId) {
            List<ContractEvaluator.Violation> violations = evaluator.violatedPreconditions(candidate.inputs());
            return !violations.isEmpty() && violations.get(0).constraintId().equals(constraintId);
        }

        // ==================== Input constraints ====================

        private void violationCase(Constraint constraint, List<InputSpace.Dimension> dimensions) {
            List<InputSpace.Dimension> searched = withDelta(constraint, dimensions);
            Optional<CandidateSearch.Candidate> found = search.find(searched, CandidateSearch.Ladder.EXTREMAL,
                    c -> violatesExactly(c, constraint.getId()));
            boolean dependents = false;
            if (found.isEmpty()) {
                // A parameter that also sizes a sequence cannot be broken alone
                found = search.find(withAllDeltas(searched), CandidateSearch.Ladder.EXTREMAL,
                        c -> rejectedFirstFor(c, constraint.getId()));
                dependents = found.isPresent();
            }
            if (found.isPresent()) {
                List<String> tags = new ArrayList<>(tags(constraint));
                Subject side = deltaSide(constraint);
                if (side != null && found.get().point().getOrDefault(InputSpace.deltaName(side), 0L) != 0) {
                    tags.add("violated-side:" + side.path());
                }
                if (dependents) {
                    tags.add("violates-dependents");
                }
                add(TestCaseKind.PRECONDITION_VIOLATION, constraint.getId(), found.get().inputs(), null,
                        ExpectedOutcome.reject(constraint.getId()), tags);
            } else {
                miss(constraint, TestCaseKind.PRECONDITION_VIOLATION,
                        "no input rejected first for this constraint within " + search.examined() + " candidates");
            }
        }

        private void boundaryCase(Constraint constraint, List<InputSpace.Dimension> dimensions) {
            List<InputSpace.Dimension> searched = withDelta(constraint, dimensions);
            Optional<CandidateSearch.Candidate> found = search.find(searched, CandidateSearch.Ladder.EXTREMAL,
                    c -> valid(c) && isTight(c, constraint.getId(), searched, false));
            if (found.isEmpty()) {
                List<InputSpace.Dimension> widened = withAllDeltas(searched);
                found = search.find(widened, CandidateSearch.Ladder.EXTREMAL,
                        c -> valid(c) && isTight(c, constraint.getId(), widened, true));
            }
            if (found.isPresent()) {
                add(TestCaseKind.BOUNDARY, constraint.getId(), found.get().inputs(), null,
                        ExpectedOutcome.accept(), tags(constraint));
            } else {
                miss(constraint, TestCaseKind.BOUNDARY,
                        "no satisfying input one step away from violating this constraint");
            }
        }

        /**
         * True if one unit step along some dimension makes the candidate
         * violate exactly the given constraint. Upward steps are tried
         * first, so an index bound lands on {@code bound - 1}.
         *
         * When {@code lenient}, the step may also shift one sequence length
         * to keep the inputs well-typed, and it is enough that the entry
         * check rejects the moved candidate for the constraint first.
         */
        private boolean isTight(CandidateSearch.Candidate candidate, String constraintId,
                                List<InputSpace.Dimension> dimensions, boolean lenient) {
            for (long step : new long[]{1, -1}) {
                for (InputSpace.Dimension dimension : dimensions) {
                    if (dimension.role() == InputSpace.Role.PRESENCE) {
                        continue;
                    }
                    for (CandidateSearch.Candidate moved : steps(candidate, dimension, step, dimensions, lenient)) {
                        if (violatesExactly(moved, constraintId) || (lenient && rejectedFirstFor(moved, constraintId))) {
                            return true;
                        }
                    }
                }
            }
            return false;
        }

        private List<CandidateSearch.Candidate> steps(CandidateSearch.Candidate candidate, InputSpace.Dimension dimension,
                                                      long step, List<InputSpace.Dimension> dimensions, boolean lenient) {
            List<CandidateSearch.Candidate> moved = new ArrayList<>();
            search.neighbour(candidate, dimension.name(), step).ifPresent(moved::add);
            if (!lenient || dimension.role() == InputSpace.Role.DELTA) {
                return moved;
            }
            for (InputSpace.Dimension delta : dimensions) {
                if (delta.role() != InputSpace.Role.DELTA) {
                    continue;
                }
                for (long compensation : new long[]{-step, step}) {
                    search.shifted(candidate, Map.of(dimension.name(), step, delta.name(), compensation))
                            .ifPresent(moved::add);
                }
            }
            return moved;
        }

        private void branchCases(Constraint constraint, List<InputSpace.Dimension> dimensions) {
            String presence = new Subject.PresentOf(constraint.getSubject()).path();
            for (long branch : new long[]{0, 1}) {
                String label = branch == 0 ? "absent" : "present";
                Optional<CandidateSearch.Candidate> found = search.find(dimensions, CandidateSearch.Ladder.EXTREMAL,
                        c -> c.point().getOrDefault(presence, 1L) == branch && valid(c));
                if (found.isPresent()) {
                    List<String> tags = new ArrayList<>(tags(constraint));
                    tags.add("branch:" + label);
                    add(TestCaseKind.BOUNDARY, constraint.getId(), found.get().inputs(), null,
                            ExpectedOutcome.accept(), tags);
                } else {
                    miss(constraint, TestCaseKind.BOUNDARY, "no satisfying input with " + label + " value");
                }
            }
        }

        // ==================== Result constraints ====================

        private void resultCases(Constraint constraint, List<InputSpace.Dimension> dimensions) {
            if (constraint.getKind() == ConstraintKind.DISJOINT) {
                miss(constraint, TestCaseKind.BOUNDARY, "the branch of the result is chosen by the implementation");
                return;
            }
            Expr driver = constraint.getKind() == ConstraintKind.LENGTH_EQUALS
                    || constraint.getKind() == ConstraintKind.LENGTH_AT_LEAST
                    || constraint.getKind() == ConstraintKind.INDEX_BOUND ? constraint.getResolved() : null;
            CandidateSearch.Candidate[] best = new CandidateSearch.Candidate[1];
            long[] bestValue = {Long.MAX_VALUE};
            search.find(dimensions, CandidateSearch.Ladder.EXTREMAL, c -> {
                if (!valid(c)) {
                    return false;
                }
                Long value = driver == null ? null : valueOverInputs(driver, c.inputs());
                if (value == null) {
                    best[0] = c;
                    return true;
                }
                if (value < bestValue[0]) {
                    best[0] = c;
                    bestValue[0] = value;
                }
                return value <= 0;
            });
            if (best[0] != null) {
                List<String> tags = new ArrayList<>(tags(constraint));
                tags.add("postcondition");
                add(TestCaseKind.BOUNDARY, constraint.getId(), best[0].inputs(), null, ExpectedOutcome.accept(), tags);
            } else {
                miss(constraint, TestCaseKind.BOUNDARY, "no satisfying input found");
            }
            propertyCase(constraint, GeneratorSpec.Property.RESULT_INVARIANT);
        }

        /**
         * Evaluates a resolved expression over source-named inputs, or null
         * when it reads something other than the inputs.
         */
        private Long valueOverInputs(Expr resolved, Map<String, Object> inputs) {
            boolean[] unsupported = {false};
            Expr overInputs = Exprs.rewrite(resolved, node -> {
                if (node instanceof Expr.Ref ref) {
                    Expr path = inputPath(ref.subject());
                    if (path == null) {
                        unsupported[0] = true;
                        return node;
                    }
                    return path;
                }
                return null;
            });
            if (unsupported[0]) {
                return null;
            }
            try {
                return ExpressionEvaluator.integer(ExpressionEvaluator.evaluate(overInputs, inputs));
            } catch (IllegalArgumentException | ArithmeticException e) {
                return null;
            }
        }

        private Expr inputPath(Subject subject) {
            if (subject instanceof Subject.Param param) {
                return Expr.var(param.name());
            }
            if (subject instanceof Subject.FieldOf field) {
                Expr owner = inputPath(field.owner());
                return owner == null ? null : new Expr.Field(owner, field.field());
            }
            if (subject instanceof Subject.PresentOf present) {
                Expr owner = inputPath(present.owner());
                return owner == null ? null : new Expr.Unwrap(owner);
            }
            return null;
        }

        // ==================== Properties ====================

        private boolean wantsProperty(Constraint constraint) {
            switch (constraint.getKind()) {
                case LENGTH_EQUALS:
                case LENGTH_AT_LEAST:
                case INDEX_BOUND:
                    return true;
                default:
                    return constraint.getResolved() != null && Exprs.containsArithmetic(constraint.getResolved());
            }
        }

        private void propertyCase(Constraint constraint, GeneratorSpec.Property property) {
            Check.Guard guard = guards.get(constraint.getId());
            if (guard == null) {
                miss(constraint, TestCaseKind.PROPERTY_BASED, "constraint has no guard condition");
                return;
            }
            boolean acceptance = property == GeneratorSpec.Property.INPUT_ACCEPTANCE;
            Map<String, GeneratorSpec.Range> ranges = new LinkedHashMap<>();
            for (InputSpace.Dimension dimension : space.dimensions()) {
                ranges.put(dimension.name(), range(dimension.role(), acceptance));
            }
            Subject side = acceptance ? deltaSide(constraint) : null;
            if (side != null) {
                ranges.put(InputSpace.deltaName(side), new GeneratorSpec.Range(-2, 2));
            }
            GeneratorSpec generator = new GeneratorSpec(ranges, property, guard.condition(), options.getTrials(),
                    options.getSeed() + cases.size());
            add(TestCaseKind.PROPERTY_BASED, constraint.getId(), null, generator,
                    ExpectedOutcome.invariant(constraint.getId(), guard.condition().render()), tags(constraint));
        }

        private GeneratorSpec.Range range(InputSpace.Role role, boolean acceptance) {
            long max = options.getRangeMax();
            switch (role) {
                case PRESENCE:
                    return new GeneratorSpec.Range(0, 1);
                case SYMBOL:
                    return new GeneratorSpec.Range(0, max);
                case DELTA:
                    return new GeneratorSpec.Range(acceptance ? -2 : 0, acceptance ? 2 : 0);
                default:
                    return new GeneratorSpec.Range(acceptance ? -2 : 0, max);
            }
        }

        // ==================== Helpers ====================

        /**
         * The side of a length constraint that gets its length shifted: the
         * first subject whose length is not the one defining the bound.
         */
        private Subject deltaSide(Constraint constraint) {
            if (constraint.getKind() != ConstraintKind.LENGTH_EQUALS
                    && constraint.getKind() != ConstraintKind.LENGTH_AT_LEAST) {
                return null;
            }
            for (Subject subject : constraint.getSubjects()) {
                boolean definitional = constraint.getResolved() instanceof Expr.Length length
                        && length.target() instanceof Expr.Ref ref && ref.subject().equals(subject);
                if (!definitional && !subject.root().equals(Subject.RESULT_NAME)) {
                    return subject;
                }
            }
            return null;
        }

        private List<InputSpace.Dimension> withDelta(Constraint constraint, List<InputSpace.Dimension> dimensions) {
            Subject side = deltaSide(constraint);
            if (side == null) {
                return dimensions;
            }
            List<InputSpace.Dimension> extended = new ArrayList<>(dimensions);
            extended.add(InputSpace.delta(side));
            return extended;
        }

        /**
         * The dimensions plus a length offset for every sequence that some
         * input length constraint relates to another value.
         */
        private List<InputSpace.Dimension> withAllDeltas(List<InputSpace.Dimension> dimensions) {
            List<InputSpace.Dimension> extended = new ArrayList<>(dimensions);
            for (Constraint constraint : model.getConstraints()) {
                Subject side = deltaSide(constraint);
                if (side != null && !extended.contains(InputSpace.delta(side))) {
                    extended.add(InputSpace.delta(side));
                }
            }
            return extended;
        }

        private List<String> tags(Constraint constraint) {
            List<String> tags = new ArrayList<>();
            tags.add("kind:" + constraint.getKind().displayName());
            tags.add("scope:" + constraint.getScope().name().toLowerCase(Locale.ROOT));
            if (constraint.getSubjects().size() > 1) {
                tags.add("merged");
            }
            if (constraint.isNested()) {
                tags.add("nested-in:" + constraint.getParentId());
            }
            return tags;
        }

        private void add(TestCaseKind kind, String constraintId, Map<String, Object> inputs, GeneratorSpec generator,
                         ExpectedOutcome expected, List<String> tags) {
            String id = model.getFunctionName() + ".t" + (cases.size() + 1);
            cases.add(new TestCase(id, kind, constraintId, inputs, generator, expected, null, tags));
        }

        private void miss(Constraint constraint, TestCaseKind kind, String reason) {
            logger.debug("No {} case for {}: {}", kind, constraint.getId(), reason);
            uncovered.add(new TestPlan.Uncovered(constraint.getId(), kind, reason));
        }

        // ==================== Reference outputs ====================

        private List<TestCase> withReference(ReferenceImplementation reference) {
            List<TestCase> finished = new ArrayList<>();
            PropertyRunner sampler = new PropertyRunner(model);
            List<TestCase> differential = new ArrayList<>();
            for (TestCase testCase : cases) {
                if (testCase.isConcrete() && testCase.kind().expectsAcceptance()) {
                    finished.add(testCase.withReferenceOutput(referenceOutput(reference, testCase.inputs(), testCase.id())));
                } else {
                    finished.add(testCase);
                }
                if (testCase.kind() == TestCaseKind.PROPERTY_BASED) {
                    List<Map<String, Object>> samples = sampler.sample(testCase, true);
                    for (Map<String, Object> inputs : samples.subList(0, Math.min(options.getDifferentialSamples(), samples.size()))) {
                        differential.add(new TestCase(null, TestCaseKind.DIFFERENTIAL, testCase.targetConstraintId(),
                                inputs, null, ExpectedOutcome.accept(), referenceOutput(reference, inputs, testCase.id()),
                                List.of("sampled-from:" + testCase.id())));
                    }
                }
            }
            for (TestCase testCase : differential) {
                finished.add(testCase.withId(model.getFunctionName() + ".t" + (finished.size() + 1)));
            }
            return finished;
        }

        private Object referenceOutput(ReferenceImplementation reference, Map<String, Object> inputs, String caseId) {
            try {
                return reference.apply(inputs);
            } catch (Exception e) {
                logger.warn("Reference failed on {} {}: {}", caseId, inputs, e.getMessage());
                return null;
            }
        }
    }
}
