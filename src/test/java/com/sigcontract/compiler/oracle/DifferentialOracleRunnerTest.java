package com.sigcontract.compiler.oracle;

import com.sigcontract.compiler.analysis.ConstraintExtractor;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.ContractSynthesizer;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.contract.GuardedFunction;
import com.sigcontract.compiler.model.ConstraintModel;
import com.sigcontract.compiler.parser.SignatureParser;
import com.sigcontract.compiler.testgen.TestCaseKind;
import com.sigcontract.compiler.testgen.TestPlan;
import com.sigcontract.compiler.testgen.TestSynthesizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class DifferentialOracleRunnerTest {

    private static final String TAKE = "take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)";
    private static final String SUM = "sum(xs: SizedSequence(Int, n)) -> Int";

    private static final Function<Map<String, Object>, Object> TAKE_BODY = arguments -> {
        List<?> xs = (List<?>) arguments.get("xs");
        return new ArrayList<>(xs.subList(0, ((Number) arguments.get("n")).intValue()));
    };

    private static final Function<Map<String, Object>, Object> SUM_BODY = arguments -> {
        long total = 0;
        for (Object x : (List<?>) arguments.get("xs")) {
            total += ((Number) x).longValue();
        }
        return total;
    };

    private static ConstraintModel model(String text) {
        return new ConstraintExtractor().extract(new SignatureParser().parse(text));
    }

    private static ContractCode contract(ConstraintModel model) {
        return new ContractSynthesizer().synthesize(model, EmissionProfile.defaults());
    }

    private static DifferentialOracleRunner runner() {
        return new DifferentialOracleRunner(OracleSettings.defaults().withParallelism(2));
    }

    // ==================== Verdicts ====================

    @Test
    void faithfulImplementationPassesEveryCase() {
        ConstraintModel model = model(TAKE);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable reference = new InProcessExecutable("take-reference", TAKE_BODY);
        FunctionExecutable generated = InProcessExecutable.guarded(new GuardedFunction(contract(model), TAKE_BODY));

        DifferentialReport report = runner().run(model, plan, reference, generated);

        assertThat(report.getOutcomes()).hasSize(plan.getCases().size());
        assertThat(report.failures()).isEmpty();
        assertThat(report.isPassed()).isTrue();
        for (String caseId : plan.casesOfKind(TestCaseKind.PRECONDITION_VIOLATION).stream().map(c -> c.id()).toList()) {
            assertThat(report.outcome(caseId).verdict()).isEqualTo(Verdict.REJECTED);
        }
    }

    @Test
    void differentValueIsAMismatch() {
        ConstraintModel model = model(SUM);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable reference = new InProcessExecutable("sum-reference", SUM_BODY);
        FunctionExecutable generated = new InProcessExecutable("off-by-one",
                arguments -> ((Long) SUM_BODY.apply(arguments)) + 1);

        DifferentialReport report = runner().run(model, plan, reference, generated);

        CaseOutcome happy = report.outcome(plan.happyPath().id());
        assertThat(happy.verdict()).isEqualTo(Verdict.VALUE_MISMATCH);
        assertThat(happy.expected()).isNotEqualTo(happy.actual());
        assertThat(report.isPassed()).isFalse();
    }

    @Test
    void contractBreakingImplementationIsReportedAsCrash() {
        ConstraintModel model = model(TAKE);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable reference = new InProcessExecutable("take-reference", TAKE_BODY);
        FunctionExecutable everything = new ContractGuardedExecutable(contract(model),
                new InProcessExecutable("everything", arguments -> arguments.get("xs")));

        DifferentialReport report = runner().run(model, plan, reference, everything);

        assertThat(report.getVerdictCounts()).containsKey(Verdict.GENERATED_CRASHED);
        assertThat(report.failures()).allMatch(o -> o.verdict() == Verdict.GENERATED_CRASHED
                || o.verdict() == Verdict.VALUE_MISMATCH);
    }

    @Test
    void unguardedImplementationDoesNotRejectViolations() {
        ConstraintModel model = model(TAKE);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable lenient = new InProcessExecutable("lenient",
                arguments -> List.of());

        DifferentialReport report = runner().run(model, plan, null, lenient);

        for (String caseId : plan.casesOfKind(TestCaseKind.PRECONDITION_VIOLATION).stream().map(c -> c.id()).toList()) {
            assertThat(report.outcome(caseId).verdict()).isEqualTo(Verdict.NOT_REJECTED);
        }
    }

    @Test
    void recordedReferenceOutputsStandInForAMissingReference() {
        ConstraintModel model = model(SUM);
        FunctionExecutable reference = new InProcessExecutable("sum-reference", SUM_BODY);
        TestPlan plan = new TestSynthesizer().synthesize(model, reference.asReference());
        FunctionExecutable generated = InProcessExecutable.guarded(new GuardedFunction(contract(model), SUM_BODY));

        DifferentialReport report = runner().run(model, plan, null, generated);

        assertThat(report.isPassed()).isTrue();
        assertThat(report.getReference()).isNull();
    }

    // ==================== Isolation ====================

    @Test
    void hangingImplementationTimesOut() {
        ConstraintModel model = model(SUM);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable reference = new InProcessExecutable("sum-reference", SUM_BODY);
        FunctionExecutable hanging = new FunctionExecutable() {
            @Override
            public String name() {
                return "hanging";
            }

            @Override
            public ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory)
                    throws InterruptedException {
                Thread.sleep(60_000);
                return ExecutionResult.returned(0L);
            }
        };
        OracleSettings settings = OracleSettings.defaults().withTimeout(Duration.ofMillis(200));

        long start = System.currentTimeMillis();
        DifferentialReport report = new DifferentialOracleRunner(settings).run(model, plan, reference, hanging);

        assertThat(report.outcome(plan.happyPath().id()).verdict()).isEqualTo(Verdict.TIMEOUT);
        assertThat(System.currentTimeMillis() - start).isLessThan(30_000);
    }

    @Test
    void workingDirectoryOutlivesATimedOutInvocationUntilItStops() {
        ConstraintModel model = model(SUM);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable reference = new InProcessExecutable("sum-reference", SUM_BODY);
        Queue<Path> directories = new ConcurrentLinkedQueue<>();
        Queue<String> lateWrites = new ConcurrentLinkedQueue<>();
        FunctionExecutable slowToStop = new FunctionExecutable() {
            @Override
            public String name() {
                return "slow-to-stop";
            }

            @Override
            public ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory) {
                directories.add(workingDirectory);
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    // keeps writing for a moment after being cancelled
                    long until = System.currentTimeMillis() + 300;
                    while (System.currentTimeMillis() < until) {
                        Thread.onSpinWait();
                    }
                    try {
                        Files.writeString(workingDirectory.resolve("late.txt"), "still here");
                        lateWrites.add("ok");
                    } catch (IOException io) {
                        lateWrites.add(io.toString());
                    }
                }
                return ExecutionResult.returned(0L);
            }
        };
        OracleSettings settings = OracleSettings.defaults().withTimeout(Duration.ofMillis(200));

        DifferentialReport report = new DifferentialOracleRunner(settings).run(model, plan, reference, slowToStop);

        assertThat(report.outcome(plan.happyPath().id()).verdict()).isEqualTo(Verdict.TIMEOUT);
        assertThat(directories).isNotEmpty();
        assertThat(lateWrites).hasSameSizeAs(directories).containsOnly("ok");
        assertThat(directories).allMatch(dir -> !Files.exists(dir));
    }

    @Test
    void crashingReferenceIsReportedSeparately() {
        ConstraintModel model = model(SUM);
        TestPlan plan = new TestSynthesizer().synthesize(model);
        FunctionExecutable broken = new InProcessExecutable("broken", arguments -> {
            throw new IllegalStateException("boom");
        });
        FunctionExecutable generated = new InProcessExecutable("sum", SUM_BODY);

        DifferentialReport report = runner().run(model, plan, broken, generated);

        CaseOutcome happy = report.outcome(plan.happyPath().id());
        assertThat(happy.verdict()).isEqualTo(Verdict.REFERENCE_CRASHED);
        assertThat(happy.detail()).contains("boom");
    }

    // ==================== Value comparison ====================

    @Test
    void numbersCompareByValue() {
        assertThat(DifferentialOracleRunner.sameValue(1, 1L)).isTrue();
        assertThat(DifferentialOracleRunner.sameValue(2, 2.0)).isTrue();
        assertThat(DifferentialOracleRunner.sameValue(List.of(1, 2), List.of(1L, 2L))).isTrue();
        assertThat(DifferentialOracleRunner.sameValue(Map.of("a", 1), Map.of("a", 1L))).isTrue();
        assertThat(DifferentialOracleRunner.sameValue(List.of(1, 2), List.of(2, 1))).isFalse();
        assertThat(DifferentialOracleRunner.sameValue(null, 0)).isFalse();
    }
}
