package com.sigcontract.compiler.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.NumericNode;
import com.sigcontract.compiler.model.ConstraintModel;
import com.sigcontract.compiler.testgen.PropertyRunner;
import com.sigcontract.compiler.testgen.TestCase;
import com.sigcontract.compiler.testgen.TestCaseKind;
import com.sigcontract.compiler.testgen.TestPlan;
import com.sigcontract.compiler.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs a test plan against a reference and a generated implementation and
 * reports a verdict per case.
 *
 * Cases run concurrently. Every invocation gets its own working directory
 * and a wall-clock timeout; a case that crashes, hangs or mismatches only
 * affects its own verdict.
 */
public class DifferentialOracleRunner {

    private static final Logger logger = LoggerFactory.getLogger(DifferentialOracleRunner.class);

    // How long a timed-out invocation may take to stop after being interrupted
    private static final long CANCEL_GRACE_MILLIS = 5_000;

    private static final Comparator<JsonNode> NUMERIC_AWARE = (left, right) -> {
        if (left instanceof NumericNode && right instanceof NumericNode) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private final OracleSettings settings;

    public DifferentialOracleRunner() {
        this(OracleSettings.defaults());
    }

    public DifferentialOracleRunner(OracleSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * @param reference may be null, in which case accepted cases are compared
     *                  against the reference outputs recorded in the plan
     */
    public DifferentialReport run(ConstraintModel model, TestPlan plan, FunctionExecutable reference,
                                  FunctionExecutable generated) {
        PropertyRunner sampler = new PropertyRunner(model);
        ExecutorService cases = Executors.newFixedThreadPool(settings.getParallelism());
        ExecutorService invocations = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "oracle-invocation");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<CaseOutcome>> futures = new ArrayList<>();
            for (TestCase testCase : plan.getCases()) {
                futures.add(cases.submit(() -> runCase(testCase, sampler, reference, generated, invocations)));
            }
            List<CaseOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(collect(futures.get(i), plan.getCases().get(i)));
            }
            DifferentialReport report = new DifferentialReport(plan.getFunctionName(),
                    reference != null ? reference.name() : null, generated.name(), outcomes);
            logger.info("Oracle run for {}: {}", plan.getFunctionName(), report.getVerdictCounts());
            return report;
        } finally {
            cases.shutdownNow();
            invocations.shutdownNow();
        }
    }

    private CaseOutcome collect(Future<CaseOutcome> future, TestCase testCase) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.GENERATED_CRASHED, "oracle interrupted");
        } catch (ExecutionException e) {
            logger.error("Oracle failed on case {}", testCase.id(), e.getCause());
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.GENERATED_CRASHED,
                    "oracle failure: " + e.getCause());
        }
    }

    private CaseOutcome runCase(TestCase testCase, PropertyRunner sampler, FunctionExecutable reference,
                                FunctionExecutable generated, ExecutorService invocations) {
        if (testCase.kind() == TestCaseKind.PRECONDITION_VIOLATION) {
            return violationCase(testCase, reference, generated, invocations);
        }
        if (testCase.kind() == TestCaseKind.PROPERTY_BASED) {
            List<Map<String, Object>> samples = sampler.sample(testCase, true);
            samples = samples.subList(0, Math.min(settings.getPropertySamples(), samples.size()));
            for (int i = 0; i < samples.size(); i++) {
                CaseOutcome outcome = acceptedCase(testCase, samples.get(i), null, reference, generated, invocations);
                if (!outcome.passed()) {
                    return new CaseOutcome(outcome.caseId(), outcome.kind(), outcome.verdict(), outcome.expected(),
                            outcome.actual(), "sample " + (i + 1) + " " + samples.get(i) + ": " + outcome.detail());
                }
            }
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.MATCH, samples.size() + " samples");
        }
        return acceptedCase(testCase, testCase.inputs(), testCase.referenceOutput(), reference, generated, invocations);
    }

    private CaseOutcome acceptedCase(TestCase testCase, Map<String, Object> inputs, Object recorded,
                                     FunctionExecutable reference, FunctionExecutable generated,
                                     ExecutorService invocations) {
        Invocation expected = reference != null
                ? invoke(reference, testCase, inputs, invocations)
                : Invocation.of(ExecutionResult.returned(recorded));
        Invocation actual = invoke(generated, testCase, inputs, invocations);

        if (expected.timedOut || actual.timedOut) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.TIMEOUT,
                    (expected.timedOut ? "reference" : "generated") + " exceeded " + settings.getTimeoutMillis() + "ms");
        }
        if (!expected.result.returnedValue()) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.REFERENCE_CRASHED, expected.result.message());
        }
        if (!actual.result.returnedValue()) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.GENERATED_CRASHED, actual.result.message());
        }
        if (reference == null && recorded == null) {
            // No reference output to compare with; acceptance is all that can be checked
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.MATCH, "accepted");
        }
        if (!sameValue(expected.result.value(), actual.result.value())) {
            return new CaseOutcome(testCase.id(), testCase.kind(), Verdict.VALUE_MISMATCH,
                    expected.result.value(), actual.result.value(), "outputs differ");
        }
        return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.MATCH, null);
    }

    private CaseOutcome violationCase(TestCase testCase, FunctionExecutable reference, FunctionExecutable generated,
                                      ExecutorService invocations) {
        Invocation actual = invoke(generated, testCase, testCase.inputs(), invocations);
        if (actual.timedOut) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.TIMEOUT,
                    "generated exceeded " + settings.getTimeoutMillis() + "ms");
        }
        if (actual.result.status() == ExecutionResult.Status.CRASHED) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.GENERATED_CRASHED, actual.result.message());
        }
        if (actual.result.status() == ExecutionResult.Status.RETURNED) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.NOT_REJECTED,
                    "generated returned " + actual.result.value());
        }
        String message = actual.result.message() != null ? actual.result.message() : "";
        String expectedId = testCase.expected().constraintId();
        String idPrefix = "[" + expectedId.substring(0, expectedId.lastIndexOf('.') + 1);
        if (message.contains(idPrefix) && !message.contains("[" + expectedId + " ")) {
            return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.NOT_REJECTED,
                    "rejected for another reason: " + message);
        }
        if (reference != null) {
            Invocation original = invoke(reference, testCase, testCase.inputs(), invocations);
            if (!original.timedOut && original.result.returnedValue()) {
                return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.NOT_REJECTED,
                        "reference returned " + original.result.value());
            }
        }
        return CaseOutcome.of(testCase.id(), testCase.kind(), Verdict.REJECTED, message);
    }

    private Invocation invoke(FunctionExecutable executable, TestCase testCase, Map<String, Object> inputs,
                              ExecutorService invocations) {
        Path workingDirectory;
        try {
            workingDirectory = WorkingDirectories.create(testCase.id());
        } catch (IOException e) {
            return Invocation.of(ExecutionResult.crashed("no working directory: " + e.getMessage()));
        }
        CountDownLatch finished = new CountDownLatch(1);
        Future<ExecutionResult> future = invocations.submit(() -> {
            try {
                return executable.execute(inputs, workingDirectory);
            } finally {
                finished.countDown();
            }
        });
        try {
            return Invocation.of(future.get(settings.getTimeoutMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} timed out on case {}", executable.name(), testCase.id());
            return new Invocation(null, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return Invocation.of(ExecutionResult.crashed(cause.getClass().getSimpleName() + ": " + cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Invocation.of(ExecutionResult.crashed("interrupted"));
        } finally {
            if (awaitFinished(finished)) {
                WorkingDirectories.delete(workingDirectory);
            } else {
                logger.warn("{} still running on case {}; keeping {}", executable.name(), testCase.id(), workingDirectory);
            }
        }
    }

    /**
     * Waits for a cancelled invocation to let go of its working directory.
     */
    private static boolean awaitFinished(CountDownLatch finished) {
        try {
            return finished.await(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean sameValue(Object expected, Object actual) {
        JsonNode left = expected == null ? NullNode.getInstance() : JsonSupport.mapper().valueToTree(expected);
        JsonNode right = actual == null ? NullNode.getInstance() : JsonSupport.mapper().valueToTree(actual);
        return left.equals(NUMERIC_AWARE, right);
    }

    private static final class Invocation {
        final ExecutionResult result;
        final boolean timedOut;

        Invocation(ExecutionResult result, boolean timedOut) {
            this.result = result;
            this.timedOut = timedOut;
        }

        static Invocation of(ExecutionResult result) {
            return new Invocation(result, false);
        }
    }
}
