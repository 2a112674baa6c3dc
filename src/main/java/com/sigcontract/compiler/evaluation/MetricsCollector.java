package com.sigcontract.compiler.evaluation;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.sigcontract.compiler.contract.Check;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.model.Constraint;
import com.sigcontract.compiler.oracle.CaseOutcome;
import com.sigcontract.compiler.processor.CompilationResult;
import com.sigcontract.compiler.testgen.TestCase;
import com.sigcontract.compiler.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Collects metrics over a batch of compiled signatures: constraint coverage,
 * synthesized checks and test cases, failures and timing.
 * Safe to feed from several worker threads.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;
    private long totalCompileTimeMs = 0;

    // Signature metrics
    private int totalSignatures = 0;
    private int compiledSignatures = 0;
    private int unconstrainedSignatures = 0;
    private final Map<String, Integer> failureCategoryCounts = new TreeMap<>();

    // Constraint metrics
    private int totalConstraints = 0;
    private int crossParameterConstraints = 0;
    private int nestedConstraints = 0;
    private int recordInvariantConstraints = 0;
    private final Map<String, Integer> constraintKindCounts = new TreeMap<>();

    // Contract metrics
    private int preconditionChecks = 0;
    private int postconditionChecks = 0;
    private int invariantChecks = 0;
    private int branchChecks = 0;

    // Test plan metrics
    private int totalTestCases = 0;
    private int uncoveredCases = 0;
    private final Map<String, Integer> testCaseKindCounts = new TreeMap<>();

    // Oracle metrics
    private int oracleCases = 0;
    private int oracleFailures = 0;
    private final Map<String, Integer> verdictCounts = new TreeMap<>();

    // Rendered Java metrics
    private int renderedMethods = 0;
    private final Map<String, Integer> annotationTypeCounts = new TreeMap<>();

    public synchronized void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    public synchronized void endAnalysis() {
        if (startTime == null) {
            throw new IllegalStateException("endAnalysis() called before startAnalysis()");
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    /**
     * Record everything produced for one signature, or its failure.
     */
    public synchronized void recordResult(CompilationResult result) {
        totalSignatures++;
        totalCompileTimeMs += result.getElapsedMillis();
        if (!result.isSuccess()) {
            failureCategoryCounts.merge(result.getFailureCategory(), 1, Integer::sum);
            return;
        }
        compiledSignatures++;

        List<Constraint> constraints = result.getModel().getConstraints();
        if (constraints.isEmpty()) {
            unconstrainedSignatures++;
        }
        for (Constraint constraint : constraints) {
            totalConstraints++;
            constraintKindCounts.merge(constraint.getKind().displayName(), 1, Integer::sum);
            if (constraint.getScope() == Constraint.Scope.CROSS_PARAMETER) crossParameterConstraints++;
            if (constraint.isNested()) nestedConstraints++;
            if (constraint.getOrigin() == Constraint.Origin.RECORD_INVARIANT) recordInvariantConstraints++;
        }

        ContractCode contract = result.getContract();
        preconditionChecks += countChecks(contract.getPreconditions());
        postconditionChecks += countChecks(contract.getPostconditions());
        contract.getInvariants().forEach(inv -> invariantChecks += countChecks(inv.checks()));

        for (TestCase testCase : result.getPlan().getCases()) {
            totalTestCases++;
            testCaseKindCounts.merge(testCase.kind().name(), 1, Integer::sum);
        }
        uncoveredCases += result.getPlan().getUncovered().size();

        if (result.getOracleReport() != null) {
            for (CaseOutcome outcome : result.getOracleReport().getOutcomes()) {
                oracleCases++;
                verdictCounts.merge(outcome.verdict().name(), 1, Integer::sum);
                if (!outcome.passed()) oracleFailures++;
            }
        }
    }

    /**
     * Counts guards, descending into branch cases. Branches themselves are
     * tallied separately.
     */
    private int countChecks(List<Check> checks) {
        int count = 0;
        for (Check check : checks) {
            if (check instanceof Check.Branch branch) {
                branchChecks++;
                for (Check.BranchCase branchCase : branch.cases()) {
                    count += countChecks(branchCase.checks());
                }
            } else {
                count++;
            }
        }
        return count;
    }

    /**
     * Record the contract annotations of one rendered Java method.
     */
    public synchronized void recordRenderedMethod(MethodDeclaration methodDecl) {
        renderedMethods++;
        for (AnnotationExpr annotation : methodDecl.getAnnotations()) {
            annotationTypeCounts.merge(getSimpleAnnotationName(annotation), 1, Integer::sum);
        }
    }

    private String getSimpleAnnotationName(AnnotationExpr annotation) {
        String fullName = annotation.getNameAsString();
        int lastDot = fullName.lastIndexOf('.');
        return lastDot >= 0 ? fullName.substring(lastDot + 1) : fullName;
    }

    public synchronized MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerSignature = totalSignatures > 0 ? (double) totalCompileTimeMs / totalSignatures : 0;

        report.totalSignatures = totalSignatures;
        report.compiledSignatures = compiledSignatures;
        report.unconstrainedSignatures = unconstrainedSignatures;
        report.failureCategoryCounts = new TreeMap<>(failureCategoryCounts);

        report.totalConstraints = totalConstraints;
        report.averageConstraintsPerSignature = compiledSignatures > 0 ? (double) totalConstraints / compiledSignatures : 0;
        report.crossParameterConstraints = crossParameterConstraints;
        report.nestedConstraints = nestedConstraints;
        report.recordInvariantConstraints = recordInvariantConstraints;
        report.constraintKindCounts = new TreeMap<>(constraintKindCounts);

        report.preconditionChecks = preconditionChecks;
        report.postconditionChecks = postconditionChecks;
        report.invariantChecks = invariantChecks;
        report.branchChecks = branchChecks;

        report.totalTestCases = totalTestCases;
        report.uncoveredCases = uncoveredCases;
        report.testCaseKindCounts = new TreeMap<>(testCaseKindCounts);

        report.oracleCases = oracleCases;
        report.oraclePassRate = calculatePercentage(oracleCases - oracleFailures, oracleCases);
        report.verdictCounts = new TreeMap<>(verdictCounts);

        report.renderedMethods = renderedMethods;
        report.annotationTypeCounts = new TreeMap<>(annotationTypeCounts);
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        Files.writeString(outputPath, JsonSupport.toJson(generateReport()), StandardCharsets.UTF_8);
        logger.info("Metrics exported to: {}", outputPath);
    }

    /**
     * Print a human-readable report to the console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("SIGNATURE CONTRACT COMPILATION - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING]");
        System.out.printf("  Total Time: %.2f seconds\n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Compile Time per Signature: %.2f ms\n", report.averageTimePerSignature);

        System.out.println("\n[SIGNATURES]");
        System.out.printf("  Total: %d\n", report.totalSignatures);
        System.out.printf("  Compiled: %.1f%% (%d/%d)\n",
                calculatePercentage(report.compiledSignatures, report.totalSignatures),
                report.compiledSignatures, report.totalSignatures);
        System.out.printf("  Without Constraints: %d\n", report.unconstrainedSignatures);
        report.failureCategoryCounts.forEach((category, count) ->
                System.out.printf("  Failed (%s): %d\n", category, count));

        System.out.println("\n[CONSTRAINTS]");
        System.out.printf("  Total: %,d (%.1f per signature)\n", report.totalConstraints,
                report.averageConstraintsPerSignature);
        System.out.printf("  Cross-parameter: %,d\n", report.crossParameterConstraints);
        System.out.printf("  Nested in a Disjoint: %,d\n", report.nestedConstraints);
        System.out.printf("  Record Invariants: %,d\n", report.recordInvariantConstraints);
        report.constraintKindCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> System.out.printf("  %-20s: %,6d\n", entry.getKey(), entry.getValue()));

        System.out.println("\n[CONTRACT CHECKS]");
        System.out.printf("  Preconditions:  %,6d\n", report.preconditionChecks);
        System.out.printf("  Postconditions: %,6d\n", report.postconditionChecks);
        System.out.printf("  Invariants:     %,6d\n", report.invariantChecks);
        System.out.printf("  Branches:       %,6d\n", report.branchChecks);

        System.out.println("\n[TEST CASES]");
        System.out.printf("  Total: %,d (%d uncovered)\n", report.totalTestCases, report.uncoveredCases);
        report.testCaseKindCounts.forEach((kind, count) -> System.out.printf("  %-22s: %,6d\n", kind, count));

        if (report.oracleCases > 0) {
            System.out.println("\n[DIFFERENTIAL ORACLE]");
            System.out.printf("  Cases: %,d, passed %.1f%%\n", report.oracleCases, report.oraclePassRate);
            report.verdictCounts.forEach((verdict, count) -> System.out.printf("  %-18s: %,6d\n", verdict, count));
        }

        if (report.renderedMethods > 0) {
            System.out.println("\n[RENDERED JAVA]");
            System.out.printf("  Methods: %,d\n", report.renderedMethods);
            report.annotationTypeCounts.forEach((name, count) -> System.out.printf("  @%-20s: %,6d\n", name, count));
        }

        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerSignature;

        // Signatures
        public int totalSignatures;
        public int compiledSignatures;
        public int unconstrainedSignatures;
        public Map<String, Integer> failureCategoryCounts;

        // Constraints
        public int totalConstraints;
        public double averageConstraintsPerSignature;
        public int crossParameterConstraints;
        public int nestedConstraints;
        public int recordInvariantConstraints;
        public Map<String, Integer> constraintKindCounts;

        // Contract checks
        public int preconditionChecks;
        public int postconditionChecks;
        public int invariantChecks;
        public int branchChecks;

        // Test plans
        public int totalTestCases;
        public int uncoveredCases;
        public Map<String, Integer> testCaseKindCounts;

        // Oracle
        public int oracleCases;
        public double oraclePassRate;
        public Map<String, Integer> verdictCounts;

        // Rendered Java
        public int renderedMethods;
        public Map<String, Integer> annotationTypeCounts;
    }
}
