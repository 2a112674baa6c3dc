package com.sigcontract.compiler.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.processor.CompilationResult;
import com.sigcontract.compiler.processor.SignatureBatchProcessor;
import com.sigcontract.compiler.processor.SignatureSource;
import com.sigcontract.compiler.render.JavaContractRenderer;
import com.sigcontract.compiler.testgen.TestSynthesisOptions;
import com.sigcontract.compiler.util.JsonSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MetricsCollectorTest {

    private static final String TAKE = "take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)";

    private final SignatureBatchProcessor processor = new SignatureBatchProcessor(EmissionProfile.defaults(),
            TestSynthesisOptions.defaults(), false, 1);

    private CompilationResult compile(String text) {
        return processor.compile(SignatureSource.inline(text));
    }

    @Test
    void countsConstraintsChecksAndCases() {
        MetricsCollector collector = new MetricsCollector();
        CompilationResult take = compile(TAKE);

        collector.recordResult(take);
        collector.recordResult(compile("zip(xs: SizedSequence(Int, n), ys: SizedSequence(Int, n)) -> Int"));
        collector.recordResult(compile("sum(xs: SizedSequence(Int, n)) -> Int"));

        MetricsCollector.MetricsReport report = collector.generateReport();
        assertThat(report.totalSignatures).isEqualTo(3);
        assertThat(report.compiledSignatures).isEqualTo(3);
        assertThat(report.unconstrainedSignatures).isEqualTo(1);
        assertThat(report.totalConstraints).isEqualTo(4);
        assertThat(report.crossParameterConstraints).isEqualTo(1);
        assertThat(report.constraintKindCounts)
                .containsEntry("Nonnegative", 1)
                .containsEntry("LengthAtLeast", 1)
                .containsEntry("LengthEquals", 2);
        assertThat(report.preconditionChecks).isEqualTo(3);
        assertThat(report.postconditionChecks).isEqualTo(1);
        assertThat(report.totalTestCases).isGreaterThanOrEqualTo(take.getPlan().getCases().size() + 2);
        assertThat(report.testCaseKindCounts).containsKey("HAPPY_PATH");
        assertThat(report.oracleCases).isZero();
    }

    @Test
    void countsFailuresByCategory() {
        MetricsCollector collector = new MetricsCollector();

        collector.recordResult(compile("f(x: Int, x: Int) -> Int"));
        collector.recordResult(compile("never(i: Fin(0)) -> Int"));
        collector.recordResult(compile("g(x: Int -> Int"));

        MetricsCollector.MetricsReport report = collector.generateReport();
        assertThat(report.compiledSignatures).isZero();
        assertThat(report.failureCategoryCounts).containsEntry("parse", 2).containsEntry("unsatisfiable", 1);
        assertThat(report.averageConstraintsPerSignature).isZero();
    }

    @Test
    void countsAnnotationsOfRenderedMethods() {
        MetricsCollector collector = new MetricsCollector();
        CompilationResult take = compile(TAKE);
        CompilationUnit cu = new JavaContractRenderer().render(take.getContract(), take.getSignature());

        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            collector.recordRenderedMethod(method);
        }

        MetricsCollector.MetricsReport report = collector.generateReport();
        assertThat(report.renderedMethods).isEqualTo(2);
        assertThat(report.annotationTypeCounts).containsEntry("Requires", 2).containsEntry("Ensures", 1);
    }

    @Test
    void endBeforeStartIsAnError() {
        assertThatThrownBy(() -> new MetricsCollector().endAnalysis())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void exportsReportAsJson(@TempDir Path dir) throws IOException {
        MetricsCollector collector = new MetricsCollector();
        collector.startAnalysis();
        collector.recordResult(compile(TAKE));
        collector.endAnalysis();
        Path out = dir.resolve("metrics.json");

        collector.exportJSON(out);

        JsonNode json = JsonSupport.mapper().readTree(out.toFile());
        assertThat(json.get("totalSignatures").asInt()).isEqualTo(1);
        assertThat(json.get("constraintKindCounts").get("LengthEquals").asInt()).isEqualTo(1);
    }
}
