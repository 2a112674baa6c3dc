package com.sigcontract.compiler.testgen;

import com.sigcontract.compiler.util.JsonSupport;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All test cases synthesized for one function, plus the constraints some
 * case kind could not be produced for.
 */
public final class TestPlan {

    /**
     * A case the synthesizer could not produce, with the reason.
     */
    public record Uncovered(String constraintId, TestCaseKind kind, String reason) {
    }

    private final String functionName;
    private final List<TestCase> cases;
    private final List<Uncovered> uncovered;

    public TestPlan(String functionName, List<TestCase> cases, List<Uncovered> uncovered) {
        this.functionName = functionName;
        this.cases = List.copyOf(cases);
        this.uncovered = List.copyOf(uncovered);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<TestCase> getCases() {
        return cases;
    }

    public List<Uncovered> getUncovered() {
        return uncovered;
    }

    public List<TestCase> casesOfKind(TestCaseKind kind) {
        return cases.stream().filter(c -> c.kind() == kind).collect(Collectors.toList());
    }

    public List<TestCase> casesFor(String constraintId) {
        return cases.stream().filter(c -> constraintId.equals(c.targetConstraintId())).collect(Collectors.toList());
    }

    public TestCase happyPath() {
        return cases.stream().filter(c -> c.kind() == TestCaseKind.HAPPY_PATH).findFirst()
                .orElseThrow(() -> new IllegalStateException("Plan for " + functionName + " has no happy path"));
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    @Override
    public String toString() {
        return "TestPlan{" + functionName + ", " + cases.size() + " cases, " + uncovered.size() + " uncovered}";
    }
}
