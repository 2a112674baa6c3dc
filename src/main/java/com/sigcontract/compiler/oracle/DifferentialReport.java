package com.sigcontract.compiler.oracle;

import com.sigcontract.compiler.util.JsonSupport;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-case verdicts of one oracle run, in plan order.
 */
public final class DifferentialReport {

    private final String functionName;
    private final String reference;
    private final String generated;
    private final List<CaseOutcome> outcomes;

    public DifferentialReport(String functionName, String reference, String generated, List<CaseOutcome> outcomes) {
        this.functionName = functionName;
        this.reference = reference;
        this.generated = generated;
        this.outcomes = List.copyOf(outcomes);
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getReference() {
        return reference;
    }

    public String getGenerated() {
        return generated;
    }

    public List<CaseOutcome> getOutcomes() {
        return outcomes;
    }

    public Map<Verdict, Long> getVerdictCounts() {
        Map<Verdict, Long> counts = new EnumMap<>(Verdict.class);
        outcomes.forEach(o -> counts.merge(o.verdict(), 1L, Long::sum));
        return counts;
    }

    public boolean isPassed() {
        return outcomes.stream().allMatch(CaseOutcome::passed);
    }

    public List<CaseOutcome> failures() {
        return outcomes.stream().filter(o -> !o.passed()).collect(Collectors.toList());
    }

    public CaseOutcome outcome(String caseId) {
        return outcomes.stream().filter(o -> o.caseId().equals(caseId)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No outcome for " + caseId));
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    @Override
    public String toString() {
        return "DifferentialReport{" + functionName + ", " + getVerdictCounts() + "}";
    }
}
