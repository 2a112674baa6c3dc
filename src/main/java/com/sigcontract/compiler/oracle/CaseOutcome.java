package com.sigcontract.compiler.oracle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sigcontract.compiler.testgen.TestCaseKind;

/**
 * Verdict for one test case. {@code expected} and {@code actual} are set
 * for value mismatches.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseOutcome(String caseId, TestCaseKind kind, Verdict verdict, Object expected, Object actual,
                          String detail) {

    public static CaseOutcome of(String caseId, TestCaseKind kind, Verdict verdict, String detail) {
        return new CaseOutcome(caseId, kind, verdict, null, null, detail);
    }

    public boolean passed() {
        return verdict.isPass();
    }
}
