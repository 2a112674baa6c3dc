package com.sigcontract.compiler.processor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.model.ConstraintModel;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.oracle.DifferentialReport;
import com.sigcontract.compiler.testgen.TestPlan;

/**
 * Outcome of compiling one signature. Either every artifact is present, or
 * none is and the failure category and message say why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompilationResult {

    public static final String INTERNAL = "internal";

    private final SignatureSource source;
    private final Signature signature;
    private final ConstraintModel model;
    private final ContractCode contract;
    private final TestPlan plan;
    private final DifferentialReport oracleReport;
    private final String failureCategory;
    private final String failureMessage;
    private final long elapsedMillis;

    private CompilationResult(SignatureSource source, Signature signature, ConstraintModel model,
                              ContractCode contract, TestPlan plan, DifferentialReport oracleReport,
                              String failureCategory, String failureMessage, long elapsedMillis) {
        this.source = source;
        this.signature = signature;
        this.model = model;
        this.contract = contract;
        this.plan = plan;
        this.oracleReport = oracleReport;
        this.failureCategory = failureCategory;
        this.failureMessage = failureMessage;
        this.elapsedMillis = elapsedMillis;
    }

    public static CompilationResult success(SignatureSource source, Signature signature, ConstraintModel model,
                                            ContractCode contract, TestPlan plan, long elapsedMillis) {
        return new CompilationResult(source, signature, model, contract, plan, null, null, null, elapsedMillis);
    }

    public static CompilationResult failure(SignatureSource source, String category, String message,
                                            long elapsedMillis) {
        return new CompilationResult(source, null, null, null, null, null, category, message, elapsedMillis);
    }

    public CompilationResult withOracleReport(DifferentialReport report) {
        return new CompilationResult(source, signature, model, contract, plan, report, failureCategory,
                failureMessage, elapsedMillis);
    }

    public boolean isSuccess() {
        return failureCategory == null;
    }

    public String getLocation() {
        return source.location();
    }

    public String getText() {
        return source.text();
    }

    /**
     * Function name, or null if the signature never parsed.
     */
    public String getFunctionName() {
        return signature != null ? signature.getName() : null;
    }

    @JsonIgnore
    public SignatureSource getSource() {
        return source;
    }

    @JsonIgnore
    public Signature getSignature() {
        return signature;
    }

    @JsonIgnore
    public ConstraintModel getModel() {
        return model;
    }

    public Integer getConstraintCount() {
        return model != null ? model.getConstraints().size() : null;
    }

    public ContractCode getContract() {
        return contract;
    }

    public TestPlan getPlan() {
        return plan;
    }

    public DifferentialReport getOracleReport() {
        return oracleReport;
    }

    public String getFailureCategory() {
        return failureCategory;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? source.location() + ": " + getFunctionName() + " (" + model.getConstraints().size() + " constraints, "
                        + plan.getCases().size() + " cases)"
                : source.location() + ": " + failureCategory + ": " + failureMessage;
    }
}
