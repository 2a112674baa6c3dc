package com.sigcontract.compiler.testgen;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a test case expects: acceptance, rejection by one constraint, or an
 * invariant over generated inputs and outputs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpectedOutcome(Type type, String constraintId, String invariant) {

    public enum Type {
        ACCEPT, REJECT, INVARIANT
    }

    public static ExpectedOutcome accept() {
        return new ExpectedOutcome(Type.ACCEPT, null, null);
    }

    public static ExpectedOutcome reject(String constraintId) {
        return new ExpectedOutcome(Type.REJECT, constraintId, null);
    }

    public static ExpectedOutcome invariant(String constraintId, String invariant) {
        return new ExpectedOutcome(Type.INVARIANT, constraintId, invariant);
    }

    @Override
    public String toString() {
        switch (type) {
            case REJECT:
                return "reject(" + constraintId + ")";
            case INVARIANT:
                return "invariant(" + invariant + ")";
            default:
                return "accept";
        }
    }
}
