package com.sigcontract.compiler.exception;

/**
 * The exhaustiveness fallback of a disjoint branch was reached. Indicates a
 * mismatch between the constraint model and the synthesized contract.
 */
public class UnreachableCaseException extends RuntimeException {

    private final String constraintId;

    public UnreachableCaseException(String constraintId, String message) {
        super("Unreachable case in " + constraintId + ": " + message);
        this.constraintId = constraintId;
    }

    public String getConstraintId() {
        return constraintId;
    }
}
