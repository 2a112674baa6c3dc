package com.sigcontract.compiler.oracle;

public enum Verdict {
    MATCH,
    VALUE_MISMATCH,
    REFERENCE_CRASHED,
    GENERATED_CRASHED,
    TIMEOUT,
    /** A violation case was rejected, as it should be. */
    REJECTED,
    /** A violation case was not rejected. */
    NOT_REJECTED;

    public boolean isPass() {
        return this == MATCH || this == REJECTED;
    }
}
