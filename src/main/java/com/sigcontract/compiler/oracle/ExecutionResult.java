package com.sigcontract.compiler.oracle;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What one invocation of an implementation produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(Status status, Object value, String message) {

    public enum Status {
        /** Returned a value. */
        RETURNED,
        /** Signalled an explicit rejection of its input. */
        REJECTED,
        /** Failed in any other way. */
        CRASHED
    }

    public static ExecutionResult returned(Object value) {
        return new ExecutionResult(Status.RETURNED, value, null);
    }

    public static ExecutionResult rejected(String message) {
        return new ExecutionResult(Status.REJECTED, null, message);
    }

    public static ExecutionResult crashed(String message) {
        return new ExecutionResult(Status.CRASHED, null, message);
    }

    public boolean returnedValue() {
        return status == Status.RETURNED;
    }
}
