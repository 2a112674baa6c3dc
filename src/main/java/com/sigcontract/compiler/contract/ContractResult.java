package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.exception.ContractViolationException;
import com.sigcontract.compiler.exception.ContractViolationException.Phase;

/**
 * Outcome of a guarded call under the return-result assertion style: either
 * the function's value or the violation that rejected the call.
 */
public record ContractResult(boolean success, Object value, String constraintId, Phase phase, String message) {

    public static ContractResult success(Object value) {
        return new ContractResult(true, value, null, null, null);
    }

    public static ContractResult violation(ContractViolationException violation) {
        return new ContractResult(false, null, violation.getConstraintId(), violation.getPhase(), violation.getMessage());
    }

    public boolean isViolation() {
        return !success;
    }

    /**
     * The value, or the violation rethrown as an exception.
     */
    public Object orThrow() {
        if (!success) {
            throw new ContractViolationException(constraintId, phase, message);
        }
        return value;
    }
}
