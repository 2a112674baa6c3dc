package com.sigcontract.compiler.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A synthesized runtime check rejected a value. This is the intended,
 * user-facing outcome for bad input, not a defect.
 */
public class ContractViolationException extends RuntimeException {

    public enum Phase {
        PRECONDITION, POSTCONDITION, INVARIANT;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final String constraintId;
    private final Phase phase;

    public ContractViolationException(String constraintId, Phase phase, String message) {
        super(message);
        this.constraintId = constraintId;
        this.phase = phase;
    }

    /**
     * One exception for several failed checks: the first failure's id and
     * phase, with every message joined by {@code "; "}.
     */
    public static ContractViolationException aggregate(List<ContractViolationException> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("No failures to aggregate");
        }
        ContractViolationException first = failures.get(0);
        if (failures.size() == 1) {
            return first;
        }
        String message = failures.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
        return new ContractViolationException(first.getConstraintId(), first.getPhase(), message);
    }

    public String getConstraintId() {
        return constraintId;
    }

    public Phase getPhase() {
        return phase;
    }
}
