package com.sigcontract.compiler.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.sigcontract.compiler.exception.ContractViolationException.Phase;
import com.sigcontract.compiler.model.ConstraintKind;
import com.sigcontract.compiler.model.Expr;

import java.util.List;

/**
 * One runtime check of a synthesized contract. Every check carries the id of
 * the constraint it enforces.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "check")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Check.Guard.class, name = "guard"),
        @JsonSubTypes.Type(value = Check.Branch.class, name = "branch")
})
public sealed interface Check {

    String constraintId();

    Phase phase();

    /**
     * A boolean condition that must hold; {@code failureMessage} is raised otherwise.
     */
    record Guard(String constraintId, ConstraintKind kind, Phase phase, Expr condition, String failureMessage)
            implements Check {
    }

    /**
     * Case analysis over an optional value. The present case runs the checks
     * of the constraints nested under the disjoint constraint. {@code fallback}
     * is null when the target enforces exhaustiveness itself.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Branch(String constraintId, Phase phase, Expr scrutinee, List<BranchCase> cases, String fallback)
            implements Check {

        public Branch {
            cases = List.copyOf(cases);
        }

        public BranchCase caseFor(Tag tag) {
            for (BranchCase branchCase : cases) {
                if (branchCase.tag() == tag) {
                    return branchCase;
                }
            }
            return null;
        }
    }

    enum Tag {
        ABSENT, PRESENT
    }

    record BranchCase(Tag tag, List<Check> checks) {
        public BranchCase {
            checks = List.copyOf(checks);
        }
    }
}
