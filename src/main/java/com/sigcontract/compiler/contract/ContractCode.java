package com.sigcontract.compiler.contract;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sigcontract.compiler.model.Exprs;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.model.Subject;
import com.sigcontract.compiler.util.JsonSupport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Target-independent contract for one function: guarded entry point name,
 * ordered precondition and postcondition checks and record invariants.
 */
@JsonPropertyOrder(alphabetic = true)
public final class ContractCode {

    /**
     * Invariant checks of one record type at one place in the signature.
     * Checks read the record through the variable {@link #SELF}.
     */
    public record RecordInvariant(String recordName, Subject site, List<Check> checks) {
        public static final String SELF = "self";

        public RecordInvariant {
            checks = List.copyOf(checks);
        }

        public boolean onResult() {
            return site.root().equals(Subject.RESULT_NAME);
        }

        /**
         * Variables the checks read besides {@link #SELF}, in name order.
         */
        public List<String> outerVariables() {
            Set<String> reads = new TreeSet<>();
            checks.forEach(check -> collectVariables(check, reads));
            reads.remove(SELF);
            return List.copyOf(reads);
        }
    }

    /**
     * One entry check: either a precondition or the invariant set of an
     * argument record site. Exactly one of the two is set.
     */
    public record EntryStep(Check precondition, RecordInvariant invariant) {
    }

    private final String sourceName;
    private final String functionName;
    private final Map<String, String> parameterNames;
    private final String resultName;
    private final Signature.Visibility visibility;
    private final Signature.Totality totality;
    private final EmissionProfile profile;
    private final List<Check> preconditions;
    private final List<Check> postconditions;
    private final List<RecordInvariant> invariants;

    public ContractCode(String sourceName, String functionName, Map<String, String> parameterNames, String resultName,
                        Signature.Visibility visibility, Signature.Totality totality, EmissionProfile profile,
                        List<Check> preconditions, List<Check> postconditions, List<RecordInvariant> invariants) {
        this.sourceName = Objects.requireNonNull(sourceName);
        this.functionName = Objects.requireNonNull(functionName);
        this.parameterNames = new LinkedHashMap<>(parameterNames);
        this.resultName = resultName;
        this.visibility = visibility;
        this.totality = totality;
        this.profile = profile;
        this.preconditions = List.copyOf(preconditions);
        this.postconditions = List.copyOf(postconditions);
        this.invariants = List.copyOf(invariants);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Name of the guarded entry point after the profile's naming conventions.
     */
    public String getFunctionName() {
        return functionName;
    }

    /**
     * Source parameter name to emitted name, in declaration order.
     */
    public Map<String, String> getParameterNames() {
        return parameterNames;
    }

    public String getResultName() {
        return resultName;
    }

    public Signature.Visibility getVisibility() {
        return visibility;
    }

    public Signature.Totality getTotality() {
        return totality;
    }

    public EmissionProfile getProfile() {
        return profile;
    }

    public List<Check> getPreconditions() {
        return preconditions;
    }

    public List<Check> getPostconditions() {
        return postconditions;
    }

    public List<RecordInvariant> getInvariants() {
        return invariants;
    }

    /**
     * Preconditions and argument invariant sets in the order they are
     * checked on entry. An invariant set runs right after the last
     * precondition that reads only variables the invariant also reads, so
     * a bound such as {@code n >= 0} is checked before a record field whose
     * length is {@code n}.
     */
    public List<EntryStep> entrySteps() {
        List<List<RecordInvariant>> slots = new ArrayList<>();
        for (int i = 0; i <= preconditions.size(); i++) {
            slots.add(new ArrayList<>());
        }
        for (RecordInvariant invariant : invariants) {
            if (invariant.onResult()) {
                continue;
            }
            List<String> reads = invariant.outerVariables();
            int slot = 0;
            for (int i = 0; i < preconditions.size(); i++) {
                Set<String> guarded = new HashSet<>();
                collectVariables(preconditions.get(i), guarded);
                if (!guarded.isEmpty() && reads.containsAll(guarded)) {
                    slot = i + 1;
                }
            }
            slots.get(slot).add(invariant);
        }
        List<EntryStep> steps = new ArrayList<>();
        slots.get(0).forEach(inv -> steps.add(new EntryStep(null, inv)));
        for (int i = 0; i < preconditions.size(); i++) {
            steps.add(new EntryStep(preconditions.get(i), null));
            slots.get(i + 1).forEach(inv -> steps.add(new EntryStep(null, inv)));
        }
        return steps;
    }

    private static void collectVariables(Check check, Set<String> out) {
        if (check instanceof Check.Guard guard) {
            out.addAll(Exprs.freeVariables(guard.condition()));
        } else if (check instanceof Check.Branch branch) {
            out.addAll(Exprs.freeVariables(branch.scrutinee()));
            branch.cases().forEach(c -> c.checks().forEach(nested -> collectVariables(nested, out)));
        }
    }

    /**
     * Ids of every constraint enforced somewhere in this contract, nested
     * branch checks included.
     */
    public List<String> enforcedConstraintIds() {
        List<String> ids = new ArrayList<>();
        Stream.concat(Stream.concat(preconditions.stream(), postconditions.stream()),
                        invariants.stream().flatMap(inv -> inv.checks().stream()))
                .forEach(check -> collectIds(check, ids));
        return ids;
    }

    private static void collectIds(Check check, List<String> ids) {
        if (!ids.contains(check.constraintId())) {
            ids.add(check.constraintId());
        }
        if (check instanceof Check.Branch branch) {
            branch.cases().forEach(c -> c.checks().forEach(nested -> collectIds(nested, ids)));
        }
    }

    /**
     * Deterministic JSON form: identical contracts produce identical text.
     */
    public String toJson() {
        return JsonSupport.toJson(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContractCode)) return false;
        ContractCode that = (ContractCode) o;
        return sourceName.equals(that.sourceName) && functionName.equals(that.functionName)
                && parameterNames.equals(that.parameterNames) && Objects.equals(resultName, that.resultName)
                && visibility == that.visibility && totality == that.totality
                && Objects.equals(profile, that.profile) && preconditions.equals(that.preconditions)
                && postconditions.equals(that.postconditions) && invariants.equals(that.invariants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, functionName, parameterNames, preconditions, postconditions, invariants);
    }

    @Override
    public String toString() {
        return functionName + "(" + String.join(", ", parameterNames.values()) + ") pre="
                + preconditions.stream().map(Check::constraintId).collect(Collectors.toList())
                + " post=" + postconditions.stream().map(Check::constraintId).collect(Collectors.toList());
    }
}
