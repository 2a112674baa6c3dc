package com.sigcontract.compiler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.*;
import java.util.stream.Collectors;

/**
 * All constraints extracted from one signature, with the symbol bindings they
 * were resolved against and the relation graph used to order checks.
 */
public final class ConstraintModel {

    private final Signature signature;
    private final List<Constraint> constraints;
    private final Map<String, SymbolBinding> bindings;
    private final RelationGraph relationGraph;

    public ConstraintModel(Signature signature, List<Constraint> constraints, Map<String, SymbolBinding> bindings) {
        this.signature = Objects.requireNonNull(signature, "signature");
        this.constraints = List.copyOf(constraints);
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.relationGraph = RelationGraph.build(this.constraints);
    }

    @JsonIgnore
    public Signature getSignature() {
        return signature;
    }

    public String getFunctionName() {
        return signature.getName();
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public Map<String, SymbolBinding> getBindings() {
        return bindings;
    }

    @JsonIgnore
    public RelationGraph getRelationGraph() {
        return relationGraph;
    }

    /**
     * True when the signature carries no value-level facts at all. This is an
     * explicit outcome (e.g. only unconstrained primitives), never a fallback.
     */
    @JsonIgnore
    public boolean isUnconstrained() {
        return constraints.isEmpty();
    }

    public Optional<Constraint> find(String constraintId) {
        return constraints.stream().filter(c -> c.getId().equals(constraintId)).findFirst();
    }

    public Constraint get(String constraintId) {
        return find(constraintId)
                .orElseThrow(() -> new NoSuchElementException("No constraint " + constraintId + " in " + getFunctionName()));
    }

    /**
     * Top-level constraints of the given origin, in declaration order.
     */
    public List<Constraint> topLevel(Constraint.Origin origin) {
        return constraints.stream()
                .filter(c -> !c.isNested() && c.getOrigin() == origin)
                .collect(Collectors.toList());
    }

    /**
     * Constraints nested in the present branch of the given disjoint constraint.
     */
    public List<Constraint> children(String parentId) {
        return constraints.stream()
                .filter(c -> parentId.equals(c.getParentId()))
                .collect(Collectors.toList());
    }

    public List<Constraint> ofKind(ConstraintKind kind) {
        return constraints.stream().filter(c -> c.getKind() == kind).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstraintModel)) return false;
        ConstraintModel that = (ConstraintModel) o;
        return signature.render().equals(that.signature.render())
                && constraints.equals(that.constraints)
                && bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature.render(), constraints, bindings);
    }

    @Override
    public String toString() {
        return getFunctionName() + constraints.stream().map(Constraint::describe).collect(Collectors.toList());
    }
}
