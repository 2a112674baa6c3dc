package com.sigcontract.compiler.model;

import java.util.*;

/**
 * A parsed function signature. Immutable once the parser returns it.
 */
public final class Signature {

    public enum Visibility {
        PUBLIC, PRIVATE
    }

    public enum Totality {
        TOTAL, POSSIBLY_PARTIAL
    }

    /**
     * A named, typed parameter. {@code type} indexes the signature's arena.
     */
    public record Parameter(String name, int type) {
    }

    private final String name;
    private final List<Parameter> parameters;
    private final int returnType;
    private final Visibility visibility;
    private final Totality totality;
    private final TypeArena arena;
    private final String sourceText;

    public Signature(String name, List<Parameter> parameters, int returnType,
                     Visibility visibility, Totality totality, TypeArena arena, String sourceText) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.totality = Objects.requireNonNull(totality, "totality");
        this.arena = Objects.requireNonNull(arena, "arena");
        this.sourceText = sourceText;
        arena.freeze();
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Optional<Parameter> getParameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    public int getReturnType() {
        return returnType;
    }

    public TypeNode typeOf(int id) {
        return arena.get(id);
    }

    /**
     * The type with any refinement layers peeled off.
     */
    public TypeNode stripRefinements(int id) {
        TypeNode node = arena.get(id);
        while (node instanceof TypeNode.Refinement refinement) {
            node = arena.get(refinement.base());
        }
        return node;
    }

    /**
     * True for types whose values are integers and may name a length or bound.
     */
    public boolean isIntegral(int id) {
        TypeNode node = stripRefinements(id);
        return node instanceof TypeNode.NonNegativeInt
                || node instanceof TypeNode.BoundedIndex
                || (node instanceof TypeNode.Primitive p && p.kind() == TypeNode.PrimitiveKind.INTEGER);
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Totality getTotality() {
        return totality;
    }

    public TypeArena getArena() {
        return arena;
    }

    public String getSourceText() {
        return sourceText;
    }

    /**
     * Canonical rendering, e.g. {@code take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)}.
     */
    public String render() {
        StringJoiner params = new StringJoiner(", ", name + "(", ")");
        for (Parameter parameter : parameters) {
            params.add(parameter.name() + ": " + arena.render(parameter.type()));
        }
        String prefix = visibility == Visibility.PRIVATE ? "private " : "";
        if (totality == Totality.POSSIBLY_PARTIAL) {
            prefix += "partial ";
        }
        return prefix + params + " -> " + arena.render(returnType);
    }

    @Override
    public String toString() {
        return render();
    }
}
