package com.sigcontract.compiler.model;

import java.util.*;

/**
 * Interning store for type nodes and expressions.
 *
 * Structurally equal nodes receive the same index, so a length expression used
 * by two parameters is a single node referenced twice. The arena is append-only
 * while a signature is parsed and is handed out read-only afterwards.
 */
public class TypeArena {

    private final List<TypeNode> nodes = new ArrayList<>();
    private final Map<TypeNode, Integer> index = new HashMap<>();
    private final Map<Expr, Expr> expressions = new HashMap<>();
    private boolean frozen = false;

    /**
     * Returns the index of the node, adding it if no equal node exists.
     */
    public int intern(TypeNode node) {
        Objects.requireNonNull(node, "node");
        Integer existing = index.get(node);
        if (existing != null) {
            return existing;
        }
        checkMutable();
        nodes.add(node);
        int id = nodes.size() - 1;
        index.put(node, id);
        return id;
    }

    /**
     * Returns the canonical instance of an expression.
     */
    public Expr intern(Expr expr) {
        Expr existing = expressions.get(expr);
        if (existing != null) {
            return existing;
        }
        checkMutable();
        expressions.put(expr, expr);
        return expr;
    }

    public TypeNode get(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("No type node " + id + " in arena of size " + nodes.size());
        }
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Renders the type at {@code id} back to surface syntax.
     */
    public String render(int id) {
        TypeNode node = get(id);
        if (node instanceof TypeNode.Primitive p) {
            return p.name();
        } else if (node instanceof TypeNode.NonNegativeInt) {
            return "Nat";
        } else if (node instanceof TypeNode.BoundedIndex b) {
            return "Fin(" + b.bound().render() + ")";
        } else if (node instanceof TypeNode.SizedSequence s) {
            return "SizedSequence(" + render(s.element()) + ", " + s.length().render() + ")";
        } else if (node instanceof TypeNode.OptionalType o) {
            return "Optional(" + render(o.inner()) + ")";
        } else if (node instanceof TypeNode.Refinement r) {
            return "Refinement(" + render(r.base()) + ", " + r.predicate().render() + ")";
        } else if (node instanceof TypeNode.RecordType r) {
            String prefix = r.name() != null ? "Record " + r.name() + " {" : "Record {";
            StringJoiner joiner = new StringJoiner(", ", prefix, "}");
            for (TypeNode.RecordField field : r.fields()) {
                joiner.add(field.name() + ": " + render(field.type()));
            }
            return joiner.toString();
        }
        throw new IllegalStateException("Unknown type node: " + node);
    }

    /**
     * Seals the arena; interning an unseen node afterwards is an error.
     */
    public void freeze() {
        this.frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Type arena is frozen");
        }
    }
}
