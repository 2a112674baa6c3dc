package com.sigcontract.compiler.model;

import java.util.List;

/**
 * One node of the closed type vocabulary. Child types are referenced by their
 * index in the owning {@link TypeArena}, never owned directly, so shared
 * substructure is stored once.
 */
public sealed interface TypeNode {

    /**
     * Primitive kinds. {@code TYPE_VARIABLE} is an element type such as {@code T}.
     */
    enum PrimitiveKind {
        INTEGER, BOOLEAN, TEXT, DOUBLE, TYPE_VARIABLE
    }

    /**
     * Unconstrained primitive. {@code name} is the variable name for type variables,
     * the canonical keyword otherwise.
     */
    record Primitive(PrimitiveKind kind, String name) implements TypeNode {
    }

    /** The natural-number type. */
    record NonNegativeInt() implements TypeNode {
    }

    /** An index strictly less than {@code bound}. */
    record BoundedIndex(Expr bound) implements TypeNode {
    }

    record SizedSequence(int element, Expr length) implements TypeNode {
    }

    record OptionalType(int inner) implements TypeNode {
    }

    /** A value of {@code base} satisfying {@code predicate}, which names the value {@link Expr#SELF}. */
    record Refinement(int base, Expr predicate) implements TypeNode {
    }

    /** A record with ordered fields; later fields may refer to earlier integer fields. */
    record RecordType(String name, List<RecordField> fields) implements TypeNode {
        public RecordType {
            fields = List.copyOf(fields);
        }
    }

    record RecordField(String name, int type) {
    }
}
