package com.sigcontract.compiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The value a constraint talks about: a parameter, the result, or a position
 * reached from one of those through record fields, sequence elements and
 * present optionals.
 *
 * Serialized as its path.
 */
public sealed interface Subject {

    String RESULT_NAME = "result";

    /**
     * Human-readable path: {@code xs}, {@code result}, {@code m.rows},
     * {@code xs[*]}, {@code opt?}.
     */
    @JsonValue
    String path();

    /**
     * The parameter (or {@code result}) this subject hangs off.
     */
    String root();

    /**
     * True if some step between the root and this subject is a sequence element.
     */
    default boolean underElement() {
        Subject current = this;
        while (current != null) {
            if (current instanceof ElementOf) {
                return true;
            }
            current = current.owner();
        }
        return false;
    }

    /**
     * The enclosing subject, or null for a root.
     */
    Subject owner();

    record Param(String name) implements Subject {
        public String path() {
            return name;
        }

        public String root() {
            return name;
        }

        public Subject owner() {
            return null;
        }
    }

    record Result() implements Subject {
        public String path() {
            return RESULT_NAME;
        }

        public String root() {
            return RESULT_NAME;
        }

        public Subject owner() {
            return null;
        }
    }

    record FieldOf(Subject owner, String field) implements Subject {
        public String path() {
            return owner.path() + "." + field;
        }

        public String root() {
            return owner.root();
        }
    }

    record ElementOf(Subject owner) implements Subject {
        public String path() {
            return owner.path() + "[*]";
        }

        public String root() {
            return owner.root();
        }
    }

    record PresentOf(Subject owner) implements Subject {
        public String path() {
            return owner.path() + "?";
        }

        public String root() {
            return owner.root();
        }
    }
}
