package com.sigcontract.compiler.model;

/**
 * The closed set of value-level facts the extractor can produce.
 */
public enum ConstraintKind {
    NONNEGATIVE("Nonnegative"),
    INDEX_BOUND("IndexBound"),
    LENGTH_EQUALS("LengthEquals"),
    LENGTH_AT_LEAST("LengthAtLeast"),
    PREDICATE_HOLDS("PredicateHolds"),
    DISJOINT("Disjoint");

    private final String displayName;

    ConstraintKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * True for kinds whose check involves arithmetic over other values.
     */
    public boolean isRelational() {
        return this == INDEX_BOUND || this == LENGTH_EQUALS || this == LENGTH_AT_LEAST;
    }
}
