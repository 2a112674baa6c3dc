package com.sigcontract.compiler.testgen;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TestCaseKind {
    @JsonProperty("preconditionViolation") PRECONDITION_VIOLATION,
    @JsonProperty("boundary") BOUNDARY,
    @JsonProperty("happyPath") HAPPY_PATH,
    @JsonProperty("propertyBased") PROPERTY_BASED,
    @JsonProperty("differential") DIFFERENTIAL;

    /**
     * True for cases whose inputs satisfy every precondition.
     */
    public boolean expectsAcceptance() {
        return this != PRECONDITION_VIOLATION;
    }
}
