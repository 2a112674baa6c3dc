package com.sigcontract.compiler.testgen;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One synthesized test. Concrete cases carry {@code inputs} keyed by source
 * parameter name; property-based cases carry a {@code generator} instead.
 * {@code targetConstraintId} is null for the happy path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestCase(String id, TestCaseKind kind, String targetConstraintId, Map<String, Object> inputs,
                       GeneratorSpec generator, ExpectedOutcome expected, Object referenceOutput, List<String> tags) {

    public TestCase {
        inputs = inputs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        tags = List.copyOf(tags);
    }

    public boolean isConcrete() {
        return inputs != null;
    }

    public TestCase withReferenceOutput(Object output) {
        return new TestCase(id, kind, targetConstraintId, inputs, generator, expected, output, tags);
    }

    public TestCase withId(String newId) {
        return new TestCase(newId, kind, targetConstraintId, inputs, generator, expected, referenceOutput, tags);
    }

    @Override
    public String toString() {
        return id + " " + kind + (targetConstraintId != null ? " [" + targetConstraintId + "]" : "")
                + (inputs != null ? " " + inputs : "") + " -> " + expected;
    }
}
