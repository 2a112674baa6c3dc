package com.sigcontract.compiler.testgen;

import java.util.Map;

/**
 * Source of expected outputs for accepted test inputs.
 */
@FunctionalInterface
public interface ReferenceImplementation {

    /**
     * @throws Exception if the reference cannot produce an output for the inputs
     */
    Object apply(Map<String, Object> arguments) throws Exception;
}
