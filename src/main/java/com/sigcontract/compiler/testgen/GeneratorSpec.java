package com.sigcontract.compiler.testgen;

import com.sigcontract.compiler.model.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generator description of a property-based case: a closed range per input
 * dimension, the invariant to check and how many seeded trials to run.
 *
 * Dimensions are named by the input path they drive: integer parameters and
 * fields ({@code n}, {@code m.rows}), length symbols ({@code m}), element
 * values ({@code xs[*]}), optional presence ({@code opt?}, 0 or 1) and
 * length offsets ({@code delta(xs)}).
 */
public record GeneratorSpec(Map<String, Range> ranges, Property property, Expr invariant, int trials, long seed) {

    public enum Property {
        /** Inputs breaking the invariant are rejected, all others accepted. */
        INPUT_ACCEPTANCE,
        /** Results of accepted inputs satisfy the invariant. */
        RESULT_INVARIANT
    }

    public record Range(long min, long max) {
        public Range {
            if (min > max) {
                throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
            }
        }
    }

    public GeneratorSpec {
        ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }
}
