package com.sigcontract.compiler.annotations;

import java.lang.annotation.*;

/**
 * Precondition enforced by a rendered contract method.
 * Carries the restated constraint and the id of the constraint it came from.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Requires.List.class)
public @interface Requires {
    /**
     * The restated constraint, e.g. {@code 0 <= i < n}.
     */
    String value();

    /**
     * Constraint id such as {@code index.c1}.
     */
    String constraint() default "";

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Requires[] value();
    }
}
