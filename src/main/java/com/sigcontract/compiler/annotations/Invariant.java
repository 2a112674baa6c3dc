package com.sigcontract.compiler.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Record invariant. Placed on the contracts class for every record type
 * it checks, and on the generated method that checks one record value.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Repeatable(Invariant.List.class)
public @interface Invariant {
    String value();

    /**
     * Name of the record type the invariant belongs to; empty for anonymous records.
     */
    String record() default "";

    String constraint() default "";

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target({ElementType.TYPE, ElementType.METHOD})
    @interface List {
        Invariant[] value();
    }
}
