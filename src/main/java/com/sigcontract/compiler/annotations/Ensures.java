package com.sigcontract.compiler.annotations;

import java.lang.annotation.*;

/**
 * Postcondition checked on the value a rendered contract method returns.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Ensures.List.class)
public @interface Ensures {
    /**
     * The restated constraint over {@code result}.
     */
    String value();

    String constraint() default "";

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Ensures[] value();
    }
}
