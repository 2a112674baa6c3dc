package com.sigcontract.compiler.processor;

import java.util.Objects;

/**
 * One signature to compile and where it came from, e.g. {@code lists.sig:3}.
 */
public record SignatureSource(String location, String text) {

    public SignatureSource {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(text, "text");
    }

    public static SignatureSource inline(String text) {
        return new SignatureSource("<inline>", text);
    }
}
