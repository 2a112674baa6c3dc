package com.sigcontract.compiler.exception;

/**
 * A type expression outside the supported vocabulary. The raw text is carried
 * verbatim so the caller sees exactly what was rejected.
 */
public class UnsupportedTypeException extends SignatureCompilationException {

    private final String rawText;

    public UnsupportedTypeException(String rawText) {
        this(rawText, "Unsupported type expression: " + rawText);
    }

    public UnsupportedTypeException(String rawText, String message) {
        super(message);
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public String category() {
        return "unsupported-type";
    }
}
