package com.sigcontract.compiler.exception;

/**
 * Malformed signature text. No partial result is ever returned alongside it.
 */
public class SignatureParseException extends SignatureCompilationException {

    private final int position;
    private final String expected;
    private final String found;

    public SignatureParseException(int position, String expected, String found) {
        super("Parse error at position " + position + ": expected " + expected + " but found " + found);
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    @Override
    public String category() {
        return "parse";
    }
}
