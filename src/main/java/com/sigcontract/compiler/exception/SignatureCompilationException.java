package com.sigcontract.compiler.exception;

/**
 * Base type for failures that are fatal for one signature but never for a batch.
 */
public abstract class SignatureCompilationException extends RuntimeException {

    protected SignatureCompilationException(String message) {
        super(message);
    }

    /**
     * Short, stable label used in batch reports, e.g. {@code parse}.
     */
    public abstract String category();
}
