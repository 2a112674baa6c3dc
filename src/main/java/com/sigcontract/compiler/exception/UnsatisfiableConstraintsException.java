package com.sigcontract.compiler.exception;

/**
 * No input satisfying every constraint was found, so no accepting test case
 * can be built for the signature.
 */
public class UnsatisfiableConstraintsException extends SignatureCompilationException {

    private final int candidatesTried;

    public UnsatisfiableConstraintsException(String functionName, int candidatesTried) {
        super("No input satisfies all constraints of " + functionName + " after " + candidatesTried + " candidates");
        this.candidatesTried = candidatesTried;
    }

    public int getCandidatesTried() {
        return candidatesTried;
    }

    @Override
    public String category() {
        return "unsatisfiable";
    }
}
