package com.sigcontract.compiler.exception;

/**
 * A bound or length expression refers to a symbol that no parameter, record
 * field or sequence length establishes.
 */
public class UnresolvedBoundException extends SignatureCompilationException {

    private final String symbol;
    private final String expression;

    public UnresolvedBoundException(String symbol, String expression, String context) {
        super("Unresolved symbol '" + symbol + "' in " + expression + " (" + context + ")");
        this.symbol = symbol;
        this.expression = expression;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String category() {
        return "unresolved-bound";
    }
}
