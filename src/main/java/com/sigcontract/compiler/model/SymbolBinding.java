package com.sigcontract.compiler.model;

/**
 * How a symbol used in a bound or length expression obtains its value.
 *
 * @param symbol the name as written in the signature
 * @param kind   how the symbol is established
 * @param source the input the value is read from
 * @param value  the symbol's value expressed over inputs
 */
public record SymbolBinding(String symbol, Kind kind, Subject source, Expr value) {

    public enum Kind {
        /** An integer parameter. */
        PARAMETER,
        /** An integer field of an enclosing record. */
        FIELD,
        /** An implicit symbol solved from a sequence length, e.g. {@code m := len(xs) - n}. */
        LENGTH_WITNESS
    }

    public String describe() {
        return symbol + " := " + value.render();
    }
}
