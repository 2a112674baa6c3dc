package com.sigcontract.compiler.parser;

/**
 * A lexical token of the signature language.
 *
 * @param kind     token kind
 * @param text     exact source text
 * @param position zero-based character offset in the signature text
 */
record Token(Kind kind, String text, int position) {

    enum Kind {
        IDENT, INT,
        LPAREN, RPAREN, LBRACE, RBRACE, COMMA, COLON, PIPE, DOT, ARROW,
        PLUS, MINUS, STAR,
        LT, LE, GT, GE, EQ, NE, AND, OR, BANG,
        EOF
    }

    int end() {
        return position + text.length();
    }

    boolean is(Kind expectedKind) {
        return kind == expectedKind;
    }

    boolean isIdent(String name) {
        return kind == Kind.IDENT && text.equals(name);
    }

    /**
     * Description used in parse errors.
     */
    String describe() {
        return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
}
