package com.sigcontract.compiler.parser;

import com.sigcontract.compiler.exception.SignatureParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits signature text into tokens. {@code --} starts a comment running to
 * the end of the line.
 */
class SignatureLexer {

    private final String text;
    private int pos = 0;

    SignatureLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Kind.EOF, "", text.length()));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("--", pos)) {
                int newline = text.indexOf('\n', pos);
                pos = newline < 0 ? text.length() : newline + 1;
            } else {
                return;
            }
        }
    }

    private Token next() {
        int start = pos;
        char c = text.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return new Token(Token.Kind.IDENT, text.substring(start, pos), start);
        }
        if (Character.isDigit(c)) {
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            return new Token(Token.Kind.INT, text.substring(start, pos), start);
        }

        // Two-character operators first
        if (pos + 1 < text.length()) {
            String two = text.substring(pos, pos + 2);
            Token.Kind kind = switch (two) {
                case "->" -> Token.Kind.ARROW;
                case "<=" -> Token.Kind.LE;
                case ">=" -> Token.Kind.GE;
                case "==" -> Token.Kind.EQ;
                case "!=" -> Token.Kind.NE;
                case "&&" -> Token.Kind.AND;
                case "||" -> Token.Kind.OR;
                default -> null;
            };
            if (kind != null) {
                pos += 2;
                return new Token(kind, two, start);
            }
        }

        Token.Kind kind = switch (c) {
            case '(' -> Token.Kind.LPAREN;
            case ')' -> Token.Kind.RPAREN;
            case '{' -> Token.Kind.LBRACE;
            case '}' -> Token.Kind.RBRACE;
            case ',' -> Token.Kind.COMMA;
            case ':' -> Token.Kind.COLON;
            case '|' -> Token.Kind.PIPE;
            case '.' -> Token.Kind.DOT;
            case '+' -> Token.Kind.PLUS;
            case '-' -> Token.Kind.MINUS;
            case '*' -> Token.Kind.STAR;
            case '<' -> Token.Kind.LT;
            case '>' -> Token.Kind.GT;
            case '!' -> Token.Kind.BANG;
            default -> throw new SignatureParseException(start, "a token", "'" + c + "'");
        };
        pos++;
        return new Token(kind, String.valueOf(c), start);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }
}
