package com.sigcontract.compiler.parser;

import com.sigcontract.compiler.exception.SignatureParseException;
import com.sigcontract.compiler.exception.UnsupportedTypeException;
import com.sigcontract.compiler.model.Expr;
import com.sigcontract.compiler.model.Exprs;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.model.Signature.Parameter;
import com.sigcontract.compiler.model.Signature.Totality;
import com.sigcontract.compiler.model.Signature.Visibility;
import com.sigcontract.compiler.model.TypeArena;
import com.sigcontract.compiler.model.TypeNode;
import com.sigcontract.compiler.model.TypeNode.PrimitiveKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for function signatures such as
 * {@code take(n: Nat, xs: SizedSequence(T, n + m)) -> SizedSequence(T, n)}.
 *
 * The parser is stateless; each call to {@link #parse(String)} works on its own
 * token stream, so one instance may be shared between threads.
 */
public class SignatureParser {

    private static final Logger logger = LoggerFactory.getLogger(SignatureParser.class);

    private static final Set<String> MODIFIERS = Set.of("public", "private", "export", "total", "partial", "covering");
    private static final Pattern TYPE_VARIABLE = Pattern.compile("[A-Z][0-9]*");

    /**
     * Parses one signature.
     *
     * @throws SignatureParseException  on malformed text
     * @throws UnsupportedTypeException on a type outside the supported vocabulary
     */
    public Signature parse(String text) {
        Objects.requireNonNull(text, "text");
        Run run = new Run(text, new SignatureLexer(text).tokenize());
        Signature signature = run.signature();
        logger.debug("Parsed signature: {}", signature.render());
        return signature;
    }

    /**
     * State of a single parse.
     */
    private static final class Run {
        private final String text;
        private final List<Token> tokens;
        private final TypeArena arena = new TypeArena();
        private int index = 0;

        Run(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        // ==================== Signature ====================

        Signature signature() {
            Visibility visibility = Visibility.PUBLIC;
            Totality totality = Totality.TOTAL;

            // A modifier keyword directly followed by '(' is the function name itself
            while (peek().is(Token.Kind.IDENT) && MODIFIERS.contains(peek().text())
                    && !peekAhead(1).is(Token.Kind.LPAREN)) {
                switch (advance().text()) {
                    case "private" -> visibility = Visibility.PRIVATE;
                    case "public", "export" -> visibility = Visibility.PUBLIC;
                    case "partial", "covering" -> totality = Totality.POSSIBLY_PARTIAL;
                    default -> totality = Totality.TOTAL;
                }
            }

            String name = expect(Token.Kind.IDENT, "function name").text();
            expect(Token.Kind.LPAREN, "'('");

            List<Parameter> parameters = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            if (!peek().is(Token.Kind.RPAREN)) {
                do {
                    Token paramName = expect(Token.Kind.IDENT, "parameter name");
                    if (!seen.add(paramName.text()) || paramName.text().equals("result")) {
                        throw new SignatureParseException(paramName.position(),
                                "a unique parameter name", paramName.describe());
                    }
                    expect(Token.Kind.COLON, "':'");
                    parameters.add(new Parameter(paramName.text(), type()));
                } while (accept(Token.Kind.COMMA));
            }
            expect(Token.Kind.RPAREN, "')' or ','");
            expect(Token.Kind.ARROW, "'->'");
            int returnType = type();
            expect(Token.Kind.EOF, "end of signature");

            return new Signature(name, parameters, returnType, visibility, totality, arena, text);
        }

        // ==================== Types ====================

        int type() {
            Token start = peek();
            if (accept(Token.Kind.LBRACE)) {
                return refinementBinder();
            }
            Token head = expect(Token.Kind.IDENT, "a type");
            switch (head.text()) {
                case "Int", "Integer":
                    return arena.intern(new TypeNode.Primitive(PrimitiveKind.INTEGER, "Int"));
                case "Bool", "Boolean":
                    return arena.intern(new TypeNode.Primitive(PrimitiveKind.BOOLEAN, "Bool"));
                case "String", "Text":
                    return arena.intern(new TypeNode.Primitive(PrimitiveKind.TEXT, "String"));
                case "Double":
                    return arena.intern(new TypeNode.Primitive(PrimitiveKind.DOUBLE, "Double"));
                case "Nat", "NonNegativeInt":
                    return arena.intern(new TypeNode.NonNegativeInt());
                case "Fin", "BoundedIndex": {
                    expect(Token.Kind.LPAREN, "'('");
                    Expr bound = expression();
                    expect(Token.Kind.RPAREN, "')'");
                    return arena.intern(new TypeNode.BoundedIndex(arena.intern(bound)));
                }
                case "SizedSequence": {
                    expect(Token.Kind.LPAREN, "'('");
                    int element = type();
                    expect(Token.Kind.COMMA, "','");
                    Expr length = expression();
                    expect(Token.Kind.RPAREN, "')'");
                    return arena.intern(new TypeNode.SizedSequence(element, arena.intern(length)));
                }
                case "Vect": {
                    expect(Token.Kind.LPAREN, "'('");
                    Expr length = expression();
                    expect(Token.Kind.COMMA, "','");
                    int element = type();
                    expect(Token.Kind.RPAREN, "')'");
                    return arena.intern(new TypeNode.SizedSequence(element, arena.intern(length)));
                }
                case "Optional", "Maybe": {
                    expect(Token.Kind.LPAREN, "'('");
                    int inner = type();
                    expect(Token.Kind.RPAREN, "')'");
                    return arena.intern(new TypeNode.OptionalType(inner));
                }
                case "Refinement": {
                    expect(Token.Kind.LPAREN, "'('");
                    int base = type();
                    expect(Token.Kind.COMMA, "','");
                    Expr predicate = expression();
                    expect(Token.Kind.RPAREN, "')'");
                    return arena.intern(new TypeNode.Refinement(base, arena.intern(predicate)));
                }
                case "Record":
                    return record();
                default:
                    if (TYPE_VARIABLE.matcher(head.text()).matches()) {
                        return arena.intern(new TypeNode.Primitive(PrimitiveKind.TYPE_VARIABLE, head.text()));
                    }
                    throw new UnsupportedTypeException(rawTypeText(start));
            }
        }

        // '{' binder ':' type '|' predicate '}' with the opening brace consumed
        private int refinementBinder() {
            String binder = expect(Token.Kind.IDENT, "refinement binder").text();
            expect(Token.Kind.COLON, "':'");
            int base = type();
            expect(Token.Kind.PIPE, "'|'");
            Expr predicate = expression();
            expect(Token.Kind.RBRACE, "'}'");
            Expr normalized = Exprs.substitute(predicate, Map.of(binder, Expr.var(Expr.SELF)));
            return arena.intern(new TypeNode.Refinement(base, arena.intern(normalized)));
        }

        private int record() {
            String name = peek().is(Token.Kind.IDENT) ? advance().text() : null;
            expect(Token.Kind.LBRACE, "'{'");
            List<TypeNode.RecordField> fields = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            do {
                Token fieldName = expect(Token.Kind.IDENT, "field name");
                if (!seen.add(fieldName.text())) {
                    throw new SignatureParseException(fieldName.position(), "a unique field name", fieldName.describe());
                }
                expect(Token.Kind.COLON, "':'");
                fields.add(new TypeNode.RecordField(fieldName.text(), type()));
            } while (accept(Token.Kind.COMMA));
            expect(Token.Kind.RBRACE, "'}' or ','");
            return arena.intern(new TypeNode.RecordType(name, fields));
        }

        /**
         * Consumes the rest of an unknown type application and returns its source text.
         */
        private String rawTypeText(Token start) {
            int end = tokens.get(index - 1).end();
            if (peek().is(Token.Kind.LPAREN) || peek().is(Token.Kind.LBRACE)) {
                int depth = 0;
                do {
                    Token token = advance();
                    if (token.is(Token.Kind.LPAREN) || token.is(Token.Kind.LBRACE)) {
                        depth++;
                    } else if (token.is(Token.Kind.RPAREN) || token.is(Token.Kind.RBRACE)) {
                        depth--;
                    }
                    end = token.end();
                } while (depth > 0 && !peek().is(Token.Kind.EOF));
            }
            return text.substring(start.position(), end);
        }

        // ==================== Expressions ====================

        Expr expression() {
            Expr left = conjunction();
            while (accept(Token.Kind.OR)) {
                left = new Expr.Logic(Expr.LogicOp.OR, left, conjunction());
            }
            return left;
        }

        private Expr conjunction() {
            Expr left = negation();
            while (accept(Token.Kind.AND)) {
                left = new Expr.Logic(Expr.LogicOp.AND, left, negation());
            }
            return left;
        }

        private Expr negation() {
            if (accept(Token.Kind.BANG)) {
                return new Expr.Not(negation());
            }
            return comparison();
        }

        private Expr comparison() {
            Expr left = additive();
            Optional<Expr.CompareOp> op = Expr.CompareOp.fromSymbol(peek().text());
            if (op.isPresent() && !peek().is(Token.Kind.IDENT)) {
                advance();
                return new Expr.Compare(op.get(), left, additive());
            }
            return left;
        }

        private Expr additive() {
            Expr left = multiplicative();
            while (true) {
                if (accept(Token.Kind.PLUS)) {
                    left = new Expr.Arith(Expr.ArithOp.ADD, left, multiplicative());
                } else if (accept(Token.Kind.MINUS)) {
                    left = new Expr.Arith(Expr.ArithOp.SUB, left, multiplicative());
                } else {
                    return left;
                }
            }
        }

        private Expr multiplicative() {
            Expr left = unary();
            while (accept(Token.Kind.STAR)) {
                left = new Expr.Arith(Expr.ArithOp.MUL, left, unary());
            }
            return left;
        }

        private Expr unary() {
            if (accept(Token.Kind.MINUS)) {
                Token literal = peek();
                if (literal.is(Token.Kind.INT)) {
                    advance();
                    return new Expr.IntLit(-parseLong(literal));
                }
                return new Expr.Arith(Expr.ArithOp.SUB, Expr.lit(0), unary());
            }
            return primary();
        }

        private Expr primary() {
            Token token = peek();
            if (token.is(Token.Kind.INT)) {
                advance();
                return new Expr.IntLit(parseLong(token));
            }
            if (accept(Token.Kind.LPAREN)) {
                Expr inner = expression();
                expect(Token.Kind.RPAREN, "')'");
                return inner;
            }
            Token name = expect(Token.Kind.IDENT, "an expression");
            switch (name.text()) {
                case "true":
                    return new Expr.BoolLit(true);
                case "false":
                    return new Expr.BoolLit(false);
                case "S":
                    if (accept(Token.Kind.LPAREN)) {
                        Expr predecessor = expression();
                        expect(Token.Kind.RPAREN, "')'");
                        return Expr.add(predecessor, Expr.lit(1));
                    }
                    break;
                case "len":
                    if (accept(Token.Kind.LPAREN)) {
                        Expr target = expression();
                        expect(Token.Kind.RPAREN, "')'");
                        return Expr.len(target);
                    }
                    break;
                default:
                    break;
            }
            Expr result = Expr.var(name.text());
            while (accept(Token.Kind.DOT)) {
                result = new Expr.Field(result, expect(Token.Kind.IDENT, "field name").text());
            }
            return result;
        }

        private long parseLong(Token token) {
            try {
                return Long.parseLong(token.text());
            } catch (NumberFormatException e) {
                throw new SignatureParseException(token.position(), "an integer literal in range", token.describe());
            }
        }

        // ==================== Token helpers ====================

        private Token peek() {
            return tokens.get(index);
        }

        private Token peekAhead(int offset) {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private Token advance() {
            Token token = tokens.get(index);
            if (!token.is(Token.Kind.EOF)) {
                index++;
            }
            return token;
        }

        private boolean accept(Token.Kind kind) {
            if (peek().is(kind)) {
                advance();
                return true;
            }
            return false;
        }

        private Token expect(Token.Kind kind, String expected) {
            Token token = peek();
            if (!token.is(kind)) {
                throw new SignatureParseException(token.position(), expected, token.describe());
            }
            return advance();
        }
    }
}
