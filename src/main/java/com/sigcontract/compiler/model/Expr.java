package com.sigcontract.compiler.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.*;

/**
 * Immutable arithmetic/boolean expression tree shared by type expressions,
 * constraints and synthesized checks.
 *
 * Structural equality (every node is a record) is what the constraint merger
 * and the type arena rely on.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Expr.IntLit.class, name = "int"),
        @JsonSubTypes.Type(value = Expr.BoolLit.class, name = "bool"),
        @JsonSubTypes.Type(value = Expr.Var.class, name = "var"),
        @JsonSubTypes.Type(value = Expr.Ref.class, name = "ref"),
        @JsonSubTypes.Type(value = Expr.Length.class, name = "len"),
        @JsonSubTypes.Type(value = Expr.Field.class, name = "field"),
        @JsonSubTypes.Type(value = Expr.Unwrap.class, name = "unwrap"),
        @JsonSubTypes.Type(value = Expr.Arith.class, name = "arith"),
        @JsonSubTypes.Type(value = Expr.Compare.class, name = "compare"),
        @JsonSubTypes.Type(value = Expr.Logic.class, name = "logic"),
        @JsonSubTypes.Type(value = Expr.Not.class, name = "not"),
        @JsonSubTypes.Type(value = Expr.ForAll.class, name = "forall")
})
public sealed interface Expr {

    /** Name of the refined value inside a refinement predicate. */
    String SELF = "it";

    /**
     * Renders the expression in the surface syntax of the signature language.
     */
    String render();

    /**
     * Binding strength used by {@link #render()} to decide on parentheses.
     */
    int precedence();

    // ==================== Factories ====================

    static Expr lit(long value) {
        return new IntLit(value);
    }

    static Expr var(String name) {
        return new Var(name);
    }

    static Expr ref(Subject subject) {
        return new Ref(subject);
    }

    static Expr len(Expr target) {
        return new Length(target);
    }

    static Expr add(Expr left, Expr right) {
        return new Arith(ArithOp.ADD, left, right);
    }

    static Expr sub(Expr left, Expr right) {
        return new Arith(ArithOp.SUB, left, right);
    }

    static Expr compare(CompareOp op, Expr left, Expr right) {
        return new Compare(op, left, right);
    }

    static Expr and(Expr left, Expr right) {
        return new Logic(LogicOp.AND, left, right);
    }

    /**
     * Conjunction of all operands; {@code true} for an empty list.
     */
    static Expr allOf(List<Expr> operands) {
        Expr result = null;
        for (Expr operand : operands) {
            result = result == null ? operand : and(result, operand);
        }
        return result == null ? new BoolLit(true) : result;
    }

    // ==================== Operators ====================

    enum ArithOp {
        ADD("+", 5), SUB("-", 5), MUL("*", 6);

        private final String symbol;
        private final int precedence;

        ArithOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public long apply(long left, long right) {
            return switch (this) {
                case ADD -> Math.addExact(left, right);
                case SUB -> Math.subtractExact(left, right);
                case MUL -> Math.multiplyExact(left, right);
            };
        }
    }

    enum CompareOp {
        LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(int comparison) {
            return switch (this) {
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
            };
        }

        public static Optional<CompareOp> fromSymbol(String symbol) {
            for (CompareOp op : values()) {
                if (op.symbol.equals(symbol)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }

    enum LogicOp {
        AND("&&", 2), OR("||", 1);

        private final String symbol;
        private final int precedence;

        LogicOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }
    }

    // ==================== Nodes ====================

    record IntLit(long value) implements Expr {
        public String render() {
            return Long.toString(value);
        }

        public int precedence() {
            return value < 0 ? 4 : 9;
        }
    }

    record BoolLit(boolean value) implements Expr {
        public String render() {
            return Boolean.toString(value);
        }

        public int precedence() {
            return 9;
        }
    }

    /** A symbol: parameter name, implicit length symbol, record field or quantifier binder. */
    record Var(String name) implements Expr {
        public String render() {
            return name;
        }

        public int precedence() {
            return 9;
        }
    }

    /** A resolved reference to a value in the function's inputs or result. */
    record Ref(Subject subject) implements Expr {
        public String render() {
            return subject.path();
        }

        public int precedence() {
            return 9;
        }
    }

    record Length(Expr target) implements Expr {
        public String render() {
            return "len(" + target.render() + ")";
        }

        public int precedence() {
            return 9;
        }
    }

    record Field(Expr target, String name) implements Expr {
        public String render() {
            return wrap(target, 8) + "." + name;
        }

        public int precedence() {
            return 8;
        }
    }

    /** The value held by an optional that is known to be present. */
    record Unwrap(Expr target) implements Expr {
        public String render() {
            return "value(" + target.render() + ")";
        }

        public int precedence() {
            return 9;
        }
    }

    record Arith(ArithOp op, Expr left, Expr right) implements Expr {
        public String render() {
            // Right operand of a non-commutative operator needs parentheses at equal precedence
            int rightMin = op == ArithOp.SUB ? op.precedence + 1 : op.precedence;
            return wrap(left, op.precedence) + " " + op.symbol + " " + wrap(right, rightMin);
        }

        public int precedence() {
            return op.precedence;
        }
    }

    record Compare(CompareOp op, Expr left, Expr right) implements Expr {
        public String render() {
            return wrap(left, 5) + " " + op.symbol + " " + wrap(right, 5);
        }

        public int precedence() {
            return 4;
        }
    }

    record Logic(LogicOp op, Expr left, Expr right) implements Expr {
        public String render() {
            return wrap(left, op.precedence) + " " + op.symbol + " " + wrap(right, op.precedence + 1);
        }

        public int precedence() {
            return op.precedence;
        }
    }

    record Not(Expr operand) implements Expr {
        public String render() {
            return "!" + wrap(operand, 3);
        }

        public int precedence() {
            return 3;
        }
    }

    /** Universal quantification over the elements of a sequence. */
    record ForAll(String binder, Expr collection, Expr body) implements Expr {
        public String render() {
            return "all(" + binder + " in " + collection.render() + ": " + body.render() + ")";
        }

        public int precedence() {
            return 9;
        }
    }

    private static String wrap(Expr expr, int minimum) {
        String rendered = expr.render();
        return expr.precedence() < minimum ? "(" + rendered + ")" : rendered;
    }
}
