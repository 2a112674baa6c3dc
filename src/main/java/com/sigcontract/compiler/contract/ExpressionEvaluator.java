package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.model.Expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Evaluates lowered check expressions against concrete values.
 *
 * Values use plain Java shapes: integers as any {@link Number} without a
 * fractional part, sequences as {@link List} (or {@link String} for length),
 * records as {@link Map} keyed by field name, optionals as {@link Optional}
 * or nullable references.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static Object evaluate(Expr expr, Map<String, Object> env) {
        if (expr instanceof Expr.IntLit lit) {
            return lit.value();
        }
        if (expr instanceof Expr.BoolLit lit) {
            return lit.value();
        }
        if (expr instanceof Expr.Var variable) {
            if (!env.containsKey(variable.name())) {
                throw new IllegalArgumentException("No value bound to " + variable.name());
            }
            return env.get(variable.name());
        }
        if (expr instanceof Expr.Length length) {
            return length(evaluate(length.target(), env));
        }
        if (expr instanceof Expr.Field field) {
            Object target = unwrapOptional(evaluate(field.target(), env));
            if (!(target instanceof Map<?, ?> fields)) {
                throw new IllegalArgumentException("Expected a record for ." + field.name() + ", got " + describe(target));
            }
            if (!fields.containsKey(field.name())) {
                throw new IllegalArgumentException("Record has no field " + field.name());
            }
            return fields.get(field.name());
        }
        if (expr instanceof Expr.Unwrap unwrap) {
            Object value = unwrapOptional(evaluate(unwrap.target(), env));
            if (value == null) {
                throw new IllegalArgumentException("Absent value in " + unwrap.render());
            }
            return value;
        }
        if (expr instanceof Expr.Arith arith) {
            return arith.op().apply(integer(evaluate(arith.left(), env)), integer(evaluate(arith.right(), env)));
        }
        if (expr instanceof Expr.Compare compare) {
            return compare.op().test(compareValues(evaluate(compare.left(), env), evaluate(compare.right(), env)));
        }
        if (expr instanceof Expr.Logic logic) {
            boolean left = bool(evaluate(logic.left(), env));
            if (logic.op() == Expr.LogicOp.AND) {
                return left && bool(evaluate(logic.right(), env));
            }
            return left || bool(evaluate(logic.right(), env));
        }
        if (expr instanceof Expr.Not not) {
            return !bool(evaluate(not.operand(), env));
        }
        if (expr instanceof Expr.ForAll forAll) {
            Object collection = evaluate(forAll.collection(), env);
            if (!(collection instanceof List<?> elements)) {
                throw new IllegalArgumentException("Expected a sequence, got " + describe(collection));
            }
            Map<String, Object> inner = new HashMap<>(env);
            for (Object element : elements) {
                inner.put(forAll.binder(), element);
                if (!bool(evaluate(forAll.body(), inner))) {
                    return false;
                }
            }
            return true;
        }
        throw new IllegalArgumentException("Cannot evaluate " + expr.render());
    }

    public static boolean test(Expr condition, Map<String, Object> env) {
        return bool(evaluate(condition, env));
    }

    public static Object unwrapOptional(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.orElse(null);
        }
        return value;
    }

    /**
     * The value as a {@code long}.
     *
     * @throws ArithmeticException if the number has a fractional part or does not fit in a {@code long}
     * @throws IllegalArgumentException if the value is not a number
     */
    public static long integer(Object value) {
        if (value instanceof Number number && isIntegral(number)) {
            return number.longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof Number number) {
            return decimal(number).longValueExact();
        }
        throw new IllegalArgumentException("Expected an integer, got " + describe(value));
    }

    private static long length(Object value) {
        Object target = unwrapOptional(value);
        if (target instanceof List<?> list) {
            return list.size();
        }
        if (target instanceof CharSequence text) {
            return text.length();
        }
        throw new IllegalArgumentException("Expected a sequence, got " + describe(target));
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Expected a boolean, got " + describe(value));
    }

    private static int compareValues(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            if (isFinite(l) && isFinite(r)) {
                return decimal(l).compareTo(decimal(r));
            }
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        if (Objects.equals(left, right)) {
            return 0;
        }
        throw new IllegalArgumentException("Cannot compare " + describe(left) + " with " + describe(right));
    }

    /**
     * Exact decimal form of a finite number.
     */
    private static BigDecimal decimal(Number number) {
        if (number instanceof BigDecimal big) {
            return big;
        }
        if (number instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("Not a finite number: " + number);
        }
        return new BigDecimal(value);
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
