package com.sigcontract.compiler.testgen;

import com.sigcontract.compiler.contract.ExpressionEvaluator;
import com.sigcontract.compiler.model.*;

import java.util.*;

/**
 * The integer dimensions that determine a function's inputs, and the mapping
 * from a point in that space to concrete argument values.
 *
 * Integer parameters and record fields, free length symbols, element values,
 * optional presence and per-sequence length offsets are dimensions; every
 * other value is derived from them. Sequence lengths follow their declared
 * length expression, so a point either yields well-typed inputs or none.
 */
final class InputSpace {

    private static final int MAX_SEQUENCE_LENGTH = 10_000;

    enum Role {
        /** Integer parameter or record field. */
        INTEGER,
        /** Length symbol that no parameter defines, such as an implicit {@code n}. */
        SYMBOL,
        /** Value shared by every element of a sequence with integer elements. */
        SEED,
        /** 1 for present, 0 for absent. */
        PRESENCE,
        /** Offset added to a sequence's declared length. */
        DELTA
    }

    record Dimension(String name, Role role) {
    }

    private final Signature signature;
    private final Set<String> parameterNames = new LinkedHashSet<>();
    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();

    InputSpace(Signature signature) {
        this.signature = signature;
        signature.getParameters().forEach(p -> parameterNames.add(p.name()));
        for (Signature.Parameter parameter : signature.getParameters()) {
            discover(parameter.type(), new Subject.Param(parameter.name()), Set.of());
        }
    }

    static String deltaName(Subject subject) {
        return "delta(" + subject.path() + ")";
    }

    static Dimension delta(Subject subject) {
        return new Dimension(deltaName(subject), Role.DELTA);
    }

    List<Dimension> dimensions() {
        return new ArrayList<>(dimensions.values());
    }

    Signature signature() {
        return signature;
    }

    private void discover(int typeId, Subject subject, Set<String> fieldScope) {
        if (signature.isIntegral(typeId)) {
            if (!subject.underElement()) {
                add(subject.path(), Role.INTEGER);
            } else if (!(signature.typeOf(typeId) instanceof TypeNode.Primitive)) {
                add(subject.path(), Role.SEED);
            }
            return;
        }
        TypeNode node = signature.stripRefinements(typeId);
        if (node instanceof TypeNode.SizedSequence sequence) {
            for (String symbol : Exprs.freeVariables(sequence.length())) {
                if (!parameterNames.contains(symbol) && !fieldScope.contains(symbol)) {
                    add(symbol, Role.SYMBOL);
                }
            }
            discover(sequence.element(), new Subject.ElementOf(subject), fieldScope);
        } else if (node instanceof TypeNode.OptionalType optional) {
            Subject present = new Subject.PresentOf(subject);
            add(present.path(), Role.PRESENCE);
            discover(optional.inner(), present, fieldScope);
        } else if (node instanceof TypeNode.RecordType recordType) {
            Set<String> scope = new LinkedHashSet<>(fieldScope);
            for (TypeNode.RecordField field : recordType.fields()) {
                discover(field.type(), new Subject.FieldOf(subject, field.name()), scope);
                if (signature.isIntegral(field.type())) {
                    scope.add(field.name());
                }
            }
        }
    }

    private void add(String name, Role role) {
        dimensions.putIfAbsent(name, new Dimension(name, role));
    }

    /**
     * Builds arguments, keyed by parameter name in declaration order, for a
     * point. Empty when the point describes no well-typed input, e.g. a
     * negative sequence length.
     */
    Optional<Map<String, Object>> build(Map<String, Long> point) {
        Map<String, Object> env = new HashMap<>();
        for (Dimension dimension : dimensions.values()) {
            if (dimension.role() == Role.SYMBOL) {
                env.put(dimension.name(), point.getOrDefault(dimension.name(), 0L));
            }
        }
        Map<String, Object> values = new HashMap<>();
        try {
            for (Signature.Parameter parameter : signature.getParameters()) {
                if (signature.isIntegral(parameter.type())) {
                    Object value = valueOf(parameter.type(), new Subject.Param(parameter.name()), env, point, 0);
                    values.put(parameter.name(), value);
                    env.put(parameter.name(), value);
                }
            }
            // Lengths may refer to other sequences, so build in dependency order
            List<Signature.Parameter> pending = new ArrayList<>();
            for (Signature.Parameter parameter : signature.getParameters()) {
                if (!values.containsKey(parameter.name())) {
                    pending.add(parameter);
                }
            }
            while (!pending.isEmpty()) {
                boolean progress = false;
                for (Iterator<Signature.Parameter> it = pending.iterator(); it.hasNext(); ) {
                    Signature.Parameter parameter = it.next();
                    Object value;
                    try {
                        value = valueOf(parameter.type(), new Subject.Param(parameter.name()), env, point, 0);
                    } catch (UnboundSymbol e) {
                        continue;
                    }
                    values.put(parameter.name(), value);
                    env.put(parameter.name(), value);
                    it.remove();
                    progress = true;
                }
                if (!progress) {
                    return Optional.empty();
                }
            }
        } catch (Infeasible e) {
            return Optional.empty();
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Signature.Parameter parameter : signature.getParameters()) {
            arguments.put(parameter.name(), values.get(parameter.name()));
        }
        return Optional.of(arguments);
    }

    private Object valueOf(int typeId, Subject subject, Map<String, Object> scope, Map<String, Long> point, int index) {
        if (signature.isIntegral(typeId)) {
            Long value = point.get(subject.path());
            return value != null ? value : (long) (index + 1);
        }
        TypeNode node = signature.stripRefinements(typeId);
        if (node instanceof TypeNode.Primitive primitive) {
            switch (primitive.kind()) {
                case BOOLEAN:
                    return index % 2 == 0;
                case TEXT:
                    return "s" + index;
                case DOUBLE:
                    return index + 0.5;
                default:
                    return (long) (index + 1);
            }
        }
        if (node instanceof TypeNode.SizedSequence sequence) {
            long length = lengthOf(sequence.length(), scope) + point.getOrDefault(deltaName(subject), 0L);
            if (length < 0 || length > MAX_SEQUENCE_LENGTH) {
                throw new Infeasible();
            }
            List<Object> elements = new ArrayList<>();
            Subject element = new Subject.ElementOf(subject);
            for (int j = 0; j < length; j++) {
                elements.add(valueOf(sequence.element(), element, scope, point, j));
            }
            return elements;
        }
        if (node instanceof TypeNode.OptionalType optional) {
            Subject present = new Subject.PresentOf(subject);
            long presence = point.getOrDefault(present.path(), 1L);
            if (presence == 0) {
                return Optional.empty();
            }
            if (presence != 1) {
                throw new Infeasible();
            }
            return Optional.of(valueOf(optional.inner(), present, scope, point, index));
        }
        if (node instanceof TypeNode.RecordType recordType) {
            Map<String, Object> fields = new LinkedHashMap<>();
            Map<String, Object> fieldScope = new HashMap<>(scope);
            for (TypeNode.RecordField field : recordType.fields()) {
                Object value = valueOf(field.type(), new Subject.FieldOf(subject, field.name()), fieldScope, point, index);
                fields.put(field.name(), value);
                if (signature.isIntegral(field.type())) {
                    fieldScope.put(field.name(), value);
                }
            }
            return fields;
        }
        throw new IllegalStateException("No value construction for " + node);
    }

    private long lengthOf(Expr length, Map<String, Object> scope) {
        for (String symbol : Exprs.freeVariables(length)) {
            if (!scope.containsKey(symbol)) {
                throw new UnboundSymbol();
            }
        }
        try {
            return ExpressionEvaluator.integer(ExpressionEvaluator.evaluate(length, scope));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new Infeasible();
        }
    }

    /** The point does not describe a well-typed input. */
    private static final class Infeasible extends RuntimeException {
        Infeasible() {
            super(null, null, false, false);
        }
    }

    /** A length refers to a parameter that is not built yet. */
    private static final class UnboundSymbol extends RuntimeException {
        UnboundSymbol() {
            super(null, null, false, false);
        }
    }
}
