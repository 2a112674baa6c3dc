package com.sigcontract.compiler.analysis;

import com.sigcontract.compiler.exception.UnresolvedBoundException;
import com.sigcontract.compiler.exception.UnsupportedTypeException;
import com.sigcontract.compiler.model.*;
import com.sigcontract.compiler.model.Constraint.Origin;
import com.sigcontract.compiler.model.Expr.*;
import com.sigcontract.compiler.model.Signature.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Extracts the constraint model of a signature.
 *
 * Works in two passes:
 * - Binding pass: integer parameters bind their own names, and sequence
 *   parameters whose length mentions exactly one unbound symbol solve it as a
 *   witness ({@code n + m} with {@code n} bound gives {@code m := len(xs) - n}).
 * - Constraint pass: every parameter type and the return type is destructured
 *   into constraints resolved against those bindings. Length constraints with
 *   structurally equal resolved expressions are then merged across parameters.
 *
 * Stateless and deterministic: the same signature always yields an equal model.
 */
public class ConstraintExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintExtractor.class);

    /**
     * Extracts constraints from the signature.
     *
     * @throws UnresolvedBoundException  if a bound or length refers to an unknown symbol
     * @throws UnsupportedTypeException  if a type nesting cannot be expressed as a check
     */
    public ConstraintModel extract(Signature signature) {
        Run run = new Run(signature);
        run.bindParameters();
        run.extractConstraints();
        List<Constraint> constraints = run.finish();

        if (constraints.isEmpty()) {
            logger.info("Signature {} carries no value-level constraints", signature.getName());
        } else {
            logger.debug("Extracted {} constraints from {}: {}", constraints.size(), signature.getName(),
                    constraints.stream().map(Constraint::describe).toList());
        }
        return new ConstraintModel(signature, constraints, run.bindings);
    }

    /**
     * A constraint before merging and id assignment.
     */
    private static final class Draft {
        final int key;
        final Constraint.Builder builder;
        final ConstraintKind kind;
        final Origin origin;
        final String recordName;
        final Integer parentKey;
        final Expr resolved;
        final List<Subject> subjects = new ArrayList<>();
        final boolean definitional;

        Draft(int key, ConstraintKind kind, Subject subject, Expr expression, Expr resolved,
              Scope scope, boolean definitional) {
            this.key = key;
            this.kind = kind;
            this.origin = scope.origin;
            this.recordName = scope.recordName;
            this.parentKey = scope.parentKey;
            this.resolved = resolved;
            this.definitional = definitional;
            this.subjects.add(subject);
            this.builder = Constraint.builder()
                    .kind(kind).origin(scope.origin)
                    .expression(expression).resolved(resolved)
                    .record(scope.recordName, scope.recordSubject);
        }

        List<Object> mergeKey() {
            return Arrays.asList(origin, recordName, parentKey, resolved);
        }
    }

    /**
     * Lexical context of the type being destructured.
     */
    private static final class Scope {
        final Origin origin;
        final String recordName;
        final Subject recordSubject;
        final Integer parentKey;
        final Map<String, SymbolBinding> symbols;

        Scope(Origin origin, String recordName, Subject recordSubject, Integer parentKey,
              Map<String, SymbolBinding> symbols) {
            this.origin = origin;
            this.recordName = recordName;
            this.recordSubject = recordSubject;
            this.parentKey = parentKey;
            this.symbols = symbols;
        }

        Scope withParent(int key) {
            return new Scope(origin, recordName, recordSubject, key, symbols);
        }

        Scope inRecord(String name, Subject subject) {
            return new Scope(Origin.RECORD_INVARIANT, name, subject, parentKey, new LinkedHashMap<>(symbols));
        }
    }

    /**
     * State of a single extraction.
     */
    private static final class Run {
        private final Signature signature;
        private final Map<String, SymbolBinding> bindings = new LinkedHashMap<>();
        private final Set<String> parameterNames = new LinkedHashSet<>();
        // sequence parameter -> symbol solved from its length
        private final Map<Subject, String> witnessSites = new HashMap<>();
        private final List<Draft> drafts = new ArrayList<>();

        Run(Signature signature) {
            this.signature = signature;
            signature.getParameters().forEach(p -> parameterNames.add(p.name()));
        }

        // ==================== Binding pass ====================

        void bindParameters() {
            for (Parameter parameter : signature.getParameters()) {
                if (isIntegral(parameter.type())) {
                    Subject source = new Subject.Param(parameter.name());
                    bindings.put(parameter.name(), new SymbolBinding(parameter.name(),
                            SymbolBinding.Kind.PARAMETER, source, Expr.ref(source)));
                }
            }

            // Solving one witness can make another sequence's length solvable
            boolean progress = true;
            while (progress) {
                progress = false;
                for (Parameter parameter : signature.getParameters()) {
                    Subject site = new Subject.Param(parameter.name());
                    TypeNode node = stripRefinements(parameter.type());
                    if (!(node instanceof TypeNode.SizedSequence sequence) || witnessSites.containsKey(site)) {
                        continue;
                    }
                    Optional<SymbolBinding> witness = solveWitness(sequence.length(), site);
                    if (witness.isPresent()) {
                        SymbolBinding binding = witness.get();
                        bindings.put(binding.symbol(), binding);
                        witnessSites.put(site, binding.symbol());
                        logger.debug("Bound implicit symbol {} from {}", binding.describe(), site.path());
                        progress = true;
                    }
                }
            }
        }

        /**
         * Solves {@code len(site) == e} for the single unbound symbol of {@code e}
         * when it appears exactly once as a plain summand.
         */
        private Optional<SymbolBinding> solveWitness(Expr length, Subject site) {
            Set<String> unbound = unboundSymbols(length, bindings);
            if (unbound.size() != 1) {
                return Optional.empty();
            }
            String symbol = unbound.iterator().next();
            List<Expr> summands = Exprs.summands(length);
            List<Expr> rest = new ArrayList<>();
            int occurrences = 0;
            for (Expr summand : summands) {
                if (summand.equals(Expr.var(symbol))) {
                    occurrences++;
                } else if (Exprs.freeVariables(summand).contains(symbol)) {
                    return Optional.empty();
                } else {
                    rest.add(summand);
                }
            }
            if (occurrences != 1) {
                return Optional.empty();
            }
            Expr restResolved = resolveWith(Exprs.sum(rest), bindings, null);
            Expr value = Exprs.fold(Expr.sub(Expr.len(Expr.ref(site)), restResolved));
            return Optional.of(new SymbolBinding(symbol, SymbolBinding.Kind.LENGTH_WITNESS, site, value));
        }

        // ==================== Constraint pass ====================

        void extractConstraints() {
            Scope parameterScope = new Scope(Origin.PARAMETER, null, null, null, bindings);
            for (Parameter parameter : signature.getParameters()) {
                extractType(parameter.type(), new Subject.Param(parameter.name()), parameterScope);
            }
            Scope returnScope = new Scope(Origin.RETURN, null, null, null, bindings);
            extractType(signature.getReturnType(), new Subject.Result(), returnScope);
        }

        private void extractType(int typeId, Subject subject, Scope scope) {
            TypeNode node = signature.typeOf(typeId);

            if (node instanceof TypeNode.Primitive) {
                return;
            }
            if (node instanceof TypeNode.NonNegativeInt) {
                add(ConstraintKind.NONNEGATIVE, subject, null, null, scope, false);
            } else if (node instanceof TypeNode.BoundedIndex index) {
                Expr resolved = resolve(index.bound(), scope, null, "bound of " + subject.path());
                add(ConstraintKind.INDEX_BOUND, subject, index.bound(), resolved, scope, false);
            } else if (node instanceof TypeNode.SizedSequence sequence) {
                extractLength(sequence.length(), subject, scope);
                extractType(sequence.element(), new Subject.ElementOf(subject), scope);
            } else if (node instanceof TypeNode.OptionalType optional) {
                if (subject.underElement()) {
                    throw new UnsupportedTypeException(signature.getArena().render(typeId),
                            "Optional values inside sequence elements cannot be checked exhaustively: "
                                    + subject.path() + ": " + signature.getArena().render(typeId));
                }
                Draft disjoint = add(ConstraintKind.DISJOINT, subject, null, null, scope, false);
                extractType(optional.inner(), new Subject.PresentOf(subject), scope.withParent(disjoint.key));
            } else if (node instanceof TypeNode.Refinement refinement) {
                extractType(refinement.base(), subject, scope);
                Expr resolved = resolve(refinement.predicate(), scope, subject, "refinement of " + subject.path());
                add(ConstraintKind.PREDICATE_HOLDS, subject, refinement.predicate(), resolved, scope, false);
            } else if (node instanceof TypeNode.RecordType record) {
                String recordName = record.name() != null ? record.name() : defaultRecordName(subject);
                Scope recordScope = scope.inRecord(recordName, subject);
                for (TypeNode.RecordField field : record.fields()) {
                    Subject fieldSubject = new Subject.FieldOf(subject, field.name());
                    extractType(field.type(), fieldSubject, recordScope);
                    // Later fields may refer to earlier integer fields
                    if (isIntegral(field.type())) {
                        recordScope.symbols.put(field.name(), new SymbolBinding(field.name(),
                                SymbolBinding.Kind.FIELD, fieldSubject, Expr.ref(fieldSubject)));
                    }
                }
            }
        }

        private void extractLength(Expr length, Subject subject, Scope scope) {
            String witness = witnessSites.get(subject);
            if (witness != null) {
                // This sequence is where an implicit symbol gets its value
                List<Expr> rest = new ArrayList<>(Exprs.summands(length));
                rest.remove(Expr.var(witness));
                Expr lowerBound = Exprs.fold(Exprs.sum(rest));
                if (lowerBound instanceof IntLit lit && lit.value() == 0) {
                    add(ConstraintKind.LENGTH_EQUALS, subject, length,
                            Expr.len(Expr.ref(subject)), scope, true);
                } else {
                    Expr resolved = resolve(lowerBound, scope, null, "length of " + subject.path());
                    add(ConstraintKind.LENGTH_AT_LEAST, subject, lowerBound, resolved, scope, false);
                }
                return;
            }

            Set<String> unbound = unboundSymbols(length, scope.symbols);
            if (unbound.isEmpty()) {
                Expr resolved = resolve(length, scope, null, "length of " + subject.path());
                add(ConstraintKind.LENGTH_EQUALS, subject, length, resolved, scope, false);
                return;
            }

            // Free symbols the caller cannot supply: keep only the guaranteed lower bound
            for (String symbol : unbound) {
                if (!occursMonotonically(length, symbol)) {
                    throw new UnresolvedBoundException(symbol, length.render(),
                            "free symbol in length of " + subject.path() + " has no lower bound");
                }
            }
            Map<String, Expr> zeroes = new HashMap<>();
            unbound.forEach(symbol -> zeroes.put(symbol, Expr.lit(0)));
            Expr lowerBound = Exprs.fold(Exprs.substitute(length, zeroes));
            if (lowerBound instanceof IntLit lit && lit.value() <= 0) {
                logger.debug("Length of {} is existential ({}); nothing to check", subject.path(), length.render());
                return;
            }
            Expr resolved = resolve(lowerBound, scope, null, "length of " + subject.path());
            add(ConstraintKind.LENGTH_AT_LEAST, subject, lowerBound, resolved, scope, false);
        }

        private Draft add(ConstraintKind kind, Subject subject, Expr expression, Expr resolved,
                          Scope scope, boolean definitional) {
            Draft draft = new Draft(drafts.size(), kind, subject, expression,
                    resolved != null ? Exprs.fold(resolved) : null, scope, definitional);
            drafts.add(draft);
            return draft;
        }

        // ==================== Merge and id assignment ====================

        List<Constraint> finish() {
            Map<List<Object>, Draft> groups = new LinkedHashMap<>();
            List<Draft> kept = new ArrayList<>();
            Map<Integer, Draft> absorbedInto = new HashMap<>();

            for (Draft draft : drafts) {
                if (draft.kind == ConstraintKind.LENGTH_EQUALS) {
                    Draft group = groups.get(draft.mergeKey());
                    if (group != null) {
                        group.subjects.addAll(draft.subjects);
                        absorbedInto.put(draft.key, group);
                        continue;
                    }
                    groups.put(draft.mergeKey(), draft);
                }
                kept.add(draft);
            }

            // A binding site alone states nothing beyond its own length
            kept.removeIf(d -> d.definitional && d.subjects.size() == 1);

            Map<Integer, String> ids = new HashMap<>();
            String prefix = signature.getName() + ".c";
            for (int i = 0; i < kept.size(); i++) {
                ids.put(kept.get(i).key, prefix + (i + 1));
            }

            List<Constraint> result = new ArrayList<>();
            for (Draft draft : kept) {
                String parentId = draft.parentKey != null ? ids.get(draft.parentKey) : null;
                result.add(draft.builder
                        .id(ids.get(draft.key))
                        .subjects(draft.subjects)
                        .parentId(parentId)
                        .build());
            }
            return result;
        }

        // ==================== Symbol resolution ====================

        /**
         * Replaces symbols by the inputs they denote. {@code self} is substituted
         * for {@link Expr#SELF} inside refinement predicates.
         */
        private Expr resolve(Expr expr, Scope scope, Subject self, String context) {
            for (String symbol : Exprs.freeVariables(expr)) {
                boolean known = scope.symbols.containsKey(symbol) || parameterNames.contains(symbol)
                        || (self != null && symbol.equals(Expr.SELF));
                if (!known) {
                    throw new UnresolvedBoundException(symbol, expr.render(), context);
                }
            }
            return resolveWith(expr, scope.symbols, self);
        }

        private Expr resolveWith(Expr expr, Map<String, SymbolBinding> symbols, Subject self) {
            Expr substituted = Exprs.rewrite(expr, node -> {
                if (node instanceof Var v) {
                    if (self != null && v.name().equals(Expr.SELF)) {
                        return Expr.ref(self);
                    }
                    SymbolBinding binding = symbols.get(v.name());
                    if (binding != null) {
                        return binding.value();
                    }
                    if (parameterNames.contains(v.name())) {
                        return Expr.ref(new Subject.Param(v.name()));
                    }
                }
                return null;
            });
            // m.rows on a parameter becomes a direct reference to the field
            return Exprs.rewrite(substituted, node -> {
                if (node instanceof Field f && f.target() instanceof Ref r) {
                    return Expr.ref(new Subject.FieldOf(r.subject(), f.name()));
                }
                return null;
            });
        }

        private Set<String> unboundSymbols(Expr expr, Map<String, SymbolBinding> symbols) {
            Set<String> result = new LinkedHashSet<>(Exprs.freeVariables(expr));
            result.removeAll(symbols.keySet());
            result.removeAll(parameterNames);
            return result;
        }

        // ==================== Type helpers ====================

        private boolean isIntegral(int typeId) {
            return signature.isIntegral(typeId);
        }

        private TypeNode stripRefinements(int typeId) {
            return signature.stripRefinements(typeId);
        }

        private static String defaultRecordName(Subject subject) {
            StringBuilder name = new StringBuilder();
            for (String part : subject.path().split("[^A-Za-z0-9]+")) {
                if (!part.isEmpty()) {
                    name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
                }
            }
            return name.append("Record").toString();
        }
    }

    /**
     * True if every occurrence of {@code symbol} sits under additions or
     * multiplications by non-negative literals, so substituting its minimum
     * (zero) gives a lower bound of the whole expression.
     */
    static boolean occursMonotonically(Expr expr, String symbol) {
        if (!Exprs.freeVariables(expr).contains(symbol)) {
            return true;
        }
        if (expr instanceof Var) {
            return true;
        }
        if (expr instanceof Arith a) {
            switch (a.op()) {
                case ADD:
                    return occursMonotonically(a.left(), symbol) && occursMonotonically(a.right(), symbol);
                case SUB:
                    return !Exprs.freeVariables(a.right()).contains(symbol) && occursMonotonically(a.left(), symbol);
                case MUL:
                    if (a.left() instanceof IntLit l && l.value() >= 0) {
                        return occursMonotonically(a.right(), symbol);
                    }
                    if (a.right() instanceof IntLit r && r.value() >= 0) {
                        return occursMonotonically(a.left(), symbol);
                    }
                    return false;
                default:
                    return false;
            }
        }
        return false;
    }
}
