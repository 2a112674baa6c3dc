package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.exception.ContractViolationException.Phase;
import com.sigcontract.compiler.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Turns a {@link ConstraintModel} into {@link ContractCode} for an
 * {@link EmissionProfile}.
 *
 * Parameter constraints become preconditions ordered by the relation graph,
 * return constraints become postconditions and record constraints become
 * invariant checks, one set per place a record occurs. Synthesis is a pure
 * function of its inputs.
 */
public class ContractSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(ContractSynthesizer.class);

    private static final String ELEMENT_BINDER = "elem";

    public ContractCode synthesize(ConstraintModel model, EmissionProfile profile) {
        Signature signature = model.getSignature();
        Map<String, String> names = emittedNames(signature, profile);
        Lowering lowering = new Lowering(model, profile, names);

        List<Check> preconditions = new ArrayList<>();
        for (Constraint constraint : model.getRelationGraph().order(model.topLevel(Constraint.Origin.PARAMETER))) {
            preconditions.add(lowering.lower(constraint, Map.of()));
        }

        List<Check> postconditions = new ArrayList<>();
        for (Constraint constraint : model.topLevel(Constraint.Origin.RETURN)) {
            postconditions.add(lowering.lower(constraint, Map.of()));
        }

        // One invariant set per record occurrence, keyed by where it occurs
        Map<Subject, List<Constraint>> bySite = new LinkedHashMap<>();
        Map<Subject, String> recordNames = new LinkedHashMap<>();
        for (Constraint constraint : model.topLevel(Constraint.Origin.RECORD_INVARIANT)) {
            bySite.computeIfAbsent(constraint.getRecordSubject(), k -> new ArrayList<>()).add(constraint);
            recordNames.put(constraint.getRecordSubject(), constraint.getRecordName());
        }
        List<ContractCode.RecordInvariant> invariants = new ArrayList<>();
        for (Map.Entry<Subject, List<Constraint>> entry : bySite.entrySet()) {
            Map<Subject, Expr> self = Map.of(entry.getKey(), Expr.var(ContractCode.RecordInvariant.SELF));
            List<Check> checks = new ArrayList<>();
            for (Constraint constraint : model.getRelationGraph().order(entry.getValue())) {
                checks.add(lowering.lower(constraint, self));
            }
            invariants.add(new ContractCode.RecordInvariant(recordNames.get(entry.getKey()), entry.getKey(), checks));
        }

        String functionName = profile.getNamingStyle().apply(signature.getName());
        if (signature.getVisibility() == Signature.Visibility.PRIVATE
                && profile.getNamingStyle() == EmissionProfile.NamingStyle.SNAKE) {
            functionName = "_" + functionName;
        }

        ContractCode code = new ContractCode(signature.getName(), functionName, parameterNames(names),
                names.get(Subject.RESULT_NAME), signature.getVisibility(), signature.getTotality(), profile,
                preconditions, postconditions, invariants);
        logger.debug("Synthesized contract for {}: {} preconditions, {} postconditions, {} invariant sets",
                signature.getName(), preconditions.size(), postconditions.size(), invariants.size());
        return code;
    }

    private static Map<String, String> parameterNames(Map<String, String> names) {
        Map<String, String> params = new LinkedHashMap<>(names);
        params.remove(Subject.RESULT_NAME);
        return params;
    }

    /**
     * Emitted name per source parameter, plus the name of the result variable
     * under the key {@code result}. Collisions after conversion get a numeric suffix.
     */
    private static Map<String, String> emittedNames(Signature signature, EmissionProfile profile) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (Signature.Parameter parameter : signature.getParameters()) {
            names.put(parameter.name(), unique(profile.getNamingStyle().apply(parameter.name()), taken));
        }
        names.put(Subject.RESULT_NAME, unique(Subject.RESULT_NAME, taken));
        return names;
    }

    private static String unique(String candidate, Set<String> taken) {
        String name = candidate;
        int suffix = 2;
        while (!taken.add(name) || name.equals(ContractCode.RecordInvariant.SELF)) {
            name = candidate + suffix++;
        }
        return name;
    }

    static String failureMessage(Constraint constraint) {
        return phaseOf(constraint).label() + " violated [" + constraint.getId() + " "
                + constraint.getKind().displayName() + "]: " + constraint.restate();
    }

    static Phase phaseOf(Constraint constraint) {
        switch (constraint.getOrigin()) {
            case RETURN:
                return Phase.POSTCONDITION;
            case RECORD_INVARIANT:
                return Phase.INVARIANT;
            default:
                return Phase.PRECONDITION;
        }
    }

    /**
     * Lowers constraints to checks over emitted variable names. The context
     * maps subjects that are already bound (quantifier binders, {@code self})
     * to the expression naming them.
     */
    private static final class Lowering {
        private final ConstraintModel model;
        private final EmissionProfile profile;
        private final Map<String, String> names;

        Lowering(ConstraintModel model, EmissionProfile profile, Map<String, String> names) {
            this.model = model;
            this.profile = profile;
            this.names = names;
        }

        Check lower(Constraint constraint, Map<Subject, Expr> context) {
            Phase phase = phaseOf(constraint);
            if (constraint.getKind() == ConstraintKind.DISJOINT) {
                return lowerDisjoint(constraint, phase, context);
            }
            return new Check.Guard(constraint.getId(), constraint.getKind(), phase,
                    condition(constraint, context), failureMessage(constraint));
        }

        private Check lowerDisjoint(Constraint constraint, Phase phase, Map<Subject, Expr> context) {
            Subject optional = constraint.getSubject();
            List<Check> present = new ArrayList<>();
            List<Constraint> children = model.getRelationGraph().order(model.children(constraint.getId()));
            for (Constraint child : children) {
                present.add(lower(child, context));
            }
            List<Check.BranchCase> cases = List.of(
                    new Check.BranchCase(Check.Tag.ABSENT, List.of()),
                    new Check.BranchCase(Check.Tag.PRESENT, present));
            String fallback = profile.isExhaustivenessChecking() ? null
                    : "no case of " + constraint.getKind().displayName() + " matched " + optional.path();
            return new Check.Branch(constraint.getId(), phase, value(optional, context), cases, fallback);
        }

        private Expr condition(Constraint constraint, Map<Subject, Expr> context) {
            switch (constraint.getKind()) {
                case NONNEGATIVE:
                    return quantified(constraint.getSubject(), context, ctx ->
                            Expr.compare(Expr.CompareOp.GE, value(constraint.getSubject(), ctx), Expr.lit(0)));
                case INDEX_BOUND:
                    return quantified(constraint.getSubject(), context, ctx -> {
                        Expr index = value(constraint.getSubject(), ctx);
                        return Expr.and(Expr.compare(Expr.CompareOp.LE, Expr.lit(0), index),
                                Expr.compare(Expr.CompareOp.LT, index, expression(constraint.getResolved(), ctx)));
                    });
                case LENGTH_EQUALS: {
                    List<Expr> parts = new ArrayList<>();
                    for (Subject subject : constraint.getSubjects()) {
                        if (isDefinitional(subject, constraint.getResolved())) {
                            continue;
                        }
                        parts.add(quantified(subject, context, ctx -> Expr.compare(Expr.CompareOp.EQ,
                                Expr.len(value(subject, ctx)), expression(constraint.getResolved(), ctx))));
                    }
                    return Expr.allOf(parts);
                }
                case LENGTH_AT_LEAST:
                    return quantified(constraint.getSubject(), context, ctx -> Expr.compare(Expr.CompareOp.GE,
                            Expr.len(value(constraint.getSubject(), ctx)), expression(constraint.getResolved(), ctx)));
                case PREDICATE_HOLDS:
                    return quantified(constraint.getSubject(), context,
                            ctx -> expression(constraint.getResolved(), ctx));
                default:
                    throw new IllegalStateException("No guard condition for " + constraint.describe());
            }
        }

        // len(xs) == len(xs) carries no information for the sequence that defines the length
        private boolean isDefinitional(Subject subject, Expr resolved) {
            return resolved instanceof Expr.Length length
                    && length.target() instanceof Expr.Ref ref
                    && ref.subject().equals(subject);
        }

        /**
         * Wraps the body in one quantifier per sequence element between the
         * subject's root and the subject, outermost first.
         */
        private Expr quantified(Subject subject, Map<Subject, Expr> context, Function<Map<Subject, Expr>, Expr> body) {
            Deque<Subject.ElementOf> elements = new ArrayDeque<>();
            for (Subject current = subject; current != null && !context.containsKey(current); current = current.owner()) {
                if (current instanceof Subject.ElementOf element) {
                    elements.push(element);
                }
            }
            return quantify(new ArrayList<>(elements), 0, context, body);
        }

        private Expr quantify(List<Subject.ElementOf> elements, int index, Map<Subject, Expr> context,
                              Function<Map<Subject, Expr>, Expr> body) {
            if (index == elements.size()) {
                return body.apply(context);
            }
            Subject.ElementOf element = elements.get(index);
            String binder = binderName(context);
            Expr collection = value(element.owner(), context);
            Map<Subject, Expr> inner = new LinkedHashMap<>(context);
            inner.put(element, Expr.var(binder));
            return new Expr.ForAll(binder, collection, quantify(elements, index + 1, inner, body));
        }

        private String binderName(Map<Subject, Expr> context) {
            int depth = 1;
            for (Subject bound : context.keySet()) {
                if (bound instanceof Subject.ElementOf) {
                    depth++;
                }
            }
            String binder = depth == 1 ? ELEMENT_BINDER : ELEMENT_BINDER + depth;
            while (names.containsValue(binder)) {
                binder = binder + "_";
            }
            return binder;
        }

        /**
         * The emitted expression denoting a subject's value.
         */
        Expr value(Subject subject, Map<Subject, Expr> context) {
            Expr bound = context.get(subject);
            if (bound != null) {
                return bound;
            }
            if (subject instanceof Subject.Param param) {
                return Expr.var(names.getOrDefault(param.name(), param.name()));
            }
            if (subject instanceof Subject.Result) {
                return Expr.var(names.get(Subject.RESULT_NAME));
            }
            if (subject instanceof Subject.FieldOf field) {
                return new Expr.Field(value(field.owner(), context), field.field());
            }
            if (subject instanceof Subject.PresentOf present) {
                return new Expr.Unwrap(value(present.owner(), context));
            }
            throw new IllegalStateException("Element " + subject.path() + " referenced outside its quantifier");
        }

        Expr expression(Expr resolved, Map<Subject, Expr> context) {
            return Exprs.rewrite(resolved, node -> node instanceof Expr.Ref ref ? value(ref.subject(), context) : null);
        }
    }
}
