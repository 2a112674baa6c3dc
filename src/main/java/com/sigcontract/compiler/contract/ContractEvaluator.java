package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.exception.ContractViolationException;
import com.sigcontract.compiler.exception.ContractViolationException.Phase;
import com.sigcontract.compiler.exception.UnreachableCaseException;
import com.sigcontract.compiler.model.Expr;
import com.sigcontract.compiler.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the checks of a {@link ContractCode} against concrete arguments and
 * results. Arguments are keyed by their source parameter names.
 *
 * Preconditions fail fast on the first violated check; postconditions are
 * all evaluated and reported together.
 */
public class ContractEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ContractEvaluator.class);

    /**
     * One failed check.
     */
    public record Violation(String constraintId, Phase phase, String message) {
    }

    private final ContractCode code;

    public ContractEvaluator(ContractCode code) {
        this.code = Objects.requireNonNull(code, "code");
    }

    public ContractCode getCode() {
        return code;
    }

    /**
     * Checks the preconditions and the record invariants of the arguments
     * in dependency order.
     *
     * @throws ContractViolationException on the first failed check
     * @throws IllegalArgumentException if an argument is missing
     */
    public void checkPreconditions(Map<String, Object> arguments) {
        List<Violation> violations = new ArrayList<>();
        evaluateEntry(environment(arguments, null, false), violations, true);
        if (!violations.isEmpty()) {
            Violation first = violations.get(0);
            throw new ContractViolationException(first.constraintId(), first.phase(), first.message());
        }
    }

    /**
     * Checks record invariants of the result, then every postcondition.
     *
     * @throws ContractViolationException naming the first failed check and
     *         carrying every failure message
     */
    public void checkPostconditions(Map<String, Object> arguments, Object result) {
        List<Violation> violations = violatedPostconditions(arguments, result);
        if (!violations.isEmpty()) {
            throw ContractViolationException.aggregate(violations.stream()
                    .map(v -> new ContractViolationException(v.constraintId(), v.phase(), v.message()))
                    .collect(Collectors.toList()));
        }
    }

    /**
     * Every entry check the arguments fail, without stopping at the first.
     */
    public List<Violation> violatedPreconditions(Map<String, Object> arguments) {
        List<Violation> violations = new ArrayList<>();
        evaluateEntry(environment(arguments, null, false), violations, false);
        return violations;
    }

    /**
     * Ids of the constraints the arguments violate.
     */
    public Set<String> violatedConstraints(Map<String, Object> arguments) {
        return violatedPreconditions(arguments).stream()
                .map(Violation::constraintId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<Violation> violatedPostconditions(Map<String, Object> arguments, Object result) {
        Map<String, Object> env = environment(arguments, result, true);
        List<Violation> violations = new ArrayList<>();
        for (ContractCode.RecordInvariant invariant : code.getInvariants()) {
            if (invariant.onResult()) {
                checkSite(invariant, env, violations, false);
            }
        }
        run(code.getPostconditions(), env, violations, false);
        return violations;
    }

    /**
     * Evaluates a lowered condition over the arguments.
     *
     * @throws IllegalArgumentException if the condition cannot be evaluated on these values
     */
    public boolean holds(Expr condition, Map<String, Object> arguments) {
        return ExpressionEvaluator.test(condition, environment(arguments, null, false));
    }

    /**
     * Evaluates a lowered condition over the arguments and the result.
     *
     * @throws IllegalArgumentException if the condition cannot be evaluated on these values
     */
    public boolean holds(Expr condition, Map<String, Object> arguments, Object result) {
        return ExpressionEvaluator.test(condition, environment(arguments, result, true));
    }

    private void evaluateEntry(Map<String, Object> env, List<Violation> violations, boolean failFast) {
        for (ContractCode.EntryStep step : code.entrySteps()) {
            boolean failed = step.invariant() != null
                    ? checkSite(step.invariant(), env, violations, failFast)
                    : run(List.of(step.precondition()), env, violations, failFast);
            if (failed && failFast) {
                return;
            }
        }
    }

    private Map<String, Object> environment(Map<String, Object> arguments, Object result, boolean withResult) {
        Map<String, Object> env = new HashMap<>();
        for (Map.Entry<String, String> parameter : code.getParameterNames().entrySet()) {
            if (!arguments.containsKey(parameter.getKey())) {
                throw new IllegalArgumentException("Missing argument " + parameter.getKey() + " for " + code.getSourceName());
            }
            env.put(parameter.getValue(), arguments.get(parameter.getKey()));
        }
        if (withResult) {
            env.put(code.getResultName(), result);
        }
        return env;
    }

    /**
     * Runs checks in order. Returns true if something failed.
     */
    private boolean run(List<Check> checks, Map<String, Object> env, List<Violation> violations, boolean failFast) {
        boolean failed = false;
        for (Check check : checks) {
            if (check instanceof Check.Guard guard) {
                if (!passes(guard, env)) {
                    violations.add(new Violation(guard.constraintId(), guard.phase(), guard.failureMessage()));
                    failed = true;
                }
            } else if (check instanceof Check.Branch branch) {
                failed |= runBranch(branch, env, violations, failFast);
            }
            if (failed && failFast) {
                return true;
            }
        }
        return failed;
    }

    private boolean passes(Check.Guard guard, Map<String, Object> env) {
        try {
            return ExpressionEvaluator.test(guard.condition(), env);
        } catch (IllegalArgumentException | ArithmeticException e) {
            // A value of the wrong shape cannot satisfy the constraint
            logger.debug("Check {} could not be evaluated: {}", guard.constraintId(), e.getMessage());
            return false;
        }
    }

    private boolean runBranch(Check.Branch branch, Map<String, Object> env, List<Violation> violations, boolean failFast) {
        Object scrutinee;
        try {
            scrutinee = ExpressionEvaluator.evaluate(branch.scrutinee(), env);
        } catch (IllegalArgumentException e) {
            logger.debug("Scrutinee of {} could not be evaluated: {}", branch.constraintId(), e.getMessage());
            violations.add(new Violation(branch.constraintId(), branch.phase(), branch.phase().label() + " violated ["
                    + branch.constraintId() + " Disjoint]: " + e.getMessage()));
            return true;
        }
        Check.Tag tag = tagOf(scrutinee);
        Check.BranchCase matched = tag == null ? null : branch.caseFor(tag);
        if (matched == null) {
            String reason = branch.fallback() != null ? branch.fallback() : "case analysis is not exhaustive";
            logger.error("Unreachable case in {}: {} (value {})", branch.constraintId(), reason, scrutinee);
            throw new UnreachableCaseException(branch.constraintId(), reason);
        }
        return run(matched.checks(), env, violations, failFast);
    }

    private Check.Tag tagOf(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? Check.Tag.PRESENT : Check.Tag.ABSENT;
        }
        if (code.getProfile().getOptionalRepresentation() == EmissionProfile.OptionalRepresentation.TAGGED) {
            // Tagged optionals must carry their tag
            return null;
        }
        return value == null ? Check.Tag.ABSENT : Check.Tag.PRESENT;
    }

    /**
     * Checks one record invariant set at every value its site denotes.
     * Returns true if something failed.
     */
    private boolean checkSite(ContractCode.RecordInvariant invariant, Map<String, Object> env,
                              List<Violation> violations, boolean failFast) {
        List<Object> records = new ArrayList<>();
        try {
            collectSiteValues(invariant.site(), env, records);
        } catch (IllegalArgumentException e) {
            logger.debug("Record site {} could not be reached: {}", invariant.site().path(), e.getMessage());
            return false;
        }
        boolean failed = false;
        for (Object value : records) {
            Map<String, Object> scoped = new HashMap<>(env);
            scoped.put(ContractCode.RecordInvariant.SELF, value);
            failed |= run(invariant.checks(), scoped, violations, failFast);
            if (failed && failFast) {
                return true;
            }
        }
        return failed;
    }

    private void collectSiteValues(Subject site, Map<String, Object> env, List<Object> out) {
        if (site instanceof Subject.Param param) {
            out.add(env.get(code.getParameterNames().get(param.name())));
        } else if (site instanceof Subject.Result) {
            if (env.containsKey(code.getResultName())) {
                out.add(env.get(code.getResultName()));
            }
        } else {
            List<Object> owners = new ArrayList<>();
            collectSiteValues(site.owner(), env, owners);
            for (Object owner : owners) {
                Object value = ExpressionEvaluator.unwrapOptional(owner);
                if (site instanceof Subject.FieldOf field && value instanceof Map<?, ?> fields) {
                    out.add(fields.get(field.field()));
                } else if (site instanceof Subject.ElementOf && value instanceof List<?> elements) {
                    out.addAll(elements);
                } else if (site instanceof Subject.PresentOf && value != null) {
                    out.add(value);
                } else if (!(site instanceof Subject.PresentOf)) {
                    throw new IllegalArgumentException("Cannot reach " + site.path() + " in " + owner);
                }
            }
        }
    }
}
