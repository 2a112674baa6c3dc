package com.sigcontract.compiler.testgen;

import com.sigcontract.compiler.contract.ContractEvaluator;
import com.sigcontract.compiler.contract.ContractResult;
import com.sigcontract.compiler.contract.ContractSynthesizer;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.contract.GuardedFunction;
import com.sigcontract.compiler.model.ConstraintModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Executes property-based cases: draws seeded random points from the case's
 * generator ranges, turns them into inputs and checks the property on each.
 */
public class PropertyRunner {

    private static final Logger logger = LoggerFactory.getLogger(PropertyRunner.class);

    private static final int ATTEMPTS_PER_TRIAL = 50;
    private static final int MAX_COUNTEREXAMPLES = 5;

    /**
     * Outcome of one property case. {@code discarded} counts samples the
     * property does not apply to, e.g. an absent optional.
     */
    public record PropertyResult(String caseId, int trials, int accepted, int rejected, int discarded,
                                 List<Map<String, Object>> counterexamples) {

        public PropertyResult {
            counterexamples = List.copyOf(counterexamples);
        }

        public boolean passed() {
            return counterexamples.isEmpty();
        }
    }

    private final InputSpace space;
    private final ContractEvaluator evaluator;

    public PropertyRunner(ConstraintModel model) {
        this.space = new InputSpace(model.getSignature());
        this.evaluator = new ContractEvaluator(new ContractSynthesizer().synthesize(model, EmissionProfile.defaults()));
    }

    /**
     * Draws up to {@code trials} inputs from the case's generator. Result
     * invariants only draw inputs every precondition accepts, as does
     * {@code acceptedOnly}.
     */
    public List<Map<String, Object>> sample(TestCase propertyCase, boolean acceptedOnly) {
        GeneratorSpec generator = requireGenerator(propertyCase);
        boolean onlyValid = acceptedOnly || generator.property() == GeneratorSpec.Property.RESULT_INVARIANT;
        Random random = new Random(generator.seed());
        List<Map<String, Object>> samples = new ArrayList<>();
        int attempts = generator.trials() * ATTEMPTS_PER_TRIAL;
        for (int attempt = 0; attempt < attempts && samples.size() < generator.trials(); attempt++) {
            Map<String, Long> point = new LinkedHashMap<>();
            for (Map.Entry<String, GeneratorSpec.Range> range : generator.ranges().entrySet()) {
                long span = range.getValue().max() - range.getValue().min() + 1;
                point.put(range.getKey(), range.getValue().min() + (long) (random.nextDouble() * span));
            }
            Optional<Map<String, Object>> inputs = space.build(point);
            if (inputs.isEmpty()) {
                continue;
            }
            if (onlyValid && !evaluator.violatedConstraints(inputs.get()).isEmpty()) {
                continue;
            }
            samples.add(inputs.get());
        }
        if (samples.size() < generator.trials()) {
            logger.debug("Only {} of {} samples drawn for {}", samples.size(), generator.trials(), propertyCase.id());
        }
        return samples;
    }

    /**
     * Runs the property against a guarded implementation.
     */
    public PropertyResult check(TestCase propertyCase, GuardedFunction function) {
        GeneratorSpec generator = requireGenerator(propertyCase);
        boolean acceptance = generator.property() == GeneratorSpec.Property.INPUT_ACCEPTANCE;
        int accepted = 0;
        int rejected = 0;
        int discarded = 0;
        List<Map<String, Object>> counterexamples = new ArrayList<>();
        List<Map<String, Object>> samples = sample(propertyCase, false);

        for (Map<String, Object> inputs : samples) {
            ContractResult result;
            try {
                result = function.call(inputs);
            } catch (RuntimeException e) {
                logger.debug("{} crashed on {}: {}", propertyCase.id(), inputs, e.toString());
                addCounterexample(counterexamples, inputs);
                continue;
            }
            if (result.isViolation()) {
                rejected++;
            } else {
                accepted++;
            }

            Boolean holds = holds(generator, inputs, result);
            if (holds == null) {
                discarded++;
                continue;
            }
            boolean ok;
            if (acceptance) {
                boolean shouldReject = !evaluator.violatedConstraints(inputs).isEmpty();
                ok = result.isViolation() == shouldReject && (holds || result.isViolation());
            } else {
                ok = !result.isViolation() && holds;
            }
            if (!ok) {
                addCounterexample(counterexamples, inputs);
            }
        }
        PropertyResult outcome = new PropertyResult(propertyCase.id(), samples.size(), accepted, rejected, discarded,
                counterexamples);
        if (outcome.passed()) {
            logger.debug("Property {} held on {} samples", propertyCase.id(), samples.size());
        } else {
            logger.warn("Property {} failed on {} of {} samples", propertyCase.id(), counterexamples.size(), samples.size());
        }
        return outcome;
    }

    private Boolean holds(GeneratorSpec generator, Map<String, Object> inputs, ContractResult result) {
        try {
            if (generator.property() == GeneratorSpec.Property.RESULT_INVARIANT) {
                return !result.isViolation() && evaluator.holds(generator.invariant(), inputs, result.value());
            }
            return evaluator.holds(generator.invariant(), inputs);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return null;
        }
    }

    private static void addCounterexample(List<Map<String, Object>> counterexamples, Map<String, Object> inputs) {
        if (counterexamples.size() < MAX_COUNTEREXAMPLES) {
            counterexamples.add(inputs);
        }
    }

    private static GeneratorSpec requireGenerator(TestCase propertyCase) {
        if (propertyCase.generator() == null) {
            throw new IllegalArgumentException(propertyCase.id() + " is not a property-based case");
        }
        return propertyCase.generator();
    }
}
