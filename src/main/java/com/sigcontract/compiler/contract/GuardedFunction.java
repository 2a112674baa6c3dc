package com.sigcontract.compiler.contract;

import com.sigcontract.compiler.exception.ContractViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A function body wrapped in its synthesized contract: preconditions run
 * before the body, postconditions after it.
 */
public class GuardedFunction {

    private static final Logger logger = LoggerFactory.getLogger(GuardedFunction.class);

    private final ContractCode code;
    private final ContractEvaluator evaluator;
    private final Function<Map<String, Object>, Object> body;

    public GuardedFunction(ContractCode code, Function<Map<String, Object>, Object> body) {
        this.code = Objects.requireNonNull(code, "code");
        this.evaluator = new ContractEvaluator(code);
        this.body = Objects.requireNonNull(body, "body");
    }

    public ContractCode getCode() {
        return code;
    }

    public ContractEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * Calls the function the way the profile's assertion style dictates:
     * the plain value (violations thrown) for {@code exception}, a
     * {@link ContractResult} for {@code return-result}.
     */
    public Object invoke(Map<String, Object> arguments) {
        if (code.getProfile().getAssertionStyle() == EmissionProfile.AssertionStyle.RETURN_RESULT) {
            return call(arguments);
        }
        return apply(arguments);
    }

    /**
     * @throws ContractViolationException if a check fails
     */
    public Object apply(Map<String, Object> arguments) {
        evaluator.checkPreconditions(arguments);
        Object result = body.apply(arguments);
        evaluator.checkPostconditions(arguments, result);
        return result;
    }

    public ContractResult call(Map<String, Object> arguments) {
        try {
            return ContractResult.success(apply(arguments));
        } catch (ContractViolationException e) {
            logger.debug("{} rejected: {}", code.getFunctionName(), e.getMessage());
            return ContractResult.violation(e);
        }
    }
}
