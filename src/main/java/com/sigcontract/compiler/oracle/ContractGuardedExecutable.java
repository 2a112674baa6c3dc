package com.sigcontract.compiler.oracle;

import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.ContractEvaluator;
import com.sigcontract.compiler.exception.ContractViolationException;
import com.sigcontract.compiler.exception.UnreachableCaseException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Wraps another executable in a synthesized contract: arguments are checked
 * before the delegate runs and its value is checked afterwards. Used as the
 * generated implementation when the body only exists as an external command.
 */
public class ContractGuardedExecutable implements FunctionExecutable {

    private final ContractEvaluator evaluator;
    private final FunctionExecutable delegate;

    public ContractGuardedExecutable(ContractCode code, FunctionExecutable delegate) {
        this.evaluator = new ContractEvaluator(code);
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return "guarded " + delegate.name();
    }

    @Override
    public ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory)
            throws IOException, InterruptedException {
        try {
            evaluator.checkPreconditions(arguments);
        } catch (ContractViolationException e) {
            return ExecutionResult.rejected(e.getMessage());
        } catch (UnreachableCaseException | IllegalArgumentException e) {
            return ExecutionResult.crashed(e.getMessage());
        }
        ExecutionResult result = delegate.execute(arguments, workingDirectory);
        if (!result.returnedValue()) {
            return result;
        }
        try {
            evaluator.checkPostconditions(arguments, result.value());
            return result;
        } catch (ContractViolationException | UnreachableCaseException e) {
            return ExecutionResult.crashed(e.getMessage());
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
