package com.sigcontract.compiler.oracle;

import com.sigcontract.compiler.contract.ContractResult;
import com.sigcontract.compiler.contract.GuardedFunction;
import com.sigcontract.compiler.exception.ContractViolationException;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Invokes a Java function in this JVM. A guarded function's contract
 * violations count as rejections; so do {@link ContractViolationException}s
 * thrown by a plain function.
 */
public class InProcessExecutable implements FunctionExecutable {

    private final String name;
    private final Function<Map<String, Object>, Object> function;

    public InProcessExecutable(String name, Function<Map<String, Object>, Object> function) {
        this.name = name;
        this.function = function;
    }

    /**
     * The generated implementation: a body wrapped in its synthesized contract.
     */
    public static InProcessExecutable guarded(GuardedFunction guarded) {
        return new InProcessExecutable(guarded.getCode().getFunctionName(), arguments -> {
            ContractResult result = guarded.call(arguments);
            return result.orThrow();
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory) {
        try {
            return ExecutionResult.returned(function.apply(arguments));
        } catch (ContractViolationException e) {
            return ExecutionResult.rejected(e.getMessage());
        } catch (RuntimeException e) {
            return ExecutionResult.crashed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "in-process " + name;
    }
}
