package com.sigcontract.compiler.oracle;

import com.sigcontract.compiler.testgen.ReferenceImplementation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * An implementation the oracle can invoke on test inputs.
 */
public interface FunctionExecutable {

    String name();

    /**
     * Runs the implementation once. Implementations must stop promptly when
     * the calling thread is interrupted.
     *
     * @param workingDirectory private to this invocation
     */
    ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory)
            throws IOException, InterruptedException;

    /**
     * Adapts this executable as a source of reference outputs for test synthesis.
     */
    default ReferenceImplementation asReference() {
        return arguments -> {
            Path workingDirectory = Files.createTempDirectory("sigcontract-ref-");
            try {
                ExecutionResult result = execute(arguments, workingDirectory);
                if (!result.returnedValue()) {
                    throw new IllegalStateException(name() + " " + result.status().name().toLowerCase() + ": " + result.message());
                }
                return result.value();
            } finally {
                WorkingDirectories.delete(workingDirectory);
            }
        };
    }
}
