package com.sigcontract.compiler.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sigcontract.compiler.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Invokes an external command once per case.
 *
 * The command reads {@code {"function": name, "arguments": {...}}} from
 * stdin and writes one JSON object to stdout: {@code {"status": "ok",
 * "value": ...}} or {@code {"status": "rejected", "message": ...}}. Anything
 * else, including a non-zero exit, is a crash.
 */
public class ProcessExecutable implements FunctionExecutable {

    private static final Logger logger = LoggerFactory.getLogger(ProcessExecutable.class);

    private static final int STDERR_TAIL = 400;

    private final String functionName;
    private final List<String> command;

    public ProcessExecutable(String functionName, List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }
        this.functionName = functionName;
        this.command = List.copyOf(command);
    }

    @Override
    public String name() {
        return String.join(" ", command);
    }

    @Override
    public ExecutionResult execute(Map<String, Object> arguments, Path workingDirectory)
            throws IOException, InterruptedException {
        ObjectNode request = JsonSupport.mapper().createObjectNode();
        request.put("function", functionName);
        request.set("arguments", JsonSupport.mapper().valueToTree(arguments));

        Path stdout = workingDirectory.resolve("stdout.json");
        Path stderr = workingDirectory.resolve("stderr.txt");
        Process process = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(JsonSupport.mapper().writeValueAsBytes(request));
            }
            int exitCode = process.waitFor();
            String output = Files.readString(stdout, StandardCharsets.UTF_8).trim();
            if (exitCode != 0) {
                return ExecutionResult.crashed("exit code " + exitCode + ": " + tail(stderr));
            }
            return parse(output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            logger.debug("Interrupted {}; process destroyed", name());
            throw e;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private ExecutionResult parse(String output) {
        JsonNode response;
        try {
            response = JsonSupport.mapper().readTree(output);
        } catch (IOException e) {
            return ExecutionResult.crashed("unreadable output: " + abbreviate(output));
        }
        if (response == null || !response.isObject()) {
            return ExecutionResult.crashed("expected a JSON object, got: " + abbreviate(output));
        }
        String status = response.path("status").asText("");
        switch (status) {
            case "ok":
                return ExecutionResult.returned(JsonSupport.mapper().convertValue(response.get("value"), Object.class));
            case "rejected":
                return ExecutionResult.rejected(response.path("message").asText("rejected"));
            default:
                return ExecutionResult.crashed("unknown status '" + status + "'");
        }
    }

    private static String tail(Path stderr) {
        try {
            String text = Files.readString(stderr, StandardCharsets.UTF_8).trim();
            return text.length() > STDERR_TAIL ? "..." + text.substring(text.length() - STDERR_TAIL) : text;
        } catch (IOException e) {
            return "(no stderr: " + e.getMessage() + ")";
        }
    }

    private static String abbreviate(String text) {
        return text.length() > STDERR_TAIL ? text.substring(0, STDERR_TAIL) + "..." : text;
    }

    @Override
    public String toString() {
        return "process " + name();
    }
}
