package com.sigcontract.compiler.processor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sigcontract.compiler.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Results of one batch, in input order.
 */
public final class BatchReport {

    private static final Logger logger = LoggerFactory.getLogger(BatchReport.class);

    private final List<CompilationResult> results;
    private final long elapsedMillis;

    public BatchReport(List<CompilationResult> results, long elapsedMillis) {
        this.results = List.copyOf(results);
        this.elapsedMillis = elapsedMillis;
    }

    public List<CompilationResult> getResults() {
        return results;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public int getSucceeded() {
        return (int) results.stream().filter(CompilationResult::isSuccess).count();
    }

    public int getFailed() {
        return results.size() - getSucceeded();
    }

    /**
     * Failure count per category; categories without failures are absent.
     */
    public Map<String, Long> getFailuresByCategory() {
        return results.stream()
                .filter(r -> !r.isSuccess())
                .collect(Collectors.groupingBy(CompilationResult::getFailureCategory, TreeMap::new,
                        Collectors.counting()));
    }

    @JsonIgnore
    public List<CompilationResult> failures() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    /**
     * The result for a function, or null if no signature of that name compiled.
     */
    public CompilationResult result(String functionName) {
        return results.stream()
                .filter(r -> functionName.equals(r.getFunctionName()))
                .findFirst()
                .orElse(null);
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    public void exportJSON(Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(), StandardCharsets.UTF_8);
        logger.info("Batch report exported to: {}", outputPath);
    }

    @Override
    public String toString() {
        return "BatchReport{" + results.size() + " signatures, " + getFailed() + " failed " + getFailuresByCategory() + "}";
    }
}
