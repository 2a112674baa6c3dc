package com.sigcontract.compiler.oracle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sigcontract.compiler.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Oracle runner configuration, loadable from JSON:
 * <pre>{@code {"timeoutMillis": 3000, "parallelism": 4, "propertySamples": 10}}</pre>
 */
public final class OracleSettings {

    private static final long DEFAULT_TIMEOUT_MILLIS = 3_000;
    private static final int DEFAULT_PROPERTY_SAMPLES = 10;

    private final long timeoutMillis;
    private final int parallelism;
    private final int propertySamples;

    @JsonCreator
    public OracleSettings(@JsonProperty("timeoutMillis") Long timeoutMillis,
                          @JsonProperty("parallelism") Integer parallelism,
                          @JsonProperty("propertySamples") Integer propertySamples) {
        this.timeoutMillis = timeoutMillis != null ? timeoutMillis : DEFAULT_TIMEOUT_MILLIS;
        this.parallelism = parallelism != null ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
        this.propertySamples = propertySamples != null ? propertySamples : DEFAULT_PROPERTY_SAMPLES;
        if (this.timeoutMillis <= 0 || this.parallelism <= 0 || this.propertySamples < 0) {
            throw new IllegalArgumentException("Invalid oracle settings " + this);
        }
    }

    public static OracleSettings defaults() {
        return new OracleSettings(null, null, null);
    }

    public static OracleSettings load(Path path) throws IOException {
        return JsonSupport.mapper().readValue(Files.readString(path), OracleSettings.class);
    }

    public OracleSettings withTimeout(Duration timeout) {
        return new OracleSettings(timeout.toMillis(), parallelism, propertySamples);
    }

    public OracleSettings withParallelism(int threads) {
        return new OracleSettings(timeoutMillis, threads, propertySamples);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public int getParallelism() {
        return parallelism;
    }

    /** Concrete samples drawn from each property-based case. */
    public int getPropertySamples() {
        return propertySamples;
    }

    @Override
    public String toString() {
        return "OracleSettings{timeout=" + timeoutMillis + "ms, parallelism=" + parallelism
                + ", propertySamples=" + propertySamples + "}";
    }
}
