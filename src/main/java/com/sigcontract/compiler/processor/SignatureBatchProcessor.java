package com.sigcontract.compiler.processor;

import com.sigcontract.compiler.analysis.ConstraintExtractor;
import com.sigcontract.compiler.contract.ContractCode;
import com.sigcontract.compiler.contract.ContractSynthesizer;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.evaluation.MetricsCollector;
import com.sigcontract.compiler.exception.SignatureCompilationException;
import com.sigcontract.compiler.model.ConstraintModel;
import com.sigcontract.compiler.model.Signature;
import com.sigcontract.compiler.oracle.ContractGuardedExecutable;
import com.sigcontract.compiler.oracle.DifferentialOracleRunner;
import com.sigcontract.compiler.oracle.DifferentialReport;
import com.sigcontract.compiler.oracle.FunctionExecutable;
import com.sigcontract.compiler.oracle.OracleSettings;
import com.sigcontract.compiler.parser.SignatureParser;
import com.sigcontract.compiler.testgen.TestPlan;
import com.sigcontract.compiler.testgen.TestSynthesisOptions;
import com.sigcontract.compiler.testgen.TestSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Compiles many signatures: parse, extract, synthesize the contract and the
 * test plan, and optionally run the differential oracle.
 *
 * Signatures are compiled concurrently on a fixed pool. A failing signature
 * is recorded in the report under its failure category and never stops the
 * rest of the batch.
 */
public class SignatureBatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SignatureBatchProcessor.class);

    public static final String SIGNATURE_EXTENSION = ".sig";
    private static final String COMMENT_PREFIX = "--";

    private final SignatureParser parser = new SignatureParser();
    private final ConstraintExtractor extractor = new ConstraintExtractor();
    private final ContractSynthesizer contractSynthesizer = new ContractSynthesizer();
    private final TestSynthesizer testSynthesizer;
    private final EmissionProfile profile;
    private final int threads;
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;

    private Function<String, FunctionExecutable> referenceFactory;
    private OracleSettings oracleSettings = OracleSettings.defaults();

    public SignatureBatchProcessor() {
        this(EmissionProfile.defaults(), TestSynthesisOptions.defaults(), true);
    }

    public SignatureBatchProcessor(EmissionProfile profile, TestSynthesisOptions options, boolean collectMetrics) {
        this(profile, options, collectMetrics, Runtime.getRuntime().availableProcessors());
    }

    public SignatureBatchProcessor(EmissionProfile profile, TestSynthesisOptions options, boolean collectMetrics,
                                   int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.profile = Objects.requireNonNull(profile, "profile");
        this.testSynthesizer = new TestSynthesizer(options);
        this.threads = threads;
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
    }

    /**
     * Enables the differential oracle. The factory maps a function name to its
     * reference executable; the generated side is the reference wrapped in the
     * synthesized contract.
     */
    public SignatureBatchProcessor withReference(Function<String, FunctionExecutable> factory, OracleSettings settings) {
        this.referenceFactory = Objects.requireNonNull(factory, "factory");
        this.oracleSettings = Objects.requireNonNull(settings, "settings");
        return this;
    }

    /**
     * Compiles every signature found in a {@code .sig} file, or in all such
     * files below a directory.
     *
     * @throws IOException if the path does not exist or cannot be read
     */
    public BatchReport processPath(Path path) throws IOException {
        return process(loadSignatures(path));
    }

    /**
     * Reads signatures, one per line. Blank lines and lines starting with
     * {@code --} are skipped.
     */
    public static List<SignatureSource> loadSignatures(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Path does not exist: " + path);
        }
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(path)) {
            try (Stream<Path> paths = Files.walk(path)) {
                paths.filter(Files::isRegularFile)
                        .filter(p -> p.toString().endsWith(SIGNATURE_EXTENSION))
                        .sorted()
                        .forEach(files::add);
            }
        } else {
            files.add(path);
        }

        List<SignatureSource> sources = new ArrayList<>();
        for (Path file : files) {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                sources.add(new SignatureSource(file.getFileName() + ":" + (i + 1), line));
            }
        }
        logger.info("Found {} signatures in {} files", sources.size(), files.size());
        return sources;
    }

    public BatchReport process(List<SignatureSource> sources) {
        long start = System.currentTimeMillis();
        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<CompilationResult> results = new ArrayList<>();
        try {
            List<Future<CompilationResult>> futures = sources.stream()
                    .map(source -> pool.submit(() -> compile(source)))
                    .collect(Collectors.toList());
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(futures.get(i), sources.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        BatchReport report = new BatchReport(results, System.currentTimeMillis() - start);
        logger.info("Compiled {} of {} signatures ({} failed: {})", report.getSucceeded(), results.size(),
                report.getFailed(), report.getFailuresByCategory());

        if (collectMetrics) {
            results.forEach(metricsCollector::recordResult);
            metricsCollector.endAnalysis();
        }
        return report;
    }

    private CompilationResult collect(Future<CompilationResult> future, SignatureSource source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompilationResult.failure(source, CompilationResult.INTERNAL, "interrupted", 0);
        } catch (ExecutionException e) {
            logger.error("Error compiling {}", source.location(), e.getCause());
            return CompilationResult.failure(source, CompilationResult.INTERNAL, String.valueOf(e.getCause()), 0);
        }
    }

    /**
     * Compiles one signature. Never throws for a bad signature; the failure is
     * returned in the result instead.
     */
    public CompilationResult compile(SignatureSource source) {
        long start = System.currentTimeMillis();
        try {
            Signature signature = parser.parse(source.text());
            ConstraintModel model = extractor.extract(signature);
            ContractCode contract = contractSynthesizer.synthesize(model, profile);

            FunctionExecutable reference = referenceFactory != null ? referenceFactory.apply(signature.getName()) : null;
            TestPlan plan = reference != null
                    ? testSynthesizer.synthesize(model, reference.asReference())
                    : testSynthesizer.synthesize(model);
            CompilationResult result = CompilationResult.success(source, signature, model, contract, plan,
                    System.currentTimeMillis() - start);

            if (reference != null) {
                DifferentialReport oracle = new DifferentialOracleRunner(oracleSettings)
                        .run(model, plan, reference, new ContractGuardedExecutable(contract, reference));
                result = result.withOracleReport(oracle);
            }
            logger.debug("Compiled {}", result);
            return result;
        } catch (SignatureCompilationException e) {
            logger.warn("{}: {} ({})", source.location(), e.getMessage(), e.category());
            return CompilationResult.failure(source, e.category(), e.getMessage(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            logger.error("Internal error compiling {}", source.location(), e);
            return CompilationResult.failure(source, CompilationResult.INTERNAL,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    /**
     * The metrics collector, or null when metrics are disabled.
     */
    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public EmissionProfile getProfile() {
        return profile;
    }
}
