package com.sigcontract.compiler;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.sigcontract.compiler.contract.EmissionProfile;
import com.sigcontract.compiler.evaluation.MetricsCollector;
import com.sigcontract.compiler.oracle.OracleSettings;
import com.sigcontract.compiler.oracle.ProcessExecutable;
import com.sigcontract.compiler.processor.BatchReport;
import com.sigcontract.compiler.processor.CompilationResult;
import com.sigcontract.compiler.processor.SignatureBatchProcessor;
import com.sigcontract.compiler.render.JavaContractRenderer;
import com.sigcontract.compiler.testgen.TestSynthesisOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Main application entry point for the signature-constraint compiler.
 * Compiles signature files into contracts and test plans.
 */
public class SigContractApp {

    private static final Logger logger = LoggerFactory.getLogger(SigContractApp.class);

    static final String USAGE = "Usage: java -jar sigcontract.jar <signature-file-or-dir> [--profile profile.json]"
            + " [--oracle oracle.json] [--report report.json] [--metrics metrics.json]"
            + " [--reference \"<command>\"] [--render <dir>]";

    /**
     * Parsed command line.
     */
    static final class Options {
        Path input;
        Path profile;
        Path oracle;
        Path report;
        Path metrics;
        List<String> referenceCommand;
        Path renderDirectory;

        static Options parse(String[] args) {
            if (args.length < 1 || args[0].startsWith("--")) {
                throw new IllegalArgumentException("Missing signature file or directory");
            }
            Options options = new Options();
            options.input = Paths.get(args[0]);
            for (int i = 1; i < args.length; i++) {
                String flag = args[i];
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + flag);
                }
                String value = args[++i];
                switch (flag) {
                    case "--profile" -> options.profile = Paths.get(value);
                    case "--oracle" -> options.oracle = Paths.get(value);
                    case "--report" -> options.report = Paths.get(value);
                    case "--metrics" -> options.metrics = Paths.get(value);
                    case "--reference" -> options.referenceCommand = Arrays.asList(value.trim().split("\\s+"));
                    case "--render" -> options.renderDirectory = Paths.get(value);
                    default -> throw new IllegalArgumentException("Unknown option " + flag);
                }
            }
            return options;
        }
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.err.println("Example: java -jar sigcontract.jar signatures/ --report build/report.json");
            System.exit(1);
            return;
        }

        logger.info("Starting signature-constraint compiler");
        logger.info("Input: {}", options.input);

        try {
            BatchReport report = run(options);
            logger.info("Processing complete!");
            logger.info("Compiled {} of {} signatures", report.getSucceeded(), report.getResults().size());
            System.exit(report.getFailed() == 0 ? 0 : 2);
        } catch (Exception e) {
            logger.error("Error compiling signatures", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static BatchReport run(Options options) throws IOException {
        EmissionProfile profile = options.profile != null ? EmissionProfile.load(options.profile) : EmissionProfile.defaults();
        SignatureBatchProcessor processor = new SignatureBatchProcessor(profile, TestSynthesisOptions.defaults(), true);
        if (options.referenceCommand != null) {
            OracleSettings settings = options.oracle != null ? OracleSettings.load(options.oracle) : OracleSettings.defaults();
            List<String> command = options.referenceCommand;
            processor.withReference(functionName -> new ProcessExecutable(functionName, command), settings);
        }

        logger.info("Processing signatures...");
        BatchReport report = processor.processPath(options.input);
        for (CompilationResult result : report.getResults()) {
            if (result.isSuccess()) {
                logger.info("{}", result);
            } else {
                logger.warn("{}", result);
            }
        }

        MetricsCollector metricsCollector = processor.getMetricsCollector();
        if (options.renderDirectory != null) {
            render(report, options.renderDirectory, metricsCollector);
        }
        if (options.report != null) {
            report.exportJSON(options.report);
        }
        metricsCollector.printReport();
        if (options.metrics != null) {
            metricsCollector.exportJSON(options.metrics);
        }
        return report;
    }

    /**
     * Writes one {@code <Name>Contracts.java} per compiled signature.
     */
    static void render(BatchReport report, Path directory, MetricsCollector metricsCollector) throws IOException {
        JavaContractRenderer renderer = new JavaContractRenderer();
        Path packageDirectory = directory.resolve(JavaContractRenderer.DEFAULT_PACKAGE.replace('.', '/'));
        Files.createDirectories(packageDirectory);
        for (CompilationResult result : report.getResults()) {
            if (!result.isSuccess()) {
                continue;
            }
            try {
                CompilationUnit cu = renderer.render(result.getContract(), result.getSignature());
                cu.findAll(MethodDeclaration.class).forEach(metricsCollector::recordRenderedMethod);
                Path file = packageDirectory.resolve(JavaContractRenderer.className(result.getContract()) + ".java");
                Files.writeString(file, cu.toString());
                logger.info("Wrote {}", file);
            } catch (IllegalArgumentException | IllegalStateException e) {
                logger.error("Could not render {}", result.getLocation(), e);
            }
        }
    }
}
