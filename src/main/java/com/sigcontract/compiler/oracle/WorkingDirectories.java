package com.sigcontract.compiler.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Per-invocation scratch directories.
 */
final class WorkingDirectories {

    private static final Logger logger = LoggerFactory.getLogger(WorkingDirectories.class);

    private WorkingDirectories() {
    }

    static Path create(String caseId) throws IOException {
        return Files.createTempDirectory("sigcontract-" + caseId.replaceAll("[^A-Za-z0-9]", "_") + "-");
    }

    static void delete(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            logger.warn("Could not delete working directory {}: {}", directory, e.getMessage());
        }
    }
}
