package com.example.samifier.service;

import com.example.samifier.aspect.LogExecutionTime;
import com.example.samifier.asset.StagedAsset;
import com.example.samifier.exception.OutputWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Commits the output of a run in one step.
 *
 * Everything is first written to a temporary directory next to the output directory and
 * then moved into place entry by entry, so a failure while writing leaves the output
 * directory untouched. Entries with the same path as a previous run are replaced; other
 * files in the output directory are left alone.
 */
@Slf4j
@Component
public class OutputWriter {
    private static final String STAGING_PREFIX = ".samifier-";

    /**
     * @param documents file name to text, e.g. the template and the plan
     * @param assets    staged code, placed at their relative paths
     */
    @LogExecutionTime("Write refactoring output")
    public void write(Path outputDir, Map<String, String> documents, List<StagedAsset> assets) {
        Path target = outputDir.toAbsolutePath().normalize();
        Path staging = null;
        try {
            Files.createDirectories(target.getParent());
            staging = Files.createTempDirectory(target.getParent(), STAGING_PREFIX);

            List<String> entries = new ArrayList<>();
            for (Map.Entry<String, String> document : documents.entrySet()) {
                Files.write(inside(staging, document.getKey()), document.getValue().getBytes(StandardCharsets.UTF_8));
                entries.add(document.getKey());
            }
            for (StagedAsset asset : assets) {
                writeAsset(staging, asset);
                entries.add(asset.getRelativePath());
            }

            Files.createDirectories(target);
            for (String entry : entries) {
                Path destination = inside(target, entry);
                Files.createDirectories(destination.getParent());
                deleteRecursively(destination);
                Files.move(staging.resolve(entry), destination, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Wrote {} file(s) and {} asset(s) to {}", documents.size(), assets.size(), target);
        } catch (IOException e) {
            throw new OutputWriteException("Failed to write output to " + target + ": " + e.getMessage(), e);
        } finally {
            if (staging != null) {
                cleanUp(staging);
            }
        }
    }

    private static void writeAsset(Path staging, StagedAsset asset) throws IOException {
        Path root = inside(staging, asset.getRelativePath());
        if (asset.isSingleFile()) {
            Files.createDirectories(root.getParent());
            Files.write(root, asset.getFiles().get(""));
            return;
        }
        for (Map.Entry<String, byte[]> file : asset.getFiles().entrySet()) {
            Path path = inside(root, file.getKey());
            Files.createDirectories(path.getParent());
            Files.write(path, file.getValue());
        }
    }

    /**
     * Resolves a relative path, refusing anything that would land outside the base directory
     */
    static Path inside(Path base, String relativePath) {
        Path resolved = base.resolve(relativePath).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new OutputWriteException("Refusing to write outside the output directory: " + relativePath);
        }
        return resolved;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path each : paths) {
            Files.delete(each);
        }
    }

    private static void cleanUp(Path staging) {
        try {
            deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", staging, e.getMessage(), e);
        }
    }
}
