package com.colorcorrection.service.lifecycle;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Owns the upload, results and models folders. They are created at startup
 * and emptied on shutdown; the folders themselves are kept.
 */
@Component
@Slf4j
public class WorkspaceCleaner implements ReleasableResource {

    private final Map<String, Path> folders = new LinkedHashMap<>();

    public WorkspaceCleaner(
            @Value("${app.workspace.upload-folder:uploads}") String uploadFolder,
            @Value("${app.workspace.results-folder:results}") String resultsFolder,
            @Value("${app.workspace.models-folder:models}") String modelsFolder) {
        folders.put("uploads", Paths.get(uploadFolder));
        folders.put("results", Paths.get(resultsFolder));
        folders.put("models", Paths.get(modelsFolder));
    }

    @PostConstruct
    public void createFolders() {
        folders.forEach((name, folder) -> {
            try {
                Files.createDirectories(folder);
            } catch (IOException e) {
                log.warn("Could not create {} folder {}: {}", name, folder, e.getMessage());
            }
        });
    }

    @Override
    public String resourceName() {
        return "workspace-folders";
    }

    /**
     * Empties every folder. A folder that cannot be cleaned is logged and the
     * others are still processed.
     */
    @Override
    public void release() {
        folders.forEach((name, folder) -> {
            try {
                clean(folder);
                log.info("✓ Cleaned up {} folder: {}", name, folder);
            } catch (IOException e) {
                log.error("⚠ Failed to cleanup {} folder: {}", name, e.getMessage());
            }
        });
    }

    private static void clean(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            return;
        }
        List<Path> contents;
        try (Stream<Path> walk = Files.walk(folder)) {
            contents = walk.filter(path -> !path.equals(folder))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        }
        for (Path path : contents) {
            Files.deleteIfExists(path);
        }
    }
}
