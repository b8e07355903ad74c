package com.poc.typeaudit.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Private temp directory for a single upload. Deleted on close, whatever the outcome.
 */
@Slf4j
public class RequestWorkspace implements AutoCloseable {

    @Getter
    private final Path directory;

    public RequestWorkspace() throws IOException {
        this.directory = Files.createTempDirectory("type-audit-");
    }

    /**
     * Copies the stream into the workspace under a fixed name, ignoring the client's filename.
     */
    public Path stage(InputStream in, String name) throws IOException {
        Path target = directory.resolve(name);
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Upload staged to {} ({} bytes)", target, Files.size(target));
        return target;
    }

    @Override
    public void close() {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::delete);
        } catch (IOException e) {
            log.error("Failed to clean up workspace {}", directory, e);
            return;
        }
        if (Files.exists(directory)) {
            log.error("Workspace {} could not be fully removed", directory);
        } else {
            log.info("Workspace {} removed", directory);
        }
    }

    private void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("Failed to delete workspace entry {}", path, e);
        }
    }
}
