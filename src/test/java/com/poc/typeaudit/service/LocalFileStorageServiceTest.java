package com.poc.typeaudit.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFileStorageServiceTest {

    @TempDir
    Path root;

    @Test
    void shouldSaveAndLoadUnderRoot() throws IOException {
        LocalFileStorageService storage = new LocalFileStorageService(root.toString());
        byte[] content = "report".getBytes(StandardCharsets.UTF_8);

        String path = storage.saveFile(content, "result_a.xlsx");

        assertTrue(path.startsWith(root.toAbsolutePath().toString()));
        assertTrue(storage.exists("result_a.xlsx"));
        assertArrayEquals(content, storage.loadFile("result_a.xlsx"));
    }

    @Test
    void shouldRejectNamesEscapingRoot() {
        LocalFileStorageService storage = new LocalFileStorageService(root.resolve("reports").toString());

        assertThrows(IllegalArgumentException.class, () -> storage.loadFile("../secret.txt"));
        assertFalse(storage.exists("../secret.txt"));
        assertFalse(storage.exists("missing.xlsx"));
    }
}
