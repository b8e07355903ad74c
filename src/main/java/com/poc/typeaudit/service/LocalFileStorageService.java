package com.poc.typeaudit.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Service
public class LocalFileStorageService implements FileStorageService {

    private final Path root;

    public LocalFileStorageService(@Value("${excel.storage.path:./output/}") String storagePath) {
        this.root = Paths.get(storagePath).toAbsolutePath().normalize();
    }

    @Override
    public String saveFile(byte[] content, String fileName) throws IOException {
        Path path = resolve(fileName);
        if (!Files.exists(path.getParent())) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, content);
        return path.toString();
    }

    @Override
    public byte[] loadFile(String fileName) throws IOException {
        return Files.readAllBytes(resolve(fileName));
    }

    @Override
    public boolean exists(String fileName) {
        try {
            return Files.isRegularFile(resolve(fileName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Path resolve(String fileName) {
        Path path = root.resolve(fileName).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Invalid file name: " + fileName);
        }
        return path;
    }
}
