package com.poc.typeaudit.service;

import java.io.IOException;

/**
 * Where finished reports are published and later served for download.
 */
public interface FileStorageService {
    /**
     * Saves byte content to the storage system.
     * @param content The file data.
     * @param fileName The desired filename.
     * @return The path or URL where the file is stored.
     */
    String saveFile(byte[] content, String fileName) throws IOException;

    /**
     * Loads a file from storage.
     * @param fileName The name of the file to load.
     * @return The file data as a byte array.
     */
    byte[] loadFile(String fileName) throws IOException;

    boolean exists(String fileName);
}
