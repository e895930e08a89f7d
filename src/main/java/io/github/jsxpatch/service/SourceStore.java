package io.github.jsxpatch.service;

/**
 * Where source files live. Paths are relative to the project root, with workspace prefixes already stripped.
 */
public interface SourceStore {
    /**
     * @throws SourceStoreException when the file is missing or unreadable
     */
    String read(String filePath);

    /**
     * Replaces the whole content of {@code filePath}, creating it if needed.
     *
     * @throws SourceStoreException when the file cannot be written
     */
    void write(String filePath, String content);

    boolean exists(String filePath);
}
