package io.github.jsxpatch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * A {@link SourceStore} over a directory on the local file system. Paths that resolve outside the root are refused.
 */
public class FileSystemSourceStore implements SourceStore {
    private static final Logger logger = LogManager.getLogger(FileSystemSourceStore.class);

    private final Path root;

    public FileSystemSourceStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public String read(String filePath) {
        var path = resolve(filePath);
        if (!Files.isRegularFile(path)) {
            throw new SourceStoreException(filePath, "File not found: " + filePath);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceStoreException(filePath, "Failed to read " + filePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(String filePath, String content) {
        var path = resolve(filePath);
        try {
            var parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            logger.debug("Wrote {} chars to {}", content.length(), path);
        } catch (IOException e) {
            throw new SourceStoreException(filePath, "Failed to write " + filePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String filePath) {
        return Files.isRegularFile(resolve(filePath));
    }

    Path resolve(String filePath) {
        Path resolved;
        try {
            resolved = root.resolve(filePath).normalize();
        } catch (InvalidPathException e) {
            throw new SourceStoreException(filePath, "Invalid path: " + filePath, e);
        }
        if (!resolved.startsWith(root)) {
            throw new SourceStoreException(filePath, "Path escapes the project root: " + filePath);
        }
        return resolved;
    }
}
