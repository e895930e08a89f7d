package io.github.jsxpatch.service;

import io.github.jsxpatch.VisualEditException;

/**
 * A source file could not be read or written.
 */
public class SourceStoreException extends VisualEditException {
    private final String filePath;

    public SourceStoreException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    public SourceStoreException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public String filePath() {
        return filePath;
    }
}
