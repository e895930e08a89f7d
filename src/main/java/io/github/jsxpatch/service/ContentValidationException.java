package io.github.jsxpatch.service;

import io.github.jsxpatch.VisualEditException;

import java.util.List;

/**
 * Rewritten content failed validation and was not written.
 */
public class ContentValidationException extends VisualEditException {
    private final String filePath;
    private final List<String> errors;

    public ContentValidationException(String filePath, List<String> errors) {
        super("Validation failed for " + filePath + ": " + String.join("; ", errors));
        this.filePath = filePath;
        this.errors = List.copyOf(errors);
    }

    public String filePath() {
        return filePath;
    }

    public List<String> errors() {
        return errors;
    }
}
