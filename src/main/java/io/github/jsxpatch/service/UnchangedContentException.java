package io.github.jsxpatch.service;

import io.github.jsxpatch.VisualEditException;

/**
 * A style edit left the file byte-identical, typically because the element already carries the classes.
 */
public class UnchangedContentException extends VisualEditException {
    public UnchangedContentException(String filePath) {
        super("Style update produced no changes in " + filePath);
    }
}
