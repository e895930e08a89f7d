package io.github.jsxpatch.classes;

import io.github.jsxpatch.VisualEditException;

/**
 * A call, bracketed expression or literal inside a class attribute has no matching closer within the
 * attribute's value.
 */
public class MalformedExpressionException extends VisualEditException {
    private final int offset;

    public MalformedExpressionException(String message, int offset) {
        super(message + " (offset " + offset + ")");
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
