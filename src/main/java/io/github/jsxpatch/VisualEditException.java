package io.github.jsxpatch;

/**
 * Base class for every failure raised while locating an element or rewriting its source.
 * All of them are reported synchronously to the immediate caller; none are retried internally.
 */
public class VisualEditException extends RuntimeException {
    public VisualEditException(String message) {
        super(message);
    }

    public VisualEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
