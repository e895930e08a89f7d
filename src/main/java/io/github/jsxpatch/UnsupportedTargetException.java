package io.github.jsxpatch;

import io.github.jsxpatch.parse.JsxNode;

/**
 * The located node cannot take the requested change: a text update aimed at a self-closing element, or a class
 * update aimed at a fragment. Nothing is modified.
 */
public class UnsupportedTargetException extends VisualEditException {
    private final JsxNode.Kind targetKind;

    public UnsupportedTargetException(String message, JsxNode.Kind targetKind) {
        super(message);
        this.targetKind = targetKind;
    }

    public JsxNode.Kind targetKind() {
        return targetKind;
    }
}
