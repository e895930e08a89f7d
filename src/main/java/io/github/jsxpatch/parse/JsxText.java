package io.github.jsxpatch.parse;

import java.util.List;

/**
 * Literal text between markup in an element body.
 */
public final class JsxText extends JsxNode {

    JsxText(SourceSpan span) {
        super(span);
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }

    @Override
    public List<JsxNode> childNodes() {
        return List.of();
    }
}
